package com.txlens.tools;

import com.txlens.domain.TokenTransfer;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.RagContext;
import com.txlens.pipeline.RagContextItem;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import com.txlens.rpc.EnsReverseResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Looks up primary ENS names for the sender, the recipient and every transfer party. Writes
 * {@link BaggageKeys#ENS_NAMES} with only the addresses that have a verified name.
 */
@Slf4j
@RequiredArgsConstructor
public class EnsNameResolver implements Tool {

    static final int MAX_ADDRESSES = 10;

    private final EnsReverseResolver ensReverseResolver;

    @Override
    public String getName() {
        return ToolNames.ENS_RESOLVER;
    }

    @Override
    public String getDescription() {
        return "Resolves primary ENS names of the addresses involved in the transaction";
    }

    @Override
    public List<String> getDependencies() {
        return List.of(ToolNames.TRANSACTION_CONTEXT_PROVIDER, ToolNames.TOKEN_TRANSFER_EXTRACTOR);
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        Set<String> addresses = new LinkedHashSet<>();
        baggage.get(BaggageKeys.TRANSACTION_CONTEXT).ifPresent(tx -> {
            addIfPresent(addresses, tx.sender());
            addIfPresent(addresses, tx.recipient());
        });
        for (TokenTransfer transfer : baggage.get(BaggageKeys.TRANSFERS).orElse(List.of())) {
            addIfPresent(addresses, transfer.from());
            addIfPresent(addresses, transfer.to());
        }

        Map<String, String> names = new LinkedHashMap<>();
        int checked = 0;
        for (String address : addresses) {
            if (checked++ >= MAX_ADDRESSES) {
                log.debug("ENS lookup cap reached; {} addresses skipped", addresses.size() - MAX_ADDRESSES);
                break;
            }
            context.throwIfCancelled();
            ensReverseResolver.reverseName(address).ifPresent(name -> names.put(address, name));
        }
        log.debug("Found ENS names for {} of {} addresses", names.size(), Math.min(addresses.size(), MAX_ADDRESSES));
        baggage.put(BaggageKeys.ENS_NAMES, Collections.unmodifiableMap(names));
    }

    private static void addIfPresent(Set<String> addresses, String address) {
        if (address != null && !address.isBlank()) {
            addresses.add(address.strip().toLowerCase(Locale.ROOT));
        }
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        Map<String, String> names = baggage.get(BaggageKeys.ENS_NAMES).orElse(Map.of());
        if (names.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("### ENS Names:");
        names.forEach((address, name) -> sb.append("\n- ").append(address).append(": ").append(name));
        return sb.toString();
    }

    @Override
    public RagContext getRagContext(ToolContext context, Baggage baggage) {
        RagContext rag = RagContext.empty();
        baggage.get(BaggageKeys.ENS_NAMES).orElse(Map.of()).forEach((address, name) -> rag.addItem(new RagContextItem(
                "ens:" + address, "address", name,
                address + " is known as " + name + ".",
                Map.of("address", address, "ensName", name),
                List.of(name, address), 0.6)));
        return rag;
    }
}
