package com.txlens.tools;

import com.txlens.cache.CacheKeys;
import com.txlens.cache.CacheTtl;
import com.txlens.cache.ToolCache;
import com.txlens.domain.ResolvedSignature;
import com.txlens.domain.TransactionContext;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.RagContext;
import com.txlens.pipeline.RagContextItem;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import com.txlens.signature.SignatureLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Names the called function and any events {@link LogDecoder} could not decode, through a
 * {@link SignatureLookup}. Found signatures are cached for {@link CacheTtl#SIGNATURE}; misses are not, since
 * signatures get registered over time. Writes {@link BaggageKeys#RESOLVED_SIGNATURES}.
 */
@Slf4j
@RequiredArgsConstructor
public class SignatureResolver implements Tool {

    static final int MAX_LOOKUPS = 10;

    private final SignatureLookup signatureLookup;
    private final ToolCache cache;

    @Override
    public String getName() {
        return ToolNames.SIGNATURE_RESOLVER;
    }

    @Override
    public String getDescription() {
        return "Resolves the called function selector and unknown event topics to text signatures";
    }

    @Override
    public List<String> getDependencies() {
        return List.of(ToolNames.TRANSACTION_CONTEXT_PROVIDER, ToolNames.LOG_DECODER);
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        List<ResolvedSignature> resolved = new ArrayList<>();
        int lookups = 0;

        String selector = baggage.get(BaggageKeys.TRANSACTION_CONTEXT)
                .map(TransactionContext::methodSelector)
                .map(s -> s.toLowerCase(Locale.ROOT))
                .orElse(null);
        if (selector != null) {
            context.throwIfCancelled();
            lookups++;
            resolve(selector, ResolvedSignature.Kind.FUNCTION).ifPresent(resolved::add);
        }

        Set<String> topics = new LinkedHashSet<>();
        baggage.get(BaggageKeys.EVENTS).orElse(List.of()).stream()
                .filter(event -> !event.isKnown() && !event.topics().isEmpty())
                .map(event -> event.topics().get(0))
                .forEach(topics::add);
        int skipped = 0;
        for (String topic : topics) {
            if (lookups >= MAX_LOOKUPS) {
                skipped++;
                continue;
            }
            context.throwIfCancelled();
            lookups++;
            resolve(topic, ResolvedSignature.Kind.EVENT).ifPresent(resolved::add);
        }

        if (skipped > 0) {
            log.debug("Signature lookup cap reached; {} event topics left unresolved", skipped);
        }
        log.debug("Resolved {} of {} signatures via {}", resolved.size(), lookups, signatureLookup.sourceName());
        baggage.put(BaggageKeys.RESOLVED_SIGNATURES, List.copyOf(resolved));
    }

    private Optional<ResolvedSignature> resolve(String hex, ResolvedSignature.Kind kind) {
        String cacheKey = kind == ResolvedSignature.Kind.FUNCTION
                ? CacheKeys.fourByteFunctionSignature(hex)
                : CacheKeys.fourByteEventSignature(hex);
        Optional<String> cached = cache.getJson(cacheKey, String.class);
        if (cached.isPresent()) {
            return cached.map(text -> new ResolvedSignature(hex, text, kind, signatureLookup.sourceName()));
        }
        Function<String, Optional<String>> lookup = kind == ResolvedSignature.Kind.FUNCTION
                ? signatureLookup::functionSignature
                : signatureLookup::eventSignature;
        Optional<String> text = lookup.apply(hex);
        text.ifPresent(t -> cache.setJson(cacheKey, t, CacheTtl.SIGNATURE));
        return text.map(t -> new ResolvedSignature(hex, t, kind, signatureLookup.sourceName()));
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        List<ResolvedSignature> resolved = baggage.get(BaggageKeys.RESOLVED_SIGNATURES).orElse(List.of());
        if (resolved.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("### Resolved Signatures:");
        resolved.forEach(sig -> sb.append("\n- ")
                .append(sig.kind() == ResolvedSignature.Kind.FUNCTION ? "Function " : "Event ")
                .append(sig.hexSignature()).append(": ").append(sig.textSignature()));
        return sb.toString();
    }

    @Override
    public RagContext getRagContext(ToolContext context, Baggage baggage) {
        RagContext rag = RagContext.empty();
        for (ResolvedSignature sig : baggage.get(BaggageKeys.RESOLVED_SIGNATURES).orElse(List.of())) {
            boolean function = sig.kind() == ResolvedSignature.Kind.FUNCTION;
            rag.addItem(new RagContextItem(
                    (function ? "function:" : "event:") + sig.textSignature(),
                    function ? "function" : "event",
                    (function ? "Function " : "Event ") + sig.textSignature(),
                    function
                            ? "The transaction called " + sig.textSignature() + " (selector " + sig.hexSignature() + ")."
                            : "An undecoded log has topic " + sig.hexSignature() + ", registered as " + sig.textSignature() + ".",
                    Map.of("hex", sig.hexSignature(), "source", sig.source()),
                    List.of(sig.shortName(), sig.hexSignature()),
                    function ? 0.7 : 0.4));
        }
        return rag;
    }
}
