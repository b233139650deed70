package com.txlens.tools;

import com.txlens.common.EvmHex;
import com.txlens.domain.EnrichedTransfer;
import com.txlens.domain.GasFee;
import com.txlens.domain.TokenMetadata;
import com.txlens.domain.TokenPrice;
import com.txlens.domain.TokenTransfer;
import com.txlens.domain.TransactionContext;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.RagContext;
import com.txlens.pipeline.RagContextItem;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scales raw transfer amounts by token decimals, values them in USD and computes the gas fee.
 * Writes {@link BaggageKeys#ENRICHED_TRANSFERS} and, when gas data is present, {@link BaggageKeys#GAS_FEE}.
 * <p>
 * Built without prices it depends on token metadata only and leaves every USD field empty.
 */
@Slf4j
public class MonetaryValueEnricher implements Tool {

    private static final int NATIVE_DECIMALS = 18;
    private static final int USD_SCALE = 2;

    private final boolean withPrices;

    public MonetaryValueEnricher() {
        this(true);
    }

    public MonetaryValueEnricher(boolean withPrices) {
        this.withPrices = withPrices;
    }

    @Override
    public String getName() {
        return ToolNames.MONETARY_VALUE_ENRICHER;
    }

    @Override
    public String getDescription() {
        return "Converts token amounts to human-readable values and USD, and computes the gas fee";
    }

    @Override
    public List<String> getDependencies() {
        String priceSource = withPrices ? ToolNames.ERC20_PRICE_LOOKUP : ToolNames.TOKEN_METADATA_ENRICHER;
        return List.of(priceSource, ToolNames.TRANSACTION_CONTEXT_PROVIDER);
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        Map<String, TokenMetadata> metadata = baggage.get(BaggageKeys.TOKEN_METADATA).orElse(Map.of());
        Map<String, TokenPrice> prices = baggage.get(BaggageKeys.TOKEN_PRICES).orElse(Map.of());

        List<EnrichedTransfer> enriched = new ArrayList<>();
        for (TokenTransfer transfer : baggage.get(BaggageKeys.TRANSFERS).orElse(List.<TokenTransfer>of())) {
            enriched.add(enrich(transfer, metadata.get(transfer.contract()), prices.get(transfer.contract())));
        }
        baggage.put(BaggageKeys.ENRICHED_TRANSFERS, List.copyOf(enriched));

        Optional<TransactionContext> txContext = baggage.get(BaggageKeys.TRANSACTION_CONTEXT);
        txContext.flatMap(tx -> gasFee(tx, baggage.get(BaggageKeys.NATIVE_TOKEN_PRICE).orElse(null)))
                .ifPresent(fee -> baggage.put(BaggageKeys.GAS_FEE, fee));
        log.debug("Enriched {} transfers", enriched.size());
    }

    static EnrichedTransfer enrich(TokenTransfer transfer, TokenMetadata meta, TokenPrice price) {
        if (meta == null) {
            return EnrichedTransfer.unpriced(transfer);
        }
        BigDecimal amount = null;
        Integer decimals = null;
        BigDecimal valueUsd = null;
        BigDecimal priceUsd = null;
        if (transfer.isFungible()) {
            decimals = meta.decimals();
            amount = EvmHex.scale(transfer.amount(), meta.decimals());
            if (price != null && amount != null) {
                priceUsd = price.priceUsd();
                valueUsd = amount.multiply(priceUsd).setScale(USD_SCALE, RoundingMode.HALF_UP);
            }
        }
        return new EnrichedTransfer(transfer.type(), transfer.contract(), transfer.from(), transfer.to(),
                transfer.amount(), transfer.tokenId(), meta.symbol(), meta.name(), decimals, amount, priceUsd, valueUsd);
    }

    static Optional<GasFee> gasFee(TransactionContext tx, BigDecimal nativePriceUsd) {
        if (tx.gasUsed() == null || tx.effectiveGasPrice() == null) {
            return Optional.empty();
        }
        BigInteger feeWei = tx.gasUsed().multiply(tx.effectiveGasPrice());
        BigDecimal feeNative = EvmHex.scale(feeWei, NATIVE_DECIMALS);
        BigDecimal feeUsd = nativePriceUsd == null ? null
                : feeNative.multiply(nativePriceUsd).setScale(USD_SCALE, RoundingMode.HALF_UP);
        return Optional.of(new GasFee(tx.gasUsed(), tx.effectiveGasPrice(), feeNative,
                tx.networkId().getNativeSymbol(), feeUsd));
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        List<EnrichedTransfer> transfers = baggage.get(BaggageKeys.ENRICHED_TRANSFERS).orElse(List.of());
        Optional<GasFee> gasFee = baggage.get(BaggageKeys.GAS_FEE);
        if (transfers.isEmpty() && gasFee.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (!transfers.isEmpty()) {
            sb.append("### Transfers with amounts:");
            for (EnrichedTransfer t : transfers) {
                sb.append("\n- ").append(t.from()).append(" -> ").append(t.to()).append(": ");
                if (t.amount() != null) {
                    sb.append(t.amount().toPlainString()).append(' ').append(symbolOf(t));
                } else if (t.tokenId() != null) {
                    sb.append(symbolOf(t)).append(" #").append(t.tokenId());
                } else {
                    sb.append(t.rawAmount()).append(" raw units of ").append(t.contract());
                }
                if (t.valueUsd() != null) {
                    sb.append(" (~$").append(t.valueUsd().toPlainString()).append(')');
                }
            }
        }
        gasFee.ifPresent(fee -> {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append("### TRANSACTION FEES:\n- Gas Fee: ").append(fee.feeNative().toPlainString())
                    .append(' ').append(fee.nativeSymbol());
            if (fee.feeUsd() != null) {
                sb.append(" = $").append(fee.feeUsd().toPlainString()).append(" USD");
            }
        });
        return sb.toString();
    }

    @Override
    public RagContext getRagContext(ToolContext context, Baggage baggage) {
        RagContext rag = RagContext.empty();
        for (EnrichedTransfer t : baggage.get(BaggageKeys.ENRICHED_TRANSFERS).orElse(List.<EnrichedTransfer>of())) {
            if (t.amount() == null) {
                continue;
            }
            String amount = t.amount().toPlainString() + " " + symbolOf(t);
            rag.addItem(new RagContextItem("amount:" + t.contract() + ":" + t.from() + ":" + t.to() + ":" + amount,
                    "amount", amount,
                    amount + (t.valueUsd() != null ? " worth about $" + t.valueUsd().toPlainString() : "")
                            + " moved from " + t.from() + " to " + t.to() + ".",
                    Map.of("contract", t.contract()), List.of(symbolOf(t)), t.valueUsd() != null ? 0.8 : 0.6));
        }
        return rag;
    }

    private static String symbolOf(EnrichedTransfer t) {
        return t.symbol() != null && !t.symbol().isBlank() ? t.symbol() : t.contract();
    }
}
