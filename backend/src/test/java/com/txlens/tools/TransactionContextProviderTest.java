package com.txlens.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.txlens.domain.NetworkId;
import com.txlens.domain.RawTransactionData;
import com.txlens.domain.TransactionContext;
import com.txlens.domain.TransactionStatus;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.ToolContext;
import com.txlens.pipeline.ToolException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static com.txlens.tools.TxFixtures.ALICE;
import static com.txlens.tools.TxFixtures.BOB;
import static com.txlens.tools.TxFixtures.USDC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionContextProviderTest {

    private final TransactionContextProvider provider = new TransactionContextProvider();
    private final ToolContext context = ToolContext.create();

    @Test
    void process_contractCall_extractsFacts() {
        Baggage baggage = TxFixtures.baggageWith(TxFixtures.usdcTransfer());

        provider.process(context, baggage);

        TransactionContext tx = baggage.get(BaggageKeys.TRANSACTION_CONTEXT).orElseThrow();
        assertThat(tx.txHash()).isEqualTo(TxFixtures.TX_HASH);
        assertThat(tx.networkId()).isEqualTo(NetworkId.ETHEREUM);
        assertThat(tx.sender()).isEqualTo(ALICE);
        assertThat(tx.recipient()).isEqualTo(USDC);
        assertThat(tx.valueWei()).isZero();
        assertThat(tx.gasUsed()).isEqualTo(TxFixtures.GAS_USED);
        assertThat(tx.effectiveGasPrice()).isEqualTo(TxFixtures.GAS_PRICE);
        assertThat(tx.status()).isEqualTo(TransactionStatus.SUCCESS);
        assertThat(tx.blockNumber()).isEqualTo(20_000_000L);
        assertThat(tx.timestamp()).isEqualTo(Instant.ofEpochSecond(TxFixtures.BLOCK_TIME));
        assertThat(tx.methodSelector()).isEqualTo("0xa9059cbb");
        assertThat(tx.isContractCall()).isTrue();
    }

    @Test
    void process_plainTransferWithoutEffectiveGasPrice_fallsBackToGasPrice() {
        RawTransactionData base = TxFixtures.raw(List.of());
        ObjectNode tx = (ObjectNode) base.transaction();
        tx.put("to", BOB).put("input", "0x").put("value", "0xde0b6b3a7640000");
        ObjectNode receipt = (ObjectNode) base.receipt();
        receipt.remove("effectiveGasPrice");
        receipt.put("to", BOB).put("status", "0x0");
        Baggage baggage = TxFixtures.baggageWith(base);

        provider.process(context, baggage);

        TransactionContext result = baggage.get(BaggageKeys.TRANSACTION_CONTEXT).orElseThrow();
        assertThat(result.effectiveGasPrice()).isEqualTo(BigInteger.valueOf(2_000_000_000L));
        assertThat(result.methodSelector()).isNull();
        assertThat(result.status()).isEqualTo(TransactionStatus.FAILED);
        assertThat(provider.getPromptContext(context, baggage))
                .contains("- Recipient: " + BOB)
                .contains("- Native Value Sent: 1 ETH")
                .contains("- Status: Failed")
                .doesNotContain("Method Selector");
    }

    @Test
    void process_withoutRawData_failsWithMissingInput() {
        assertThatThrownBy(() -> provider.process(context, new Baggage()))
                .isInstanceOf(ToolException.class)
                .satisfies(e -> {
                    ToolException te = (ToolException) e;
                    assertThat(te.getToolName()).isEqualTo(ToolNames.TRANSACTION_CONTEXT_PROVIDER);
                    assertThat(te.getCode()).isEqualTo("MISSING_INPUT");
                });
    }

    @Test
    void getPromptContext_describesSenderAndCalledContract() {
        Baggage baggage = TxFixtures.baggageWith(TxFixtures.usdcTransfer());
        provider.process(context, baggage);

        String prompt = provider.getPromptContext(context, baggage);

        assertThat(prompt).startsWith("### TRANSACTION CONTEXT:")
                .contains("- Network: Ethereum")
                .contains("- TRANSACTION SENDER: " + ALICE)
                .contains("- Contract Called: " + USDC)
                .contains("- Total Gas Used: 46097")
                .contains("- Status: Success")
                .doesNotContain("Native Value Sent");
    }

    @Test
    void getRagContext_ranksSenderAboveTarget() {
        Baggage baggage = TxFixtures.baggageWith(TxFixtures.usdcTransfer());
        provider.process(context, baggage);

        var items = provider.getRagContext(context, baggage).topByRelevance(5);

        assertThat(items).extracting(item -> item.metadata().get("role")).containsExactly("sender", "recipient");
        assertThat(items.get(1).content()).endsWith("is the contract that was called.");
    }

    @Test
    void exports_emptyWithoutContext() {
        assertThat(provider.getPromptContext(context, new Baggage())).isEmpty();
        assertThat(provider.getRagContext(context, new Baggage()).isEmpty()).isTrue();
        assertThat(provider.getDependencies()).isEmpty();
    }
}
