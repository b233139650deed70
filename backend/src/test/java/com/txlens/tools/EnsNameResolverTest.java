package com.txlens.tools;

import com.txlens.domain.NetworkId;
import com.txlens.domain.TokenTransfer;
import com.txlens.domain.TransactionContext;
import com.txlens.domain.TransactionStatus;
import com.txlens.domain.TransferType;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.RagContextItem;
import com.txlens.pipeline.ToolContext;
import com.txlens.rpc.EnsReverseResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

import static com.txlens.tools.TxFixtures.ALICE;
import static com.txlens.tools.TxFixtures.BOB;
import static com.txlens.tools.TxFixtures.TX_HASH;
import static com.txlens.tools.TxFixtures.USDC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnsNameResolverTest {

    @Mock
    private EnsReverseResolver ens;

    private final ToolContext context = ToolContext.create();

    @Test
    void process_namesEachPartyOnceAndKeepsOnlyHits() {
        when(ens.reverseName(ALICE)).thenReturn(Optional.of("alice.eth"));
        when(ens.reverseName(USDC)).thenReturn(Optional.empty());
        when(ens.reverseName(BOB)).thenReturn(Optional.empty());
        Baggage baggage = baggage(List.of(transfer(ALICE, BOB, 0), transfer(BOB, ALICE, 1)));

        new EnsNameResolver(ens).process(context, baggage);

        assertThat(baggage.get(BaggageKeys.ENS_NAMES)).contains(Map.of(ALICE, "alice.eth"));
        verify(ens, times(1)).reverseName(ALICE);
        verify(ens, times(1)).reverseName(BOB);
    }

    @Test
    void process_noContext_writesEmptyMap() {
        Baggage baggage = new Baggage();

        new EnsNameResolver(ens).process(context, baggage);

        assertThat(baggage.get(BaggageKeys.ENS_NAMES)).contains(Map.of());
        verify(ens, never()).reverseName(anyString());
    }

    @Test
    void process_manyParties_cappedAtMaxAddresses() {
        when(ens.reverseName(anyString())).thenReturn(Optional.empty());
        List<TokenTransfer> transfers = new ArrayList<>();
        for (int i = 0; i < EnsNameResolver.MAX_ADDRESSES; i++) {
            transfers.add(transfer(address(2 * i + 10), address(2 * i + 11), i));
        }

        new EnsNameResolver(ens).process(context, baggage(transfers));

        verify(ens, times(EnsNameResolver.MAX_ADDRESSES)).reverseName(anyString());
    }

    @Test
    void process_cancelled_stopsBeforeLookup() {
        ToolContext cancelled = ToolContext.create();
        cancelled.cancel();

        assertThatThrownBy(() -> new EnsNameResolver(ens).process(cancelled, baggage(List.of())))
                .isInstanceOf(CancellationException.class);
        verify(ens, never()).reverseName(anyString());
    }

    @Test
    void promptAndRag_describeNamedAddresses() {
        Baggage baggage = new Baggage();
        baggage.put(BaggageKeys.ENS_NAMES, Map.of(ALICE, "alice.eth"));
        EnsNameResolver resolver = new EnsNameResolver(ens);

        assertThat(resolver.getPromptContext(context, baggage)).isEqualTo("### ENS Names:\n- " + ALICE + ": alice.eth");
        List<RagContextItem> items = resolver.getRagContext(context, baggage).getItems();
        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.type()).isEqualTo("address");
            assertThat(item.keywords()).containsExactly("alice.eth", ALICE);
        });
    }

    private static Baggage baggage(List<TokenTransfer> transfers) {
        Baggage baggage = new Baggage();
        baggage.put(BaggageKeys.TRANSACTION_CONTEXT, new TransactionContext(TX_HASH, NetworkId.ETHEREUM, ALICE, USDC,
                BigInteger.ZERO, BigInteger.valueOf(46_097), BigInteger.ONE, TransactionStatus.SUCCESS, 20_000_000L,
                null, "0xa9059cbb"));
        baggage.put(BaggageKeys.TRANSFERS, transfers);
        return baggage;
    }

    private static TokenTransfer transfer(String from, String to, long logIndex) {
        return new TokenTransfer(TransferType.ERC20, USDC, from, to, BigInteger.TEN, null, logIndex);
    }

    private static String address(int n) {
        return "0x" + String.format("%040x", n);
    }
}
