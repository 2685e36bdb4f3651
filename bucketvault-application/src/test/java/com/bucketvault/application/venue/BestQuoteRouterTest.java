package com.bucketvault.application.venue;

import com.bucketvault.application.ports.NativeWrapperPort;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.error.NoQuoteAvailableException;
import com.bucketvault.domain.error.VaultErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BestQuoteRouterTest {

    private static final AssetId USDC = AssetId.of("USDC");
    private static final AssetId WETH = AssetId.of("WETH");
    private static final AssetId ETH = AssetId.of("ETH");
    private static final BigInteger AMOUNT = BigInteger.valueOf(1_000_000);

    private final VenueTable table = new VenueTable();

    private static VenueConfig venue(int index, VenueQuoter quoter, VenueExecutor executor) {
        return new VenueConfig(VenueId.of(index), executor, quoter, 3000, false, true);
    }

    private static VenueQuoter fixed(long out) {
        return (in, o, amount, tier) -> BigInteger.valueOf(out);
    }

    private static VenueExecutor delivering(long out) {
        return (in, o, amount, min, tier) -> BigInteger.valueOf(out);
    }

    @Test
    @DisplayName("A throwing quoter is skipped, not fatal")
    void failingQuoterIsSkipped() {
        table.put(venue(0, (in, out, amount, tier) -> { throw new IllegalStateException("down"); }, delivering(0)));
        table.put(venue(1, fixed(900), delivering(900)));

        BestQuoteRouter router = new BestQuoteRouter(table, null, 500);

        assertThat(router.bestQuote(USDC, WETH, AMOUNT)).hasValue(new BestQuote(VenueId.of(1), BigInteger.valueOf(900)));
    }

    @Test
    @DisplayName("Highest quote wins; ties go to the lowest venue index")
    void highestThenLowestIndex() {
        table.put(venue(2, fixed(1000), delivering(1000)));
        table.put(venue(1, fixed(1000), delivering(1000)));
        table.put(venue(0, fixed(999), delivering(999)));

        BestQuoteRouter router = new BestQuoteRouter(table, null, 500);

        assertThat(router.bestQuote(USDC, WETH, AMOUNT).orElseThrow().venue()).isEqualTo(VenueId.of(1));
    }

    @Test
    @DisplayName("Zero quotes and disabled venues never win")
    void zeroAndDisabledIgnored() {
        table.put(venue(0, fixed(0), delivering(0)));
        table.put(venue(1, fixed(5000), delivering(5000)).withEnabled(false));

        BestQuoteRouter router = new BestQuoteRouter(table, null, 500);

        assertThat(router.bestQuote(USDC, WETH, AMOUNT)).isEmpty();
        assertThatThrownBy(() -> router.execute(USDC, WETH, AMOUNT))
                .isInstanceOf(NoQuoteAvailableException.class);
    }

    @Test
    @DisplayName("Execution carries quote * (1 - slippage) as minimum output")
    void passesMinimumOutput() {
        AtomicReference<BigInteger> seenMin = new AtomicReference<>();
        table.put(venue(0, fixed(10_000), (in, out, amount, min, tier) -> {
            seenMin.set(min);
            return BigInteger.valueOf(9_800);
        }));

        ExecutedSwap swap = new BestQuoteRouter(table, null, 500).execute(USDC, WETH, AMOUNT);

        assertThat(seenMin.get()).isEqualTo(BigInteger.valueOf(9_500));
        assertThat(swap.amountOut()).isEqualTo(BigInteger.valueOf(9_800));
        assertThat(swap.quotedOut()).isEqualTo(BigInteger.valueOf(10_000));
        assertThat(swap.route()).isEqualTo("venue#0");
    }

    @Test
    @DisplayName("Delivering below the minimum is a venue failure")
    void shortFillRejected() {
        table.put(venue(0, fixed(10_000), delivering(9_000)));

        assertThatThrownBy(() -> new BestQuoteRouter(table, null, 500).execute(USDC, WETH, AMOUNT))
                .isInstanceOf(VenueExecutionException.class)
                .satisfies(e -> assertThat(((VenueExecutionException) e).code())
                        .isEqualTo(VaultErrorCode.VENUE_EXECUTION_FAILED));
    }

    @Test
    @DisplayName("Checked executor failures are wrapped with their cause")
    void executorFailureWrapped() {
        Exception boom = new Exception("reverted");
        table.put(venue(0, fixed(10_000), (in, out, amount, min, tier) -> { throw boom; }));

        assertThatThrownBy(() -> new BestQuoteRouter(table, null, 500).execute(USDC, WETH, AMOUNT))
                .isInstanceOf(VenueExecutionException.class)
                .hasCause(boom);
    }

    @Test
    @DisplayName("Venues that only take the wrapped coin get it wrapped before and unwrapped after")
    void wrapsNativeCoin() {
        RecordingWrapper wrapper = new RecordingWrapper();
        List<AssetId> seenPairs = new ArrayList<>();
        VenueQuoter quoter = (in, out, amount, tier) -> {
            seenPairs.add(in);
            return BigInteger.valueOf(500);
        };
        table.put(new VenueConfig(VenueId.of(0), delivering(500), quoter, 3000, true, true));

        BestQuoteRouter router = new BestQuoteRouter(table, wrapper, 500);
        router.execute(ETH, USDC, AMOUNT);
        router.execute(USDC, ETH, AMOUNT);

        assertThat(seenPairs).containsExactly(WETH, USDC);
        assertThat(wrapper.calls).containsExactly("wrap:" + AMOUNT, "unwrap:500");
    }

    private static final class RecordingWrapper implements NativeWrapperPort {
        final List<String> calls = new ArrayList<>();

        @Override
        public AssetId nativeAsset() {
            return ETH;
        }

        @Override
        public AssetId wrappedAsset() {
            return WETH;
        }

        @Override
        public void wrap(BigInteger amount) {
            calls.add("wrap:" + amount);
        }

        @Override
        public void unwrap(BigInteger amount) {
            calls.add("unwrap:" + amount);
        }
    }
}
