package com.bucketvault.application.engine;

import com.bucketvault.application.config.VaultParameters;
import com.bucketvault.application.journal.VaultEvent;
import com.bucketvault.application.journal.VaultEventType;
import com.bucketvault.application.ports.VaultSnapshot;
import com.bucketvault.application.ports.VaultStateRepository;
import com.bucketvault.application.venue.ExecutedSwap;
import com.bucketvault.application.venue.VenueHandles;
import com.bucketvault.application.venue.VenueId;
import com.bucketvault.domain.allocation.AssetWeight;
import com.bucketvault.domain.allocation.TargetAllocation;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.error.AllocationOutOfToleranceException;
import com.bucketvault.domain.error.InsufficientBalanceException;
import com.bucketvault.domain.error.InvalidAssetException;
import com.bucketvault.domain.error.NoQuoteAvailableException;
import com.bucketvault.domain.error.PlatformHaltedException;
import com.bucketvault.domain.error.ReentrantCallException;
import com.bucketvault.domain.error.UnaccountableException;
import com.bucketvault.domain.error.UnauthorizedException;
import com.bucketvault.domain.error.ValueLossExceededException;
import com.bucketvault.domain.error.VaultException;
import com.bucketvault.domain.error.VaultPausedException;
import com.bucketvault.domain.error.ZeroAmountException;
import com.bucketvault.domain.error.ZeroSharesException;
import com.bucketvault.domain.vault.FixedPoint;
import com.bucketvault.domain.vault.HolderId;
import com.bucketvault.domain.vault.VaultId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VaultAccountingEngineTest {

    private static final VaultId VAULT = VaultId.of("vault-1");
    private static final HolderId MANAGER = HolderId.of("manager");
    private static final HolderId ALICE = HolderId.of("alice");
    private static final HolderId BOB = HolderId.of("bob");

    private static final AssetId A = AssetId.of("USDA");
    private static final AssetId B = AssetId.of("USDB");
    private static final AssetId JUNK = AssetId.of("JUNK");

    private static final TargetAllocation FIFTY_FIFTY =
            TargetAllocation.of(AssetWeight.of("USDA", 50), AssetWeight.of("USDB", 50));

    private FakeOracle oracle;
    private FakeCustody custody;
    private FakeVenue venue;
    private MapRepository repository;
    private List<VaultEvent> events;
    private VaultAccountingEngine engine;

    @BeforeEach
    void setUp() {
        oracle = new FakeOracle()
                .add("USDA", 6, FixedPoint.USD_UNIT)
                .add("USDB", 6, FixedPoint.USD_UNIT);
        custody = new FakeCustody();
        venue = new FakeVenue(oracle, custody, FixedPoint.BPS);
        repository = new MapRepository();
        events = new ArrayList<>();
        engine = newEngine(VaultParameters.defaults());
    }

    private VaultAccountingEngine.Builder builder(VaultParameters params) {
        return VaultAccountingEngine.builder()
                .vaultId(VAULT)
                .manager(MANAGER)
                .oracle(oracle)
                .custody(custody)
                .repository(repository)
                .journal(events::add)
                .parameters(params)
                .venueRegistry(id -> new VenueHandles(venue, venue));
    }

    private VaultAccountingEngine newEngine(VaultParameters params) {
        return builder(params).allocation(FIFTY_FIFTY).venue(venue.config(0)).build();
    }

    private static BigInteger units(long whole) {
        return BigInteger.valueOf(whole).multiply(FixedPoint.pow10(6));
    }

    private static BigInteger shares(long whole) {
        return BigInteger.valueOf(whole).multiply(FixedPoint.SCALE);
    }

    private static BigInteger usd(long whole) {
        return BigInteger.valueOf(whole).multiply(FixedPoint.USD_UNIT);
    }

    /** Manager holds 70% in A, alice 30% in B. */
    private void seventyThirty() {
        engine.deposit(MANAGER, A, units(700));
        engine.deposit(ALICE, B, units(300));
    }

    private void assertLedgerConsistent() {
        BigInteger sum = engine.shareBalances().values().stream().reduce(BigInteger.ZERO, BigInteger::add);
        assertThat(sum).isEqualTo(engine.totalSupply());
        assertThat(engine.sharePrice()).isEqualTo(FixedPoint.sharePrice(engine.currentTotalValue(), engine.totalSupply()));
    }

    @Nested
    class Deposits {

        @Test
        @DisplayName("Two $1 deposits into a 50/50 vault mint 1:1 and leave nothing to rebalance")
        void fiftyFiftyScenario() {
            DepositResult first = engine.deposit(ALICE, A, units(1000));
            assertThat(first.sharesMinted()).isEqualTo(shares(1000));
            assertThat(first.sharePriceUsd()).isEqualTo(FixedPoint.INITIAL_PRICE);

            DepositResult second = engine.deposit(BOB, B, units(1000));
            assertThat(second.sharesMinted()).isEqualTo(shares(1000));
            assertThat(engine.sharePrice()).isEqualTo(FixedPoint.INITIAL_PRICE);

            RebalanceResult result = engine.rebalanceByBestQuote(ALICE);

            assertThat(result.traded()).isFalse();
            assertThat(result.fees().isEmpty()).isTrue();
            assertThat(venue.swaps).isZero();
            assertThat(engine.totalDepositValue()).isEqualTo(usd(2000));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("Share price starts at the initial price before anything is issued")
        void initialPriceView() {
            assertThat(engine.sharePrice()).isEqualTo(FixedPoint.INITIAL_PRICE);
            assertThat(engine.totalSupply()).isZero();
            assertThat(engine.isAccountable()).isTrue();
        }

        @Test
        void zeroAmountRejected() {
            assertThatThrownBy(() -> engine.deposit(ALICE, A, BigInteger.ZERO))
                    .isInstanceOf(ZeroAmountException.class);
        }

        @Test
        void unacceptedAssetRejected() {
            assertThatThrownBy(() -> engine.deposit(ALICE, JUNK, units(1)))
                    .isInstanceOf(InvalidAssetException.class);
        }

        @Test
        @DisplayName("A zero oracle price fails the whole valuation")
        void zeroPriceRejected() {
            engine.deposit(ALICE, A, units(100));
            oracle.prices.put(B, BigInteger.ZERO);

            assertThatThrownBy(() -> engine.deposit(BOB, A, units(100)))
                    .isInstanceOf(InvalidAssetException.class);
            assertThat(engine.balanceOf(BOB)).isZero();
        }

        @Test
        @DisplayName("Dust worth less than one USD unit mints nothing and is refused")
        void dustRejected() {
            oracle.add("DUST", 18, FixedPoint.USD_UNIT);

            assertThatThrownBy(() -> engine.deposit(ALICE, AssetId.of("DUST"), BigInteger.ONE))
                    .isInstanceOf(ZeroSharesException.class);
            assertThat(custody.balanceOf(AssetId.of("DUST"))).isZero();
        }

        @Test
        @DisplayName("Native coin deposits are valued like any accepted asset")
        void nativeDeposit() {
            oracle.addNative("ETH", 18, usd(2000));

            DepositResult r = engine.depositNative(ALICE, FixedPoint.pow10(18));

            assertThat(r.asset()).isEqualTo(AssetId.of("ETH"));
            assertThat(r.sharesMinted()).isEqualTo(shares(2000));
        }

        @Test
        @DisplayName("After a gain, new deposits buy fewer shares")
        void depositsAtMarkPrice() {
            seventyThirty();
            venue.rateBps = 10_200;
            engine.rebalanceByBestQuote(ALICE);

            BigInteger price = engine.sharePrice();
            assertThat(price).isGreaterThan(FixedPoint.INITIAL_PRICE);

            DepositResult r = engine.deposit(BOB, A, units(100));
            assertThat(r.sharesMinted()).isLessThan(shares(100));
            assertLedgerConsistent();
        }
    }

    @Nested
    class Redeems {

        @Test
        @DisplayName("Redeeming more than the balance fails without any change")
        void redeemAboveBalance() {
            engine.deposit(ALICE, A, units(100));
            VaultSnapshot before = engine.snapshot();
            int eventsBefore = events.size();

            assertThatThrownBy(() -> engine.redeem(ALICE, shares(101)))
                    .isInstanceOf(InsufficientBalanceException.class);

            assertThat(engine.snapshot()).isEqualTo(before);
            assertThat(custody.balanceOf(A)).isEqualTo(units(100));
            assertThat(events).hasSize(eventsBefore);
        }

        @Test
        @DisplayName("Deposit then full redeem returns at most the deposited value")
        void roundTripNeverGains() {
            engine.deposit(ALICE, A, units(1000));
            engine.deposit(BOB, B, units(1000));

            RedeemResult r = engine.redeem(ALICE, engine.balanceOf(ALICE));

            assertThat(r.payouts()).containsEntry(A, units(500)).containsEntry(B, units(500));
            BigInteger paidValue = FixedPoint.valueOf(custody.paidTo(ALICE, A), FixedPoint.USD_UNIT, 6)
                    .add(FixedPoint.valueOf(custody.paidTo(ALICE, B), FixedPoint.USD_UNIT, 6));
            assertThat(paidValue).isLessThanOrEqualTo(usd(1000)).isGreaterThanOrEqualTo(usd(999));
            assertThat(engine.balanceOf(ALICE)).isZero();
            assertThat(engine.totalWithdrawValue()).isEqualTo(usd(1000));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("Last holder out leaves supply zero and price back at the initial price")
        void lastHolderOut() {
            engine.deposit(ALICE, A, units(10));
            engine.redeem(ALICE, shares(10));

            assertThat(engine.totalSupply()).isZero();
            assertThat(engine.sharePrice()).isEqualTo(FixedPoint.INITIAL_PRICE);
            assertThat(custody.balanceOf(A)).isZero();
        }

        @Test
        void zeroSharesRejected() {
            assertThatThrownBy(() -> engine.redeem(ALICE, BigInteger.ZERO))
                    .isInstanceOf(ZeroAmountException.class);
        }

        @Test
        @DisplayName("Shares are burned before the first payout and payout callbacks cannot re-enter")
        void burnsBeforePayout() {
            engine.deposit(ALICE, A, units(600));
            engine.deposit(BOB, B, units(400));
            List<BigInteger> aliceSeenBySend = new ArrayList<>();
            List<BigInteger> supplySeenBySend = new ArrayList<>();
            List<Throwable> nested = new ArrayList<>();
            custody.beforeSend = () -> {
                aliceSeenBySend.add(engine.balanceOf(ALICE));
                supplySeenBySend.add(engine.totalSupply());
                try {
                    engine.redeem(ALICE, shares(1));
                } catch (ReentrantCallException e) {
                    nested.add(e);
                }
                try {
                    engine.deposit(ALICE, A, units(1));
                } catch (ReentrantCallException e) {
                    nested.add(e);
                }
            };

            RedeemResult r = engine.redeem(ALICE, shares(500));

            assertThat(r.payouts()).containsEntry(A, units(300)).containsEntry(B, units(200));
            assertThat(aliceSeenBySend).hasSize(2).containsOnly(shares(100));
            assertThat(supplySeenBySend).containsOnly(shares(500));
            assertThat(nested).hasSize(4).allMatch(e -> e instanceof ReentrantCallException);
            assertThat(engine.balanceOf(ALICE)).isEqualTo(shares(100));
            assertLedgerConsistent();
        }
    }

    @Nested
    class Rebalancing {

        @Test
        @DisplayName("70/30 with a 0.98 quote lands within tolerance and inside the loss budget")
        void seventyThirtyDiscountedQuote() {
            seventyThirty();
            venue.rateBps = 9_800;
            BigInteger managerBefore = engine.balanceOf(MANAGER);

            RebalanceResult r = engine.rebalanceByBestQuote(ALICE);

            assertThat(r.swaps()).singleElement().satisfies(s -> {
                assertThat(s.assetIn()).isEqualTo(A);
                assertThat(s.amountIn()).isEqualTo(units(200));
                assertThat(s.amountOut()).isEqualTo(units(196));
            });
            assertThat(r.valueBeforeUsd()).isEqualTo(usd(1000));
            assertThat(r.valueAfterUsd()).isEqualTo(usd(996));
            assertThat(engine.currentAllocation())
                    .allSatisfy(v -> assertThat(Math.abs(v.weightBps() - v.targetBps())).isLessThanOrEqualTo(200));

            // loss with an accountable manager: penalty burned from the manager only
            assertThat(r.fees().penaltyShares()).isPositive();
            assertThat(r.fees().mintedShares()).isZero();
            assertThat(engine.balanceOf(MANAGER)).isEqualTo(managerBefore.subtract(r.fees().penaltyShares()));
            assertThat(engine.balanceOf(ALICE)).isEqualTo(shares(300));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("A 0.90 quote breaks the value-loss budget and rolls everything back")
        void valueLossRollsBack() {
            seventyThirty();
            venue.rateBps = 9_000;
            VaultSnapshot before = engine.snapshot();
            int eventsBefore = events.size();

            assertThatThrownBy(() -> engine.rebalanceByBestQuote(ALICE))
                    .isInstanceOf(ValueLossExceededException.class)
                    .satisfies(e -> assertThat(((VaultException) e).code().isRetryable()).isTrue());

            assertThat(engine.snapshot()).isEqualTo(before);
            assertThat(repository.load(VAULT)).hasValue(before);
            assertThat(custody.balanceOf(A)).isEqualTo(units(700));
            assertThat(custody.balanceOf(B)).isEqualTo(units(300));
            assertThat(events).hasSize(eventsBefore);
        }

        @Test
        @DisplayName("Right after a rebalance a second one trades nothing and mints nothing")
        void secondRebalanceIsQuiet() {
            seventyThirty();
            venue.rateBps = 9_900;
            engine.rebalanceByBestQuote(ALICE);
            int swapsAfterFirst = venue.swaps;
            BigInteger supply = engine.totalSupply();

            RebalanceResult second = engine.rebalanceByBestQuote(ALICE);

            assertThat(second.traded()).isFalse();
            assertThat(second.fees().mintedShares()).isZero();
            assertThat(second.fees().penaltyShares()).isZero();
            assertThat(venue.swaps).isEqualTo(swapsAfterFirst);
            assertThat(engine.totalSupply()).isEqualTo(supply);
        }

        @Test
        @DisplayName("A gain mints platform, manager and caller shares at the post-trade price")
        void gainMintsFees() {
            seventyThirty();
            venue.rateBps = 10_200;

            RebalanceResult r = engine.rebalanceByBestQuote(ALICE);

            assertThat(r.valueAfterUsd()).isEqualTo(usd(1004));
            FeeSettlementResult fees = r.fees();
            BigInteger postPrice = FixedPoint.sharePrice(usd(1004), shares(1000));
            assertThat(fees.postPriceUsd()).isEqualTo(postPrice);
            assertThat(fees.platformShares()).isEqualTo(FixedPoint.sharesFor(FixedPoint.applyBps(usd(4), 1000), postPrice));
            assertThat(fees.managerShares()).isEqualTo(FixedPoint.sharesFor(FixedPoint.applyBps(usd(4), 100), postPrice));
            assertThat(fees.callerShares()).isEqualTo(FixedPoint.sharesFor(FixedPoint.applyBps(usd(4), 10), postPrice));
            assertThat(engine.balanceOf(FakeOracle.PLATFORM)).isEqualTo(fees.platformShares());
            assertThat(engine.balanceOf(ALICE)).isEqualTo(shares(300).add(fees.callerShares()));
            assertThat(events).extracting(VaultEvent::type).contains(VaultEventType.FEE_MINT);
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("Only share holders may trigger a rebalance")
        void outsiderRejected() {
            seventyThirty();
            assertThatThrownBy(() -> engine.rebalanceByBestQuote(BOB))
                    .isInstanceOf(UnauthorizedException.class)
                    .satisfies(e -> assertThat(((VaultException) e).code().isRetryable()).isFalse());
        }

        @Test
        @DisplayName("With every venue disabled the trade has no quote")
        void noVenue() {
            seventyThirty();
            engine.setVenueEnabled(MANAGER, VenueId.of(0), false);

            assertThatThrownBy(() -> engine.rebalanceByBestQuote(ALICE))
                    .isInstanceOf(NoQuoteAvailableException.class);
            assertThat(custody.balanceOf(A)).isEqualTo(units(700));
        }

        @Test
        @DisplayName("A venue calling back into the vault is rejected and the rebalance reverts")
        void reentrancyRejected() {
            seventyThirty();
            venue.beforeSwap = () -> engine.deposit(BOB, A, units(1));
            VaultSnapshot before = engine.snapshot();

            assertThatThrownBy(() -> engine.rebalanceByBestQuote(ALICE))
                    .isInstanceOf(ReentrantCallException.class);
            assertThat(engine.snapshot()).isEqualTo(before);

            venue.beforeSwap = null;
            engine.deposit(BOB, A, units(1));
            assertThat(engine.balanceOf(BOB)).isPositive();
        }

        @Test
        @DisplayName("An aggregator route is held to the same loss and tolerance checks")
        void externalRoute() {
            seventyThirty();
            VaultAccountingEngine routed = builder(VaultParameters.defaults())
                    .allocation(FIFTY_FIFTY)
                    .aggregator(route -> {
                        BigInteger in = new BigInteger(new String(route, StandardCharsets.UTF_8));
                        BigInteger out = FixedPoint.applyBps(in, 9_900);
                        custody.debit(A, in);
                        custody.credit(B, out);
                        return List.of(new ExecutedSwap("aggregator", A, B, in, out, out));
                    })
                    .build();

            byte[] tooSmall = units(50).toString().getBytes(StandardCharsets.UTF_8);
            assertThatThrownBy(() -> routed.rebalanceByExternalRoute(ALICE, tooSmall))
                    .isInstanceOf(AllocationOutOfToleranceException.class);
            assertThat(custody.balanceOf(A)).isEqualTo(units(700));

            RebalanceResult r = routed.rebalanceByExternalRoute(ALICE, units(200).toString().getBytes(StandardCharsets.UTF_8));
            assertThat(r.swaps()).hasSize(1);
            assertThat(r.valueAfterUsd()).isEqualTo(usd(998));
        }

        @Test
        @DisplayName("An Error thrown by a hostile aggregator after moving funds still reverts everything")
        void errorFromAggregatorRollsBack() {
            seventyThirty();
            AssertionError boom = new AssertionError("aggregator blew up");
            VaultAccountingEngine routed = builder(VaultParameters.defaults())
                    .allocation(FIFTY_FIFTY)
                    .aggregator(route -> {
                        custody.debit(A, units(500));
                        throw boom;
                    })
                    .build();
            VaultSnapshot before = routed.snapshot();
            BigInteger valueBefore = routed.currentTotalValue();
            int eventsBefore = events.size();

            assertThatThrownBy(() -> routed.rebalanceByExternalRoute(ALICE, new byte[0])).isSameAs(boom);

            assertThat(custody.balanceOf(A)).isEqualTo(units(700));
            assertThat(routed.currentTotalValue()).isEqualTo(valueBefore);
            assertThat(routed.snapshot()).isEqualTo(before);
            assertThat(repository.load(VAULT)).hasValue(before);
            assertThat(events).hasSize(eventsBefore);

            routed.deposit(BOB, A, units(1));
            assertThat(routed.balanceOf(BOB)).isPositive();
        }

        @Test
        @DisplayName("An Error thrown inside a venue swap reverts the rebalance")
        void errorFromVenueRollsBack() {
            seventyThirty();
            StackOverflowError boom = new StackOverflowError();
            venue.beforeSwap = () -> {
                custody.debit(B, units(100));
                throw boom;
            };
            VaultSnapshot before = engine.snapshot();

            assertThatThrownBy(() -> engine.rebalanceByBestQuote(ALICE)).isSameAs(boom);

            assertThat(custody.balanceOf(B)).isEqualTo(units(300));
            assertThat(engine.snapshot()).isEqualTo(before);
        }

        @Test
        void externalRouteNeedsAggregator() {
            seventyThirty();
            assertThatThrownBy(() -> engine.rebalanceByExternalRoute(ALICE, new byte[0]))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Paused rebalancing blocks swaps but not deposits")
        void rebalancingPaused() {
            seventyThirty();
            engine.pauseRebalancing(MANAGER);

            assertThatThrownBy(() -> engine.rebalanceByBestQuote(ALICE)).isInstanceOf(VaultPausedException.class);
            engine.deposit(BOB, A, units(1));

            engine.unpauseRebalancing(MANAGER);
            assertThat(engine.isRebalancingPaused()).isFalse();
        }
    }

    @Nested
    class Accountability {

        /** Alice 1000 A, manager 10 A: the manager owns under 1%. */
        private void smallManagerStake() {
            engine.deposit(ALICE, A, units(1000));
            engine.deposit(MANAGER, A, units(10));
        }

        @Test
        @DisplayName("An under-staked manager loses privileged actions but can still lift a pause")
        void gatesPrivilegedActions() {
            smallManagerStake();
            assertThat(engine.isAccountable()).isFalse();

            assertThatThrownBy(() -> engine.pause(MANAGER)).isInstanceOf(UnaccountableException.class);
            assertThatThrownBy(() -> engine.updateTargetAllocation(MANAGER, TargetAllocation.of(AssetWeight.of("USDA", 100))))
                    .isInstanceOf(UnaccountableException.class);
            assertThatThrownBy(() -> engine.pauseRebalancing(MANAGER)).isInstanceOf(UnaccountableException.class);

            engine.unpause(MANAGER);
            engine.unpauseRebalancing(MANAGER);
        }

        @Test
        @DisplayName("An under-staked manager earns no fee on a gain")
        void noManagerFee() {
            smallManagerStake();
            venue.rateBps = 10_200;

            RebalanceResult r = engine.rebalanceByBestQuote(ALICE);

            assertThat(r.fees().managerShares()).isZero();
            assertThat(r.fees().callerShares()).isPositive();
            assertThat(engine.balanceOf(MANAGER)).isEqualTo(shares(10));
        }

        @Test
        @DisplayName("An under-staked manager is not penalized on a loss")
        void noPenalty() {
            smallManagerStake();
            venue.rateBps = 9_960;

            RebalanceResult r = engine.rebalanceByBestQuote(ALICE);

            assertThat(r.valueAfterUsd()).isLessThan(r.valueBeforeUsd());
            assertThat(r.fees().penaltyShares()).isZero();
            assertThat(engine.balanceOf(MANAGER)).isEqualTo(shares(10));
        }

        @Test
        @DisplayName("Without the gate the same manager keeps every right")
        void ungated() {
            engine = newEngine(new VaultParameters(200, 50, 500, false, 500, 100, 10));
            smallManagerStake();

            assertThat(engine.isAccountable()).isTrue();
            engine.pause(MANAGER);
            assertThat(engine.isPaused()).isTrue();
        }
    }

    @Nested
    class Administration {

        @Test
        void onlyManagerAdministers() {
            assertThatThrownBy(() -> engine.setFeeSplit(ALICE, 100, 10)).isInstanceOf(UnauthorizedException.class);
            assertThatThrownBy(() -> engine.pause(ALICE)).isInstanceOf(UnauthorizedException.class);
            assertThatThrownBy(() -> engine.configureVenue(ALICE, venue.config(1))).isInstanceOf(UnauthorizedException.class);
        }

        @Test
        @DisplayName("Fee split is validated and applied")
        void feeSplit() {
            assertThatThrownBy(() -> engine.setFeeSplit(MANAGER, 6000, 5000)).isInstanceOf(IllegalArgumentException.class);

            engine.setFeeSplit(MANAGER, 200, 20);
            assertThat(engine.ownerFeeBps()).isEqualTo(200);
            assertThat(engine.callerFeeBps()).isEqualTo(20);
        }

        @Test
        @DisplayName("Allocation updates must reference accepted assets")
        void allocationUpdate() {
            TargetAllocation withJunk = TargetAllocation.of(AssetWeight.of("USDA", 50), AssetWeight.of("JUNK", 50));
            assertThatThrownBy(() -> engine.updateTargetAllocation(MANAGER, withJunk))
                    .isInstanceOf(InvalidAssetException.class);
            assertThat(engine.targetAllocation()).hasValue(FIFTY_FIFTY);

            TargetAllocation seventy = TargetAllocation.of(AssetWeight.of("USDA", 70), AssetWeight.of("USDB", 30));
            engine.updateTargetAllocation(MANAGER, seventy);
            assertThat(engine.targetAllocation()).hasValue(seventy);
            assertThat(events).extracting(VaultEvent::type).contains(VaultEventType.ALLOCATION_UPDATED);
        }

        @Test
        @DisplayName("Pausing blocks deposits and rebalances but never redemptions")
        void pause() {
            engine.deposit(ALICE, A, units(100));
            engine.pause(MANAGER);

            assertThatThrownBy(() -> engine.deposit(ALICE, A, units(1))).isInstanceOf(VaultPausedException.class);
            assertThatThrownBy(() -> engine.rebalanceByBestQuote(ALICE)).isInstanceOf(VaultPausedException.class);
            engine.redeem(ALICE, shares(50));

            engine.unpause(MANAGER);
            engine.deposit(ALICE, A, units(1));
        }

        @Test
        @DisplayName("A halted platform stops every mutating call")
        void platformHalted() {
            engine.deposit(ALICE, A, units(100));
            oracle.operational = false;

            assertThatThrownBy(() -> engine.deposit(ALICE, A, units(1))).isInstanceOf(PlatformHaltedException.class);
            assertThatThrownBy(() -> engine.redeem(ALICE, shares(1))).isInstanceOf(PlatformHaltedException.class);
            assertThatThrownBy(() -> engine.unpause(MANAGER)).isInstanceOf(PlatformHaltedException.class);
        }

        @Test
        @DisplayName("A halted platform is reported before a missing native asset")
        void haltedBeforeNativeLookup() {
            oracle.operational = false;

            assertThatThrownBy(() -> engine.depositNative(ALICE, FixedPoint.pow10(18)))
                    .isInstanceOf(PlatformHaltedException.class);

            oracle.operational = true;
            assertThatThrownBy(() -> engine.depositNative(ALICE, FixedPoint.pow10(18)))
                    .isInstanceOf(InvalidAssetException.class);
        }

        @Test
        @DisplayName("Stray tokens can be swept out, accepted assets cannot")
        void sweep() {
            engine.deposit(ALICE, A, units(100));
            custody.credit(JUNK, BigInteger.valueOf(5));

            assertThatThrownBy(() -> engine.sweep(MANAGER, A, units(1), MANAGER)).isInstanceOf(InvalidAssetException.class);
            assertThatThrownBy(() -> engine.sweep(ALICE, JUNK, BigInteger.ONE, ALICE)).isInstanceOf(UnauthorizedException.class);

            engine.sweep(MANAGER, JUNK, BigInteger.valueOf(5), MANAGER);
            assertThat(custody.paidTo(MANAGER, JUNK)).isEqualTo(BigInteger.valueOf(5));
            assertThat(custody.balanceOf(A)).isEqualTo(units(100));
        }
    }

    @Nested
    class Persistence {

        @Test
        @DisplayName("A restored vault carries balances, counters, allocation and venues")
        void restore() {
            seventyThirty();
            engine.setFeeSplit(MANAGER, 150, 15);

            VaultAccountingEngine restored = builder(VaultParameters.defaults()).restore();

            assertThat(restored.snapshot()).isEqualTo(engine.snapshot());
            assertThat(restored.balanceOf(MANAGER)).isEqualTo(shares(700));
            assertThat(restored.targetAllocation()).hasValue(FIFTY_FIFTY);
            assertThat(restored.venues()).extracting(v -> v.id().index()).containsExactly(0);
            assertThat(restored.ownerFeeBps()).isEqualTo(150);

            venue.rateBps = 9_900;
            assertThat(restored.rebalanceByBestQuote(ALICE).traded()).isTrue();
        }

        @Test
        void restoreWithoutSnapshotFails() {
            repository.map.clear();
            assertThatThrownBy(() -> builder(VaultParameters.defaults()).restore())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Only committed operations reach the journal, after the snapshot is saved")
        void journalAfterCommit() {
            engine.deposit(ALICE, A, units(10));
            assertThat(events).extracting(VaultEvent::type).containsExactly(VaultEventType.DEPOSIT);
            assertThat(repository.map).containsKey(VAULT.value());

            assertThatThrownBy(() -> engine.redeem(BOB, shares(1))).isInstanceOf(InsufficientBalanceException.class);
            assertThat(events).hasSize(1);
        }
    }

    @Test
    @DisplayName("Share balances always sum to supply across a mixed sequence")
    void ledgerInvariantOverSequence() {
        seventyThirty();
        engine.deposit(BOB, B, units(250));
        venue.rateBps = 10_100;
        engine.rebalanceByBestQuote(BOB);
        engine.redeem(ALICE, engine.balanceOf(ALICE).divide(BigInteger.TWO));
        engine.deposit(ALICE, A, units(33));
        venue.rateBps = 9_980;
        engine.redeem(MANAGER, shares(100));

        assertLedgerConsistent();
        assertThat(engine.currentAllocation()).hasSize(2);
    }

    private static final class MapRepository implements VaultStateRepository {
        final Map<String, VaultSnapshot> map = new HashMap<>();

        @Override
        public Optional<VaultSnapshot> load(VaultId id) {
            return Optional.ofNullable(map.get(id.value()));
        }

        @Override
        public void save(VaultSnapshot snapshot) {
            map.put(snapshot.vaultId(), new VaultSnapshot(snapshot.vaultId(), snapshot.manager(),
                    new LinkedHashMap<>(snapshot.shareBalances()), snapshot.totalSupply(), snapshot.allocation(),
                    snapshot.venues(), snapshot.sharePriceUsd(), snapshot.totalDepositValueUsd(),
                    snapshot.totalWithdrawValueUsd(), snapshot.paused(), snapshot.swapPaused(),
                    snapshot.ownerFeeBps(), snapshot.callerFeeBps()));
        }
    }
}
