package com.bucketvault.application.engine;

import com.bucketvault.application.config.VaultParameters;
import com.bucketvault.application.journal.VaultEvent;
import com.bucketvault.application.journal.VaultEventType;
import com.bucketvault.application.ports.AggregatorRouterPort;
import com.bucketvault.application.ports.CustodyPort;
import com.bucketvault.application.ports.CustodyTransaction;
import com.bucketvault.application.ports.NativeWrapperPort;
import com.bucketvault.application.ports.NoopVaultJournal;
import com.bucketvault.application.ports.PriceOraclePort;
import com.bucketvault.application.ports.VaultJournalPort;
import com.bucketvault.application.ports.VaultSnapshot;
import com.bucketvault.application.ports.VaultStateRepository;
import com.bucketvault.application.venue.BestQuote;
import com.bucketvault.application.venue.BestQuoteRouter;
import com.bucketvault.application.venue.ExecutedSwap;
import com.bucketvault.application.venue.VenueConfig;
import com.bucketvault.application.venue.VenueExecutionException;
import com.bucketvault.application.venue.VenueHandles;
import com.bucketvault.application.venue.VenueId;
import com.bucketvault.application.venue.VenueRegistry;
import com.bucketvault.application.venue.VenueTable;
import com.bucketvault.domain.allocation.TargetAllocation;
import com.bucketvault.domain.asset.Asset;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.error.AllocationInvalidException;
import com.bucketvault.domain.error.AllocationOutOfToleranceException;
import com.bucketvault.domain.error.InsufficientBalanceException;
import com.bucketvault.domain.error.InvalidAssetException;
import com.bucketvault.domain.error.PlatformHaltedException;
import com.bucketvault.domain.error.UnaccountableException;
import com.bucketvault.domain.error.UnauthorizedException;
import com.bucketvault.domain.error.VaultException;
import com.bucketvault.domain.error.VaultPausedException;
import com.bucketvault.domain.error.ZeroAmountException;
import com.bucketvault.domain.error.ZeroSharesException;
import com.bucketvault.domain.rebalance.AssetDrift;
import com.bucketvault.domain.rebalance.AssetPosition;
import com.bucketvault.domain.rebalance.DriftCorrectionPlanner;
import com.bucketvault.domain.rebalance.RebalancePlan;
import com.bucketvault.domain.rebalance.TradeLeg;
import com.bucketvault.domain.risk.AccountabilityPolicy;
import com.bucketvault.domain.risk.ValueLossGuard;
import com.bucketvault.domain.vault.FixedPoint;
import com.bucketvault.domain.vault.HolderId;
import com.bucketvault.domain.vault.ShareLedger;
import com.bucketvault.domain.vault.VaultId;
import com.bucketvault.domain.vault.VaultState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Share accounting and drift-correction engine of one vault instance.
 *
 * <p>Owns the share ledger, accounting state, target allocation and venue table. Every mutating call
 * is serialized on the instance, guarded against reentrant callbacks, and all-or-nothing: on any
 * failure (errors included) ledger, state, tables and custody balances are restored before the
 * throwable escapes unchanged.
 * Nothing here retries; the caller decides whether a failure is worth another attempt
 * (see {@link com.bucketvault.domain.error.VaultErrorCode#isRetryable()}).
 *
 * <p>Variants are chosen at construction: without a target allocation only external-route
 * rebalancing is possible; with {@link AccountabilityPolicy#ungated()} the manager is never gated.
 */
public class VaultAccountingEngine {

    private static final Logger log = LoggerFactory.getLogger(VaultAccountingEngine.class);

    private final VaultId vaultId;
    private final HolderId manager;
    private final PriceOraclePort oracle;
    private final CustodyPort custody;
    private final AggregatorRouterPort aggregator;
    private final VaultStateRepository repository;
    private final VaultJournalPort journal;
    private final AccountabilityPolicy accountability;
    private final DriftCorrectionPlanner planner;
    private final ValueLossGuard lossGuard;
    private final FeeSettlement feeSettlement;
    private final BestQuoteRouter router;
    private final ReentrancyGuard guard = new ReentrancyGuard();

    private final ShareLedger ledger;
    private final VaultState state;
    private final VenueTable venues;
    private TargetAllocation allocation;

    private final List<VaultEvent> pending = new ArrayList<>();

    private VaultAccountingEngine(Builder b, ShareLedger ledger, VaultState state, VenueTable venues,
                                  TargetAllocation allocation) {
        this.vaultId = b.vaultId;
        this.manager = b.manager;
        this.oracle = b.oracle;
        this.custody = b.custody;
        this.aggregator = b.aggregator;
        this.repository = b.repository;
        this.journal = b.journal;
        this.accountability = b.parameters.accountabilityPolicy();
        this.planner = new DriftCorrectionPlanner(b.parameters.toleranceBps());
        this.lossGuard = new ValueLossGuard(b.parameters.maxValueLossBps());
        this.feeSettlement = new FeeSettlement(b.oracle);
        this.ledger = ledger;
        this.state = state;
        this.venues = venues;
        this.allocation = allocation;
        this.router = new BestQuoteRouter(venues, b.wrapper, b.parameters.venueSlippageBps());
    }

    public static Builder builder() {
        return new Builder();
    }

    /* =========================
       Holder operations
       ========================= */

    public synchronized DepositResult deposit(HolderId caller, AssetId asset, BigInteger amount) {
        return atomically("DEPOSIT", () -> {
            requireOperational();
            return depositAsset(caller, asset, amount);
        });
    }

    /** Deposit of the chain-native coin as registered with the oracle. */
    public synchronized DepositResult depositNative(HolderId caller, BigInteger amount) {
        return atomically("DEPOSIT", () -> {
            requireOperational();
            AssetId nativeId = oracle.nativeAsset()
                    .map(Asset::id)
                    .orElseThrow(() -> new InvalidAssetException(AssetId.of("NATIVE"), "no native asset is accepted"));
            return depositAsset(caller, nativeId, amount);
        });
    }

    private DepositResult depositAsset(HolderId caller, AssetId asset, BigInteger amount) {
        requireNotPaused();
        Objects.requireNonNull(caller, "caller");
        Asset meta = acceptedAsset(asset);
        BigInteger price = priceOf(asset);
        requirePositive(amount, "deposit amount");

        BigInteger sharePrice = mintPrice();
        BigInteger valueUsd = FixedPoint.valueOf(amount, price, meta.decimals());
        BigInteger shares = FixedPoint.sharesFor(valueUsd, sharePrice);
        if (shares.signum() == 0) {
            throw new ZeroSharesException(valueUsd, sharePrice);
        }

        custody.receive(caller, asset, amount);
        state.recordDeposit(valueUsd);
        ledger.mint(caller, shares);
        BigInteger newPrice = refreshSharePrice();

        emit(VaultEventType.DEPOSIT, caller, asset, amount, valueUsd, shares, null);
        log.info("[VAULT] action=DEPOSIT vault={} holder={} asset={} amount={} valueUsd={} shares={} price={}",
                vaultId, caller, asset, amount, valueUsd, shares, newPrice);
        return new DepositResult(caller, asset, amount, valueUsd, shares, newPrice);
    }

    /**
     * Pays out {@code shareAmount / totalSupply} of every physical holding. Shares are burned before any
     * transfer so a counterparty callback sees the post-redeem ratio.
     */
    public synchronized RedeemResult redeem(HolderId caller, BigInteger shareAmount) {
        return atomically("REDEEM", () -> {
            requireOperational();
            Objects.requireNonNull(caller, "caller");
            requirePositive(shareAmount, "share amount");
            BigInteger balance = ledger.balanceOf(caller);
            if (balance.compareTo(shareAmount) < 0) {
                throw new InsufficientBalanceException(caller, shareAmount, balance);
            }

            BigInteger supplyBefore = ledger.totalSupply();
            Map<AssetId, BigInteger> payouts = new LinkedHashMap<>();
            for (Asset a : oracle.getAcceptedAssets()) {
                BigInteger payout = FixedPoint.mulDiv(custody.balanceOf(a.id()), shareAmount, supplyBefore);
                if (payout.signum() > 0) payouts.put(a.id(), payout);
            }
            BigInteger withdrawValue = FixedPoint.valueOfShares(shareAmount, state.sharePriceUsd());

            ledger.burn(caller, shareAmount);
            state.recordWithdraw(withdrawValue);

            for (Map.Entry<AssetId, BigInteger> p : payouts.entrySet()) {
                custody.send(caller, p.getKey(), p.getValue());
                emit(VaultEventType.REDEEM_PAYOUT, caller, p.getKey(), p.getValue(), null, null, null);
            }
            BigInteger newPrice = refreshSharePrice();

            emit(VaultEventType.REDEEM, caller, null, null, withdrawValue, shareAmount, null);
            log.info("[VAULT] action=REDEEM vault={} holder={} shares={} payouts={} price={}",
                    vaultId, caller, shareAmount, payouts, newPrice);
            return new RedeemResult(caller, shareAmount, Collections.unmodifiableMap(payouts), newPrice);
        });
    }

    /**
     * Corrects drift from the target allocation through best-quote venue selection.
     * Any holder may trigger it and earns the caller fee on a gain.
     */
    public synchronized RebalanceResult rebalanceByBestQuote(HolderId caller) {
        return atomically("REBALANCE", () -> {
            requireRebalanceAllowed(caller);
            TargetAllocation target = allocation;
            if (target == null) {
                throw new AllocationInvalidException("no target allocation configured");
            }

            List<AssetPosition> before = positions(target);
            BigInteger valueBefore = AssetPosition.totalValue(before);

            List<ExecutedSwap> swaps = new ArrayList<>();
            if (planner.isWithinTolerance(before, target)) {
                log.info("[VAULT] action=REBALANCE vault={} caller={} status=WITHIN_TOLERANCE valueUsd={}",
                        vaultId, caller, valueBefore);
            } else {
                RebalancePlan plan = planner.plan(before, target);
                log.info("[VAULT] action=REBALANCE vault={} caller={} sellers={} buyers={} legs={}",
                        vaultId, caller, plan.sellerExcess(), plan.buyerDeficit(), plan.legs().size());
                for (TradeLeg leg : plan.legs()) {
                    ExecutedSwap swap = router.execute(leg.assetIn(), leg.assetOut(), leg.amountIn());
                    swaps.add(swap);
                    emit(VaultEventType.SWAP, caller, leg.assetIn(), leg.amountIn(), leg.expectedValueUsd(), null,
                            swap.route() + " -> " + swap.amountOut() + " " + swap.assetOut());
                }
            }
            return completeRebalance(caller, target, valueBefore, swaps, "BEST_QUOTE");
        });
    }

    /**
     * Executes a caller-supplied aggregator route, then applies the same value-loss, allocation and fee
     * rules as {@link #rebalanceByBestQuote}. Without a target allocation the tolerance check is skipped.
     */
    public synchronized RebalanceResult rebalanceByExternalRoute(HolderId caller, byte[] routeData) {
        return atomically("REBALANCE_ROUTE", () -> {
            requireRebalanceAllowed(caller);
            if (aggregator == null) {
                throw new IllegalStateException("No aggregator router configured for vault " + vaultId);
            }
            Objects.requireNonNull(routeData, "routeData");
            TargetAllocation target = allocation;

            BigInteger valueBefore = AssetPosition.totalValue(positions(target));
            List<ExecutedSwap> swaps;
            try {
                swaps = List.copyOf(aggregator.execute(routeData));
            } catch (VaultException e) {
                throw e;
            } catch (Exception e) {
                throw new VenueExecutionException("aggregator", e);
            }
            for (ExecutedSwap swap : swaps) {
                emit(VaultEventType.SWAP, caller, swap.assetIn(), swap.amountIn(), null, null,
                        swap.route() + " -> " + swap.amountOut() + " " + swap.assetOut());
            }
            return completeRebalance(caller, target, valueBefore, swaps, "EXTERNAL_ROUTE");
        });
    }

    private RebalanceResult completeRebalance(HolderId caller, TargetAllocation target, BigInteger valueBefore,
                                              List<ExecutedSwap> swaps, String mode) {
        List<AssetPosition> after = positions(target);
        BigInteger valueAfter = AssetPosition.totalValue(after);

        lossGuard.check(valueBefore, valueAfter);
        if (target != null) {
            Optional<AssetDrift> drift = planner.firstOutOfTolerance(after, target);
            if (drift.isPresent()) {
                AssetDrift d = drift.get();
                throw new AllocationOutOfToleranceException(d.asset(), d.actualBps(), d.targetBps(),
                        planner.toleranceBps());
            }
        }

        boolean accountable = isAccountableInternal();
        FeeSettlementResult fees = feeSettlement.settle(ledger, manager, caller, valueBefore, valueAfter,
                accountable, state.ownerFeeBps(), state.callerFeeBps());
        recordFees(caller, fees);

        BigInteger newPrice = FixedPoint.sharePrice(valueAfter, ledger.totalSupply());
        state.updateSharePrice(newPrice);

        emit(VaultEventType.REBALANCE, caller, null, null, valueAfter, null,
                mode + " swaps=" + swaps.size() + " before=" + valueBefore);
        log.info("[VAULT] action=REBALANCE vault={} caller={} mode={} swaps={} valueBefore={} valueAfter={} "
                        + "feeShares={} penaltyShares={} price={}",
                vaultId, caller, mode, swaps.size(), valueBefore, valueAfter, fees.mintedShares(),
                fees.penaltyShares(), newPrice);
        return new RebalanceResult(List.copyOf(swaps), valueBefore, valueAfter, fees, newPrice);
    }

    private void recordFees(HolderId caller, FeeSettlementResult fees) {
        if (fees.platformShares().signum() > 0) {
            emit(VaultEventType.FEE_MINT, oracle.platformFeeRecipient(), null, null, null, fees.platformShares(), "platform");
        }
        if (fees.managerShares().signum() > 0) {
            emit(VaultEventType.FEE_MINT, manager, null, null, null, fees.managerShares(), "manager");
        }
        if (fees.callerShares().signum() > 0) {
            emit(VaultEventType.FEE_MINT, caller, null, null, null, fees.callerShares(), "caller");
        }
        if (fees.penaltyShares().signum() > 0) {
            emit(VaultEventType.PENALTY_BURN, manager, null, null, null, fees.penaltyShares(), "manager");
        }
    }

    /* =========================
       Manager operations
       ========================= */

    public synchronized void updateTargetAllocation(HolderId caller, TargetAllocation newAllocation) {
        atomically("UPDATE_ALLOCATION", () -> {
            requireOperational();
            requireManager(caller);
            requireAccountable();
            Objects.requireNonNull(newAllocation, "newAllocation");
            for (AssetId a : newAllocation.assets()) {
                if (!oracle.isAssetAccepted(a)) {
                    throw new InvalidAssetException(a, "not accepted by the registry");
                }
            }
            this.allocation = newAllocation;
            emit(VaultEventType.ALLOCATION_UPDATED, caller, null, null, null, null, newAllocation.toString());
            log.info("[VAULT] action=UPDATE_ALLOCATION vault={} allocation={}", vaultId, newAllocation);
            return null;
        });
    }

    public synchronized void configureVenue(HolderId caller, VenueConfig venue) {
        atomically("CONFIGURE_VENUE", () -> {
            requireOperational();
            requireManager(caller);
            venues.put(venue);
            emit(VaultEventType.VENUE_CONFIGURED, caller, null, null, null, null,
                    venue.id() + " feeTier=" + venue.feeTier() + " enabled=" + venue.enabled());
            log.info("[VAULT] action=CONFIGURE_VENUE vault={} venue={} feeTier={} wrappedNative={} enabled={}",
                    vaultId, venue.id(), venue.feeTier(), venue.usesWrappedNative(), venue.enabled());
            return null;
        });
    }

    public synchronized void setVenueEnabled(HolderId caller, VenueId venueId, boolean enabled) {
        atomically("CONFIGURE_VENUE", () -> {
            requireOperational();
            requireManager(caller);
            venues.setEnabled(venueId, enabled);
            emit(VaultEventType.VENUE_CONFIGURED, caller, null, null, null, null, venueId + " enabled=" + enabled);
            log.info("[VAULT] action=CONFIGURE_VENUE vault={} venue={} enabled={}", vaultId, venueId, enabled);
            return null;
        });
    }

    public synchronized void setFeeSplit(HolderId caller, int ownerBps, int callerBps) {
        atomically("SET_FEE_SPLIT", () -> {
            requireOperational();
            requireManager(caller);
            state.setFeeSplit(ownerBps, callerBps);
            emit(VaultEventType.FEE_SPLIT_UPDATED, caller, null, null, null, null,
                    "owner=" + ownerBps + " caller=" + callerBps);
            log.info("[VAULT] action=SET_FEE_SPLIT vault={} ownerBps={} callerBps={}", vaultId, ownerBps, callerBps);
            return null;
        });
    }

    public synchronized void pause(HolderId caller) {
        changePause(caller, "PAUSE", true, false);
    }

    public synchronized void unpause(HolderId caller) {
        changePause(caller, "UNPAUSE", false, false);
    }

    public synchronized void pauseRebalancing(HolderId caller) {
        changePause(caller, "PAUSE_REBALANCING", true, true);
    }

    public synchronized void unpauseRebalancing(HolderId caller) {
        changePause(caller, "UNPAUSE_REBALANCING", false, true);
    }

    private void changePause(HolderId caller, String action, boolean value, boolean swapsOnly) {
        atomically(action, () -> {
            requireOperational();
            requireManager(caller);
            // lifting a pause stays available to a manager who lost accountability
            if (value) requireAccountable();
            if (swapsOnly) state.setSwapPaused(value);
            else state.setPaused(value);
            emit(VaultEventType.PAUSE_CHANGED, caller, null, null, null, null, action);
            log.info("[VAULT] action={} vault={} caller={}", action, vaultId, caller);
            return null;
        });
    }

    /** Recovers tokens sent to the vault by mistake. Never applies to an accepted asset. */
    public synchronized void sweep(HolderId caller, AssetId asset, BigInteger amount, HolderId to) {
        atomically("SWEEP", () -> {
            requireOperational();
            requireManager(caller);
            Objects.requireNonNull(asset, "asset");
            Objects.requireNonNull(to, "to");
            if (oracle.isAssetAccepted(asset)) {
                throw new InvalidAssetException(asset, "accepted assets cannot be swept");
            }
            requirePositive(amount, "sweep amount");
            custody.send(to, asset, amount);
            emit(VaultEventType.SWEEP, to, asset, amount, null, null, null);
            log.warn("[VAULT] action=SWEEP vault={} asset={} amount={} to={}", vaultId, asset, amount, to);
            return null;
        });
    }

    /* =========================
       Views
       ========================= */

    public synchronized BigInteger currentTotalValue() {
        return AssetPosition.totalValue(positions(null));
    }

    public synchronized List<AllocationView> currentAllocation() {
        List<AssetPosition> positions = positions(allocation);
        BigInteger total = AssetPosition.totalValue(positions);
        List<AllocationView> out = new ArrayList<>(positions.size());
        for (AssetPosition p : positions) {
            BigInteger value = p.valueUsd();
            int target = allocation == null ? 0 : allocation.targetBps(p.asset());
            out.add(new AllocationView(p.asset(), p.balance(), value, FixedPoint.bpsOf(value, total), target));
        }
        return out;
    }

    /** Recorded share price; {@link FixedPoint#INITIAL_PRICE} before the first deposit. */
    public synchronized BigInteger sharePrice() {
        return state.isPriceInitialized() ? state.sharePriceUsd() : FixedPoint.INITIAL_PRICE;
    }

    public synchronized BigInteger totalSupply() {
        return ledger.totalSupply();
    }

    public synchronized BigInteger balanceOf(HolderId holder) {
        return ledger.balanceOf(holder);
    }

    public synchronized Map<HolderId, BigInteger> shareBalances() {
        return ledger.balances();
    }

    public synchronized boolean isAccountable() {
        return isAccountableInternal();
    }

    public synchronized Optional<BestQuote> bestQuote(AssetId assetIn, AssetId assetOut, BigInteger amountIn) {
        return router.bestQuote(assetIn, assetOut, amountIn);
    }

    public synchronized List<VenueConfig> venues() {
        return venues.all();
    }

    public synchronized Optional<TargetAllocation> targetAllocation() {
        return Optional.ofNullable(allocation);
    }

    public synchronized BigInteger totalDepositValue() {
        return state.totalDepositValueUsd();
    }

    public synchronized BigInteger totalWithdrawValue() {
        return state.totalWithdrawValueUsd();
    }

    public synchronized int ownerFeeBps() {
        return state.ownerFeeBps();
    }

    public synchronized int callerFeeBps() {
        return state.callerFeeBps();
    }

    public synchronized boolean isPaused() {
        return state.paused();
    }

    public synchronized boolean isRebalancingPaused() {
        return state.swapPaused();
    }

    public VaultId vaultId() {
        return vaultId;
    }

    public HolderId manager() {
        return manager;
    }

    public synchronized VaultSnapshot snapshot() {
        Map<String, BigInteger> balances = new LinkedHashMap<>();
        ledger.balances().forEach((h, v) -> balances.put(h.value(), v));
        List<VaultSnapshot.VenueRow> rows = venues.all().stream()
                .map(v -> new VaultSnapshot.VenueRow(v.id().index(), v.feeTier(), v.usesWrappedNative(), v.enabled()))
                .toList();
        return new VaultSnapshot(
                vaultId.value(),
                manager.value(),
                balances,
                ledger.totalSupply(),
                allocation == null ? List.of() : allocation.rows(),
                rows,
                state.sharePriceUsd(),
                state.totalDepositValueUsd(),
                state.totalWithdrawValueUsd(),
                state.paused(),
                state.swapPaused(),
                state.ownerFeeBps(),
                state.callerFeeBps());
    }

    /* =========================
       Internals
       ========================= */

    private <T> T atomically(String action, Supplier<T> work) {
        guard.enter(action);
        try {
            ShareLedger ledgerBackup = ledger.copy();
            VaultState stateBackup = state.copy();
            VenueTable venuesBackup = venues.copy();
            TargetAllocation allocationBackup = allocation;
            pending.clear();

            CustodyTransaction tx = custody.begin();
            try {
                T result = work.get();
                if (repository != null) {
                    repository.save(snapshot());
                }
                tx.commit();
                flushEvents();
                return result;
            } catch (Throwable e) {
                tx.rollback();
                ledger.restoreFrom(ledgerBackup);
                state.restoreFrom(stateBackup);
                venues.restoreFrom(venuesBackup);
                allocation = allocationBackup;
                pending.clear();
                if (e instanceof VaultException ve) {
                    log.warn("[VAULT] action={} vault={} status=REVERTED code={} retryable={} reason={}",
                            action, vaultId, ve.code(), ve.code().isRetryable(), ve.getMessage());
                } else {
                    log.error("[VAULT] action={} vault={} status=REVERTED", action, vaultId, e);
                }
                throw e;
            }
        } finally {
            guard.exit();
        }
    }

    private void emit(VaultEventType type, HolderId holder, AssetId asset, BigInteger amount,
                      BigInteger valueUsd, BigInteger shares, String detail) {
        pending.add(VaultEvent.of(vaultId, type, holder, asset, amount, valueUsd, shares, detail));
    }

    private void flushEvents() {
        List<VaultEvent> events = List.copyOf(pending);
        pending.clear();
        for (VaultEvent e : events) {
            try {
                journal.record(e);
            } catch (RuntimeException ex) {
                // committed state stays authoritative when the audit sink is down
                log.warn("[VAULT] journal write failed vault={} type={} reason={}", vaultId, e.type(), ex.toString());
            }
        }
    }

    private void requireOperational() {
        if (!oracle.isPlatformOperational()) {
            throw new PlatformHaltedException();
        }
    }

    private void requireNotPaused() {
        if (state.paused()) throw new VaultPausedException("Vault " + vaultId + " is paused");
    }

    private void requireRebalanceAllowed(HolderId caller) {
        requireOperational();
        requireNotPaused();
        if (state.swapPaused()) throw new VaultPausedException("Rebalancing of vault " + vaultId + " is paused");
        Objects.requireNonNull(caller, "caller");
        if (ledger.balanceOf(caller).signum() == 0) {
            throw new UnauthorizedException("Only share holders may trigger a rebalance: " + caller);
        }
    }

    private void requireManager(HolderId caller) {
        if (!manager.equals(caller)) {
            throw new UnauthorizedException("Caller " + caller + " is not the manager of vault " + vaultId);
        }
    }

    private void requireAccountable() {
        if (!isAccountableInternal()) {
            throw new UnaccountableException(ledger.balanceOf(manager), ledger.totalSupply());
        }
    }

    private boolean isAccountableInternal() {
        return accountability.isAccountable(ledger.balanceOf(manager), ledger.totalSupply());
    }

    private static void requirePositive(BigInteger amount, String what) {
        if (amount == null || amount.signum() <= 0) throw new ZeroAmountException(what);
    }

    private Asset acceptedAsset(AssetId asset) {
        Objects.requireNonNull(asset, "asset");
        if (!oracle.isAssetAccepted(asset)) {
            throw new InvalidAssetException(asset, "not accepted by the registry");
        }
        return oracle.findAcceptedAsset(asset)
                .orElseThrow(() -> new InvalidAssetException(asset, "no registry metadata"));
    }

    private BigInteger priceOf(AssetId asset) {
        BigInteger p = oracle.getPrice(asset);
        if (p == null || p.signum() <= 0) {
            throw new InvalidAssetException(asset, "oracle price is zero");
        }
        return p;
    }

    /**
     * Accepted assets (plus every target asset, which must be accepted), priced now.
     */
    private List<AssetPosition> positions(TargetAllocation target) {
        Map<AssetId, Asset> assets = new LinkedHashMap<>();
        for (Asset a : oracle.getAcceptedAssets()) {
            assets.put(a.id(), a);
        }
        if (target != null) {
            Set<AssetId> targetAssets = target.assets();
            for (AssetId id : targetAssets) {
                if (!assets.containsKey(id)) throw new InvalidAssetException(id, "target asset is not accepted");
            }
        }
        List<AssetPosition> out = new ArrayList<>(assets.size());
        for (Asset a : assets.values()) {
            out.add(new AssetPosition(a.id(), a.decimals(), custody.balanceOf(a.id()), priceOf(a.id())));
        }
        return out;
    }

    /** Price new shares are issued at: the current mark, or the initial price while nothing is issued. */
    private BigInteger mintPrice() {
        BigInteger supply = ledger.totalSupply();
        if (supply.signum() == 0) {
            state.updateSharePrice(FixedPoint.INITIAL_PRICE);
            return FixedPoint.INITIAL_PRICE;
        }
        BigInteger mark = FixedPoint.sharePrice(currentTotalValueInternal(), supply);
        if (mark.signum() > 0) return mark;
        return state.isPriceInitialized() ? state.sharePriceUsd() : FixedPoint.INITIAL_PRICE;
    }

    private BigInteger currentTotalValueInternal() {
        return AssetPosition.totalValue(positions(null));
    }

    private BigInteger refreshSharePrice() {
        BigInteger price = FixedPoint.sharePrice(currentTotalValueInternal(), ledger.totalSupply());
        state.updateSharePrice(price);
        return price;
    }

    /* =========================
       Construction
       ========================= */

    public static final class Builder {
        private VaultId vaultId;
        private HolderId manager;
        private PriceOraclePort oracle;
        private CustodyPort custody;
        private NativeWrapperPort wrapper;
        private AggregatorRouterPort aggregator;
        private VaultStateRepository repository;
        private VaultJournalPort journal = new NoopVaultJournal();
        private VaultParameters parameters = VaultParameters.defaults();
        private TargetAllocation allocation;
        private VenueRegistry venueRegistry;
        private final List<VenueConfig> venues = new ArrayList<>();

        private Builder() {}

        public Builder vaultId(VaultId vaultId) { this.vaultId = vaultId; return this; }
        public Builder manager(HolderId manager) { this.manager = manager; return this; }
        public Builder oracle(PriceOraclePort oracle) { this.oracle = oracle; return this; }
        public Builder custody(CustodyPort custody) { this.custody = custody; return this; }
        public Builder nativeWrapper(NativeWrapperPort wrapper) { this.wrapper = wrapper; return this; }
        public Builder aggregator(AggregatorRouterPort aggregator) { this.aggregator = aggregator; return this; }
        public Builder repository(VaultStateRepository repository) { this.repository = repository; return this; }
        public Builder journal(VaultJournalPort journal) { this.journal = journal; return this; }
        public Builder parameters(VaultParameters parameters) { this.parameters = parameters; return this; }
        public Builder allocation(TargetAllocation allocation) { this.allocation = allocation; return this; }
        public Builder venueRegistry(VenueRegistry venueRegistry) { this.venueRegistry = venueRegistry; return this; }

        public Builder venue(VenueConfig venue) {
            this.venues.add(Objects.requireNonNull(venue, "venue"));
            return this;
        }

        /**
         * Builds the engine. When the repository already holds a snapshot for the vault id, the instance
         * is rehydrated from it and the builder's allocation and venues are ignored.
         */
        public VaultAccountingEngine build() {
            requireWired();
            Optional<VaultSnapshot> stored = repository == null ? Optional.empty() : repository.load(vaultId);
            if (stored.isPresent()) {
                return fromSnapshot(stored.get());
            }

            VenueTable table = new VenueTable();
            venues.forEach(table::put);
            VaultState state = new VaultState(parameters.ownerFeeBps(), parameters.callerFeeBps());
            log.info("[VAULT] action=CREATE vault={} manager={} allocation={} venues={}",
                    vaultId, manager, allocation, table.size());
            return new VaultAccountingEngine(this, new ShareLedger(), state, table, allocation);
        }

        /**
         * Rebuilds a previously persisted vault; fails when the repository holds no snapshot for the id.
         */
        public VaultAccountingEngine restore() {
            requireWired();
            Objects.requireNonNull(repository, "repository");
            VaultSnapshot snapshot = repository.load(vaultId)
                    .orElseThrow(() -> new IllegalStateException("No stored snapshot for vault " + vaultId));
            return fromSnapshot(snapshot);
        }

        private void requireWired() {
            Objects.requireNonNull(vaultId, "vaultId");
            Objects.requireNonNull(manager, "manager");
            Objects.requireNonNull(oracle, "oracle");
            Objects.requireNonNull(custody, "custody");
            Objects.requireNonNull(journal, "journal");
            Objects.requireNonNull(parameters, "parameters");
        }

        private VaultAccountingEngine fromSnapshot(VaultSnapshot s) {
            if (!manager.value().equals(s.manager())) {
                throw new IllegalStateException("Stored manager " + s.manager() + " differs from " + manager);
            }
            Map<HolderId, BigInteger> balances = new LinkedHashMap<>();
            if (s.shareBalances() != null) {
                s.shareBalances().forEach((h, v) -> balances.put(HolderId.of(h), v));
            }
            ShareLedger ledger = ShareLedger.restore(balances);
            if (s.totalSupply() != null && ledger.totalSupply().compareTo(s.totalSupply()) != 0) {
                throw new IllegalStateException("Snapshot of " + vaultId + " is inconsistent: balances sum to "
                        + ledger.totalSupply() + " but supply is " + s.totalSupply());
            }
            VaultState state = VaultState.restore(s.totalDepositValueUsd(), s.totalWithdrawValueUsd(),
                    s.sharePriceUsd(), s.paused(), s.swapPaused(), s.ownerFeeBps(), s.callerFeeBps());

            VenueTable table = new VenueTable();
            if (s.venues() != null && !s.venues().isEmpty()) {
                if (venueRegistry == null) {
                    throw new IllegalStateException("Snapshot of " + vaultId + " has venues but no venue registry is wired");
                }
                for (VaultSnapshot.VenueRow row : s.venues()) {
                    VenueId id = VenueId.of(row.id());
                    VenueHandles h = venueRegistry.get(id);
                    table.put(new VenueConfig(id, h.executor(), h.quoter(), row.feeTier(),
                            row.usesWrappedNative(), row.enabled()));
                }
            }
            TargetAllocation restored = (s.allocation() == null || s.allocation().isEmpty())
                    ? null
                    : TargetAllocation.of(s.allocation());

            log.info("[VAULT] action=RESTORE vault={} supply={} price={} venues={}",
                    vaultId, ledger.totalSupply(), state.sharePriceUsd(), table.size());
            return new VaultAccountingEngine(this, ledger, state, table, restored);
        }
    }
}
