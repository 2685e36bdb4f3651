package com.bucketvault.infrastructure.venue;

import com.bucketvault.application.ports.PriceOraclePort;
import com.bucketvault.application.venue.VenueExecutor;
import com.bucketvault.application.venue.VenueHandles;
import com.bucketvault.application.venue.VenueId;
import com.bucketvault.application.venue.VenueQuoter;
import com.bucketvault.domain.asset.Asset;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.FixedPoint;
import com.bucketvault.infrastructure.custody.InMemoryCustody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;

/**
 * PAPER venue that prices trades at the oracle and settles them against in-memory custody.
 *
 * <p>Fault switches emulate unreliable venues: failing quotes, failing swaps, and fills that
 * deliver less than quoted. A before-swap hook lets tests act as an adversarial counterparty.
 */
public final class PaperVenue implements VenueQuoter, VenueExecutor {

    private static final Logger log = LoggerFactory.getLogger(PaperVenue.class);

    private final VenueId id;
    private final PriceOraclePort oracle;
    private final InMemoryCustody custody;
    private final PaperExecutionModel model;

    private volatile boolean quotesFailing;
    private volatile boolean swapsFailing;
    private volatile int fillShortfallBps;
    private volatile Runnable beforeSwap;

    public PaperVenue(VenueId id, PriceOraclePort oracle, InMemoryCustody custody, PaperExecutionModel model) {
        this.id = Objects.requireNonNull(id, "id");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.custody = Objects.requireNonNull(custody, "custody");
        this.model = Objects.requireNonNull(model, "model");
    }

    public VenueId id() {
        return id;
    }

    public VenueHandles handles() {
        return new VenueHandles(this, this);
    }

    public void setQuotesFailing(boolean value) { this.quotesFailing = value; }

    public void setSwapsFailing(boolean value) { this.swapsFailing = value; }

    /** Fills deliver this many bps less than the quote. */
    public void setFillShortfallBps(int bps) {
        if (bps < 0 || bps > FixedPoint.BPS) throw new IllegalArgumentException("bps must be in [0, 10000]");
        this.fillShortfallBps = bps;
    }

    public void setBeforeSwap(Runnable hook) { this.beforeSwap = hook; }

    @Override
    public BigInteger quote(AssetId assetIn, AssetId assetOut, BigInteger amountIn, int feeTier) {
        if (quotesFailing) {
            throw new IllegalStateException("Quote source of " + id + " unavailable");
        }
        return expectedOut(assetIn, assetOut, amountIn);
    }

    @Override
    public BigInteger swap(AssetId assetIn, AssetId assetOut, BigInteger amountIn, BigInteger minAmountOut, int feeTier) {
        Runnable hook = beforeSwap;
        if (hook != null) hook.run();
        if (swapsFailing) {
            throw new IllegalStateException("Swap on " + id + " reverted");
        }

        BigInteger out = FixedPoint.applyBps(expectedOut(assetIn, assetOut, amountIn), FixedPoint.BPS - fillShortfallBps);
        if (minAmountOut != null && out.compareTo(minAmountOut) < 0) {
            throw new IllegalStateException("Too little received on " + id + ": " + out + " < " + minAmountOut);
        }
        if (out.signum() <= 0) {
            throw new IllegalStateException("Empty fill on " + id);
        }

        custody.debit(assetIn, amountIn);
        custody.credit(assetOut, out);
        log.debug("[VENUE] action=PAPER_FILL venue={} pair={}->{} amountIn={} amountOut={} feeTier={}",
                id, assetIn, assetOut, amountIn, out, feeTier);
        return out;
    }

    private BigInteger expectedOut(AssetId assetIn, AssetId assetOut, BigInteger amountIn) {
        Asset in = metadata(assetIn);
        Asset out = metadata(assetOut);
        BigInteger valueUsd = FixedPoint.valueOf(amountIn, price(assetIn), in.decimals());
        return model.fill(FixedPoint.amountFor(valueUsd, price(assetOut), out.decimals()));
    }

    private Asset metadata(AssetId asset) {
        return oracle.findAcceptedAsset(asset)
                .orElseThrow(() -> new IllegalArgumentException(id + " does not list " + asset));
    }

    private BigInteger price(AssetId asset) {
        BigInteger p = oracle.getPrice(asset);
        if (p == null || p.signum() <= 0) throw new IllegalStateException(id + " has no price for " + asset);
        return p;
    }
}
