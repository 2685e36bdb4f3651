package com.bucketvault.application.venue;

import com.bucketvault.application.ports.NativeWrapperPort;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.error.NoQuoteAvailableException;
import com.bucketvault.domain.error.VaultException;
import com.bucketvault.domain.vault.FixedPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes one trade to whichever enabled venue quotes the highest output.
 *
 * <p>A quoter that throws or returns a non-positive amount simply has no quote; it never aborts the
 * selection. Ties go to the lowest venue index. Execution carries a minimum output of
 * {@code quote * (10000 - slippageBps) / 10000}.
 *
 * <p>If the winning venue only trades the wrapped native coin, the native side of the trade is wrapped
 * before execution (asset in) or unwrapped after it (asset out).
 */
public final class BestQuoteRouter {

    private static final Logger log = LoggerFactory.getLogger(BestQuoteRouter.class);

    private final VenueTable venues;
    private final NativeWrapperPort wrapper;
    private final int slippageBps;

    public BestQuoteRouter(VenueTable venues, NativeWrapperPort wrapper, int slippageBps) {
        this.venues = Objects.requireNonNull(venues, "venues");
        this.wrapper = wrapper;
        if (slippageBps < 0 || slippageBps >= FixedPoint.BPS) {
            throw new IllegalArgumentException("slippageBps must be in [0, 10000)");
        }
        this.slippageBps = slippageBps;
    }

    public Optional<BestQuote> bestQuote(AssetId assetIn, AssetId assetOut, BigInteger amountIn) {
        BestQuote best = null;
        for (VenueConfig venue : venues.enabled()) {
            Optional<BigInteger> q = quote(venue, assetIn, assetOut, amountIn);
            if (q.isPresent() && (best == null || q.get().compareTo(best.amountOut()) > 0)) {
                best = new BestQuote(venue.id(), q.get());
            }
        }
        return Optional.ofNullable(best);
    }

    /** Quote of a single venue; empty on failure or non-positive output. */
    public Optional<BigInteger> quote(VenueConfig venue, AssetId assetIn, AssetId assetOut, BigInteger amountIn) {
        try {
            BigInteger out = venue.quoter().quote(
                    venueAsset(venue, assetIn), venueAsset(venue, assetOut), amountIn, venue.feeTier());
            if (out == null || out.signum() <= 0) {
                log.debug("[VENUE] action=QUOTE venue={} pair={}->{} status=EMPTY", venue.id(), assetIn, assetOut);
                return Optional.empty();
            }
            return Optional.of(out);
        } catch (Exception e) {
            log.warn("[VENUE] action=QUOTE venue={} pair={}->{} status=FAILED reason={}",
                    venue.id(), assetIn, assetOut, e.toString());
            return Optional.empty();
        }
    }

    public ExecutedSwap execute(AssetId assetIn, AssetId assetOut, BigInteger amountIn) {
        BestQuote best = bestQuote(assetIn, assetOut, amountIn)
                .orElseThrow(() -> new NoQuoteAvailableException(assetIn, assetOut, amountIn));
        VenueConfig venue = venues.get(best.venue());
        BigInteger minOut = FixedPoint.applyBps(best.amountOut(), FixedPoint.BPS - slippageBps);

        boolean wrapIn = needsWrapping(venue, assetIn);
        boolean unwrapOut = needsWrapping(venue, assetOut);
        if (wrapIn) wrapper.wrap(amountIn);

        BigInteger received;
        try {
            received = venue.executor().swap(venueAsset(venue, assetIn), venueAsset(venue, assetOut),
                    amountIn, minOut, venue.feeTier());
        } catch (VaultException e) {
            throw e;
        } catch (Exception e) {
            throw new VenueExecutionException(venue.id().toString(), e);
        }
        if (received == null || received.compareTo(minOut) < 0) {
            throw new VenueExecutionException(venue.id().toString(),
                    "received " + received + " below minimum " + minOut);
        }
        if (unwrapOut) wrapper.unwrap(received);

        log.info("[VENUE] action=SWAP venue={} pair={}->{} amountIn={} quoted={} received={}",
                venue.id(), assetIn, assetOut, amountIn, best.amountOut(), received);
        return new ExecutedSwap(venue.id().toString(), assetIn, assetOut, amountIn, best.amountOut(), received);
    }

    private boolean needsWrapping(VenueConfig venue, AssetId asset) {
        return venue.usesWrappedNative() && wrapper != null && wrapper.nativeAsset().equals(asset);
    }

    private AssetId venueAsset(VenueConfig venue, AssetId asset) {
        return needsWrapping(venue, asset) ? wrapper.wrappedAsset() : asset;
    }
}
