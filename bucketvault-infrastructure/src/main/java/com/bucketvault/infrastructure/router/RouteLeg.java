package com.bucketvault.infrastructure.router;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One hop of an aggregator route.
 *
 * @param minAmountOut lower bound the hop must deliver; zero means unchecked
 */
public record RouteLeg(AssetId assetIn, AssetId assetOut, BigInteger amountIn, BigInteger minAmountOut) {

    public RouteLeg {
        Objects.requireNonNull(assetIn, "assetIn");
        Objects.requireNonNull(assetOut, "assetOut");
        if (amountIn == null || amountIn.signum() <= 0) throw new IllegalArgumentException("amountIn must be > 0");
        if (minAmountOut == null) minAmountOut = BigInteger.ZERO;
        if (minAmountOut.signum() < 0) throw new IllegalArgumentException("minAmountOut must be >= 0");
    }

    public static RouteLeg of(String assetIn, String assetOut, BigInteger amountIn) {
        return new RouteLeg(AssetId.of(assetIn), AssetId.of(assetOut), amountIn, BigInteger.ZERO);
    }
}
