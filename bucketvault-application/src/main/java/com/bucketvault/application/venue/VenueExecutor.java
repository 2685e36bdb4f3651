package com.bucketvault.application.venue;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;

/**
 * Trade execution on one venue against the vault's custody.
 */
@FunctionalInterface
public interface VenueExecutor {

    /**
     * Sell exactly {@code amountIn} of {@code assetIn}; must fail rather than deliver less than {@code minAmountOut}.
     *
     * @return amount of {@code assetOut} received by the vault
     */
    BigInteger swap(AssetId assetIn, AssetId assetOut, BigInteger amountIn, BigInteger minAmountOut, int feeTier)
            throws Exception;
}
