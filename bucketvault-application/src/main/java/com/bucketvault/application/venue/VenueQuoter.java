package com.bucketvault.application.venue;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;

/**
 * Best-effort price source of one venue. May throw or return zero; the router treats both as "no quote".
 */
@FunctionalInterface
public interface VenueQuoter {

    /** Expected output amount for selling {@code amountIn} of {@code assetIn}. */
    BigInteger quote(AssetId assetIn, AssetId assetOut, BigInteger amountIn, int feeTier) throws Exception;
}
