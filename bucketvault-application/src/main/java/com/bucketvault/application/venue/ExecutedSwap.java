package com.bucketvault.application.venue;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;

/**
 * A completed trade.
 *
 * @param route      venue id for best-quote swaps, aggregator label for external routes
 * @param quotedOut  quote the trade was selected on (equals amountOut when none was taken)
 */
public record ExecutedSwap(String route,
                           AssetId assetIn,
                           AssetId assetOut,
                           BigInteger amountIn,
                           BigInteger quotedOut,
                           BigInteger amountOut) {}
