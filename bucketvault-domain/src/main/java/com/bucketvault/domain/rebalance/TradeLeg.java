package com.bucketvault.domain.rebalance;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;

/**
 * One planned swap: sell {@code amountIn} of an overweight asset for an underweight one.
 *
 * @param expectedValueUsd oracle value of {@code amountIn} at planning time
 */
public record TradeLeg(AssetId assetIn, AssetId assetOut, BigInteger amountIn, BigInteger expectedValueUsd) {}
