package com.bucketvault.application.engine;

import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.HolderId;

import java.math.BigInteger;
import java.util.Map;

/**
 * @param payouts nonzero transfers only, in registry order
 */
public record RedeemResult(HolderId holder,
                           BigInteger sharesBurned,
                           Map<AssetId, BigInteger> payouts,
                           BigInteger sharePriceUsd) {}
