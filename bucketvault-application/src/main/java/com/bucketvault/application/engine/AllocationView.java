package com.bucketvault.application.engine;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;

/** Current holding of one asset relative to the target. */
public record AllocationView(AssetId asset,
                             BigInteger balance,
                             BigInteger valueUsd,
                             int weightBps,
                             int targetBps) {}
