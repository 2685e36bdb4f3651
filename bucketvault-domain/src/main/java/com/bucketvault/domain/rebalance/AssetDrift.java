package com.bucketvault.domain.rebalance;

import com.bucketvault.domain.asset.AssetId;

/** Actual vs. target weight of one asset, both in basis points. */
public record AssetDrift(AssetId asset, int actualBps, int targetBps) {

    public int deviationBps() {
        return Math.abs(actualBps - targetBps);
    }
}
