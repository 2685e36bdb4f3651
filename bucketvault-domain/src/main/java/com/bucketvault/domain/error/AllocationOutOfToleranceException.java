package com.bucketvault.domain.error;

import com.bucketvault.domain.asset.AssetId;

public final class AllocationOutOfToleranceException extends VaultException {

    private final AssetId asset;
    private final int actualBps;
    private final int targetBps;

    public AllocationOutOfToleranceException(AssetId asset, int actualBps, int targetBps, int toleranceBps) {
        super(VaultErrorCode.ALLOCATION_OUT_OF_TOLERANCE,
                "Asset " + asset + " weight " + actualBps + " bps vs target " + targetBps
                        + " bps exceeds tolerance " + toleranceBps + " bps");
        this.asset = asset;
        this.actualBps = actualBps;
        this.targetBps = targetBps;
    }

    public AssetId asset() { return asset; }
    public int actualBps() { return actualBps; }
    public int targetBps() { return targetBps; }
}
