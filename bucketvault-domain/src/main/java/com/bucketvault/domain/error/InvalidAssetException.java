package com.bucketvault.domain.error;

import com.bucketvault.domain.asset.AssetId;

public final class InvalidAssetException extends VaultException {

    private final AssetId asset;

    public InvalidAssetException(AssetId asset, String reason) {
        super(VaultErrorCode.INVALID_ASSET, "Invalid asset " + asset + ": " + reason);
        this.asset = asset;
    }

    public AssetId asset() {
        return asset;
    }
}
