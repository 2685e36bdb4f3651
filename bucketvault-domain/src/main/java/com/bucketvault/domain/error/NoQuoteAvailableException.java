package com.bucketvault.domain.error;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;

public final class NoQuoteAvailableException extends VaultException {

    private final AssetId assetIn;
    private final AssetId assetOut;
    private final BigInteger amountIn;

    public NoQuoteAvailableException(AssetId assetIn, AssetId assetOut, BigInteger amountIn) {
        super(VaultErrorCode.NO_QUOTE_AVAILABLE,
                "No venue quoted " + amountIn + " " + assetIn + " -> " + assetOut);
        this.assetIn = assetIn;
        this.assetOut = assetOut;
        this.amountIn = amountIn;
    }

    public AssetId assetIn() { return assetIn; }
    public AssetId assetOut() { return assetOut; }
    public BigInteger amountIn() { return amountIn; }
}
