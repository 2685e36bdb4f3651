package com.bucketvault.domain.rebalance;

import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.FixedPoint;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Physical holding of one asset, priced at valuation time.
 */
public record AssetPosition(AssetId asset, int decimals, BigInteger balance, BigInteger priceUsd) {

    public AssetPosition {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(balance, "balance");
        Objects.requireNonNull(priceUsd, "priceUsd");
        if (balance.signum() < 0) throw new IllegalArgumentException("balance must be >= 0");
        if (priceUsd.signum() <= 0) throw new IllegalArgumentException("price must be > 0 for " + asset);
    }

    public BigInteger valueUsd() {
        return FixedPoint.valueOf(balance, priceUsd, decimals);
    }

    public static BigInteger totalValue(Iterable<AssetPosition> positions) {
        BigInteger total = BigInteger.ZERO;
        for (AssetPosition p : positions) total = total.add(p.valueUsd());
        return total;
    }
}
