package com.bucketvault.domain.asset;

import java.util.Objects;

/**
 * Asset metadata. Price and acceptance are owned by the oracle, not by this record.
 *
 * @param id       identifier
 * @param decimals native precision (e.g. 6 for USDC, 18 for ETH)
 * @param nativeCurrency true for the chain-native coin that some venues only trade in wrapped form
 */
public record Asset(AssetId id, int decimals, boolean nativeCurrency) {

    public Asset {
        Objects.requireNonNull(id, "id");
        if (decimals < 0 || decimals > 36) throw new IllegalArgumentException("decimals out of range: " + decimals);
    }

    public static Asset token(String id, int decimals) {
        return new Asset(AssetId.of(id), decimals, false);
    }

    public static Asset nativeCoin(String id, int decimals) {
        return new Asset(AssetId.of(id), decimals, true);
    }
}
