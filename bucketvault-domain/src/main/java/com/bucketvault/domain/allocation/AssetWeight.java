package com.bucketvault.domain.allocation;

import com.bucketvault.domain.asset.AssetId;

import java.util.Objects;

/** One row of a target allocation: integer percent of total value. */
public record AssetWeight(AssetId asset, int weight) {
    public AssetWeight {
        Objects.requireNonNull(asset, "asset");
    }

    public static AssetWeight of(String asset, int weight) {
        return new AssetWeight(AssetId.of(asset), weight);
    }
}
