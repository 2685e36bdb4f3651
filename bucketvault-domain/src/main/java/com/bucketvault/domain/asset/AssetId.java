package com.bucketvault.domain.asset;

import java.util.Locale;
import java.util.Objects;

/**
 * Stable asset identifier (symbol or address), normalized to upper case.
 */
public record AssetId(String value) {

    public AssetId {
        Objects.requireNonNull(value, "value");
        value = value.trim();
        if (value.isEmpty()) throw new IllegalArgumentException("AssetId is blank");
        value = value.toUpperCase(Locale.ROOT);
    }

    public static AssetId of(String value) {
        return new AssetId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
