package com.bucketvault.domain.vault;

import java.util.Objects;

public record VaultId(String value) {
    public VaultId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("VaultId is blank");
    }

    public static VaultId of(String value) {
        return new VaultId(value.trim());
    }

    @Override
    public String toString() {
        return value;
    }
}
