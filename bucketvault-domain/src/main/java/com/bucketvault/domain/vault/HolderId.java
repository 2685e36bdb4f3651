package com.bucketvault.domain.vault;

import java.util.Objects;

/**
 * Account that can hold shares or receive transfers (depositor, manager, platform treasury).
 */
public record HolderId(String value) {
    public HolderId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("HolderId is blank");
    }

    public static HolderId of(String value) {
        return new HolderId(value.trim());
    }

    @Override
    public String toString() {
        return value;
    }
}
