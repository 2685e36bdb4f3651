package com.bucketvault.application.journal;

import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.HolderId;
import com.bucketvault.domain.vault.VaultId;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * One committed fact. Fields that do not apply to a type are null.
 */
public record VaultEvent(
        Instant time,
        VaultId vaultId,
        VaultEventType type,
        HolderId holder,
        AssetId asset,
        BigInteger amount,
        BigInteger valueUsd,
        BigInteger shares,
        String detail
) {
    public VaultEvent {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(vaultId, "vaultId");
        Objects.requireNonNull(type, "type");
    }

    public static VaultEvent of(VaultId vaultId, VaultEventType type, HolderId holder, AssetId asset,
                                BigInteger amount, BigInteger valueUsd, BigInteger shares, String detail) {
        return new VaultEvent(Instant.now(), vaultId, type, holder, asset, amount, valueUsd, shares, detail);
    }
}
