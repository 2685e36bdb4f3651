package com.bucketvault.application.ports;

import com.bucketvault.domain.allocation.AssetWeight;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Persisted image of a vault instance. Venue rows carry configuration only; handles are resolved
 * through a venue registry on restore.
 */
public record VaultSnapshot(
        String vaultId,
        String manager,
        Map<String, BigInteger> shareBalances,
        BigInteger totalSupply,
        List<AssetWeight> allocation,
        List<VenueRow> venues,
        BigInteger sharePriceUsd,
        BigInteger totalDepositValueUsd,
        BigInteger totalWithdrawValueUsd,
        boolean paused,
        boolean swapPaused,
        int ownerFeeBps,
        int callerFeeBps
) {
    public record VenueRow(int id, int feeTier, boolean usesWrappedNative, boolean enabled) {}
}
