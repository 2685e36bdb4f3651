package com.bucketvault.application.ports;

import com.bucketvault.domain.asset.Asset;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.HolderId;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * External price oracle and asset registry.
 *
 * Prices are USD with 8 decimals. A zero price is a hard failure for the caller, never a skip.
 */
public interface PriceOraclePort {

    /** Global kill switch; checked first by every mutating vault call. */
    boolean isPlatformOperational();

    boolean isAssetAccepted(AssetId asset);

    BigInteger getPrice(AssetId asset);

    /** Every asset currently on the whitelist, with metadata. */
    List<Asset> getAcceptedAssets();

    /** Platform cut of a raw USD gain. */
    BigInteger computeFee(BigInteger rawValueUsd);

    /** Receiver of the platform fee shares. */
    HolderId platformFeeRecipient();

    default Optional<Asset> findAcceptedAsset(AssetId id) {
        for (Asset a : getAcceptedAssets()) {
            if (a.id().equals(id)) return Optional.of(a);
        }
        return Optional.empty();
    }

    default Optional<Asset> nativeAsset() {
        return getAcceptedAssets().stream().filter(Asset::nativeCurrency).findFirst();
    }
}
