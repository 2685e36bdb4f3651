package com.bucketvault.application.ports;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;

/**
 * Converts the vault's native coin to and from its wrapped token, 1:1.
 */
public interface NativeWrapperPort {

    AssetId nativeAsset();

    AssetId wrappedAsset();

    void wrap(BigInteger amount);

    void unwrap(BigInteger amount);
}
