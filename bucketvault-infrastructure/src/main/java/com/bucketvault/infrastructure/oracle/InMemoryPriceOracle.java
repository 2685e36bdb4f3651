package com.bucketvault.infrastructure.oracle;

import com.bucketvault.application.ports.PriceOraclePort;
import com.bucketvault.domain.asset.Asset;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.FixedPoint;
import com.bucketvault.domain.vault.HolderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry + price feed kept in memory. Used by the paper runtime and tests.
 *
 * <p>Assets keep registration order. Prices are USD with 8 decimals; unknown assets price at zero.
 * The platform fee is a flat share of the raw gain.
 */
public final class InMemoryPriceOracle implements PriceOraclePort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPriceOracle.class);

    private final Map<AssetId, Asset> assets = new LinkedHashMap<>();
    private final Map<AssetId, BigInteger> prices = new LinkedHashMap<>();
    private final Map<AssetId, Boolean> accepted = new LinkedHashMap<>();
    private final HolderId feeRecipient;
    private volatile boolean operational = true;
    private volatile int platformFeeBps;

    public InMemoryPriceOracle(HolderId feeRecipient, int platformFeeBps) {
        this.feeRecipient = Objects.requireNonNull(feeRecipient, "feeRecipient");
        setPlatformFeeBps(platformFeeBps);
    }

    /** Registers and accepts an asset at the given USD price (8 decimals). */
    public synchronized InMemoryPriceOracle register(Asset asset, BigInteger priceUsd) {
        Objects.requireNonNull(asset, "asset");
        assets.put(asset.id(), asset);
        prices.put(asset.id(), priceUsd == null ? BigInteger.ZERO : priceUsd);
        accepted.put(asset.id(), Boolean.TRUE);
        log.info("[ORACLE] action=REGISTER asset={} decimals={} native={} price={}",
                asset.id(), asset.decimals(), asset.nativeCurrency(), priceUsd);
        return this;
    }

    public synchronized void setPrice(AssetId asset, BigInteger priceUsd) {
        if (!assets.containsKey(asset)) throw new IllegalArgumentException("Unknown asset: " + asset);
        prices.put(asset, priceUsd == null ? BigInteger.ZERO : priceUsd);
    }

    public synchronized void setAccepted(AssetId asset, boolean value) {
        if (!assets.containsKey(asset)) throw new IllegalArgumentException("Unknown asset: " + asset);
        accepted.put(asset, value);
    }

    public void setOperational(boolean operational) {
        this.operational = operational;
        log.info("[ORACLE] action=PLATFORM_SWITCH operational={}", operational);
    }

    public void setPlatformFeeBps(int bps) {
        if (bps < 0 || bps > FixedPoint.BPS) throw new IllegalArgumentException("platformFeeBps must be in [0, 10000]");
        this.platformFeeBps = bps;
    }

    /** Metadata of any registered asset, accepted or not. */
    public synchronized Asset asset(AssetId id) {
        Asset a = assets.get(id);
        if (a == null) throw new IllegalArgumentException("Unknown asset: " + id);
        return a;
    }

    @Override
    public boolean isPlatformOperational() {
        return operational;
    }

    @Override
    public synchronized boolean isAssetAccepted(AssetId asset) {
        return Boolean.TRUE.equals(accepted.get(asset));
    }

    @Override
    public synchronized BigInteger getPrice(AssetId asset) {
        return prices.getOrDefault(asset, BigInteger.ZERO);
    }

    @Override
    public synchronized List<Asset> getAcceptedAssets() {
        List<Asset> out = new ArrayList<>();
        for (Asset a : assets.values()) {
            if (Boolean.TRUE.equals(accepted.get(a.id()))) out.add(a);
        }
        return out;
    }

    @Override
    public BigInteger computeFee(BigInteger rawValueUsd) {
        if (rawValueUsd == null || rawValueUsd.signum() <= 0) return BigInteger.ZERO;
        return FixedPoint.applyBps(rawValueUsd, platformFeeBps);
    }

    @Override
    public HolderId platformFeeRecipient() {
        return feeRecipient;
    }
}
