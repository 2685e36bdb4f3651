package com.bucketvault.domain.rebalance;

import com.bucketvault.domain.allocation.TargetAllocation;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.FixedPoint;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns weight drift into a list of swaps.
 *
 * <p>Matching is a single proportional pass: every seller splits its excess across all buyers by
 * their share of the total deficit ({@code excess * deficit / totalDeficit}). It is O(sellers x buyers)
 * and not globally optimal; residual drift is left for the next call. Floor division guarantees that
 * no seller trades more than its excess and buyers never receive more than the total deficit.
 *
 * <p>Assets present in the positions but absent from the allocation have a target of zero and are sold.
 */
public final class DriftCorrectionPlanner {

    private final int toleranceBps;

    public DriftCorrectionPlanner(int toleranceBps) {
        if (toleranceBps < 0 || toleranceBps > FixedPoint.BPS) {
            throw new IllegalArgumentException("toleranceBps must be in [0, 10000]");
        }
        this.toleranceBps = toleranceBps;
    }

    public int toleranceBps() {
        return toleranceBps;
    }

    public List<AssetDrift> drifts(List<AssetPosition> positions, TargetAllocation allocation) {
        BigInteger total = AssetPosition.totalValue(positions);
        List<AssetDrift> out = new ArrayList<>(positions.size());
        for (AssetPosition p : positions) {
            out.add(new AssetDrift(p.asset(), FixedPoint.bpsOf(p.valueUsd(), total), allocation.targetBps(p.asset())));
        }
        return out;
    }

    /**
     * First asset whose weight deviates from target by more than the tolerance.
     * An empty vault has no weights and is considered balanced.
     */
    public Optional<AssetDrift> firstOutOfTolerance(List<AssetPosition> positions, TargetAllocation allocation) {
        if (AssetPosition.totalValue(positions).signum() == 0) return Optional.empty();
        return drifts(positions, allocation).stream()
                .filter(d -> d.deviationBps() > toleranceBps)
                .findFirst();
    }

    public boolean isWithinTolerance(List<AssetPosition> positions, TargetAllocation allocation) {
        return firstOutOfTolerance(positions, allocation).isEmpty();
    }

    public RebalancePlan plan(List<AssetPosition> positions, TargetAllocation allocation) {
        BigInteger total = AssetPosition.totalValue(positions);
        if (total.signum() == 0) return RebalancePlan.empty();

        Map<AssetId, AssetPosition> sellers = new LinkedHashMap<>();
        Map<AssetId, BigInteger> sellerExcess = new LinkedHashMap<>();
        Map<AssetId, BigInteger> buyerDeficit = new LinkedHashMap<>();
        BigInteger totalDeficit = BigInteger.ZERO;

        for (AssetPosition p : positions) {
            BigInteger target = FixedPoint.mulDiv(total, BigInteger.valueOf(allocation.weightOf(p.asset())),
                    BigInteger.valueOf(FixedPoint.WEIGHT_SUM));
            BigInteger value = p.valueUsd();
            int cmp = value.compareTo(target);
            if (cmp > 0) {
                BigInteger excessNative = FixedPoint.amountFor(value.subtract(target), p.priceUsd(), p.decimals())
                        .min(p.balance());
                if (excessNative.signum() > 0) {
                    sellers.put(p.asset(), p);
                    sellerExcess.put(p.asset(), excessNative);
                }
            } else if (cmp < 0) {
                BigInteger deficit = target.subtract(value);
                buyerDeficit.put(p.asset(), deficit);
                totalDeficit = totalDeficit.add(deficit);
            }
        }

        if (sellerExcess.isEmpty() || totalDeficit.signum() == 0) {
            return new RebalancePlan(Collections.unmodifiableMap(sellerExcess),
                    Collections.unmodifiableMap(buyerDeficit), totalDeficit, List.of());
        }

        List<TradeLeg> legs = new ArrayList<>();
        for (Map.Entry<AssetId, BigInteger> s : sellerExcess.entrySet()) {
            AssetPosition seller = sellers.get(s.getKey());
            for (Map.Entry<AssetId, BigInteger> b : buyerDeficit.entrySet()) {
                BigInteger amountIn = FixedPoint.mulDiv(s.getValue(), b.getValue(), totalDeficit);
                if (amountIn.signum() == 0) continue;
                BigInteger value = FixedPoint.valueOf(amountIn, seller.priceUsd(), seller.decimals());
                legs.add(new TradeLeg(s.getKey(), b.getKey(), amountIn, value));
            }
        }
        return new RebalancePlan(Collections.unmodifiableMap(sellerExcess),
                Collections.unmodifiableMap(buyerDeficit), totalDeficit, List.copyOf(legs));
    }
}
