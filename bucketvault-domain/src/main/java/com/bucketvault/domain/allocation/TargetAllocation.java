package com.bucketvault.domain.allocation;

import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.error.AllocationInvalidException;
import com.bucketvault.domain.vault.FixedPoint;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Desired split of total value across assets.
 *
 * <p>Weights are integer percents that sum to exactly {@link FixedPoint#WEIGHT_SUM}; no duplicates,
 * no zero or negative weights, never empty. Invalid tables are rejected as a whole.
 */
public final class TargetAllocation {

    private final Map<AssetId, Integer> weights;

    private TargetAllocation(Map<AssetId, Integer> weights) {
        this.weights = weights;
    }

    public static TargetAllocation of(List<AssetWeight> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new AllocationInvalidException("allocation is empty");
        }
        Map<AssetId, Integer> map = new LinkedHashMap<>();
        Set<AssetId> seen = new HashSet<>();
        int sum = 0;
        for (AssetWeight row : rows) {
            if (row == null) throw new AllocationInvalidException("allocation contains a null row");
            if (!seen.add(row.asset())) {
                throw new AllocationInvalidException("duplicate asset " + row.asset());
            }
            if (row.weight() <= 0) {
                throw new AllocationInvalidException("weight of " + row.asset() + " must be > 0, was " + row.weight());
            }
            if (row.weight() > FixedPoint.WEIGHT_SUM) {
                throw new AllocationInvalidException("weight of " + row.asset() + " exceeds " + FixedPoint.WEIGHT_SUM
                        + ", was " + row.weight());
            }
            sum += row.weight();
            map.put(row.asset(), row.weight());
        }
        if (sum != FixedPoint.WEIGHT_SUM) {
            throw new AllocationInvalidException("weights sum to " + sum + ", expected " + FixedPoint.WEIGHT_SUM);
        }
        return new TargetAllocation(Collections.unmodifiableMap(map));
    }

    public static TargetAllocation of(AssetWeight... rows) {
        return of(List.of(rows));
    }

    /** Weight in percent, 0 for assets outside the table. */
    public int weightOf(AssetId asset) {
        return weights.getOrDefault(asset, 0);
    }

    /** Weight expressed in basis points. */
    public int targetBps(AssetId asset) {
        return weightOf(asset) * (FixedPoint.BPS / FixedPoint.WEIGHT_SUM);
    }

    public Set<AssetId> assets() {
        return weights.keySet();
    }

    public List<AssetWeight> rows() {
        return weights.entrySet().stream()
                .map(e -> new AssetWeight(e.getKey(), e.getValue()))
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetAllocation other)) return false;
        return weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "TargetAllocation" + weights;
    }
}
