package com.bucketvault.domain.rebalance;

import com.bucketvault.domain.asset.AssetId;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link DriftCorrectionPlanner#plan}.
 *
 * @param sellerExcess  per overweight asset, excess in native units
 * @param buyerDeficit  per underweight asset, deficit in USD
 * @param totalDeficit  sum of {@code buyerDeficit}
 * @param legs          seller x buyer trades, seller-major order
 */
public record RebalancePlan(Map<AssetId, BigInteger> sellerExcess,
                            Map<AssetId, BigInteger> buyerDeficit,
                            BigInteger totalDeficit,
                            List<TradeLeg> legs) {

    public static RebalancePlan empty() {
        return new RebalancePlan(Map.of(), Map.of(), BigInteger.ZERO, List.of());
    }

    public boolean isEmpty() {
        return legs.isEmpty();
    }
}
