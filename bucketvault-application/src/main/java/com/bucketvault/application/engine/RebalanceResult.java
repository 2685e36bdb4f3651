package com.bucketvault.application.engine;

import com.bucketvault.application.venue.ExecutedSwap;

import java.math.BigInteger;
import java.util.List;

public record RebalanceResult(List<ExecutedSwap> swaps,
                              BigInteger valueBeforeUsd,
                              BigInteger valueAfterUsd,
                              FeeSettlementResult fees,
                              BigInteger sharePriceUsd) {

    public boolean traded() {
        return !swaps.isEmpty();
    }
}
