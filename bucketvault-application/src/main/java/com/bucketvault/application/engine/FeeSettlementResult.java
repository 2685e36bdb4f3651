package com.bucketvault.application.engine;

import java.math.BigInteger;

/**
 * Shares minted or burned by one settlement.
 *
 * @param postPriceUsd share price used for every conversion (after the operation, before settlement)
 */
public record FeeSettlementResult(BigInteger platformShares,
                                  BigInteger managerShares,
                                  BigInteger callerShares,
                                  BigInteger penaltyShares,
                                  BigInteger postPriceUsd) {

    public static FeeSettlementResult none(BigInteger postPriceUsd) {
        return new FeeSettlementResult(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, postPriceUsd);
    }

    public BigInteger mintedShares() {
        return platformShares.add(managerShares).add(callerShares);
    }

    public boolean isEmpty() {
        return mintedShares().signum() == 0 && penaltyShares.signum() == 0;
    }
}
