package com.bucketvault.domain.error;

import java.math.BigInteger;

public final class ValueLossExceededException extends VaultException {

    private final BigInteger valueBefore;
    private final BigInteger valueAfter;
    private final int maxLossBps;

    public ValueLossExceededException(BigInteger valueBefore, BigInteger valueAfter, int maxLossBps) {
        super(VaultErrorCode.VALUE_LOSS_EXCEEDED,
                "Value dropped from " + valueBefore + " to " + valueAfter + " (budget " + maxLossBps + " bps)");
        this.valueBefore = valueBefore;
        this.valueAfter = valueAfter;
        this.maxLossBps = maxLossBps;
    }

    public BigInteger valueBefore() { return valueBefore; }
    public BigInteger valueAfter() { return valueAfter; }
    public int maxLossBps() { return maxLossBps; }
}
