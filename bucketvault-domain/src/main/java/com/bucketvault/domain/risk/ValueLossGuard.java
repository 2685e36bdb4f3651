package com.bucketvault.domain.risk;

import com.bucketvault.domain.error.ValueLossExceededException;
import com.bucketvault.domain.vault.FixedPoint;

import java.math.BigInteger;

/**
 * Per-operation value-loss limiter.
 *
 * Rejects an outcome whose total value dropped by more than {@code maxLossBps} of the value before.
 * Gains and flat outcomes always pass.
 */
public final class ValueLossGuard {

    private final int maxLossBps;

    public ValueLossGuard(int maxLossBps) {
        if (maxLossBps < 0 || maxLossBps > FixedPoint.BPS) {
            throw new IllegalArgumentException("maxLossBps must be in [0, 10000]");
        }
        this.maxLossBps = maxLossBps;
    }

    public int maxLossBps() {
        return maxLossBps;
    }

    public boolean isAcceptable(BigInteger before, BigInteger after) {
        if (after.compareTo(before) >= 0) return true;
        BigInteger loss = before.subtract(after);
        return loss.multiply(FixedPoint.BPS_DENOM).compareTo(before.multiply(BigInteger.valueOf(maxLossBps))) <= 0;
    }

    public void check(BigInteger before, BigInteger after) {
        if (!isAcceptable(before, after)) {
            throw new ValueLossExceededException(before, after, maxLossBps);
        }
    }
}
