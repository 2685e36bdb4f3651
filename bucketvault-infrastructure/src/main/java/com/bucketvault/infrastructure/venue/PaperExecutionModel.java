package com.bucketvault.infrastructure.venue;

import com.bucketvault.domain.vault.FixedPoint;

import java.math.BigInteger;

/**
 * A tiny, configurable execution model for PAPER venues.
 *
 * <p>Turns the oracle-fair output of a trade into what the venue actually delivers:
 * slippage first, then the venue fee, both charged in the output asset.
 */
public final class PaperExecutionModel {

    private final int feeBps;
    private final int slippageBps;

    public PaperExecutionModel(int feeBps, int slippageBps) {
        if (feeBps < 0 || feeBps >= FixedPoint.BPS) throw new IllegalArgumentException("feeBps must be in [0, 10000)");
        if (slippageBps < 0 || slippageBps >= FixedPoint.BPS) {
            throw new IllegalArgumentException("slippageBps must be in [0, 10000)");
        }
        this.feeBps = feeBps;
        this.slippageBps = slippageBps;
    }

    public static PaperExecutionModel defaults() {
        // 0.1% fee, 0.05% slippage
        return new PaperExecutionModel(10, 5);
    }

    /** Frictionless fills at the oracle price. */
    public static PaperExecutionModel frictionless() {
        return new PaperExecutionModel(0, 0);
    }

    public int feeBps() { return feeBps; }

    public int slippageBps() { return slippageBps; }

    public BigInteger fill(BigInteger fairOut) {
        BigInteger afterSlippage = FixedPoint.applyBps(fairOut, FixedPoint.BPS - slippageBps);
        return afterSlippage.subtract(FixedPoint.applyBps(afterSlippage, feeBps));
    }
}
