package com.bucketvault.domain.risk;

import com.bucketvault.domain.vault.FixedPoint;

import java.math.BigInteger;

/**
 * Decides whether the manager keeps enough stake to use privileged actions and share in fees/penalties.
 */
public interface AccountabilityPolicy {

    boolean isAccountable(BigInteger managerShares, BigInteger totalSupply);

    /**
     * Manager must hold at least {@code minOwnerBps} of supply. Vacuously true while nothing is issued.
     */
    static AccountabilityPolicy minimumStake(int minOwnerBps) {
        if (minOwnerBps < 0 || minOwnerBps > FixedPoint.BPS) {
            throw new IllegalArgumentException("minOwnerBps must be in [0, 10000]");
        }
        BigInteger min = BigInteger.valueOf(minOwnerBps);
        return (managerShares, totalSupply) -> {
            if (totalSupply.signum() == 0) return true;
            return FixedPoint.mulDiv(managerShares, FixedPoint.BPS_DENOM, totalSupply).compareTo(min) >= 0;
        };
    }

    /** No gate: the manager is always accountable. */
    static AccountabilityPolicy ungated() {
        return (managerShares, totalSupply) -> true;
    }
}
