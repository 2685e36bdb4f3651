package com.bucketvault.application.config;

import com.bucketvault.application.ports.ConfigPort;
import com.bucketvault.domain.risk.AccountabilityPolicy;
import com.bucketvault.domain.vault.FixedPoint;

/**
 * Tunable limits of a vault instance.
 *
 * @param toleranceBps        max |actual - target| weight per asset before and after a rebalance
 * @param maxValueLossBps     value-loss budget of one rebalance
 * @param venueSlippageBps    downward allowance from a winning quote to the executed minimum
 * @param accountabilityGated whether the manager stake gate applies at all
 * @param minOwnerBps         manager stake threshold when gated
 * @param ownerFeeBps         initial manager share of gain/loss
 * @param callerFeeBps        initial caller share of gain (and manager penalty share of loss)
 */
public record VaultParameters(int toleranceBps,
                              int maxValueLossBps,
                              int venueSlippageBps,
                              boolean accountabilityGated,
                              int minOwnerBps,
                              int ownerFeeBps,
                              int callerFeeBps) {

    public static final int DEFAULT_TOLERANCE_BPS = 200;
    public static final int DEFAULT_MAX_VALUE_LOSS_BPS = 50;
    public static final int DEFAULT_VENUE_SLIPPAGE_BPS = 500;
    public static final int DEFAULT_MIN_OWNER_BPS = 500;
    public static final int DEFAULT_OWNER_FEE_BPS = 100;
    public static final int DEFAULT_CALLER_FEE_BPS = 10;

    public VaultParameters {
        requireBps("toleranceBps", toleranceBps);
        requireBps("maxValueLossBps", maxValueLossBps);
        requireBps("minOwnerBps", minOwnerBps);
        requireBps("ownerFeeBps", ownerFeeBps);
        requireBps("callerFeeBps", callerFeeBps);
        if (venueSlippageBps < 0 || venueSlippageBps >= FixedPoint.BPS) {
            throw new IllegalArgumentException("venueSlippageBps must be in [0, 10000)");
        }
        if (ownerFeeBps + callerFeeBps > FixedPoint.BPS) {
            throw new IllegalArgumentException("ownerFeeBps + callerFeeBps must not exceed 10000");
        }
    }

    public static VaultParameters defaults() {
        return new VaultParameters(DEFAULT_TOLERANCE_BPS, DEFAULT_MAX_VALUE_LOSS_BPS, DEFAULT_VENUE_SLIPPAGE_BPS,
                true, DEFAULT_MIN_OWNER_BPS, DEFAULT_OWNER_FEE_BPS, DEFAULT_CALLER_FEE_BPS);
    }

    public static VaultParameters fromConfig(ConfigPort config) {
        return new VaultParameters(
                config.getInt(ConfigKey.TOLERANCE_BPS.key(), DEFAULT_TOLERANCE_BPS),
                config.getInt(ConfigKey.MAX_VALUE_LOSS_BPS.key(), DEFAULT_MAX_VALUE_LOSS_BPS),
                config.getInt(ConfigKey.VENUE_SLIPPAGE_BPS.key(), DEFAULT_VENUE_SLIPPAGE_BPS),
                config.getBoolean(ConfigKey.ACCOUNTABILITY_ENABLED.key(), true),
                config.getInt(ConfigKey.MIN_OWNER_BPS.key(), DEFAULT_MIN_OWNER_BPS),
                config.getInt(ConfigKey.OWNER_FEE_BPS.key(), DEFAULT_OWNER_FEE_BPS),
                config.getInt(ConfigKey.CALLER_FEE_BPS.key(), DEFAULT_CALLER_FEE_BPS));
    }

    public AccountabilityPolicy accountabilityPolicy() {
        return accountabilityGated ? AccountabilityPolicy.minimumStake(minOwnerBps) : AccountabilityPolicy.ungated();
    }

    private static void requireBps(String name, int v) {
        if (v < 0 || v > FixedPoint.BPS) throw new IllegalArgumentException(name + " must be in [0, 10000]");
    }
}
