package com.bucketvault.application.config;

/**
 * Known configuration keys for a vault instance.
 * Values live in config.properties / .env and may be overridden by BUCKETVAULT_* environment variables.
 */
public enum ConfigKey {
    VAULT_ID("vault.id", false),
    VAULT_MANAGER("vault.manager", false),

    // Rebalance limits (bps)
    TOLERANCE_BPS("vault.rebalance.toleranceBps", true),
    MAX_VALUE_LOSS_BPS("vault.rebalance.maxValueLossBps", true),
    VENUE_SLIPPAGE_BPS("vault.venue.slippageBps", true),

    // Manager stake gate
    ACCOUNTABILITY_ENABLED("vault.accountability.enabled", true),
    MIN_OWNER_BPS("vault.accountability.minOwnerBps", true),

    // Gain/loss split
    OWNER_FEE_BPS("vault.fee.ownerBps", true),
    CALLER_FEE_BPS("vault.fee.callerBps", true),

    // Optional target table, e.g. "USDC:50,WETH:50"
    ALLOCATION("vault.allocation", true),

    // Snapshot directory; in-memory storage when unset
    STATE_DIR("vault.state.dir", true),

    // Platform side of the fee split
    PLATFORM_FEE_BPS("platform.feeBps", true),
    PLATFORM_RECIPIENT("platform.feeRecipient", true),

    // Paper runtime: "ID:DECIMALS:PRICE_USD_8DP[:native]" rows, comma separated
    PAPER_ASSETS("vault.paper.assets", true),
    PAPER_WRAPPED_NATIVE("vault.paper.wrappedNative", true),
    PAPER_VENUES("vault.paper.venues", true),
    PAPER_FEE_BPS("vault.paper.feeBps", true),
    PAPER_SLIPPAGE_BPS("vault.paper.slippageBps", true);

    private final String key;
    private final boolean optional;

    ConfigKey(String key, boolean optional) {
        this.key = key;
        this.optional = optional;
    }

    public String key() { return key; }
    public boolean isOptional() { return optional; }
}
