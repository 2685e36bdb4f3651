package com.bucketvault.domain.error;

/**
 * Stable failure codes. Callers use them to decide whether retrying with other parameters is worthwhile.
 */
public enum VaultErrorCode {
    PLATFORM_HALTED("Platform is halted by the registry", false),
    VAULT_PAUSED("Vault or rebalancing is paused", false),
    INVALID_ASSET("Asset is not accepted or has no price", false),
    ZERO_AMOUNT("Amount must be positive", false),
    ZERO_SHARES("Deposit too small to mint a share unit", false),
    INSUFFICIENT_BALANCE("Balance lower than requested amount", false),
    ALLOCATION_INVALID("Target allocation rejected", false),
    NO_QUOTE_AVAILABLE("No venue returned a positive quote", true),
    VENUE_EXECUTION_FAILED("Venue failed to execute the trade", true),
    VALUE_LOSS_EXCEEDED("Rebalance lost more value than the budget allows", true),
    ALLOCATION_OUT_OF_TOLERANCE("Allocation still out of tolerance after rebalance", true),
    UNACCOUNTABLE("Manager stake below the accountability threshold", false),
    UNAUTHORIZED("Caller is not allowed to perform this action", false),
    REENTRANT_CALL("Reentrant call rejected", false);

    private final String description;
    private final boolean retryable;

    VaultErrorCode(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String description() { return description; }

    /** True when the same call may succeed later without any parameter change (market moved, venue recovered). */
    public boolean isRetryable() { return retryable; }
}
