package com.bucketvault.application.journal;

public enum VaultEventType {
    DEPOSIT,
    REDEEM,
    REDEEM_PAYOUT,
    SWAP,
    REBALANCE,
    FEE_MINT,
    PENALTY_BURN,
    ALLOCATION_UPDATED,
    VENUE_CONFIGURED,
    FEE_SPLIT_UPDATED,
    PAUSE_CHANGED,
    SWEEP
}
