package com.bucketvault.domain.error;

import com.bucketvault.domain.vault.HolderId;

import java.math.BigInteger;

public final class InsufficientBalanceException extends VaultException {

    private final HolderId holder;
    private final BigInteger requested;
    private final BigInteger available;

    public InsufficientBalanceException(HolderId holder, BigInteger requested, BigInteger available) {
        super(VaultErrorCode.INSUFFICIENT_BALANCE,
                "Holder " + holder + " requested " + requested + " but holds " + available);
        this.holder = holder;
        this.requested = requested;
        this.available = available;
    }

    public HolderId holder() { return holder; }
    public BigInteger requested() { return requested; }
    public BigInteger available() { return available; }
}
