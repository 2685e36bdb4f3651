package com.bucketvault.domain.error;

public final class ZeroAmountException extends VaultException {
    public ZeroAmountException(String what) {
        super(VaultErrorCode.ZERO_AMOUNT, what + " must be > 0");
    }
}
