package com.bucketvault.domain.error;

public final class VaultPausedException extends VaultException {
    public VaultPausedException(String message) {
        super(VaultErrorCode.VAULT_PAUSED, message);
    }
}
