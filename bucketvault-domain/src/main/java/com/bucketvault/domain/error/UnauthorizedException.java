package com.bucketvault.domain.error;

public final class UnauthorizedException extends VaultException {
    public UnauthorizedException(String message) {
        super(VaultErrorCode.UNAUTHORIZED, message);
    }
}
