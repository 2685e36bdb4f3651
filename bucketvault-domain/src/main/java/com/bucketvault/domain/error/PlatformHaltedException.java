package com.bucketvault.domain.error;

public final class PlatformHaltedException extends VaultException {
    public PlatformHaltedException() {
        super(VaultErrorCode.PLATFORM_HALTED, "Platform is not operational");
    }
}
