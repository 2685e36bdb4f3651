package com.bucketvault.domain.error;

public final class AllocationInvalidException extends VaultException {
    public AllocationInvalidException(String reason) {
        super(VaultErrorCode.ALLOCATION_INVALID, "Allocation invalid: " + reason);
    }
}
