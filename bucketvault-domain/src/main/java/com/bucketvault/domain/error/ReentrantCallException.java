package com.bucketvault.domain.error;

public final class ReentrantCallException extends VaultException {
    public ReentrantCallException(String action, String activeAction) {
        super(VaultErrorCode.REENTRANT_CALL, "Reentrant " + action + " rejected while " + activeAction + " is running");
    }
}
