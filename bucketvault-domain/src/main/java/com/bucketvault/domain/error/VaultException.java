package com.bucketvault.domain.error;

import com.bucketvault.domain.DomainException;

import java.util.Objects;

/**
 * Root of the vault error taxonomy. Any instance escaping an engine call means nothing was committed.
 */
public class VaultException extends DomainException {

    private final VaultErrorCode code;

    public VaultException(VaultErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public VaultException(VaultErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public VaultErrorCode code() {
        return code;
    }
}
