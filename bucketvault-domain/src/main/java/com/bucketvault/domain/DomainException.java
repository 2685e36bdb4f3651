package com.bucketvault.domain;

/**
 * Base type for every rule violation raised by the domain model.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
