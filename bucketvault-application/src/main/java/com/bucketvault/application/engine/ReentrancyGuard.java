package com.bucketvault.application.engine;

import com.bucketvault.domain.error.ReentrantCallException;

/**
 * Per-instance guard against a counterparty calling back into the vault during an operation.
 *
 * Java monitors are reentrant for the owning thread, so serialization alone would let such a
 * callback through; this flag rejects it.
 */
final class ReentrancyGuard {

    private String active;

    void enter(String action) {
        if (active != null) {
            throw new ReentrantCallException(action, active);
        }
        active = action;
    }

    void exit() {
        active = null;
    }
}
