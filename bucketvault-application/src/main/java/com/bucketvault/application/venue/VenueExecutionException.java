package com.bucketvault.application.venue;

import com.bucketvault.domain.error.VaultErrorCode;
import com.bucketvault.domain.error.VaultException;

public final class VenueExecutionException extends VaultException {

    private final String route;

    public VenueExecutionException(String route, String message) {
        super(VaultErrorCode.VENUE_EXECUTION_FAILED, route + ": " + message);
        this.route = route;
    }

    public VenueExecutionException(String route, Throwable cause) {
        super(VaultErrorCode.VENUE_EXECUTION_FAILED, route + ": " + cause.getMessage(), cause);
        this.route = route;
    }

    public String route() {
        return route;
    }
}
