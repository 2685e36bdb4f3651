package com.bucketvault.application.venue;

import java.util.Objects;

public record VenueHandles(VenueExecutor executor, VenueQuoter quoter) {
    public VenueHandles {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(quoter, "quoter");
    }
}
