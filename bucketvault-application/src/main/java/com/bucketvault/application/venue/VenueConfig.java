package com.bucketvault.application.venue;

import java.util.Objects;

/**
 * One row of a vault's venue table.
 *
 * @param feeTier           venue-specific pool parameter passed through to quoter and executor
 * @param usesWrappedNative venue only trades the wrapped form of the native coin
 */
public record VenueConfig(VenueId id,
                          VenueExecutor executor,
                          VenueQuoter quoter,
                          int feeTier,
                          boolean usesWrappedNative,
                          boolean enabled) {

    public VenueConfig {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(quoter, "quoter");
        if (feeTier < 0) throw new IllegalArgumentException("feeTier must be >= 0");
    }

    public static VenueConfig of(int index, VenueHandles handles, int feeTier) {
        return new VenueConfig(VenueId.of(index), handles.executor(), handles.quoter(), feeTier, false, true);
    }

    public VenueConfig withEnabled(boolean value) {
        return new VenueConfig(id, executor, quoter, feeTier, usesWrappedNative, value);
    }
}
