package com.bucketvault.infrastructure.venue;

import com.bucketvault.application.venue.VenueHandles;
import com.bucketvault.application.venue.VenueId;
import com.bucketvault.application.venue.VenueRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Simple in-memory venue registry.
 *
 * For a Spring setup this can be replaced by DI.
 */
public final class SimpleVenueRegistry implements VenueRegistry {

    private final Map<VenueId, VenueHandles> map = new TreeMap<>();

    public SimpleVenueRegistry register(VenueId id, VenueHandles handles) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(handles, "handles");
        map.put(id, handles);
        return this;
    }

    public SimpleVenueRegistry register(PaperVenue venue) {
        return register(venue.id(), venue.handles());
    }

    @Override
    public VenueHandles get(VenueId venueId) {
        VenueHandles handles = map.get(venueId);
        if (handles == null) {
            throw new IllegalStateException("Venue not registered: " + venueId);
        }
        return handles;
    }
}
