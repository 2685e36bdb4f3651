package com.bucketvault.application.venue;

/**
 * Resolves runtime venue handles by id when a vault is restored from storage.
 *
 * Infrastructure provides an implementation (map, DI container, etc.).
 */
public interface VenueRegistry {
    VenueHandles get(VenueId venueId);
}
