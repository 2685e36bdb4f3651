package com.bucketvault.application.venue;

import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Venue configuration owned by a single vault instance, ordered by venue index.
 */
public final class VenueTable {

    private final TreeMap<VenueId, VenueConfig> rows = new TreeMap<>();

    public void put(VenueConfig config) {
        Objects.requireNonNull(config, "config");
        rows.put(config.id(), config);
    }

    public VenueConfig get(VenueId id) {
        VenueConfig c = rows.get(id);
        if (c == null) throw new IllegalArgumentException("Unknown venue: " + id);
        return c;
    }

    public void setEnabled(VenueId id, boolean enabled) {
        put(get(id).withEnabled(enabled));
    }

    public List<VenueConfig> all() {
        return List.copyOf(rows.values());
    }

    public List<VenueConfig> enabled() {
        return rows.values().stream().filter(VenueConfig::enabled).toList();
    }

    public int size() {
        return rows.size();
    }

    public VenueTable copy() {
        VenueTable c = new VenueTable();
        c.rows.putAll(rows);
        return c;
    }

    public void restoreFrom(VenueTable other) {
        rows.clear();
        rows.putAll(other.rows);
    }
}
