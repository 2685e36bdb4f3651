package com.bucketvault.application.venue;

/**
 * Venue slot index. Lower index wins ties between equal quotes.
 */
public record VenueId(int index) implements Comparable<VenueId> {
    public VenueId {
        if (index < 0) throw new IllegalArgumentException("venue index must be >= 0");
    }

    public static VenueId of(int index) {
        return new VenueId(index);
    }

    @Override
    public int compareTo(VenueId o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public String toString() {
        return "venue#" + index;
    }
}
