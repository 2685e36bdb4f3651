package com.bucketvault.worker.wiring;

import com.bucketvault.infrastructure.venue.PaperVenue;

import java.util.List;

/** The paper venues of the runtime, in venue-index order. */
public record PaperVenues(List<PaperVenue> all) {

  public PaperVenues {
    all = List.copyOf(all);
  }

  public PaperVenue first() {
    if (all.isEmpty()) {
      throw new IllegalStateException("At least one paper venue is required");
    }
    return all.get(0);
  }
}
