package com.bucketvault.worker.metrics;

import com.bucketvault.application.journal.VaultEvent;
import com.bucketvault.application.journal.VaultEventType;
import com.bucketvault.application.ports.VaultJournalPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Journal decorator that counts committed vault events.
 *
 * Exposes:
 * - bucketvault.vault.events{type=...} (counter per event type)
 * - bucketvault.vault.journal.failures (counter)
 */
public class VaultMetrics implements VaultJournalPort {

  private final VaultJournalPort delegate;
  private final Map<VaultEventType, Counter> events = new EnumMap<>(VaultEventType.class);
  private final Counter journalFailures;

  public VaultMetrics(MeterRegistry registry, VaultJournalPort delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    for (VaultEventType type : VaultEventType.values()) {
      events.put(type, Counter.builder("bucketvault.vault.events")
          .description("Committed vault events")
          .tag("type", type.name())
          .register(registry));
    }
    this.journalFailures = Counter.builder("bucketvault.vault.journal.failures")
        .description("Events the audit journal failed to write")
        .register(registry);
  }

  @Override
  public void record(VaultEvent event) {
    events.get(event.type()).increment();
    try {
      delegate.record(event);
    } catch (RuntimeException e) {
      journalFailures.increment();
      throw e;
    }
  }

  public double count(VaultEventType type) {
    return events.get(type).count();
  }

  public double journalFailures() {
    return journalFailures.count();
  }
}
