package com.bucketvault.infrastructure.journal;

import com.bucketvault.application.journal.VaultEvent;
import com.bucketvault.application.journal.VaultEventType;
import com.bucketvault.application.ports.VaultJournalPort;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Keeps every event in memory; for tests and diagnostics. */
public class InMemoryVaultJournal implements VaultJournalPort {

    private final List<VaultEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(VaultEvent event) {
        events.add(event);
    }

    public List<VaultEvent> events() {
        return List.copyOf(events);
    }

    public List<VaultEvent> ofType(VaultEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    public void clear() {
        events.clear();
    }
}
