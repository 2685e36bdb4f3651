package com.bucketvault.application.ports;

import com.bucketvault.application.journal.VaultEvent;

/**
 * Application port for recording committed vault activity (audit trail, metrics).
 * Only events of successful operations reach it.
 */
public interface VaultJournalPort {
    void record(VaultEvent event);
}
