package com.bucketvault.application.ports;

import com.bucketvault.application.journal.VaultEvent;

/** Safe default when no journal is wired. */
public final class NoopVaultJournal implements VaultJournalPort {
    @Override
    public void record(VaultEvent event) {
        // no-op
    }
}
