package com.bucketvault.infrastructure.journal;

import com.bucketvault.application.journal.VaultEvent;
import com.bucketvault.application.ports.VaultJournalPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit trail on a dedicated logger ("bucketvault.journal"), one line per committed event.
 * Route it to its own appender to keep an append-only file.
 */
public class Slf4jVaultJournal implements VaultJournalPort {

    private static final Logger journal = LoggerFactory.getLogger("bucketvault.journal");

    @Override
    public void record(VaultEvent e) {
        journal.info("[JOURNAL] time={} vault={} type={} holder={} asset={} amount={} valueUsd={} shares={} detail={}",
                e.time(), e.vaultId(), e.type(), e.holder(), e.asset(), e.amount(), e.valueUsd(), e.shares(),
                e.detail());
    }
}
