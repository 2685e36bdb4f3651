package com.bucketvault.application.ports;

import com.bucketvault.domain.vault.VaultId;

import java.util.Optional;

/**
 * Durable key-value storage of vault snapshots, keyed per vault instance.
 */
public interface VaultStateRepository {

    Optional<VaultSnapshot> load(VaultId id);

    void save(VaultSnapshot snapshot);
}
