package com.bucketvault.infrastructure.persistence;

import com.bucketvault.application.ports.VaultSnapshot;
import com.bucketvault.application.ports.VaultStateRepository;
import com.bucketvault.domain.vault.VaultId;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory snapshot store (tests / ephemeral paper vaults).
 */
public class InMemoryVaultStateRepository implements VaultStateRepository {

    private final Map<String, VaultSnapshot> store = new ConcurrentHashMap<>();

    @Override
    public Optional<VaultSnapshot> load(VaultId id) {
        Objects.requireNonNull(id, "id");
        return Optional.ofNullable(store.get(id.value()));
    }

    @Override
    public void save(VaultSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        store.put(snapshot.vaultId(), snapshot);
    }

    public int size() {
        return store.size();
    }
}
