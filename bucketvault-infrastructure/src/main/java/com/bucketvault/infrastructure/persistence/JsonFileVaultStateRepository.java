package com.bucketvault.infrastructure.persistence;

import com.bucketvault.application.ports.VaultSnapshot;
import com.bucketvault.application.ports.VaultStateRepository;
import com.bucketvault.domain.allocation.AssetWeight;
import com.bucketvault.domain.vault.VaultId;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One JSON file per vault: {@code <dir>/<vaultId>.json}.
 *
 * <p>Writes go to a temp file first and are moved into place, so a crash never leaves a
 * half-written snapshot behind.
 */
public final class JsonFileVaultStateRepository implements VaultStateRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileVaultStateRepository.class);

    private final Path dir;
    private final ObjectMapper mapper;

    public JsonFileVaultStateRepository(Path dir, ObjectMapper mapper) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public JsonFileVaultStateRepository(Path dir) {
        this(dir, new ObjectMapper());
    }

    @Override
    public Optional<VaultSnapshot> load(VaultId id) {
        Path file = fileFor(id.value());
        if (!Files.exists(file)) return Optional.empty();
        try {
            StoredVault stored = mapper.readValue(file.toFile(), StoredVault.class);
            return Optional.of(stored.toSnapshot());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read vault snapshot " + file, e);
        }
    }

    @Override
    public void save(VaultSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Path file = fileFor(snapshot.vaultId());
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, snapshot.vaultId() + "-", ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), StoredVault.from(snapshot));
                moveIntoPlace(tmp, file);
            } catch (IOException | RuntimeException e) {
                discard(tmp, e);
                throw e;
            }
            log.debug("[STATE] action=SAVE vault={} file={}", snapshot.vaultId(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write vault snapshot " + file, e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path file) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path tmp, Exception cause) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private Path fileFor(String vaultId) {
        if (vaultId == null || !vaultId.matches("[A-Za-z0-9._-]+")) {
            throw new IllegalArgumentException("Vault id is not usable as a file name: " + vaultId);
        }
        return dir.resolve(vaultId + ".json");
    }

    /* Flat, domain-free JSON shape. */

    record StoredWeight(String asset, int weight) {}

    record StoredVault(String vaultId,
                       String manager,
                       Map<String, BigInteger> shareBalances,
                       BigInteger totalSupply,
                       List<StoredWeight> allocation,
                       List<VaultSnapshot.VenueRow> venues,
                       BigInteger sharePriceUsd,
                       BigInteger totalDepositValueUsd,
                       BigInteger totalWithdrawValueUsd,
                       boolean paused,
                       boolean swapPaused,
                       int ownerFeeBps,
                       int callerFeeBps) {

        static StoredVault from(VaultSnapshot s) {
            List<StoredWeight> weights = s.allocation() == null ? List.of()
                    : s.allocation().stream().map(w -> new StoredWeight(w.asset().value(), w.weight())).toList();
            return new StoredVault(s.vaultId(), s.manager(), s.shareBalances(), s.totalSupply(), weights,
                    s.venues(), s.sharePriceUsd(), s.totalDepositValueUsd(), s.totalWithdrawValueUsd(),
                    s.paused(), s.swapPaused(), s.ownerFeeBps(), s.callerFeeBps());
        }

        VaultSnapshot toSnapshot() {
            List<AssetWeight> weights = allocation == null ? List.of()
                    : allocation.stream().map(w -> AssetWeight.of(w.asset(), w.weight())).toList();
            return new VaultSnapshot(vaultId, manager,
                    shareBalances == null ? Map.of() : shareBalances,
                    totalSupply, weights,
                    venues == null ? List.of() : venues,
                    sharePriceUsd, totalDepositValueUsd, totalWithdrawValueUsd,
                    paused, swapPaused, ownerFeeBps, callerFeeBps);
        }
    }
}
