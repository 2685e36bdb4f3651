package com.bucketvault.infrastructure.custody;

import com.bucketvault.application.ports.CustodyPort;
import com.bucketvault.application.ports.CustodyTransaction;
import com.bucketvault.application.ports.NativeWrapperPort;
import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.error.InsufficientBalanceException;
import com.bucketvault.domain.vault.HolderId;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe in-memory custody for PAPER vaults.
 *
 * <p>Keeps the vault's own balances plus external holder wallets, so deposits and payouts are
 * real transfers. Venues settle against the vault through {@link #credit} / {@link #debit}.
 * <p>{@link #begin()} snapshots every balance; rollback puts the snapshot back.
 */
public final class InMemoryCustody implements CustodyPort, NativeWrapperPort {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<AssetId, BigInteger> vault = new LinkedHashMap<>();
    private final Map<HolderId, Map<AssetId, BigInteger>> wallets = new HashMap<>();
    private final AssetId nativeAsset;
    private final AssetId wrappedAsset;

    public InMemoryCustody() {
        this(null, null);
    }

    /** Custody that can also wrap {@code nativeAsset} into {@code wrappedAsset} 1:1. */
    public InMemoryCustody(AssetId nativeAsset, AssetId wrappedAsset) {
        if ((nativeAsset == null) != (wrappedAsset == null)) {
            throw new IllegalArgumentException("nativeAsset and wrappedAsset must be set together");
        }
        this.nativeAsset = nativeAsset;
        this.wrappedAsset = wrappedAsset;
    }

    /* =========================
       Holder wallets
       ========================= */

    /** Gives a holder tokens outside the vault. */
    public void fund(HolderId holder, AssetId asset, BigInteger amount) {
        lock.lock();
        try {
            add(wallet(holder), asset, requirePositive(amount));
        } finally {
            lock.unlock();
        }
    }

    public BigInteger walletBalance(HolderId holder, AssetId asset) {
        lock.lock();
        try {
            Map<AssetId, BigInteger> w = wallets.get(holder);
            return w == null ? BigInteger.ZERO : w.getOrDefault(asset, BigInteger.ZERO);
        } finally {
            lock.unlock();
        }
    }

    /* =========================
       CustodyPort
       ========================= */

    @Override
    public BigInteger balanceOf(AssetId asset) {
        lock.lock();
        try {
            return vault.getOrDefault(asset, BigInteger.ZERO);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void receive(HolderId from, AssetId asset, BigInteger amount) {
        Objects.requireNonNull(from, "from");
        lock.lock();
        try {
            Map<AssetId, BigInteger> w = wallet(from);
            BigInteger have = w.getOrDefault(asset, BigInteger.ZERO);
            if (have.compareTo(requirePositive(amount)) < 0) {
                throw new InsufficientBalanceException(from, amount, have);
            }
            sub(w, asset, amount);
            add(vault, asset, amount);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void send(HolderId to, AssetId asset, BigInteger amount) {
        Objects.requireNonNull(to, "to");
        lock.lock();
        try {
            ensureVault(asset, requirePositive(amount));
            sub(vault, asset, amount);
            add(wallet(to), asset, amount);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CustodyTransaction begin() {
        lock.lock();
        try {
            Map<AssetId, BigInteger> vaultCopy = new LinkedHashMap<>(vault);
            Map<HolderId, Map<AssetId, BigInteger>> walletsCopy = new HashMap<>();
            wallets.forEach((h, w) -> walletsCopy.put(h, new LinkedHashMap<>(w)));
            return new Snapshot(vaultCopy, walletsCopy);
        } finally {
            lock.unlock();
        }
    }

    /* =========================
       Venue settlement
       ========================= */

    /** Tokens arriving in the vault from a venue (or sent to it by mistake). */
    public void credit(AssetId asset, BigInteger amount) {
        lock.lock();
        try {
            add(vault, asset, requirePositive(amount));
        } finally {
            lock.unlock();
        }
    }

    /** Tokens leaving the vault to a venue. */
    public void debit(AssetId asset, BigInteger amount) {
        lock.lock();
        try {
            ensureVault(asset, requirePositive(amount));
            sub(vault, asset, amount);
        } finally {
            lock.unlock();
        }
    }

    public Map<AssetId, BigInteger> balances() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(vault));
        } finally {
            lock.unlock();
        }
    }

    /* =========================
       NativeWrapperPort
       ========================= */

    public boolean supportsWrapping() {
        return nativeAsset != null;
    }

    @Override
    public AssetId nativeAsset() {
        requireWrapping();
        return nativeAsset;
    }

    @Override
    public AssetId wrappedAsset() {
        requireWrapping();
        return wrappedAsset;
    }

    @Override
    public void wrap(BigInteger amount) {
        convert(nativeAsset(), wrappedAsset(), amount);
    }

    @Override
    public void unwrap(BigInteger amount) {
        convert(wrappedAsset(), nativeAsset(), amount);
    }

    private void convert(AssetId from, AssetId to, BigInteger amount) {
        lock.lock();
        try {
            ensureVault(from, requirePositive(amount));
            sub(vault, from, amount);
            add(vault, to, amount);
        } finally {
            lock.unlock();
        }
    }

    private void requireWrapping() {
        if (nativeAsset == null) throw new IllegalStateException("Custody has no native wrapper configured");
    }

    /* =========================
       Internals
       ========================= */

    private Map<AssetId, BigInteger> wallet(HolderId holder) {
        return wallets.computeIfAbsent(Objects.requireNonNull(holder, "holder"), h -> new LinkedHashMap<>());
    }

    private void ensureVault(AssetId asset, BigInteger needed) {
        BigInteger have = vault.getOrDefault(asset, BigInteger.ZERO);
        if (have.compareTo(needed) < 0) {
            throw new IllegalStateException("Insufficient vault balance " + asset + ": need " + needed + ", have " + have);
        }
    }

    private static void add(Map<AssetId, BigInteger> m, AssetId asset, BigInteger delta) {
        m.merge(Objects.requireNonNull(asset, "asset"), delta, BigInteger::add);
    }

    private static void sub(Map<AssetId, BigInteger> m, AssetId asset, BigInteger delta) {
        BigInteger left = m.getOrDefault(asset, BigInteger.ZERO).subtract(delta);
        if (left.signum() == 0) m.remove(asset);
        else m.put(asset, left);
    }

    private static BigInteger requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) throw new IllegalArgumentException("amount must be > 0");
        return amount;
    }

    private final class Snapshot implements CustodyTransaction {
        private final Map<AssetId, BigInteger> vaultCopy;
        private final Map<HolderId, Map<AssetId, BigInteger>> walletsCopy;
        private boolean done;

        private Snapshot(Map<AssetId, BigInteger> vaultCopy, Map<HolderId, Map<AssetId, BigInteger>> walletsCopy) {
            this.vaultCopy = vaultCopy;
            this.walletsCopy = walletsCopy;
        }

        @Override
        public void commit() {
            done = true;
        }

        @Override
        public void rollback() {
            if (done) return;
            lock.lock();
            try {
                vault.clear();
                vault.putAll(vaultCopy);
                wallets.clear();
                wallets.putAll(walletsCopy);
                done = true;
            } finally {
                lock.unlock();
            }
        }
    }
}
