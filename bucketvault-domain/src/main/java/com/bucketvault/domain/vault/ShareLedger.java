package com.bucketvault.domain.vault;

import com.bucketvault.domain.error.InsufficientBalanceException;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-holder share balances and total supply.
 *
 * <p>Invariant: the sum of all balances equals {@link #totalSupply()}. Not thread-safe; the owning
 * engine serializes every call.
 */
public final class ShareLedger {

    private final Map<HolderId, BigInteger> balances = new LinkedHashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public BigInteger balanceOf(HolderId holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    public BigInteger totalSupply() {
        return totalSupply;
    }

    public void mint(HolderId holder, BigInteger shares) {
        Objects.requireNonNull(holder, "holder");
        requireNonNegative(shares);
        if (shares.signum() == 0) return;
        balances.merge(holder, shares, BigInteger::add);
        totalSupply = totalSupply.add(shares);
    }

    public void burn(HolderId holder, BigInteger shares) {
        Objects.requireNonNull(holder, "holder");
        requireNonNegative(shares);
        if (shares.signum() == 0) return;
        BigInteger have = balanceOf(holder);
        if (have.compareTo(shares) < 0) {
            throw new InsufficientBalanceException(holder, shares, have);
        }
        BigInteger left = have.subtract(shares);
        if (left.signum() == 0) balances.remove(holder);
        else balances.put(holder, left);
        totalSupply = totalSupply.subtract(shares);
    }

    public Map<HolderId, BigInteger> balances() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(balances));
    }

    public ShareLedger copy() {
        ShareLedger c = new ShareLedger();
        c.balances.putAll(balances);
        c.totalSupply = totalSupply;
        return c;
    }

    /** Replaces the content with {@code other}'s (used to undo a failed operation). */
    public void restoreFrom(ShareLedger other) {
        balances.clear();
        balances.putAll(other.balances);
        totalSupply = other.totalSupply;
    }

    /** Rehydrate from persisted balances; supply is derived so the invariant holds by construction. */
    public static ShareLedger restore(Map<HolderId, BigInteger> persisted) {
        ShareLedger ledger = new ShareLedger();
        if (persisted != null) {
            persisted.forEach(ledger::mint);
        }
        return ledger;
    }

    private static void requireNonNegative(BigInteger shares) {
        Objects.requireNonNull(shares, "shares");
        if (shares.signum() < 0) throw new IllegalArgumentException("shares must be >= 0: " + shares);
    }
}
