package com.bucketvault.domain.vault;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Mutable accounting state of one vault instance (everything except balances and configuration tables).
 */
public final class VaultState {

    private BigInteger totalDepositValueUsd = BigInteger.ZERO;
    private BigInteger totalWithdrawValueUsd = BigInteger.ZERO;
    private BigInteger sharePriceUsd = BigInteger.ZERO;
    private boolean paused;
    private boolean swapPaused;
    private int ownerFeeBps;
    private int callerFeeBps;

    public VaultState(int ownerFeeBps, int callerFeeBps) {
        setFeeSplit(ownerFeeBps, callerFeeBps);
    }

    public BigInteger totalDepositValueUsd() { return totalDepositValueUsd; }
    public BigInteger totalWithdrawValueUsd() { return totalWithdrawValueUsd; }

    /** Last recorded price; zero until the first deposit initializes it. */
    public BigInteger sharePriceUsd() { return sharePriceUsd; }

    public boolean isPriceInitialized() { return sharePriceUsd.signum() > 0; }
    public boolean paused() { return paused; }
    public boolean swapPaused() { return swapPaused; }
    public int ownerFeeBps() { return ownerFeeBps; }
    public int callerFeeBps() { return callerFeeBps; }

    public void recordDeposit(BigInteger valueUsd) {
        totalDepositValueUsd = totalDepositValueUsd.add(valueUsd);
    }

    public void recordWithdraw(BigInteger valueUsd) {
        totalWithdrawValueUsd = totalWithdrawValueUsd.add(valueUsd);
    }

    public void updateSharePrice(BigInteger priceUsd) {
        Objects.requireNonNull(priceUsd, "priceUsd");
        if (priceUsd.signum() < 0) throw new IllegalArgumentException("price must be >= 0");
        this.sharePriceUsd = priceUsd;
    }

    public void setPaused(boolean paused) { this.paused = paused; }

    public void setSwapPaused(boolean swapPaused) { this.swapPaused = swapPaused; }

    public void setFeeSplit(int ownerFeeBps, int callerFeeBps) {
        if (ownerFeeBps < 0 || callerFeeBps < 0 || ownerFeeBps + callerFeeBps > FixedPoint.BPS) {
            throw new IllegalArgumentException("fee split out of range: owner=" + ownerFeeBps + " caller=" + callerFeeBps);
        }
        this.ownerFeeBps = ownerFeeBps;
        this.callerFeeBps = callerFeeBps;
    }

    public VaultState copy() {
        VaultState c = new VaultState(ownerFeeBps, callerFeeBps);
        c.restoreFrom(this);
        return c;
    }

    public void restoreFrom(VaultState other) {
        this.totalDepositValueUsd = other.totalDepositValueUsd;
        this.totalWithdrawValueUsd = other.totalWithdrawValueUsd;
        this.sharePriceUsd = other.sharePriceUsd;
        this.paused = other.paused;
        this.swapPaused = other.swapPaused;
        this.ownerFeeBps = other.ownerFeeBps;
        this.callerFeeBps = other.callerFeeBps;
    }

    /** Rehydrate from persistence. */
    public static VaultState restore(BigInteger totalDepositValueUsd,
                                     BigInteger totalWithdrawValueUsd,
                                     BigInteger sharePriceUsd,
                                     boolean paused,
                                     boolean swapPaused,
                                     int ownerFeeBps,
                                     int callerFeeBps) {
        VaultState s = new VaultState(ownerFeeBps, callerFeeBps);
        s.totalDepositValueUsd = nz(totalDepositValueUsd);
        s.totalWithdrawValueUsd = nz(totalWithdrawValueUsd);
        s.sharePriceUsd = nz(sharePriceUsd);
        s.paused = paused;
        s.swapPaused = swapPaused;
        return s;
    }

    private static BigInteger nz(BigInteger v) {
        return v == null ? BigInteger.ZERO : v;
    }
}
