package com.bucketvault.domain.vault;

import java.math.BigInteger;

/**
 * Integer fixed-point arithmetic shared by the vault.
 *
 * <p>USD amounts and prices carry {@link #USD_DECIMALS} decimals, shares carry 18 ({@link #SCALE}).
 * Every division floors; nothing here ever rounds in the holder's favour.
 */
public final class FixedPoint {

    public static final int USD_DECIMALS = 8;
    public static final BigInteger USD_UNIT = BigInteger.TEN.pow(USD_DECIMALS);
    public static final BigInteger SCALE = BigInteger.TEN.pow(18);
    public static final BigInteger INITIAL_PRICE = USD_UNIT;
    public static final int BPS = 10_000;
    public static final BigInteger BPS_DENOM = BigInteger.valueOf(BPS);
    public static final int WEIGHT_SUM = 100;

    private FixedPoint() {}

    public static BigInteger pow10(int decimals) {
        return BigInteger.TEN.pow(decimals);
    }

    /** floor(a * b / c). */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger c) {
        if (c.signum() == 0) throw new ArithmeticException("division by zero");
        return a.multiply(b).divide(c);
    }

    /** floor(value * bps / 10_000). */
    public static BigInteger applyBps(BigInteger value, int bps) {
        return mulDiv(value, BigInteger.valueOf(bps), BPS_DENOM);
    }

    /** USD value (8 decimals) of a native amount. */
    public static BigInteger valueOf(BigInteger amount, BigInteger priceUsd, int decimals) {
        return mulDiv(amount, priceUsd, pow10(decimals));
    }

    /** Native amount worth {@code valueUsd}. */
    public static BigInteger amountFor(BigInteger valueUsd, BigInteger priceUsd, int decimals) {
        return mulDiv(valueUsd, pow10(decimals), priceUsd);
    }

    public static BigInteger sharesFor(BigInteger valueUsd, BigInteger sharePriceUsd) {
        return mulDiv(valueUsd, SCALE, sharePriceUsd);
    }

    public static BigInteger valueOfShares(BigInteger shares, BigInteger sharePriceUsd) {
        return mulDiv(shares, sharePriceUsd, SCALE);
    }

    /** totalValue / totalSupply in USD per whole share, or {@link #INITIAL_PRICE} when nothing is issued. */
    public static BigInteger sharePrice(BigInteger totalValueUsd, BigInteger totalSupply) {
        if (totalSupply.signum() == 0) return INITIAL_PRICE;
        return mulDiv(totalValueUsd, SCALE, totalSupply);
    }

    /** value as basis points of total; 0 when total is 0. */
    public static int bpsOf(BigInteger value, BigInteger total) {
        if (total.signum() == 0) return 0;
        return mulDiv(value, BPS_DENOM, total).intValueExact();
    }
}
