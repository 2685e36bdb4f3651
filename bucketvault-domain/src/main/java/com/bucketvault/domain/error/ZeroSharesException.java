package com.bucketvault.domain.error;

import java.math.BigInteger;

public final class ZeroSharesException extends VaultException {

    private final BigInteger valueUsd;
    private final BigInteger sharePriceUsd;

    public ZeroSharesException(BigInteger valueUsd, BigInteger sharePriceUsd) {
        super(VaultErrorCode.ZERO_SHARES,
                "Deposit value " + valueUsd + " at share price " + sharePriceUsd + " mints zero shares");
        this.valueUsd = valueUsd;
        this.sharePriceUsd = sharePriceUsd;
    }

    public BigInteger valueUsd() { return valueUsd; }
    public BigInteger sharePriceUsd() { return sharePriceUsd; }
}
