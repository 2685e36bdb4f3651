package com.bucketvault.domain.error;

import java.math.BigInteger;

public final class UnaccountableException extends VaultException {

    private final BigInteger managerShares;
    private final BigInteger totalSupply;

    public UnaccountableException(BigInteger managerShares, BigInteger totalSupply) {
        super(VaultErrorCode.UNACCOUNTABLE,
                "Manager holds " + managerShares + " of " + totalSupply + " shares, below the required stake");
        this.managerShares = managerShares;
        this.totalSupply = totalSupply;
    }

    public BigInteger managerShares() { return managerShares; }
    public BigInteger totalSupply() { return totalSupply; }
}
