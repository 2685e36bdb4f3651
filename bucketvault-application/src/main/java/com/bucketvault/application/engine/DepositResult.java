package com.bucketvault.application.engine;

import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.HolderId;

import java.math.BigInteger;

public record DepositResult(HolderId holder,
                            AssetId asset,
                            BigInteger amount,
                            BigInteger valueUsd,
                            BigInteger sharesMinted,
                            BigInteger sharePriceUsd) {}
