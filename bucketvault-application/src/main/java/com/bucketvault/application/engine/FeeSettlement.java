package com.bucketvault.application.engine;

import com.bucketvault.application.ports.PriceOraclePort;
import com.bucketvault.domain.vault.FixedPoint;
import com.bucketvault.domain.vault.HolderId;
import com.bucketvault.domain.vault.ShareLedger;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Splits the value change of one operation between platform, manager and the caller.
 *
 * <p>Gain: platform takes {@link PriceOraclePort#computeFee}; the manager takes {@code ownerFeeBps} of
 * the gain only while accountable; the caller always takes {@code callerFeeBps}. Every cut is minted
 * as shares.
 * <p>Loss: an accountable manager burns {@code ownerFeeBps + callerFeeBps} of the loss from their own
 * balance, capped at what they hold.
 * <p>All conversions use the post-operation share price.
 */
final class FeeSettlement {

    private final PriceOraclePort oracle;

    FeeSettlement(PriceOraclePort oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    FeeSettlementResult settle(ShareLedger ledger,
                               HolderId manager,
                               HolderId caller,
                               BigInteger valueBefore,
                               BigInteger valueAfter,
                               boolean managerAccountable,
                               int ownerFeeBps,
                               int callerFeeBps) {
        BigInteger supply = ledger.totalSupply();
        BigInteger postPrice = FixedPoint.sharePrice(valueAfter, supply);
        int delta = valueAfter.compareTo(valueBefore);
        if (supply.signum() == 0 || postPrice.signum() == 0 || delta == 0) {
            return FeeSettlementResult.none(postPrice);
        }

        if (delta > 0) {
            BigInteger gain = valueAfter.subtract(valueBefore);

            BigInteger platformFee = oracle.computeFee(gain);
            BigInteger platformShares = (platformFee == null || platformFee.signum() <= 0)
                    ? BigInteger.ZERO
                    : FixedPoint.sharesFor(platformFee, postPrice);
            BigInteger managerShares = managerAccountable
                    ? FixedPoint.sharesFor(FixedPoint.applyBps(gain, ownerFeeBps), postPrice)
                    : BigInteger.ZERO;
            BigInteger callerShares = FixedPoint.sharesFor(FixedPoint.applyBps(gain, callerFeeBps), postPrice);

            ledger.mint(oracle.platformFeeRecipient(), platformShares);
            ledger.mint(manager, managerShares);
            ledger.mint(caller, callerShares);
            return new FeeSettlementResult(platformShares, managerShares, callerShares, BigInteger.ZERO, postPrice);
        }

        if (!managerAccountable) {
            return FeeSettlementResult.none(postPrice);
        }
        BigInteger loss = valueBefore.subtract(valueAfter);
        BigInteger penalty = FixedPoint.sharesFor(FixedPoint.applyBps(loss, ownerFeeBps + callerFeeBps), postPrice)
                .min(ledger.balanceOf(manager));
        ledger.burn(manager, penalty);
        return new FeeSettlementResult(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, penalty, postPrice);
    }
}
