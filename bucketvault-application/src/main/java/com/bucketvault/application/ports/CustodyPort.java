package com.bucketvault.application.ports;

import com.bucketvault.domain.asset.AssetId;
import com.bucketvault.domain.vault.HolderId;

import java.math.BigInteger;

/**
 * Physical holdings of one vault plus transfers in and out of it.
 *
 * Every transfer is atomic with the call: it either completes or throws without moving anything.
 */
public interface CustodyPort {

    BigInteger balanceOf(AssetId asset);

    /** Pull {@code amount} from {@code from} into the vault. */
    void receive(HolderId from, AssetId asset, BigInteger amount);

    /** Push {@code amount} from the vault to {@code to}. */
    void send(HolderId to, AssetId asset, BigInteger amount);

    /** Opens a unit of work that can undo every balance change made until commit. */
    CustodyTransaction begin();
}
