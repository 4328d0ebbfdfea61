package com.demo.soulbound.service.ledger;

import org.web3j.abi.datatypes.Address;

/**
 * Decides whether a balance mutation may happen at all. Runs before every
 * call into {@link BalanceLedger#update}.
 */
@FunctionalInterface
public interface TransferGuard {

    /** Throws when the move is not one of the sanctioned paths. */
    void check(Address operator, Address from, Address to);
}
