package com.demo.soulbound.service.ledger;

import com.demo.soulbound.service.error.InvariantViolationException;
import org.web3j.abi.datatypes.Address;

import java.util.function.Predicate;

/**
 * Allows mints (no sender), burns (no receiver) and moves made by the
 * identity that holds the recovery role. Everything else is a transfer
 * and is refused.
 */
public class NonTransferableGuard implements TransferGuard {

    private final Predicate<Address> recoveryRole;

    public NonTransferableGuard(Predicate<Address> recoveryRole) {
        this.recoveryRole = recoveryRole;
    }

    @Override
    public void check(Address operator, Address from, Address to) {
        if (from == null || to == null) {
            return;
        }
        if (!recoveryRole.test(operator)) {
            throw new InvariantViolationException(InvariantViolationException.Reason.NON_TRANSFERABLE,
                    "Credentials are non-transferable: " + from + " -> " + to);
        }
    }
}
