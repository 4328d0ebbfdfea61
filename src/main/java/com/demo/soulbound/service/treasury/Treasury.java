package com.demo.soulbound.service.treasury;

import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.access.AccessControl;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.event.AdministrationChanged;
import com.demo.soulbound.service.event.ValueForwarded;
import com.demo.soulbound.service.tx.OperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

/**
 * Treasury identity plus the forwarding step. Operations call
 * {@link #forward} last, after every state mutation is staged.
 */
@Slf4j
public class Treasury {

    private final OperationExecutor executor;
    private final AccessControl access;
    private final TreasurySink sink;
    private Address address;

    public Treasury(OperationExecutor executor, AccessControl access, TreasurySink sink, Address initial) {
        if (Addresses.isZero(initial)) {
            throw new IllegalArgumentException("Treasury must be set");
        }
        this.executor = executor;
        this.access = access;
        this.sink = sink;
        this.address = initial;
    }

    public Address address() {
        return address;
    }

    public BigInteger received() {
        return sink.balanceOf(address);
    }

    public void setAddress(Address caller, Address newTreasury) {
        access.requireOwner(caller);
        access.requireNotPaused();
        if (Addresses.isZero(newTreasury)) {
            throw new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT,
                    "Treasury must be a non-zero address");
        }
        Address previous = address;
        executor.journal().onRollback(() -> address = previous);
        address = newTreasury;
        executor.journal().emit(new AdministrationChanged("TREASURY_CHANGED", caller, newTreasury.toString()));
        log.info("Treasury changed from {} to {}", previous, newTreasury);
    }

    public void forward(Address from, BigInteger value) {
        if (value == null || value.signum() == 0) {
            return;
        }
        sink.deposit(from, address, value);
        executor.journal().emit(new ValueForwarded(from, address, value));
        log.debug("Forwarded {} from {} to treasury {}", value, from, address);
    }
}
