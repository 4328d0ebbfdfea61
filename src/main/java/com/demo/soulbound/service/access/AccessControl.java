package com.demo.soulbound.service.access;

import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.error.AuthorizationException;
import com.demo.soulbound.service.error.InvalidStateException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.event.AdministrationChanged;
import com.demo.soulbound.service.tx.OperationExecutor;
import com.demo.soulbound.service.tx.StateJournal;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Owner, pause switch and minter set. Ownership moves in two steps: the owner
 * nominates, the nominee accepts.
 */
@Slf4j
public class AccessControl {

    private final OperationExecutor executor;
    private final Set<Address> minters = new LinkedHashSet<>();
    private Address owner;
    private Address pendingOwner;
    private boolean paused;

    public AccessControl(OperationExecutor executor, Address initialOwner) {
        if (Addresses.isZero(initialOwner)) {
            throw new IllegalArgumentException("Initial owner must be set");
        }
        this.executor = executor;
        this.owner = initialOwner;
    }

    public Address owner() {
        return owner;
    }

    public Address pendingOwner() {
        return pendingOwner;
    }

    public boolean isOwner(Address caller) {
        return owner.equals(caller);
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isMinter(Address account) {
        return minters.contains(account);
    }

    public List<Address> minters() {
        return List.copyOf(minters);
    }

    public void requireOwner(Address caller) {
        if (!isOwner(caller)) {
            throw new AuthorizationException(AuthorizationException.Reason.NOT_OWNER,
                    "Caller " + caller + " is not the owner");
        }
    }

    public void requireNotPaused() {
        if (paused) {
            throw new InvalidStateException(InvalidStateException.Reason.PAUSED, "System is paused");
        }
    }

    public void requireMinter(Address caller) {
        if (!isMinter(caller)) {
            throw new AuthorizationException(AuthorizationException.Reason.NOT_MINTER,
                    "Caller " + caller + " is not a minter");
        }
    }

    public void pause(Address caller) {
        requireOwner(caller);
        requireNotPaused();
        setPaused(true);
        emit("PAUSED", caller, "");
        log.info("System paused by {}", caller);
    }

    public void unpause(Address caller) {
        requireOwner(caller);
        if (!paused) {
            throw new InvalidStateException(InvalidStateException.Reason.NOT_PAUSED, "System is not paused");
        }
        setPaused(false);
        emit("UNPAUSED", caller, "");
        log.info("System unpaused by {}", caller);
    }

    public void addMinter(Address caller, Address minter) {
        requireOwner(caller);
        requireNotPaused();
        if (Addresses.isZero(minter)) {
            throw new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT,
                    "Minter must be a non-zero address");
        }
        if (minters.contains(minter)) {
            throw new InvariantViolationException(InvariantViolationException.Reason.MINTER_ALREADY_PRESENT,
                    minter + " is already a minter");
        }
        journal().onRollback(() -> minters.remove(minter));
        minters.add(minter);
        emit("MINTER_ADDED", caller, minter.toString());
        log.info("Minter {} added", minter);
    }

    public void removeMinter(Address caller, Address minter) {
        requireOwner(caller);
        requireNotPaused();
        if (!minters.contains(minter)) {
            throw new InvariantViolationException(InvariantViolationException.Reason.MINTER_ABSENT,
                    minter + " is not a minter");
        }
        journal().onRollback(() -> minters.add(minter));
        minters.remove(minter);
        emit("MINTER_REMOVED", caller, minter.toString());
        log.info("Minter {} removed", minter);
    }

    public void transferOwnership(Address caller, Address newOwner) {
        requireOwner(caller);
        if (Addresses.isZero(newOwner)) {
            throw new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT,
                    "New owner must be a non-zero address");
        }
        Address previous = pendingOwner;
        journal().onRollback(() -> pendingOwner = previous);
        pendingOwner = newOwner;
        emit("OWNERSHIP_TRANSFER_STARTED", caller, newOwner.toString());
    }

    public void acceptOwnership(Address caller) {
        if (pendingOwner == null || !pendingOwner.equals(caller)) {
            throw new AuthorizationException(AuthorizationException.Reason.NOT_PENDING_OWNER,
                    "Caller " + caller + " is not the pending owner");
        }
        Address previousOwner = owner;
        Address previousPending = pendingOwner;
        journal().onRollback(() -> {
            owner = previousOwner;
            pendingOwner = previousPending;
        });
        owner = caller;
        pendingOwner = null;
        emit("OWNERSHIP_TRANSFERRED", caller, previousOwner.toString());
        log.info("Ownership transferred from {} to {}", previousOwner, caller);
    }

    private void setPaused(boolean value) {
        boolean previous = paused;
        journal().onRollback(() -> paused = previous);
        paused = value;
    }

    private void emit(String action, Address actor, String detail) {
        journal().emit(new AdministrationChanged(action, actor, detail));
    }

    private StateJournal journal() {
        return executor.journal();
    }
}
