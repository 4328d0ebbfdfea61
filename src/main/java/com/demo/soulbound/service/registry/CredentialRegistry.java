package com.demo.soulbound.service.registry;

import com.demo.soulbound.service.access.AccessControl;
import com.demo.soulbound.service.error.CredentialNotFoundException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.event.AdministrationChanged;
import com.demo.soulbound.service.event.CredentialTypeCreated;
import com.demo.soulbound.service.tx.OperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only table of credential types. Ids are list positions, so they are
 * dense from 0 and never reused.
 */
@Slf4j
public class CredentialRegistry {

    // price is signed over as one 32-byte word
    static final int MAX_PRICE_BITS = 256;

    private final OperationExecutor executor;
    private final AccessControl access;
    private final Clock clock;
    private final List<CredentialType> types = new ArrayList<>();
    private String baseUri;

    public CredentialRegistry(OperationExecutor executor, AccessControl access, Clock clock, String baseUri) {
        this.executor = executor;
        this.access = access;
        this.clock = clock;
        this.baseUri = baseUri == null ? "" : baseUri;
    }

    public long create(Address caller, String name, String description,
                       long startTime, long endTime, BigInteger price) {
        access.requireOwner(caller);
        access.requireNotPaused();
        if (startTime < 0 || endTime < 0) {
            throw invalid("Window bounds must not be negative");
        }
        if (endTime != 0 && endTime <= startTime) {
            throw invalid("Window end " + endTime + " must be after start " + startTime);
        }
        BigInteger required = price == null ? BigInteger.ZERO : price;
        if (required.signum() < 0) {
            throw invalid("Price must not be negative");
        }
        if (required.bitLength() > MAX_PRICE_BITS) {
            throw invalid("Price must fit in " + MAX_PRICE_BITS + " bits");
        }

        long id = types.size();
        CredentialType type = new CredentialType(id, name == null ? "" : name,
                description == null ? "" : description, caller,
                clock.instant().getEpochSecond(), startTime, endTime, required);
        executor.journal().onRollback(() -> types.remove(types.size() - 1));
        types.add(type);
        executor.journal().emit(new CredentialTypeCreated(id, type.name(), caller, startTime, endTime, required));
        log.info("Credential type {} '{}' created, window [{}, {}]", id, type.name(), startTime, endTime);
        return id;
    }

    public boolean isCreated(long id) {
        return id >= 0 && id < types.size();
    }

    /** First id not yet assigned, which is also the number of created types. */
    public long nextId() {
        return types.size();
    }

    public CredentialType get(long id) {
        if (!isCreated(id)) {
            throw new CredentialNotFoundException(id);
        }
        return types.get((int) id);
    }

    public List<CredentialType> all() {
        return List.copyOf(types);
    }

    public String uri(long id) {
        get(id);
        return baseUri.isEmpty() ? "" : baseUri + id;
    }

    public String baseUri() {
        return baseUri;
    }

    public void setBaseUri(Address caller, String newBaseUri) {
        access.requireOwner(caller);
        access.requireNotPaused();
        String previous = baseUri;
        String next = newBaseUri == null ? "" : newBaseUri;
        executor.journal().onRollback(() -> baseUri = previous);
        baseUri = next;
        executor.journal().emit(new AdministrationChanged("BASE_URI_CHANGED", caller, next));
    }

    private static InvariantViolationException invalid(String message) {
        return new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT, message);
    }
}
