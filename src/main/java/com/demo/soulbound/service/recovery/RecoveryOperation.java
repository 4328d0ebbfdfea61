package com.demo.soulbound.service.recovery;

import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.access.AccessControl;
import com.demo.soulbound.service.error.EmptyRecoveryException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.event.CredentialsRecovered;
import com.demo.soulbound.service.ledger.SoulboundLedger;
import com.demo.soulbound.service.registry.CredentialRegistry;
import com.demo.soulbound.service.tx.OperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.util.ArrayList;
import java.util.List;

/**
 * Owner-only move of every credential an identity holds to a replacement
 * identity, in one batch. Cost grows with the number of created types.
 */
@Slf4j
public class RecoveryOperation {

    private final OperationExecutor executor;
    private final AccessControl access;
    private final CredentialRegistry registry;
    private final SoulboundLedger ledger;

    public RecoveryOperation(OperationExecutor executor, AccessControl access,
                             CredentialRegistry registry, SoulboundLedger ledger) {
        this.executor = executor;
        this.access = access;
        this.registry = registry;
        this.ledger = ledger;
    }

    /** Returns the moved credential type ids in ascending order. */
    public List<Long> recover(Address caller, Address oldHolder, Address newHolder) {
        access.requireNotPaused();
        access.requireOwner(caller);
        if (Addresses.isZero(oldHolder) || Addresses.isZero(newHolder) || oldHolder.equals(newHolder)) {
            throw new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT,
                    "Recovery needs two distinct non-zero holders");
        }

        List<Long> ids = new ArrayList<>();
        List<Long> amounts = new ArrayList<>();
        for (long id = 0; id < registry.nextId(); id++) {
            long balance = ledger.balanceOf(oldHolder, id);
            if (balance > 0) {
                ids.add(id);
                amounts.add(balance);
            }
        }
        if (ids.isEmpty()) {
            throw new EmptyRecoveryException(oldHolder);
        }

        ledger.move(caller, oldHolder, newHolder,
                ids.stream().mapToLong(Long::longValue).toArray(),
                amounts.stream().mapToLong(Long::longValue).toArray());
        executor.journal().emit(new CredentialsRecovered(oldHolder, newHolder, List.copyOf(ids), List.copyOf(amounts)));
        log.info("Recovered credential types {} from {} to {}", ids, oldHolder, newHolder);
        return List.copyOf(ids);
    }
}
