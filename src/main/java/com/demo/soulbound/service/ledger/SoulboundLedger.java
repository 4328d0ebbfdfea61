package com.demo.soulbound.service.ledger;

import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.error.AuthorizationException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.event.CredentialsBurned;
import com.demo.soulbound.service.tx.OperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The only path from the engine into {@link BalanceLedger}. Every mutation
 * passes the {@link TransferGuard} and leaves its inverse in the journal.
 */
@Slf4j
public class SoulboundLedger {

    private final BalanceLedger ledger;
    private final TransferGuard guard;
    private final OperationExecutor executor;

    public SoulboundLedger(BalanceLedger ledger, TransferGuard guard, OperationExecutor executor) {
        this.ledger = ledger;
        this.guard = guard;
        this.executor = executor;
    }

    public long balanceOf(Address holder, long credentialTypeId) {
        return ledger.balanceOf(holder, credentialTypeId);
    }

    public long[] balanceOfBatch(List<Address> holders, long[] credentialTypeIds) {
        if (holders.size() != credentialTypeIds.length) {
            throw invalid("holders and ids length mismatch");
        }
        long[] out = new long[credentialTypeIds.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = ledger.balanceOf(holders.get(i), credentialTypeIds[i]);
        }
        return out;
    }

    public long totalSupply(long credentialTypeId) {
        return ledger.totalSupply(credentialTypeId);
    }

    /** Non-zero balances of {@code holder} over ids {@code 0 .. typeCount - 1}, in id order. */
    public Map<Long, Long> holdings(Address holder, long typeCount) {
        Map<Long, Long> out = new LinkedHashMap<>();
        for (long id = 0; id < typeCount; id++) {
            long balance = ledger.balanceOf(holder, id);
            if (balance > 0) {
                out.put(id, balance);
            }
        }
        return out;
    }

    public boolean isApprovedForAll(Address holder, Address operator) {
        return ledger.isApprovedForAll(holder, operator);
    }

    public void setApprovalForAll(Address holder, Address operator, boolean approved) {
        if (holder.equals(operator)) {
            throw invalid("Cannot set approval status for self");
        }
        boolean previous = ledger.isApprovedForAll(holder, operator);
        executor.journal().onRollback(() -> ledger.setApprovalForAll(holder, operator, previous));
        ledger.setApprovalForAll(holder, operator, approved);
        log.info("Operator {} approval for {} set to {}", operator, holder, approved);
    }

    public void mint(Address operator, Address to, long credentialTypeId, long amount) {
        if (Addresses.isZero(to)) {
            throw invalid("Cannot mint to the zero address");
        }
        apply(operator, null, to, new long[]{credentialTypeId}, new long[]{amount});
    }

    public void burnBatch(Address operator, Address holder, long[] ids, long[] amounts) {
        requireHolderOrApproved(operator, holder);
        apply(operator, holder, null, ids, amounts);
        executor.journal().emit(new CredentialsBurned(operator, holder, boxed(ids), boxed(amounts)));
        log.info("Burned {} x {} from {}", Arrays.toString(ids), Arrays.toString(amounts), holder);
    }

    /**
     * Holder-initiated transfer. Reaches the guard after the usual
     * holder-or-approved check, so it only succeeds for the recovery role.
     */
    public void transferBatch(Address operator, Address from, Address to, long[] ids, long[] amounts) {
        requireHolderOrApproved(operator, from);
        if (Addresses.isZero(to)) {
            throw invalid("Cannot transfer to the zero address");
        }
        apply(operator, from, to, ids, amounts);
    }

    /** Recovery move; skips the holder-or-approved check but still passes the guard. */
    public void move(Address operator, Address from, Address to, long[] ids, long[] amounts) {
        apply(operator, from, to, ids, amounts);
    }

    private void apply(Address operator, Address from, Address to, long[] ids, long[] amounts) {
        if (ids.length != amounts.length) {
            throw invalid("ids and amounts length mismatch: " + ids.length + " != " + amounts.length);
        }
        guard.check(operator, from, to);
        long[] idsCopy = ids.clone();
        long[] amountsCopy = amounts.clone();
        ledger.update(from, to, idsCopy, amountsCopy);
        executor.journal().onRollback(() -> ledger.update(to, from, idsCopy, amountsCopy));
    }

    private void requireHolderOrApproved(Address operator, Address holder) {
        if (!holder.equals(operator) && !ledger.isApprovedForAll(holder, operator)) {
            throw new AuthorizationException(AuthorizationException.Reason.NOT_HOLDER_OR_APPROVED,
                    operator + " is neither " + holder + " nor an approved operator");
        }
    }

    private static List<Long> boxed(long[] values) {
        return Arrays.stream(values).boxed().toList();
    }

    private static InvariantViolationException invalid(String message) {
        return new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT, message);
    }
}
