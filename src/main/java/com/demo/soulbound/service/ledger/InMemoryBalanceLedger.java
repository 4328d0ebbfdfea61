package com.demo.soulbound.service.ledger;

import com.demo.soulbound.service.error.InvariantViolationException;
import org.web3j.abi.datatypes.Address;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class InMemoryBalanceLedger implements BalanceLedger {

    private final Map<BalanceKey, Long> balances = new HashMap<>();
    private final Map<Long, Long> supply = new HashMap<>();
    private final Set<Approval> approvals = new HashSet<>();

    @Override
    public long balanceOf(Address holder, long credentialTypeId) {
        return balances.getOrDefault(new BalanceKey(holder, credentialTypeId), 0L);
    }

    @Override
    public long totalSupply(long credentialTypeId) {
        return supply.getOrDefault(credentialTypeId, 0L);
    }

    @Override
    public void update(Address from, Address to, long[] ids, long[] amounts) {
        if (ids.length != amounts.length) {
            throw new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT,
                    "ids and amounts length mismatch: " + ids.length + " != " + amounts.length);
        }
        // Validate the whole batch first; a batch may list the same id twice.
        Map<Long, Long> debits = new LinkedHashMap<>();
        for (int i = 0; i < ids.length; i++) {
            if (amounts[i] < 0) {
                throw new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT,
                        "Negative amount for credential type " + ids[i]);
            }
            debits.merge(ids[i], amounts[i], Math::addExact);
        }
        if (from != null) {
            debits.forEach((id, amount) -> {
                long balance = balanceOf(from, id);
                if (balance < amount) {
                    throw new InvariantViolationException(InvariantViolationException.Reason.INSUFFICIENT_BALANCE,
                            "Balance of " + from + " for credential type " + id + " is " + balance + ", needs " + amount);
                }
            });
        }

        debits.forEach((id, amount) -> {
            if (from == null) {
                supply.merge(id, amount, Math::addExact);
            } else {
                adjust(from, id, -amount);
            }
            if (to == null) {
                supply.merge(id, -amount, Long::sum);
            } else {
                adjust(to, id, amount);
            }
        });
    }

    @Override
    public void setApprovalForAll(Address holder, Address operator, boolean approved) {
        if (approved) {
            approvals.add(new Approval(holder, operator));
        } else {
            approvals.remove(new Approval(holder, operator));
        }
    }

    @Override
    public boolean isApprovedForAll(Address holder, Address operator) {
        return approvals.contains(new Approval(holder, operator));
    }

    private void adjust(Address holder, long id, long delta) {
        BalanceKey key = new BalanceKey(holder, id);
        long next = Math.addExact(balances.getOrDefault(key, 0L), delta);
        if (next == 0) {
            balances.remove(key);
        } else {
            balances.put(key, next);
        }
    }

    private record BalanceKey(Address holder, long credentialTypeId) {}

    private record Approval(Address holder, Address operator) {}
}
