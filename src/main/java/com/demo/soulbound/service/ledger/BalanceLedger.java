package com.demo.soulbound.service.ledger;

import org.web3j.abi.datatypes.Address;

/**
 * Multi-asset balance primitive: per-(holder, credential type) quantities,
 * per-type supply and operator approvals. It knows nothing about who may
 * move what; callers enforce that before reaching {@link #update}.
 */
public interface BalanceLedger {

    long balanceOf(Address holder, long credentialTypeId);

    long totalSupply(long credentialTypeId);

    /**
     * Moves {@code amounts[i]} of {@code ids[i]} from {@code from} to {@code to} as one unit.
     * A {@code null} sender mints, a {@code null} receiver burns. When any sender balance is
     * short the call fails and nothing changes.
     */
    void update(Address from, Address to, long[] ids, long[] amounts);

    void setApprovalForAll(Address holder, Address operator, boolean approved);

    boolean isApprovedForAll(Address holder, Address operator);
}
