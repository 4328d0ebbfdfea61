package com.demo.soulbound.service.signature;

import com.demo.soulbound.service.tx.OperationExecutor;
import org.web3j.abi.datatypes.Address;

import java.util.HashMap;
import java.util.Map;

/** Per-holder counter of consumed mint authorizations. */
public class NonceTracker {

    private final OperationExecutor executor;
    private final Map<Address, Long> nonces = new HashMap<>();

    public NonceTracker(OperationExecutor executor) {
        this.executor = executor;
    }

    public long current(Address holder) {
        return nonces.getOrDefault(holder, 0L);
    }

    /** Returns the consumed value and advances the counter by one. */
    public long consume(Address holder) {
        long value = current(holder);
        executor.journal().onRollback(() -> {
            if (value == 0) {
                nonces.remove(holder);
            } else {
                nonces.put(holder, value);
            }
        });
        nonces.put(holder, value + 1);
        return value;
    }
}
