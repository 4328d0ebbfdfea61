package com.demo.soulbound.service.error;

/**
 * Root of every rejected operation. A thrown instance always means the
 * operation left no trace: no balance, nonce, registry or configuration change.
 */
public abstract class SoulboundException extends RuntimeException {

    protected SoulboundException(String message) {
        super(message);
    }

    /** Stable machine-readable reason, e.g. {@code NOT_OWNER}. */
    public abstract String reason();
}
