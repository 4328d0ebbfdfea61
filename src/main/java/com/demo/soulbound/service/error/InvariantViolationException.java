package com.demo.soulbound.service.error;

public class InvariantViolationException extends SoulboundException {

    public enum Reason {
        NON_TRANSFERABLE,
        MINTER_ALREADY_PRESENT,
        MINTER_ABSENT,
        ALREADY_CLAIMED,
        INSUFFICIENT_BALANCE,
        INVALID_ARGUMENT
    }

    private final Reason reason;

    public InvariantViolationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String reason() {
        return reason.name();
    }
}
