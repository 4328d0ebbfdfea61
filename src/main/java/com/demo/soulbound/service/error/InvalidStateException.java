package com.demo.soulbound.service.error;

public class InvalidStateException extends SoulboundException {

    public enum Reason { PAUSED, NOT_PAUSED, REENTRANT_CALL }

    private final Reason reason;

    public InvalidStateException(Reason reason, String message) {
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
