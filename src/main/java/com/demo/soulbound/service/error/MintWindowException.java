package com.demo.soulbound.service.error;

public class MintWindowException extends SoulboundException {

    public enum Reason { NOT_STARTED, ENDED }

    private final Reason reason;

    public MintWindowException(Reason reason, String message) {
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
