package com.demo.soulbound.service.error;

public class AuthorizationException extends SoulboundException {

    public enum Reason {
        NOT_OWNER,
        NOT_PENDING_OWNER,
        NOT_MINTER,
        NOT_HOLDER_OR_APPROVED,
        INVALID_SIGNATURE,
        SIGNATURE_EXPIRED,
        MINT_PATH_DISABLED,
        SIGNER_NOT_CONFIGURED
    }

    private final Reason reason;

    public AuthorizationException(Reason reason, String message) {
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
