package com.demo.soulbound.service.error;

public class CredentialNotFoundException extends SoulboundException {

    private final long credentialTypeId;

    public CredentialNotFoundException(long credentialTypeId) {
        super("Credential type " + credentialTypeId + " is not created");
        this.credentialTypeId = credentialTypeId;
    }

    public long getCredentialTypeId() {
        return credentialTypeId;
    }

    @Override
    public String reason() {
        return "NOT_CREATED";
    }
}
