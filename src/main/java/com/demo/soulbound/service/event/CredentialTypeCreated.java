package com.demo.soulbound.service.event;

import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

public record CredentialTypeCreated(long credentialTypeId, String credentialName, Address creator,
                                    long startTime, long endTime, BigInteger price) implements CredentialEvent {
    @Override
    public String name() {
        return "CredentialTypeCreated";
    }
}
