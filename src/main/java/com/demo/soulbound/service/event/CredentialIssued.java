package com.demo.soulbound.service.event;

import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

public record CredentialIssued(Address operator, Address to, long credentialTypeId, BigInteger value,
                               boolean signed) implements CredentialEvent {
    @Override
    public String name() {
        return "CredentialIssued";
    }
}
