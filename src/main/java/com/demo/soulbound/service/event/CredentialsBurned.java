package com.demo.soulbound.service.event;

import org.web3j.abi.datatypes.Address;

import java.util.List;

public record CredentialsBurned(Address operator, Address holder, List<Long> credentialTypeIds,
                                List<Long> amounts) implements CredentialEvent {
    @Override
    public String name() {
        return "CredentialsBurned";
    }
}
