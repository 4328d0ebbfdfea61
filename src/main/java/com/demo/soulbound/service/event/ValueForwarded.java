package com.demo.soulbound.service.event;

import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

public record ValueForwarded(Address from, Address treasury, BigInteger value) implements CredentialEvent {
    @Override
    public String name() {
        return "ValueForwarded";
    }
}
