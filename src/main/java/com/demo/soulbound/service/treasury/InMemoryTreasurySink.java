package com.demo.soulbound.service.treasury;

import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTreasurySink implements TreasurySink {

    private final ConcurrentHashMap<Address, BigInteger> received = new ConcurrentHashMap<>();

    @Override
    public void deposit(Address from, Address treasury, BigInteger amount) {
        received.merge(treasury, amount, BigInteger::add);
    }

    @Override
    public BigInteger balanceOf(Address treasury) {
        return received.getOrDefault(treasury, BigInteger.ZERO);
    }
}
