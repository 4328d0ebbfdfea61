package com.demo.soulbound.service.treasury;

import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

/** Where forwarded value ends up. A thrown exception aborts the forwarding operation. */
public interface TreasurySink {

    void deposit(Address from, Address treasury, BigInteger amount);

    BigInteger balanceOf(Address treasury);
}
