package com.demo.soulbound.service;

import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.WalletUtils;

import java.math.BigInteger;

public final class Addresses {

    public static final Address ZERO = new Address(BigInteger.ZERO);

    private Addresses() {}

    /** Parses a {@code 0x}-prefixed 20-byte hex address; rejects anything else. */
    public static Address parse(String value) {
        if (value == null || !value.startsWith("0x") || !WalletUtils.isValidAddress(value)) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        return new Address(value);
    }

    public static boolean isZero(Address address) {
        return address == null || ZERO.equals(address);
    }
}
