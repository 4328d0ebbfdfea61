package com.demo.soulbound.service.registry;

import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

/**
 * Registered credential category. Times are epoch seconds; {@code endTime == 0}
 * leaves the mint window open-ended.
 */
public record CredentialType(
        long id,
        String name,
        String description,
        Address creator,
        long registeredAt,
        long startTime,
        long endTime,
        BigInteger price
) {}
