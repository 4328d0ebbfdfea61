package com.demo.soulbound.service.signature;

import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Fields a trusted signer commits to when authorizing a mint.
 *
 * <p>Packed encoding: the 20-byte recipient followed by five 32-byte
 * big-endian words (type id, price, deadline, domain id, nonce). The digest
 * is the Keccak-256 of that encoding; signers sign it as an Ethereum
 * personal message.
 */
public record MintAuthorization(
        Address recipient,
        long credentialTypeId,
        BigInteger price,
        long deadline,
        long domainId,
        long nonce
) {

    private static final int ADDRESS_BYTES = 20;
    private static final int WORD_BYTES = 32;

    public byte[] encode() {
        return ByteBuffer.allocate(ADDRESS_BYTES + 5 * WORD_BYTES)
                .put(Numeric.toBytesPadded(recipient.toUint().getValue(), ADDRESS_BYTES))
                .put(word(BigInteger.valueOf(credentialTypeId)))
                .put(word(price))
                .put(word(BigInteger.valueOf(deadline)))
                .put(word(BigInteger.valueOf(domainId)))
                .put(word(BigInteger.valueOf(nonce)))
                .array();
    }

    public byte[] digest() {
        return Hash.sha3(encode());
    }

    private static byte[] word(BigInteger value) {
        return Numeric.toBytesPadded(value, WORD_BYTES);
    }
}
