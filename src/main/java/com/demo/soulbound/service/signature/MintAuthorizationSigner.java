package com.demo.soulbound.service.signature;

import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;

/** Signing side of the protocol, for deployments that run their own authorization service. */
public class MintAuthorizationSigner {

    private final ECKeyPair keyPair;
    private final Address address;

    public MintAuthorizationSigner(ECKeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = new Address(Credentials.create(keyPair).getAddress());
    }

    public static MintAuthorizationSigner fromPrivateKey(String privateKeyHex) {
        return new MintAuthorizationSigner(Credentials.create(privateKeyHex).getEcKeyPair());
    }

    public Address address() {
        return address;
    }

    public byte[] sign(MintAuthorization authorization) {
        return Signatures.toBytes(Sign.signPrefixedMessage(authorization.digest(), keyPair));
    }
}
