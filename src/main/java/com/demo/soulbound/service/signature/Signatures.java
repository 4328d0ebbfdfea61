package com.demo.soulbound.service.signature;

import org.web3j.crypto.Sign;

import java.util.Arrays;

/** Conversions between 65-byte {@code r || s || v} signatures and web3j's {@link Sign.SignatureData}. */
public final class Signatures {

    public static final int LENGTH = 65;

    private Signatures() {}

    public static byte[] toBytes(Sign.SignatureData data) {
        byte[] out = new byte[LENGTH];
        System.arraycopy(data.getR(), 0, out, 0, 32);
        System.arraycopy(data.getS(), 0, out, 32, 32);
        out[64] = data.getV()[0];
        return out;
    }

    public static Sign.SignatureData fromBytes(byte[] signature) {
        if (signature == null || signature.length != LENGTH) {
            throw new IllegalArgumentException("Signature must be " + LENGTH + " bytes");
        }
        byte v = signature[64];
        if (v < 27) {
            v += 27;
        }
        return new Sign.SignatureData(v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64));
    }
}
