package com.demo.soulbound.service.error;

import java.math.BigInteger;

public class InsufficientValueException extends SoulboundException {

    private final BigInteger required;
    private final BigInteger supplied;

    public InsufficientValueException(BigInteger required, BigInteger supplied) {
        super("Attached value " + supplied + " is below the required price " + required);
        this.required = required;
        this.supplied = supplied;
    }

    public BigInteger getRequired() {
        return required;
    }

    public BigInteger getSupplied() {
        return supplied;
    }

    @Override
    public String reason() {
        return "INSUFFICIENT_VALUE";
    }
}
