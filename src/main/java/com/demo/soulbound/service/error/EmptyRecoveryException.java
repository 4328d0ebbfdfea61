package com.demo.soulbound.service.error;

import org.web3j.abi.datatypes.Address;

public class EmptyRecoveryException extends SoulboundException {

    public EmptyRecoveryException(Address oldHolder) {
        super("Nothing to recover: " + oldHolder + " holds no credentials");
    }

    @Override
    public String reason() {
        return "NOTHING_TO_RECOVER";
    }
}
