package com.demo.soulbound.service.event;

import org.web3j.abi.datatypes.Address;

/**
 * Owner-side configuration change: pause, unpause, minter add/remove, signer,
 * treasury, base URI, ownership.
 */
public record AdministrationChanged(String action, Address actor, String detail) implements CredentialEvent {
    @Override
    public String name() {
        return "AdministrationChanged";
    }
}
