package com.demo.soulbound.service.treasury;

public class TreasuryForwardException extends RuntimeException {

    public TreasuryForwardException(String message, Throwable cause) {
        super(message, cause);
    }
}
