package com.demo.soulbound.service.event;

/** Record emitted by a committed operation. */
public interface CredentialEvent {

    /** Event name as stored in the event log. */
    String name();
}
