package com.demo.soulbound.service;

import com.demo.soulbound.repository.CredentialEventRepository;
import com.demo.soulbound.service.event.CredentialEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Appends committed events to the event log. The log is a projection: a
 * failed append is reported but does not undo the operation that already
 * committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialEventRecorder {

    private final CredentialEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @EventListener
    public void on(CredentialEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.name(), e);
        }
        try {
            repository.append(event.name(), payload, clock.instant());
        } catch (DataAccessException ex) {
            log.warn("Event log append failed for {}: {}", event.name(), ex.toString());
        }
    }
}
