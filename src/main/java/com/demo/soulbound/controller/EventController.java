package com.demo.soulbound.controller;

import com.demo.soulbound.repository.CredentialEventRepository;
import com.demo.soulbound.repository.CredentialEventRepository.EventRow;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final CredentialEventRepository repository;

    @GetMapping
    public List<EventRow> list(@RequestParam(required = false) String name,
                               @RequestParam(defaultValue = "0") long after,
                               @RequestParam(defaultValue = "100") int limit) {
        return repository.list(name, after, Math.max(1, Math.min(limit, 500)));
    }
}
