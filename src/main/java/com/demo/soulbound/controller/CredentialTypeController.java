package com.demo.soulbound.controller;

import com.demo.soulbound.controller.dto.CredentialDtos.CreateTypeRequest;
import com.demo.soulbound.controller.dto.CredentialDtos.TypeView;
import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.SoulboundCredentialService;
import com.demo.soulbound.service.registry.CredentialType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/credential-types")
@RequiredArgsConstructor
public class CredentialTypeController {

    private final SoulboundCredentialService service;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> create(@RequestHeader(CallerHeader.NAME) String caller,
                                      @Valid @RequestBody CreateTypeRequest req) {
        long id = service.createCredentialType(Addresses.parse(caller), req.name, req.description,
                req.startTime, req.endTime, req.price);
        return Map.of("id", id);
    }

    @GetMapping
    public List<TypeView> list() {
        return service.listCredentialTypes().stream().map(this::view).toList();
    }

    // next unused id == number of created types
    @GetMapping("/count")
    public Map<String, Object> count() {
        return Map.of("count", service.nextCredentialTypeId());
    }

    @GetMapping("/{id}")
    public TypeView get(@PathVariable("id") long id) {
        return view(service.getMetadata(id));
    }

    @GetMapping("/{id}/created")
    public Map<String, Object> isCreated(@PathVariable("id") long id) {
        return Map.of("id", id, "created", service.isCreated(id));
    }

    private TypeView view(CredentialType t) {
        TypeView v = new TypeView();
        v.id = t.id(); v.name = t.name(); v.description = t.description(); v.creator = t.creator();
        v.registeredAt = t.registeredAt(); v.startTime = t.startTime(); v.endTime = t.endTime();
        v.price = t.price();
        v.uri = service.uri(t.id());
        v.totalSupply = service.totalSupply(t.id());
        return v;
    }
}
