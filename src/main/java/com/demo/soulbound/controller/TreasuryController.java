package com.demo.soulbound.controller;

import com.demo.soulbound.controller.dto.CredentialDtos.ValueRequest;
import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.SoulboundCredentialService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TreasuryController {

    private final SoulboundCredentialService service;

    // value sent with no matching call
    @PostMapping("/value")
    public Map<String, Object> receive(@RequestHeader(CallerHeader.NAME) String caller,
                                       @Valid @RequestBody ValueRequest req) {
        service.receiveValue(Addresses.parse(caller), req.value);
        var state = service.state();
        return Map.of("ok", true, "treasury", state.treasury(), "received", state.treasuryReceived());
    }
}
