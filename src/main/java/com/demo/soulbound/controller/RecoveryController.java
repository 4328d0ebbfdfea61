package com.demo.soulbound.controller;

import com.demo.soulbound.controller.dto.CredentialDtos.RecoveryRequest;
import com.demo.soulbound.controller.dto.CredentialDtos.RecoveryResponse;
import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.SoulboundCredentialService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/recovery")
@RequiredArgsConstructor
public class RecoveryController {

    private final SoulboundCredentialService service;

    @PostMapping
    public RecoveryResponse recover(@RequestHeader(CallerHeader.NAME) String caller,
                                    @Valid @RequestBody RecoveryRequest req) {
        RecoveryResponse res = new RecoveryResponse();
        res.recoveredTypeIds = service.recover(Addresses.parse(caller), req.oldHolder, req.newHolder);
        res.oldHolder = req.oldHolder;
        res.newHolder = req.newHolder;
        return res;
    }
}
