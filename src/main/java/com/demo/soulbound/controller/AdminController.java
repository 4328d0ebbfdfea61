package com.demo.soulbound.controller;

import com.demo.soulbound.controller.dto.CredentialDtos.AddressRequest;
import com.demo.soulbound.controller.dto.CredentialDtos.BaseUriRequest;
import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.SoulboundCredentialService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import org.web3j.abi.datatypes.Address;

import java.util.List;
import java.util.Map;

/** Owner-gated configuration. The service enforces the owner check; this layer only parses. */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final SoulboundCredentialService service;

    @GetMapping("/state")
    public SoulboundCredentialService.EngineState state() {
        return service.state();
    }

    @GetMapping("/minters")
    public List<Address> minters() {
        return service.minters();
    }

    @GetMapping("/minters/{account}")
    public Map<String, Object> isMinter(@PathVariable("account") String account) {
        return Map.of("minter", service.isMinter(Addresses.parse(account)));
    }

    @PostMapping("/minters")
    public Map<String, Object> addMinter(@RequestHeader(CallerHeader.NAME) String caller,
                                         @Valid @RequestBody AddressRequest req) {
        service.addMinter(Addresses.parse(caller), req.address);
        return Map.of("ok", true, "minter", req.address);
    }

    @DeleteMapping("/minters/{account}")
    public Map<String, Object> removeMinter(@RequestHeader(CallerHeader.NAME) String caller,
                                            @PathVariable("account") String account) {
        service.removeMinter(Addresses.parse(caller), Addresses.parse(account));
        return Map.of("ok", true);
    }

    @PutMapping("/signer")
    public Map<String, Object> setSigner(@RequestHeader(CallerHeader.NAME) String caller,
                                         @Valid @RequestBody AddressRequest req) {
        service.setSigner(Addresses.parse(caller), req.address);
        return Map.of("ok", true, "signer", req.address);
    }

    @PutMapping("/treasury")
    public Map<String, Object> setTreasury(@RequestHeader(CallerHeader.NAME) String caller,
                                           @Valid @RequestBody AddressRequest req) {
        service.setTreasury(Addresses.parse(caller), req.address);
        return Map.of("ok", true, "treasury", req.address);
    }

    @PutMapping("/base-uri")
    public Map<String, Object> setBaseUri(@RequestHeader(CallerHeader.NAME) String caller,
                                          @RequestBody BaseUriRequest req) {
        service.setBaseMetadataUri(Addresses.parse(caller), req.baseUri);
        return Map.of("ok", true);
    }

    @PostMapping("/pause")
    public Map<String, Object> pause(@RequestHeader(CallerHeader.NAME) String caller) {
        service.pause(Addresses.parse(caller));
        return Map.of("paused", true);
    }

    @PostMapping("/unpause")
    public Map<String, Object> unpause(@RequestHeader(CallerHeader.NAME) String caller) {
        service.unpause(Addresses.parse(caller));
        return Map.of("paused", false);
    }

    @PostMapping("/ownership")
    public Map<String, Object> transferOwnership(@RequestHeader(CallerHeader.NAME) String caller,
                                                 @Valid @RequestBody AddressRequest req) {
        service.transferOwnership(Addresses.parse(caller), req.address);
        return Map.of("ok", true, "pendingOwner", req.address);
    }

    @PostMapping("/ownership/accept")
    public Map<String, Object> acceptOwnership(@RequestHeader(CallerHeader.NAME) String caller) {
        Address next = Addresses.parse(caller);
        service.acceptOwnership(next);
        return Map.of("ok", true, "owner", next);
    }
}
