package com.demo.soulbound.controller;

import com.demo.soulbound.controller.dto.CredentialDtos.AuthorizationRequest;
import com.demo.soulbound.controller.dto.CredentialDtos.AuthorizationResponse;
import com.demo.soulbound.controller.dto.CredentialDtos.MintRequest;
import com.demo.soulbound.controller.dto.CredentialDtos.SignedMintRequest;
import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.SoulboundCredentialService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import org.web3j.utils.Numeric;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MintController {

    private final SoulboundCredentialService service;

    /** Role path: caller must be a minter. */
    @PostMapping("/mint")
    public Map<String, Object> mint(@RequestHeader(CallerHeader.NAME) String caller,
                                    @Valid @RequestBody MintRequest req) {
        service.mint(Addresses.parse(caller), req.to, req.typeId, req.value);
        return Map.of("ok", true, "to", req.to, "typeId", req.typeId,
                "balance", service.balanceOf(req.to, req.typeId));
    }

    /** Signature path: any caller, authorized by a trusted-signer signature naming the recipient. */
    @PostMapping("/mint/signed")
    public Map<String, Object> mintSigned(@RequestHeader(CallerHeader.NAME) String caller,
                                          @Valid @RequestBody SignedMintRequest req) {
        service.mintWithSignature(Addresses.parse(caller), req.to, req.typeId, req.value,
                req.deadline, Numeric.hexStringToByteArray(req.signature));
        return Map.of("ok", true, "to", req.to, "typeId", req.typeId,
                "nonce", service.nonceOf(req.to));
    }

    @PostMapping("/authorizations")
    public AuthorizationResponse authorize(@Valid @RequestBody AuthorizationRequest req) {
        var signed = service.signAuthorization(req.to, req.typeId);
        var a = signed.authorization();
        AuthorizationResponse res = new AuthorizationResponse();
        res.to = a.recipient();
        res.typeId = a.credentialTypeId();
        res.price = a.price();
        res.deadline = a.deadline();
        res.domainId = a.domainId();
        res.nonce = a.nonce();
        res.signature = Numeric.toHexString(signed.signature());
        res.signer = signed.signer();
        return res;
    }
}
