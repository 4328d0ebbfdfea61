package com.demo.soulbound.controller;

import com.demo.soulbound.controller.dto.CredentialDtos.ApprovalRequest;
import com.demo.soulbound.controller.dto.CredentialDtos.BurnRequest;
import com.demo.soulbound.controller.dto.CredentialDtos.Holding;
import com.demo.soulbound.controller.dto.CredentialDtos.HoldingsResponse;
import com.demo.soulbound.controller.dto.CredentialDtos.TransferRequest;
import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.SoulboundCredentialService;
import com.demo.soulbound.service.error.AuthorizationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import org.web3j.abi.datatypes.Address;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/holders/{holder}")
@RequiredArgsConstructor
public class HolderController {

    private final SoulboundCredentialService service;

    @GetMapping("/balances")
    public HoldingsResponse holdings(@PathVariable("holder") String holder) {
        Address h = Addresses.parse(holder);
        HoldingsResponse res = new HoldingsResponse();
        res.holder = h;
        res.holdings = service.holdingsOf(h).entrySet().stream()
                .map(e -> new Holding(e.getKey(), e.getValue()))
                .toList();
        return res;
    }

    @GetMapping("/balances/{typeId}")
    public Map<String, Object> balance(@PathVariable("holder") String holder, @PathVariable("typeId") long typeId) {
        return Map.of("typeId", typeId, "balance", service.balanceOf(Addresses.parse(holder), typeId));
    }

    @GetMapping("/nonce")
    public Map<String, Object> nonce(@PathVariable("holder") String holder) {
        return Map.of("nonce", service.nonceOf(Addresses.parse(holder)));
    }

    @GetMapping("/approvals/{operator}")
    public Map<String, Object> isApproved(@PathVariable("holder") String holder,
                                          @PathVariable("operator") String operator) {
        return Map.of("approved", service.isApprovedForAll(Addresses.parse(holder), Addresses.parse(operator)));
    }

    /** The caller approves (or revokes) an operator for its own credentials; the path must name the caller. */
    @PostMapping("/approvals")
    public Map<String, Object> approve(@RequestHeader(CallerHeader.NAME) String caller,
                                       @PathVariable("holder") String holder,
                                       @Valid @RequestBody ApprovalRequest req) {
        Address h = Addresses.parse(holder);
        if (!h.equals(Addresses.parse(caller))) {
            throw new AuthorizationException(AuthorizationException.Reason.NOT_HOLDER_OR_APPROVED,
                    "Approvals can only be set by the holder itself");
        }
        service.setApprovalForAll(h, req.operator, req.approved);
        return Map.of("ok", true, "operator", req.operator, "approved", req.approved);
    }

    @PostMapping("/burn")
    public Map<String, Object> burn(@RequestHeader(CallerHeader.NAME) String caller,
                                    @PathVariable("holder") String holder,
                                    @RequestParam("typeId") long typeId,
                                    @RequestParam(name = "amount", defaultValue = "1") long amount) {
        service.burn(Addresses.parse(caller), Addresses.parse(holder), typeId, amount);
        return Map.of("ok", true);
    }

    @PostMapping("/burn-batch")
    public Map<String, Object> burnBatch(@RequestHeader(CallerHeader.NAME) String caller,
                                         @PathVariable("holder") String holder,
                                         @Valid @RequestBody BurnRequest req) {
        service.burnBatch(Addresses.parse(caller), Addresses.parse(holder), toArray(req.typeIds), toArray(req.amounts));
        return Map.of("ok", true);
    }

    /** Present so clients get the explicit non-transferable rejection instead of a 404. */
    @PostMapping("/transfer")
    public Map<String, Object> transfer(@RequestHeader(CallerHeader.NAME) String caller,
                                        @PathVariable("holder") String holder,
                                        @Valid @RequestBody TransferRequest req) {
        service.safeBatchTransferFrom(Addresses.parse(caller), Addresses.parse(holder), req.to,
                toArray(req.typeIds), toArray(req.amounts));
        return Map.of("ok", true);
    }

    private static long[] toArray(List<Long> values) {
        return values.stream().mapToLong(Long::longValue).toArray();
    }
}
