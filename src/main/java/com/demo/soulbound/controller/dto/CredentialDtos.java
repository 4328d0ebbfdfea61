package com.demo.soulbound.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.util.List;

public final class CredentialDtos {
    private CredentialDtos() {}

    // -------- Requests ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CreateTypeRequest {
        @NotBlank
        public String name;
        public String description;
        @PositiveOrZero
        public long startTime;      // epoch seconds
        @PositiveOrZero
        public long endTime;        // 0 = open-ended
        public BigInteger price;    // optional, defaults to 0
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MintRequest {
        @NotNull
        public Address to;
        @NotNull
        @PositiveOrZero
        public Long typeId;
        public BigInteger value;    // donation on the role path, payment on the signed path
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SignedMintRequest extends MintRequest {
        @NotNull
        public Long deadline;
        @NotBlank
        public String signature;    // 0x-prefixed r || s || v
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AuthorizationRequest {
        @NotNull
        public Address to;
        @NotNull
        @PositiveOrZero
        public Long typeId;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BurnRequest {
        @NotEmpty
        public List<Long> typeIds;
        @NotEmpty
        public List<Long> amounts;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApprovalRequest {
        @NotNull
        public Address operator;
        public boolean approved;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TransferRequest {
        @NotNull
        public Address to;
        @NotEmpty
        public List<Long> typeIds;
        @NotEmpty
        public List<Long> amounts;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecoveryRequest {
        @NotNull
        public Address oldHolder;
        @NotNull
        public Address newHolder;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AddressRequest {
        @NotNull
        public Address address;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BaseUriRequest {
        public String baseUri;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValueRequest {
        @NotNull
        public BigInteger value;
    }

    // -------- Responses ----------
    public static class TypeView {
        public long id;
        public String name;
        public String description;
        public Address creator;
        public long registeredAt;
        public long startTime;
        public long endTime;
        public BigInteger price;
        public String uri;
        public long totalSupply;
    }

    public static class AuthorizationResponse {
        public Address to;
        public long typeId;
        public BigInteger price;
        public long deadline;
        public long domainId;
        public long nonce;
        public String signature;
        public Address signer;
    }

    public static class RecoveryResponse {
        public Address oldHolder;
        public Address newHolder;
        public List<Long> recoveredTypeIds;
    }

    public static class HoldingsResponse {
        public Address holder;
        public List<Holding> holdings;
    }

    public static class Holding {
        public long typeId;
        public long balance;

        public Holding(long typeId, long balance) {
            this.typeId = typeId;
            this.balance = balance;
        }
    }
}
