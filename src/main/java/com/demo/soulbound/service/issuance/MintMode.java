package com.demo.soulbound.service.issuance;

/** Which authorization path a deployment accepts for minting. */
public enum MintMode {
    /** Caller must be in the minter set; attached value is a voluntary donation. */
    ROLE,
    /** Caller presents a trusted-signer authorization naming the recipient; value must cover the price. */
    SIGNATURE
}
