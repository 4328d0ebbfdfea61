package com.demo.soulbound.service.issuance;

import com.demo.soulbound.service.access.AccessControl;
import com.demo.soulbound.service.error.AuthorizationException;
import com.demo.soulbound.service.error.InsufficientValueException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.error.MintWindowException;
import com.demo.soulbound.service.event.CredentialIssued;
import com.demo.soulbound.service.ledger.SoulboundLedger;
import com.demo.soulbound.service.registry.CredentialRegistry;
import com.demo.soulbound.service.registry.CredentialType;
import com.demo.soulbound.service.signature.MintAuthorization;
import com.demo.soulbound.service.signature.MintAuthorizationVerifier;
import com.demo.soulbound.service.signature.NonceTracker;
import com.demo.soulbound.service.treasury.Treasury;
import com.demo.soulbound.service.tx.OperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Mints one unit of a credential type.
 *
 * <p>Checks run fail-fast in a fixed order: pause, type exists, window
 * started, window not ended, authorization, value. Effects are staged as
 * balance credit, then nonce consumption (signature path), then forwarding
 * of the attached value.
 */
@Slf4j
public class IssuanceEngine {

    private final OperationExecutor executor;
    private final AccessControl access;
    private final CredentialRegistry registry;
    private final SoulboundLedger ledger;
    private final NonceTracker nonces;
    private final MintAuthorizationVerifier verifier;
    private final Treasury treasury;
    private final Clock clock;
    private final MintMode mode;

    public IssuanceEngine(OperationExecutor executor, AccessControl access, CredentialRegistry registry,
                          SoulboundLedger ledger, NonceTracker nonces, MintAuthorizationVerifier verifier,
                          Treasury treasury, Clock clock, MintMode mode) {
        this.executor = executor;
        this.access = access;
        this.registry = registry;
        this.ledger = ledger;
        this.nonces = nonces;
        this.verifier = verifier;
        this.treasury = treasury;
        this.clock = clock;
        this.mode = mode;
    }

    public MintMode mode() {
        return mode;
    }

    public void mint(Address caller, Address to, long credentialTypeId, BigInteger value) {
        CredentialType type = checkMintable(credentialTypeId);
        requireMode(MintMode.ROLE);
        access.requireMinter(caller);
        BigInteger attached = requireValue(value);

        ledger.mint(caller, to, credentialTypeId, 1);
        executor.journal().emit(new CredentialIssued(caller, to, credentialTypeId, attached, false));
        treasury.forward(caller, attached);
        log.info("Minted credential type {} to {} by {}", type.id(), to, caller);
    }

    public void mintWithSignature(Address caller, Address to, long credentialTypeId, BigInteger value,
                                  long deadline, byte[] signature) {
        CredentialType type = checkMintable(credentialTypeId);
        requireMode(MintMode.SIGNATURE);
        verifier.requireNotExpired(deadline, now());
        if (ledger.balanceOf(to, credentialTypeId) > 0) {
            throw new InvariantViolationException(InvariantViolationException.Reason.ALREADY_CLAIMED,
                    to + " already holds credential type " + credentialTypeId);
        }
        MintAuthorization authorization = new MintAuthorization(to, credentialTypeId, type.price(),
                deadline, verifier.domainId(), nonces.current(to));
        verifier.verify(authorization, signature);
        BigInteger attached = requireValue(value);
        if (attached.compareTo(type.price()) < 0) {
            throw new InsufficientValueException(type.price(), attached);
        }

        ledger.mint(caller, to, credentialTypeId, 1);
        long consumed = nonces.consume(to);
        executor.journal().emit(new CredentialIssued(caller, to, credentialTypeId, attached, true));
        treasury.forward(caller, attached);
        log.info("Minted credential type {} to {} with signed authorization, nonce {}", type.id(), to, consumed);
    }

    private CredentialType checkMintable(long credentialTypeId) {
        access.requireNotPaused();
        CredentialType type = registry.get(credentialTypeId);
        long now = now();
        if (now < type.startTime()) {
            throw new MintWindowException(MintWindowException.Reason.NOT_STARTED,
                    "Credential type " + credentialTypeId + " opens at " + type.startTime() + ", now " + now);
        }
        if (type.endTime() != 0 && now >= type.endTime()) {
            throw new MintWindowException(MintWindowException.Reason.ENDED,
                    "Credential type " + credentialTypeId + " closed at " + type.endTime() + ", now " + now);
        }
        return type;
    }

    private void requireMode(MintMode required) {
        if (mode != required) {
            throw new AuthorizationException(AuthorizationException.Reason.MINT_PATH_DISABLED,
                    "This deployment mints through the " + mode + " path");
        }
    }

    private static BigInteger requireValue(BigInteger value) {
        BigInteger attached = value == null ? BigInteger.ZERO : value;
        if (attached.signum() < 0) {
            throw new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT,
                    "Attached value must not be negative");
        }
        return attached;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
