package com.demo.soulbound.service;

import com.demo.soulbound.service.access.AccessControl;
import com.demo.soulbound.service.error.AuthorizationException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.issuance.IssuanceEngine;
import com.demo.soulbound.service.issuance.MintMode;
import com.demo.soulbound.service.ledger.SoulboundLedger;
import com.demo.soulbound.service.recovery.RecoveryOperation;
import com.demo.soulbound.service.registry.CredentialRegistry;
import com.demo.soulbound.service.registry.CredentialType;
import com.demo.soulbound.service.signature.MintAuthorization;
import com.demo.soulbound.service.signature.MintAuthorizationSigner;
import com.demo.soulbound.service.signature.MintAuthorizationVerifier;
import com.demo.soulbound.service.signature.NonceTracker;
import com.demo.soulbound.service.treasury.Treasury;
import com.demo.soulbound.service.tx.OperationExecutor;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Boundary of the credential engine. Every mutating call runs as one
 * all-or-nothing operation on the executor; the caller identity is always
 * an explicit argument.
 */
public class SoulboundCredentialService {

    private final OperationExecutor executor;
    private final AccessControl access;
    private final CredentialRegistry registry;
    private final SoulboundLedger ledger;
    private final NonceTracker nonces;
    private final MintAuthorizationVerifier verifier;
    private final Treasury treasury;
    private final IssuanceEngine issuance;
    private final RecoveryOperation recovery;
    private final MintAuthorizationSigner authorizationSigner;
    private final Clock clock;
    private final long authorizationTtlSeconds;

    public SoulboundCredentialService(OperationExecutor executor, AccessControl access, CredentialRegistry registry,
                                      SoulboundLedger ledger, NonceTracker nonces, MintAuthorizationVerifier verifier,
                                      Treasury treasury, IssuanceEngine issuance, RecoveryOperation recovery,
                                      MintAuthorizationSigner authorizationSigner, Clock clock,
                                      long authorizationTtlSeconds) {
        this.executor = executor;
        this.access = access;
        this.registry = registry;
        this.ledger = ledger;
        this.nonces = nonces;
        this.verifier = verifier;
        this.treasury = treasury;
        this.issuance = issuance;
        this.recovery = recovery;
        this.authorizationSigner = authorizationSigner;
        this.clock = clock;
        this.authorizationTtlSeconds = authorizationTtlSeconds;
    }

    // ---- registry

    public long createCredentialType(Address caller, String name, String description,
                                     long startTime, long endTime, BigInteger price) {
        return executor.execute("createCredentialType",
                () -> registry.create(caller, name, description, startTime, endTime, price));
    }

    public boolean isCreated(long id) {
        return executor.read(() -> registry.isCreated(id));
    }

    public long nextCredentialTypeId() {
        return executor.read(registry::nextId);
    }

    public CredentialType getMetadata(long id) {
        return executor.read(() -> registry.get(id));
    }

    public List<CredentialType> listCredentialTypes() {
        return executor.read(registry::all);
    }

    public String uri(long id) {
        return executor.read(() -> registry.uri(id));
    }

    public void setBaseMetadataUri(Address caller, String baseUri) {
        executor.run("setBaseMetadataURI", () -> registry.setBaseUri(caller, baseUri));
    }

    // ---- issuance

    public void mint(Address caller, Address to, long credentialTypeId, BigInteger value) {
        executor.run("mint", () -> issuance.mint(caller, to, credentialTypeId, value));
    }

    public void mintWithSignature(Address caller, Address to, long credentialTypeId, BigInteger value,
                                  long deadline, byte[] signature) {
        executor.run("mintWithSignature",
                () -> issuance.mintWithSignature(caller, to, credentialTypeId, value, deadline, signature));
    }

    public MintMode mintMode() {
        return issuance.mode();
    }

    /**
     * Produces an authorization for {@code to} over the holder's current nonce,
     * valid for the configured time to live. Only available when this instance
     * holds a signing key.
     */
    public SignedAuthorization signAuthorization(Address to, long credentialTypeId) {
        if (authorizationSigner == null) {
            throw new AuthorizationException(AuthorizationException.Reason.SIGNER_NOT_CONFIGURED,
                    "This instance holds no signing key");
        }
        MintAuthorization authorization = executor.read(() -> new MintAuthorization(
                to, credentialTypeId, registry.get(credentialTypeId).price(),
                clock.instant().getEpochSecond() + authorizationTtlSeconds,
                verifier.domainId(), nonces.current(to)));
        return new SignedAuthorization(authorization, authorizationSigner.sign(authorization),
                authorizationSigner.address());
    }

    public Optional<Address> authorizationSignerAddress() {
        return Optional.ofNullable(authorizationSigner).map(MintAuthorizationSigner::address);
    }

    public long nonceOf(Address holder) {
        return executor.read(() -> nonces.current(holder));
    }

    // ---- ledger

    public long balanceOf(Address holder, long credentialTypeId) {
        return executor.read(() -> ledger.balanceOf(holder, credentialTypeId));
    }

    public long[] balanceOfBatch(List<Address> holders, long[] credentialTypeIds) {
        return executor.read(() -> ledger.balanceOfBatch(holders, credentialTypeIds));
    }

    public Map<Long, Long> holdingsOf(Address holder) {
        return executor.read(() -> ledger.holdings(holder, registry.nextId()));
    }

    public long totalSupply(long credentialTypeId) {
        return executor.read(() -> ledger.totalSupply(credentialTypeId));
    }

    public boolean exists(long credentialTypeId) {
        return totalSupply(credentialTypeId) > 0;
    }

    public void burn(Address caller, Address holder, long credentialTypeId, long amount) {
        burnBatch(caller, holder, new long[]{credentialTypeId}, new long[]{amount});
    }

    /** Not pause-gated: holders can always shed credentials. */
    public void burnBatch(Address caller, Address holder, long[] ids, long[] amounts) {
        executor.run("burn", () -> ledger.burnBatch(caller, holder, ids, amounts));
    }

    public void setApprovalForAll(Address caller, Address operator, boolean approved) {
        executor.run("setApprovalForAll", () -> ledger.setApprovalForAll(caller, operator, approved));
    }

    public boolean isApprovedForAll(Address holder, Address operator) {
        return executor.read(() -> ledger.isApprovedForAll(holder, operator));
    }

    public void safeTransferFrom(Address caller, Address from, Address to, long credentialTypeId, long amount) {
        safeBatchTransferFrom(caller, from, to, new long[]{credentialTypeId}, new long[]{amount});
    }

    /** Not pause-gated: the non-transfer guard alone decides, so a holder is always refused with NON_TRANSFERABLE. */
    public void safeBatchTransferFrom(Address caller, Address from, Address to, long[] ids, long[] amounts) {
        executor.run("transfer", () -> ledger.transferBatch(caller, from, to, ids, amounts));
    }

    // ---- recovery

    public List<Long> recover(Address caller, Address oldHolder, Address newHolder) {
        return executor.execute("recover", () -> recovery.recover(caller, oldHolder, newHolder));
    }

    // ---- access control and configuration

    public void addMinter(Address caller, Address minter) {
        executor.run("addMinter", () -> access.addMinter(caller, minter));
    }

    public void removeMinter(Address caller, Address minter) {
        executor.run("removeMinter", () -> access.removeMinter(caller, minter));
    }

    public boolean isMinter(Address account) {
        return executor.read(() -> access.isMinter(account));
    }

    public List<Address> minters() {
        return executor.read(access::minters);
    }

    public void pause(Address caller) {
        executor.run("pause", () -> access.pause(caller));
    }

    public void unpause(Address caller) {
        executor.run("unpause", () -> access.unpause(caller));
    }

    public void transferOwnership(Address caller, Address newOwner) {
        executor.run("transferOwnership", () -> access.transferOwnership(caller, newOwner));
    }

    public void acceptOwnership(Address caller) {
        executor.run("acceptOwnership", () -> access.acceptOwnership(caller));
    }

    public void setSigner(Address caller, Address signer) {
        executor.run("setSigner", () -> verifier.setSigner(caller, signer));
    }

    public void setTreasury(Address caller, Address newTreasury) {
        executor.run("setTreasury", () -> treasury.setAddress(caller, newTreasury));
    }

    /** Value arriving with no matching call goes straight to the treasury. */
    public void receiveValue(Address sender, BigInteger value) {
        executor.run("receiveValue", () -> {
            if (value == null || value.signum() < 0) {
                throw new InvariantViolationException(InvariantViolationException.Reason.INVALID_ARGUMENT,
                        "Value must not be negative");
            }
            treasury.forward(sender, value);
        });
    }

    public EngineState state() {
        return executor.read(() -> new EngineState(access.owner(), access.pendingOwner(), access.isPaused(),
                verifier.signer(), treasury.address(), treasury.received(), verifier.domainId(),
                issuance.mode(), registry.baseUri(), registry.nextId()));
    }

    public record SignedAuthorization(MintAuthorization authorization, byte[] signature, Address signer) {}

    public record EngineState(
            Address owner,
            Address pendingOwner,
            boolean paused,
            Address signer,
            Address treasury,
            BigInteger treasuryReceived,
            long domainId,
            MintMode mintMode,
            String baseUri,
            long credentialTypeCount
    ) {}
}
