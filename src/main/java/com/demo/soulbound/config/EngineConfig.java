package com.demo.soulbound.config;

import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.SoulboundCredentialService;
import com.demo.soulbound.service.access.AccessControl;
import com.demo.soulbound.service.issuance.IssuanceEngine;
import com.demo.soulbound.service.issuance.MintMode;
import com.demo.soulbound.service.ledger.BalanceLedger;
import com.demo.soulbound.service.ledger.InMemoryBalanceLedger;
import com.demo.soulbound.service.ledger.NonTransferableGuard;
import com.demo.soulbound.service.ledger.SoulboundLedger;
import com.demo.soulbound.service.recovery.RecoveryOperation;
import com.demo.soulbound.service.registry.CredentialRegistry;
import com.demo.soulbound.service.signature.MintAuthorizationSigner;
import com.demo.soulbound.service.signature.MintAuthorizationVerifier;
import com.demo.soulbound.service.signature.NonceTracker;
import com.demo.soulbound.service.treasury.InMemoryTreasurySink;
import com.demo.soulbound.service.treasury.Treasury;
import com.demo.soulbound.service.treasury.TreasurySink;
import com.demo.soulbound.service.treasury.WebhookTreasurySink;
import com.demo.soulbound.service.tx.OperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;
import org.web3j.abi.datatypes.Address;
import org.web3j.protocol.Web3j;

import java.time.Clock;
import java.util.Locale;

/** Wires the engine components from {@code soulbound.*} properties. */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OperationExecutor operationExecutor(ApplicationEventPublisher publisher) {
        return new OperationExecutor(publisher);
    }

    @Bean
    public AccessControl accessControl(OperationExecutor executor, @Value("${soulbound.owner}") String owner) {
        return new AccessControl(executor, Addresses.parse(owner));
    }

    @Bean
    public BalanceLedger balanceLedger() {
        return new InMemoryBalanceLedger();
    }

    /** The recovery role is the owner, so the guard lets only owner-operated moves through. */
    @Bean
    public SoulboundLedger soulboundLedger(BalanceLedger balanceLedger, AccessControl access,
                                           OperationExecutor executor) {
        return new SoulboundLedger(balanceLedger, new NonTransferableGuard(access::isOwner), executor);
    }

    @Bean
    public CredentialRegistry credentialRegistry(OperationExecutor executor, AccessControl access, Clock clock,
                                                 @Value("${soulbound.base-uri:}") String baseUri) {
        return new CredentialRegistry(executor, access, clock, baseUri);
    }

    @Bean
    public NonceTracker nonceTracker(OperationExecutor executor) {
        return new NonceTracker(executor);
    }

    @Bean
    public MintAuthorizationVerifier mintAuthorizationVerifier(OperationExecutor executor, AccessControl access,
                                                               @Value("${soulbound.signer:}") String signer,
                                                               @Value("${soulbound.domain-id:0}") long domainId,
                                                               ObjectProvider<Web3j> web3j) {
        Address trusted = StringUtils.hasText(signer) ? Addresses.parse(signer) : Addresses.ZERO;
        return new MintAuthorizationVerifier(executor, access, trusted, Web3jConfig.resolveDomainId(domainId, web3j));
    }

    @Bean
    public TreasurySink treasurySink(RestTemplate restTemplate,
                                     @Value("${soulbound.treasury.webhook-url:}") String webhookUrl) {
        TreasurySink local = new InMemoryTreasurySink();
        if (!StringUtils.hasText(webhookUrl)) {
            return local;
        }
        log.info("Treasury forwards are posted to {}", webhookUrl);
        return new WebhookTreasurySink(restTemplate, webhookUrl, local);
    }

    @Bean
    public Treasury treasury(OperationExecutor executor, AccessControl access, TreasurySink sink,
                             @Value("${soulbound.treasury:}") String treasury) {
        Address initial = StringUtils.hasText(treasury) ? Addresses.parse(treasury) : access.owner();
        return new Treasury(executor, access, sink, initial);
    }

    @Bean
    public IssuanceEngine issuanceEngine(OperationExecutor executor, AccessControl access, CredentialRegistry registry,
                                         SoulboundLedger ledger, NonceTracker nonces, MintAuthorizationVerifier verifier,
                                         Treasury treasury, Clock clock,
                                         @Value("${soulbound.mint-mode:ROLE}") String mintMode) {
        MintMode mode = MintMode.valueOf(mintMode.trim().toUpperCase(Locale.ROOT));
        log.info("Minting through the {} path", mode);
        return new IssuanceEngine(executor, access, registry, ledger, nonces, verifier, treasury, clock, mode);
    }

    @Bean
    public RecoveryOperation recoveryOperation(OperationExecutor executor, AccessControl access,
                                               CredentialRegistry registry, SoulboundLedger ledger) {
        return new RecoveryOperation(executor, access, registry, ledger);
    }

    @Bean
    public SoulboundCredentialService soulboundCredentialService(
            OperationExecutor executor, AccessControl access, CredentialRegistry registry, SoulboundLedger ledger,
            NonceTracker nonces, MintAuthorizationVerifier verifier, Treasury treasury, IssuanceEngine issuance,
            RecoveryOperation recovery, Clock clock,
            @Value("${soulbound.signer.private-key:}") String signerKey,
            @Value("${soulbound.signer.ttl-seconds:3600}") long ttlSeconds) {
        MintAuthorizationSigner signer = null;
        if (StringUtils.hasText(signerKey)) {
            signer = MintAuthorizationSigner.fromPrivateKey(signerKey);
            if (!signer.address().equals(verifier.signer())) {
                log.warn("Local signing key {} is not the trusted signer {}", signer.address(), verifier.signer());
            }
        }
        return new SoulboundCredentialService(executor, access, registry, ledger, nonces, verifier, treasury,
                issuance, recovery, signer, clock, ttlSeconds);
    }
}
