package com.demo.soulbound.service.issuance;

import com.demo.soulbound.service.error.AuthorizationException;
import com.demo.soulbound.service.error.InsufficientValueException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.event.CredentialIssued;
import com.demo.soulbound.service.signature.MintAuthorization;
import com.demo.soulbound.service.treasury.InMemoryTreasurySink;
import com.demo.soulbound.support.EngineFixture;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.demo.soulbound.support.EngineFixture.ALICE;
import static com.demo.soulbound.support.EngineFixture.BOB;
import static com.demo.soulbound.support.EngineFixture.MINTER;
import static com.demo.soulbound.support.EngineFixture.OTHER_SIGNER;
import static com.demo.soulbound.support.EngineFixture.OWNER;
import static com.demo.soulbound.support.EngineFixture.SIGNER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignedIssuanceTest {

    private final EngineFixture f = new EngineFixture(MintMode.SIGNATURE);

    @Test
    void validAuthorizationMintsAndConsumesNonce() {
        long a = f.createOpenType("a");
        long deadline = f.deadline();

        // any caller may relay the authorization
        f.service.mintWithSignature(BOB, ALICE, a, BigInteger.ZERO, deadline, f.sign(ALICE, a, deadline));

        assertThat(f.service.balanceOf(ALICE, a)).isEqualTo(1);
        assertThat(f.service.balanceOf(BOB, a)).isZero();
        assertThat(f.service.nonceOf(ALICE)).isEqualTo(1);
        assertThat(f.eventsOf(CredentialIssued.class)).singleElement()
                .satisfies(e -> assertThat(e.signed()).isTrue());
    }

    @Test
    void sameAuthorizationCannotBeUsedTwice() {
        long a = f.createOpenType("a");
        long deadline = f.deadline();
        byte[] sig = f.sign(ALICE, a, deadline);
        f.service.mintWithSignature(ALICE, ALICE, a, BigInteger.ZERO, deadline, sig);

        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, a, BigInteger.ZERO, deadline, sig))
                .isInstanceOfSatisfying(InvariantViolationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(InvariantViolationException.Reason.ALREADY_CLAIMED));

        // even after shedding the credential, the consumed nonce keeps the signature dead
        f.service.burn(ALICE, ALICE, a, 1);
        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, a, BigInteger.ZERO, deadline, sig))
                .isInstanceOfSatisfying(AuthorizationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(AuthorizationException.Reason.INVALID_SIGNATURE));
        assertThat(f.service.nonceOf(ALICE)).isEqualTo(1);
    }

    @Test
    void nonceCountsOnlySuccesses() {
        long a = f.createOpenType("a");
        long b = f.createOpenType("b");
        long c = f.createOpenType("c");
        long deadline = f.deadline();

        f.service.mintWithSignature(ALICE, ALICE, a, null, deadline, f.sign(ALICE, a, deadline));
        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, b, null, deadline,
                OTHER_SIGNER.sign(f.authorization(ALICE, b, deadline))))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, b, null, f.clock.epochSecond() - 1,
                f.sign(ALICE, b, f.clock.epochSecond() - 1)))
                .isInstanceOf(AuthorizationException.class);
        f.service.mintWithSignature(ALICE, ALICE, b, null, deadline, f.sign(ALICE, b, deadline));
        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, c, null, deadline, new byte[65]))
                .isInstanceOf(AuthorizationException.class);
        f.service.mintWithSignature(ALICE, ALICE, c, null, deadline, f.sign(ALICE, c, deadline));

        assertThat(f.service.nonceOf(ALICE)).isEqualTo(3);
        assertThat(f.service.nonceOf(BOB)).isZero();
    }

    @Test
    void signatureIsBoundToRecipient() {
        long a = f.createOpenType("a");
        long deadline = f.deadline();
        byte[] forAlice = f.sign(ALICE, a, deadline);

        assertThatThrownBy(() -> f.service.mintWithSignature(BOB, BOB, a, null, deadline, forAlice))
                .isInstanceOfSatisfying(AuthorizationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(AuthorizationException.Reason.INVALID_SIGNATURE));
    }

    @Test
    void signatureIsBoundToDomain() {
        EngineFixture otherDeployment = new EngineFixture(MintMode.SIGNATURE, new InMemoryTreasurySink(), 1L);
        long a = f.createOpenType("a");
        otherDeployment.createOpenType("a");
        long deadline = f.deadline();
        byte[] sig = f.sign(ALICE, a, deadline);

        assertThatThrownBy(() -> otherDeployment.service.mintWithSignature(ALICE, ALICE, a, null, deadline, sig))
                .isInstanceOfSatisfying(AuthorizationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(AuthorizationException.Reason.INVALID_SIGNATURE));
    }

    @Test
    void expiredIsReportedAsExpired() {
        long a = f.createOpenType("a");
        long deadline = f.clock.epochSecond();
        byte[] sig = f.sign(ALICE, a, deadline);

        f.clock.advance(1);

        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, a, null, deadline, sig))
                .isInstanceOfSatisfying(AuthorizationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(AuthorizationException.Reason.SIGNATURE_EXPIRED));
        assertThat(f.service.nonceOf(ALICE)).isZero();
    }

    @Test
    void deadlineEqualToNowIsAccepted() {
        long a = f.createOpenType("a");
        long deadline = f.clock.epochSecond();

        f.service.mintWithSignature(ALICE, ALICE, a, null, deadline, f.sign(ALICE, a, deadline));

        assertThat(f.service.balanceOf(ALICE, a)).isEqualTo(1);
    }

    @Test
    void priceMustBeCovered() {
        long paid = f.createPricedType("paid", BigInteger.valueOf(100));
        long deadline = f.deadline();
        byte[] sig = f.sign(ALICE, paid, deadline);

        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, paid, BigInteger.valueOf(99), deadline, sig))
                .isInstanceOfSatisfying(InsufficientValueException.class, ex -> {
                    assertThat(ex.getRequired()).isEqualTo(BigInteger.valueOf(100));
                    assertThat(ex.getSupplied()).isEqualTo(BigInteger.valueOf(99));
                });
        assertThat(f.service.nonceOf(ALICE)).isZero();

        // the same signature still works once corrected
        f.service.mintWithSignature(ALICE, ALICE, paid, BigInteger.valueOf(150), deadline, sig);
        assertThat(f.service.balanceOf(ALICE, paid)).isEqualTo(1);
        assertThat(f.service.state().treasuryReceived()).isEqualTo(BigInteger.valueOf(150));
    }

    @Test
    void signatureOverDifferentPriceIsRejected() {
        long paid = f.createPricedType("paid", BigInteger.valueOf(100));
        long deadline = f.deadline();
        MintAuthorization cheap = new MintAuthorization(ALICE, paid, BigInteger.ONE, deadline,
                EngineFixture.DOMAIN_ID, 0);

        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, paid, BigInteger.ONE, deadline,
                SIGNER.sign(cheap)))
                .isInstanceOfSatisfying(AuthorizationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(AuthorizationException.Reason.INVALID_SIGNATURE));
    }

    @Test
    void rolePathIsDisabled() {
        long a = f.createOpenType("a");
        f.service.addMinter(OWNER, MINTER);

        assertThatThrownBy(() -> f.service.mint(MINTER, ALICE, a, null))
                .isInstanceOfSatisfying(AuthorizationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(AuthorizationException.Reason.MINT_PATH_DISABLED));
    }

    @Test
    void unsetSignerRejectsEverything() {
        long a = f.createOpenType("a");
        f.service.setSigner(OWNER, null);
        long deadline = f.deadline();

        assertThatThrownBy(() -> f.service.mintWithSignature(ALICE, ALICE, a, null, deadline, f.sign(ALICE, a, deadline)))
                .isInstanceOfSatisfying(AuthorizationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(AuthorizationException.Reason.SIGNER_NOT_CONFIGURED));
    }

    @Test
    void localSignerServiceProducesUsableAuthorization() {
        long a = f.createOpenType("a");

        var signed = f.service.signAuthorization(ALICE, a);
        assertThat(signed.signer()).isEqualTo(SIGNER.address());
        assertThat(signed.authorization().nonce()).isZero();
        assertThat(signed.authorization().deadline()).isEqualTo(f.clock.epochSecond() + 3600);

        f.service.mintWithSignature(ALICE, ALICE, a, null, signed.authorization().deadline(), signed.signature());
        assertThat(f.service.balanceOf(ALICE, a)).isEqualTo(1);
    }
}
