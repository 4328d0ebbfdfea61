package com.demo.soulbound.service.registry;

import com.demo.soulbound.service.error.AuthorizationException;
import com.demo.soulbound.service.error.CredentialNotFoundException;
import com.demo.soulbound.service.error.InvalidStateException;
import com.demo.soulbound.service.error.InvariantViolationException;
import com.demo.soulbound.service.event.CredentialTypeCreated;
import com.demo.soulbound.service.issuance.MintMode;
import com.demo.soulbound.support.EngineFixture;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.demo.soulbound.support.EngineFixture.ALICE;
import static com.demo.soulbound.support.EngineFixture.OWNER;
import static com.demo.soulbound.support.EngineFixture.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialRegistryTest {

    private final EngineFixture f = new EngineFixture(MintMode.ROLE);

    @Test
    void idsAreDenseFromZero() {
        assertThat(f.createOpenType("a")).isZero();
        assertThat(f.createOpenType("b")).isEqualTo(1);
        assertThat(f.createOpenType("c")).isEqualTo(2);

        assertThat(f.service.nextCredentialTypeId()).isEqualTo(3);
        assertThat(f.service.isCreated(2)).isTrue();
        assertThat(f.service.isCreated(3)).isFalse();
        assertThat(f.service.isCreated(-1)).isFalse();
    }

    @Test
    void storesMetadata() {
        long id = f.service.createCredentialType(OWNER, "Hackathon 2024", "Attended", START + 10, START + 100,
                BigInteger.valueOf(5));

        CredentialType t = f.service.getMetadata(id);
        assertThat(t.name()).isEqualTo("Hackathon 2024");
        assertThat(t.description()).isEqualTo("Attended");
        assertThat(t.creator()).isEqualTo(OWNER);
        assertThat(t.registeredAt()).isEqualTo(START);
        assertThat(t.startTime()).isEqualTo(START + 10);
        assertThat(t.endTime()).isEqualTo(START + 100);
        assertThat(t.price()).isEqualTo(BigInteger.valueOf(5));
        assertThat(f.eventsOf(CredentialTypeCreated.class)).singleElement()
                .satisfies(e -> assertThat(e.credentialTypeId()).isEqualTo(id));
    }

    @Test
    void onlyOwnerWhileUnpaused() {
        assertThatThrownBy(() -> f.createOpenTypeAs(ALICE)).isInstanceOf(AuthorizationException.class);

        f.service.pause(OWNER);
        assertThatThrownBy(() -> f.createOpenType("x")).isInstanceOf(InvalidStateException.class);
        assertThat(f.service.nextCredentialTypeId()).isZero();
    }

    @Test
    void rejectsInvertedWindow() {
        assertThatThrownBy(() -> f.service.createCredentialType(OWNER, "x", "", 100, 100, null))
                .isInstanceOfSatisfying(InvariantViolationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(InvariantViolationException.Reason.INVALID_ARGUMENT));
        assertThat(f.service.nextCredentialTypeId()).isZero();
    }

    @Test
    void uriIsBasePlusDecimalId() {
        f.createOpenType("a");
        long id = f.createOpenType("b");

        assertThat(f.service.uri(id)).isEqualTo("ipfs://creds/1");

        f.service.setBaseMetadataUri(OWNER, "");
        assertThat(f.service.uri(id)).isEmpty();

        assertThatThrownBy(() -> f.service.uri(7)).isInstanceOf(CredentialNotFoundException.class);
    }

    @Test
    void unknownIdIsNotFound() {
        assertThatThrownBy(() -> f.service.getMetadata(0))
                .isInstanceOfSatisfying(CredentialNotFoundException.class, ex ->
                        assertThat(ex.getCredentialTypeId()).isZero());
    }

    @Test
    void priceMustFitInOneWord() {
        BigInteger largest = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

        long id = f.createPricedType("max", largest);
        assertThat(f.service.getMetadata(id).price()).isEqualTo(largest);
        assertThat(f.service.signAuthorization(ALICE, id).authorization().price()).isEqualTo(largest);

        assertThatThrownBy(() -> f.createPricedType("too-big", BigInteger.TWO.pow(256)))
                .isInstanceOfSatisfying(InvariantViolationException.class, ex ->
                        assertThat(ex.getReason()).isEqualTo(InvariantViolationException.Reason.INVALID_ARGUMENT));
        assertThat(f.service.nextCredentialTypeId()).isEqualTo(1);
    }
}
