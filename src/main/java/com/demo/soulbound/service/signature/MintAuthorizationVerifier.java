package com.demo.soulbound.service.signature;

import com.demo.soulbound.service.Addresses;
import com.demo.soulbound.service.access.AccessControl;
import com.demo.soulbound.service.error.AuthorizationException;
import com.demo.soulbound.service.event.AdministrationChanged;
import com.demo.soulbound.service.tx.OperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;

/**
 * Checks that a mint authorization was signed by the trusted signer.
 * Rotating the signer makes every unconsumed signature of the previous one
 * unverifiable.
 */
@Slf4j
public class MintAuthorizationVerifier {

    // secp256k1 n / 2; signatures with a larger s are the malleated twin of a valid one
    private static final BigInteger HALF_CURVE_ORDER = new BigInteger(
            "7FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF5D576E7357A4501DDFE92F46681B20A0", 16);

    private final OperationExecutor executor;
    private final AccessControl access;
    private final long domainId;
    private Address signer;

    public MintAuthorizationVerifier(OperationExecutor executor, AccessControl access,
                                     Address signer, long domainId) {
        this.executor = executor;
        this.access = access;
        this.signer = signer == null ? Addresses.ZERO : signer;
        this.domainId = domainId;
    }

    public Address signer() {
        return signer;
    }

    public long domainId() {
        return domainId;
    }

    public void setSigner(Address caller, Address newSigner) {
        access.requireOwner(caller);
        Address previous = signer;
        Address next = newSigner == null ? Addresses.ZERO : newSigner;
        executor.journal().onRollback(() -> signer = previous);
        signer = next;
        executor.journal().emit(new AdministrationChanged("SIGNER_CHANGED", caller, next.toString()));
        log.info("Trusted signer rotated from {} to {}", previous, next);
    }

    public void requireNotExpired(long deadline, long now) {
        if (deadline < now) {
            throw new AuthorizationException(AuthorizationException.Reason.SIGNATURE_EXPIRED,
                    "Authorization expired at " + deadline + ", now " + now);
        }
    }

    public void verify(MintAuthorization authorization, byte[] signature) {
        if (Addresses.isZero(signer)) {
            throw new AuthorizationException(AuthorizationException.Reason.SIGNER_NOT_CONFIGURED,
                    "No trusted signer configured");
        }
        Address recovered = recover(authorization, signature);
        if (!signer.equals(recovered)) {
            log.warn("Rejected mint authorization for {} type {}: recovered {}",
                    authorization.recipient(), authorization.credentialTypeId(), recovered);
            throw invalidSignature("Signature was not produced by the trusted signer");
        }
    }

    Address recover(MintAuthorization authorization, byte[] signature) {
        Sign.SignatureData data;
        try {
            data = Signatures.fromBytes(signature);
        } catch (IllegalArgumentException ex) {
            throw invalidSignature(ex.getMessage());
        }
        if (Numeric.toBigInt(data.getS()).compareTo(HALF_CURVE_ORDER) > 0) {
            throw invalidSignature("Signature s value is not canonical");
        }
        byte[] digest = authorization.digest();
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest, data);
            return new Address(Keys.getAddress(publicKey));
        } catch (SignatureException | RuntimeException ex) {
            throw invalidSignature("Signature could not be recovered: " + ex.getMessage());
        }
    }

    private static AuthorizationException invalidSignature(String message) {
        return new AuthorizationException(AuthorizationException.Reason.INVALID_SIGNATURE, message);
    }
}
