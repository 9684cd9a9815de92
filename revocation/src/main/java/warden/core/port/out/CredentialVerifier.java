package warden.core.port.out;

import java.util.Optional;

import warden.core.model.revocation.TokenClaims;

/**
 * Verified decode of a credential, supplied by the authentication subsystem.
 *
 * <p>Implementations check the credential's signature and validity before
 * returning its claims. Any verification failure (bad signature, expiry,
 * malformed input, no key configured) yields an empty result rather than an
 * exception.
 */
public interface CredentialVerifier {

    /**
     * Verify a credential and return its claims.
     *
     * @param credential the raw credential
     * @return verified claims, or empty if the credential cannot be verified
     */
    Optional<TokenClaims> verify(String credential);
}
