package warden.core.model.revocation;

/**
 * How a credential's claims were recovered.
 */
public enum ClaimsSource {
    /** Signature verified by the authentication subsystem. */
    VERIFIED,
    /** Payload decoded without verification; bookkeeping only. */
    UNVERIFIED,
    /** Credential could not be decoded; identifier is a content hash. */
    CONTENT_HASH
}
