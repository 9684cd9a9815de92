package warden.core.model.revocation;

import java.time.Duration;
import java.time.Instant;

/**
 * A single revoked credential.
 *
 * @param identifier the credential identifier ({@code jti} or content hash)
 * @param reason     why the credential was revoked
 * @param revokedAt  when the revocation was recorded
 * @param userId     owning user for audit correlation (may be null)
 * @param ttl        how long the record lives
 */
public record RevocationRecord(
        String identifier, RevocationReason reason, Instant revokedAt, String userId, Duration ttl)
        implements RevocationEntry {

    public RevocationRecord {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be null or blank");
        }
        if (reason == null) {
            throw new IllegalArgumentException("Reason cannot be null");
        }
        if (revokedAt == null) {
            throw new IllegalArgumentException("Revocation time cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
    }

    @Override
    public String key() {
        return identifier;
    }

    @Override
    public Instant expiresAt() {
        return revokedAt.plus(ttl);
    }
}
