package warden.core.model.revocation;

import java.time.Duration;
import java.time.Instant;

/**
 * Every credential of {@code userId} issued before {@code revokedBefore} is revoked.
 *
 * <p>Only one marker exists per user; a newer marker replaces the previous one.
 *
 * @param userId        the affected user
 * @param revokedBefore credentials issued strictly before this instant are revoked
 * @param reason        why the user's credentials were revoked
 * @param ttl           how long the marker lives
 */
public record UserRevocationMarker(String userId, Instant revokedBefore, RevocationReason reason, Duration ttl)
        implements RevocationEntry {

    private static final String KEY_PREFIX = "user:";

    public UserRevocationMarker {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        if (revokedBefore == null) {
            throw new IllegalArgumentException("Revoked-before time cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("Reason cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
    }

    /**
     * Returns the tier key for a user's marker.
     *
     * @param userId the user ID
     * @return key of the form {@code user:<userId>}
     */
    public static String keyFor(String userId) {
        return KEY_PREFIX + userId;
    }

    @Override
    public String key() {
        return keyFor(userId);
    }

    @Override
    public Instant expiresAt() {
        return revokedBefore.plus(ttl);
    }

    /**
     * Check whether a credential issued at {@code issuedAt} is covered by this marker.
     *
     * @param issuedAt the credential's issued-at time
     * @return true if the credential was issued before the cutoff
     */
    public boolean revokes(Instant issuedAt) {
        return issuedAt.isBefore(revokedBefore);
    }
}
