package warden.core.model.revocation;

import java.time.Duration;
import java.util.Map;

/**
 * Options for a revocation request.
 *
 * @param reason   why the revocation happens; null selects the operation's default reason
 * @param ttl      how long the revocation lives; null selects the configured default TTL
 * @param userId   owning user for audit correlation (may be null)
 * @param metadata extra audit metadata (never null)
 */
public record RevocationOptions(RevocationReason reason, Duration ttl, String userId, Map<String, Object> metadata) {

    public RevocationOptions {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Options with every field defaulted.
     *
     * @return default options
     */
    public static RevocationOptions defaults() {
        return new RevocationOptions(null, null, null, Map.of());
    }

    /**
     * Options carrying only a reason.
     *
     * @param reason the revocation reason
     * @return options for the reason
     */
    public static RevocationOptions of(RevocationReason reason) {
        return new RevocationOptions(reason, null, null, Map.of());
    }

    public RevocationOptions withTtl(Duration ttl) {
        return new RevocationOptions(reason, ttl, userId, metadata);
    }

    public RevocationOptions withUserId(String userId) {
        return new RevocationOptions(reason, ttl, userId, metadata);
    }

    public RevocationOptions withMetadata(Map<String, Object> metadata) {
        return new RevocationOptions(reason, ttl, userId, metadata);
    }

    /**
     * Returns the reason, falling back to {@code defaultReason} when none was given.
     *
     * @param defaultReason the operation's default reason
     * @return effective reason
     */
    public RevocationReason reasonOr(RevocationReason defaultReason) {
        return reason != null ? reason : defaultReason;
    }

    /**
     * Returns the TTL, falling back to {@code defaultTtl} when none was given.
     *
     * @param defaultTtl the configured default TTL
     * @return effective TTL
     */
    public Duration ttlOr(Duration defaultTtl) {
        return ttl != null ? ttl : defaultTtl;
    }
}
