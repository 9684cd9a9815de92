package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;

import warden.core.model.revocation.RevocationEntry;
import warden.core.model.revocation.RevocationReason;
import warden.core.model.revocation.RevocationRecord;
import warden.core.model.revocation.UserRevocationMarker;

/**
 * JSON form of a revocation entry as stored in Redis.
 *
 * <p>{@code timestamp} is the revocation time for a token record and the
 * revoked-before cutoff for a user marker, both in epoch milliseconds.
 */
record RedisRevocationPayload(
        String type, String identifier, String userId, String reason, long timestamp, long ttlMillis) {

    static final String TOKEN = "token";
    static final String USER = "user";

    static RedisRevocationPayload from(RevocationEntry entry) {
        if (entry instanceof UserRevocationMarker marker) {
            return new RedisRevocationPayload(
                    USER,
                    null,
                    marker.userId(),
                    marker.reason().value(),
                    marker.revokedBefore().toEpochMilli(),
                    toMillis(marker.ttl()));
        }
        var record = (RevocationRecord) entry;
        return new RedisRevocationPayload(
                TOKEN,
                record.identifier(),
                record.userId(),
                record.reason().value(),
                record.revokedAt().toEpochMilli(),
                toMillis(record.ttl()));
    }

    private static long toMillis(Duration ttl) {
        return Math.max(1, ttl.toMillis());
    }

    RevocationEntry toEntry() {
        var revocationReason = RevocationReason.fromValue(reason);
        var at = Instant.ofEpochMilli(timestamp);
        var ttl = Duration.ofMillis(ttlMillis);
        if (USER.equals(type)) {
            return new UserRevocationMarker(userId, at, revocationReason, ttl);
        }
        if (TOKEN.equals(type)) {
            return new RevocationRecord(identifier, revocationReason, at, userId, ttl);
        }
        throw new IllegalArgumentException("Unknown revocation entry type: " + type);
    }
}
