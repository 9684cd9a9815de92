package warden.core.model.revocation;

import java.time.Duration;
import java.time.Instant;

/**
 * A revocation fact held by a storage tier.
 *
 * <p>Entries are immutable. They stop applying once {@link #expiresAt()} has
 * passed and are eventually reclaimed by the tier that holds them.
 */
public sealed interface RevocationEntry permits RevocationRecord, UserRevocationMarker {

    /**
     * Returns the tier key this entry is stored under.
     *
     * @return storage key
     */
    String key();

    /**
     * Returns why the entry was created.
     *
     * @return revocation reason
     */
    RevocationReason reason();

    /**
     * Returns how long the entry lives from its creation time.
     *
     * @return entry TTL
     */
    Duration ttl();

    /**
     * Returns when the entry stops applying.
     *
     * @return expiry instant
     */
    Instant expiresAt();

    /**
     * Check whether the entry has expired.
     *
     * @param now the current time
     * @return true if the entry no longer applies
     */
    default boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }

    /**
     * Returns the TTL left at {@code now}, never negative.
     *
     * @param now the current time
     * @return remaining lifetime
     */
    default Duration remainingTtl(Instant now) {
        var remaining = Duration.between(now, expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
