package warden.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.revocation.RevocationEntry;
import warden.core.model.revocation.TierName;

/**
 * Port for one storage tier of the revocation cascade.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>An entry that was put and has not expired MUST be returned by {@link #get}
 *       (no false negatives)</li>
 *   <li>Entries MUST stop being returned once their TTL has elapsed</li>
 *   <li>{@link #put} MUST be an idempotent upsert</li>
 *   <li>Failures MUST be reported as failed {@link Uni}s, never as empty results</li>
 * </ul>
 *
 * @see warden.adapter.out.storage.redis.RedisRevocationTier
 */
public interface RevocationTier {

    /**
     * Returns which tier this is.
     *
     * @return tier name
     */
    TierName tierName();

    /**
     * Look up an entry.
     *
     * @param key the tier key
     * @return Uni with the entry, or empty if absent or expired
     */
    Uni<Optional<RevocationEntry>> get(String key);

    /**
     * Store an entry, replacing any previous entry under the same key.
     *
     * @param key   the tier key
     * @param entry the entry to store
     * @param ttl   how long the tier keeps the entry
     * @return Uni completing when the entry is stored
     */
    Uni<Void> put(String key, RevocationEntry entry, Duration ttl);

    /**
     * Remove an entry.
     *
     * @param key the tier key
     * @return Uni completing when the entry is removed
     */
    Uni<Void> delete(String key);

    /**
     * Remove every entry whose key matches a glob pattern.
     *
     * <p>{@code *} matches any run of characters and {@code ?} a single character.
     * Every other character, including {@code [}, {@code ]} and {@code \},
     * matches literally in every tier.
     *
     * @param pattern the glob pattern
     * @return Uni with the number of entries removed
     */
    Uni<Long> deleteMatching(String pattern);
}
