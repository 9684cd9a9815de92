package warden.core.service.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.TokenRevocationConfig;
import warden.core.model.revocation.RevocationEntry;
import warden.core.model.revocation.TierName;
import warden.core.port.out.RevocationTier;

/**
 * In-process hot tier for revocation facts.
 *
 * <p>First tier consulted on every check. Backed by a bounded Caffeine cache
 * whose entries expire individually after the TTL they were stored with.
 * Contents are lost on restart; slower tiers repopulate it through promotion.
 *
 * <p>Performance characteristics:
 * <ul>
 *   <li>Lookup: ~1μs (no network I/O)</li>
 *   <li>Memory: configurable max size (default 100,000 entries)</li>
 * </ul>
 */
@ApplicationScoped
@Typed(HotRevocationTier.class)
public class HotRevocationTier implements RevocationTier {

    private static final Logger LOG = Logger.getLogger(HotRevocationTier.class);

    private final Clock clock;
    private final Cache<String, CachedEntry> cache;

    @Inject
    public HotRevocationTier(TokenRevocationConfig config, Clock clock) {
        this(config.hotTier().maxSize(), clock);
    }

    HotRevocationTier(long maxSize, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new EntryExpiry())
                .build();
        LOG.infof("Initialized hot revocation tier (maxSize: %d)", maxSize);
    }

    @Override
    public TierName tierName() {
        return TierName.HOT;
    }

    @Override
    public Uni<Optional<RevocationEntry>> get(String key) {
        return Uni.createFrom().item(() -> {
            var cached = cache.getIfPresent(key);
            if (cached == null) {
                return Optional.empty();
            }
            if (!clock.instant().isBefore(cached.expiresAt())) {
                cache.asMap().remove(key, cached);
                return Optional.empty();
            }
            return Optional.of(cached.entry());
        });
    }

    @Override
    public Uni<Void> put(String key, RevocationEntry entry, Duration ttl) {
        return Uni.createFrom().item(() -> {
            cache.put(key, new CachedEntry(entry, clock.instant().plus(ttl), ttl.toNanos()));
            LOG.debugf("Cached revocation in hot tier: %s (ttl: %s)", key, ttl);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            cache.invalidate(key);
            return null;
        });
    }

    @Override
    public Uni<Long> deleteMatching(String pattern) {
        return Uni.createFrom().item(() -> {
            var glob = GlobPattern.compile(pattern);
            long removed = 0;
            for (var key : cache.asMap().keySet()) {
                if (glob.matches(key) && cache.asMap().remove(key) != null) {
                    removed++;
                }
            }
            LOG.debugf("Removed %d hot tier entries matching %s", removed, pattern);
            return removed;
        });
    }

    /**
     * Returns the estimated number of cached entries.
     *
     * @return estimated size
     */
    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private record CachedEntry(RevocationEntry entry, Instant expiresAt, long ttlNanos) {}

    /**
     * Expires each entry after the TTL it was written with; reads don't extend it.
     */
    private static class EntryExpiry implements Expiry<String, CachedEntry> {
        @Override
        public long expireAfterCreate(String key, CachedEntry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedEntry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
