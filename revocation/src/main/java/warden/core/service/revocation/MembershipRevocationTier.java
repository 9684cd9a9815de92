package warden.core.service.revocation;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.revocation.RevocationEntry;
import warden.core.model.revocation.TierName;
import warden.core.port.out.RevocationTier;

/**
 * Exact expiring set of revoked token identifiers.
 *
 * <p>Unlike a bloom filter this tier has neither false positives nor false
 * negatives: anything put and not yet expired is found. Each entry carries its
 * expiry in epoch seconds. Expired entries are dropped lazily on read and in
 * bulk by {@link MembershipCleanupJob}; nothing else removes them.
 *
 * <p>Reads are lock-free; writes to the same key are serialized by the
 * underlying {@link ConcurrentHashMap}.
 */
@ApplicationScoped
@Typed(MembershipRevocationTier.class)
public class MembershipRevocationTier implements RevocationTier {

    private static final Logger LOG = Logger.getLogger(MembershipRevocationTier.class);

    private final Clock clock;
    private final ConcurrentMap<String, MembershipEntry> entries = new ConcurrentHashMap<>();

    public MembershipRevocationTier(Clock clock) {
        this.clock = clock;
    }

    @Override
    public TierName tierName() {
        return TierName.MEMBERSHIP;
    }

    @Override
    public Uni<Optional<RevocationEntry>> get(String key) {
        return Uni.createFrom().item(() -> {
            var member = entries.get(key);
            if (member == null) {
                return Optional.empty();
            }
            if (member.isExpired(nowEpochSeconds())) {
                entries.remove(key, member);
                return Optional.empty();
            }
            return Optional.of(member.entry());
        });
    }

    @Override
    public Uni<Void> put(String key, RevocationEntry entry, Duration ttl) {
        return Uni.createFrom().item(() -> {
            var expiresAt = clock.instant().plus(ttl).getEpochSecond();
            entries.put(key, new MembershipEntry(entry, expiresAt));
            LOG.debugf("Added %s to membership tier (expires: %d)", key, expiresAt);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            entries.remove(key);
            return null;
        });
    }

    @Override
    public Uni<Long> deleteMatching(String pattern) {
        return Uni.createFrom().item(() -> {
            var glob = GlobPattern.compile(pattern);
            long removed = 0;
            for (var key : entries.keySet()) {
                if (glob.matches(key) && entries.remove(key) != null) {
                    removed++;
                }
            }
            LOG.debugf("Removed %d membership tier entries matching %s", removed, pattern);
            return removed;
        });
    }

    /**
     * Remove every entry whose expiry has passed.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        final var now = nowEpochSeconds();
        var removed = 0;
        for (var member : entries.entrySet()) {
            if (member.getValue().isExpired(now) && entries.remove(member.getKey(), member.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Returns the number of entries held, including expired ones not yet purged.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    private long nowEpochSeconds() {
        return clock.instant().getEpochSecond();
    }

    private record MembershipEntry(RevocationEntry entry, long expiresAtEpochSeconds) {

        boolean isExpired(long nowEpochSeconds) {
            return nowEpochSeconds >= expiresAtEpochSeconds;
        }
    }
}
