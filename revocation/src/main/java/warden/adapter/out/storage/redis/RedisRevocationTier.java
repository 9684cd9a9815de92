package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.DefaultBean;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.TokenRevocationConfig;
import warden.core.model.revocation.RevocationEntry;
import warden.core.model.revocation.TierName;
import warden.core.port.out.RevocationTier;

/**
 * Redis implementation of the durable revocation tier.
 *
 * <p>This is the default implementation for production deployments. Entries
 * are stored as JSON with a Redis TTL, so Redis itself expires them. The tier
 * is shared by every instance and survives restarts.
 *
 * <p>Key format: {@code warden:revoked:{key}}, where the key is a token
 * identifier or {@code user:{userId}} for a user marker. The prefix is
 * configurable through {@code warden.revocation.durable-tier.key-prefix}.
 *
 * <p>Platform teams can provide custom implementations via CDI:
 * <pre>{@code
 * @Alternative
 * @Priority(1)
 * @ApplicationScoped
 * public class CustomRevocationTier implements RevocationTier {
 *     // Custom implementation
 * }
 * }</pre>
 */
@ApplicationScoped
@DefaultBean
public class RedisRevocationTier implements RevocationTier {

    private static final Logger LOG = Logger.getLogger(RedisRevocationTier.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final int scanCount;

    @Inject
    public RedisRevocationTier(ReactiveRedisDataSource redisDataSource, TokenRevocationConfig config) {
        this(redisDataSource, config.durableTier().keyPrefix(), config.durableTier().scanCount());
    }

    RedisRevocationTier(ReactiveRedisDataSource redisDataSource, String keyPrefix, int scanCount) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.scanCount = scanCount;
        LOG.infof("Initialized Redis revocation tier (keyPrefix: %s)", keyPrefix);
    }

    @Override
    public TierName tierName() {
        return TierName.DURABLE;
    }

    @Override
    public Uni<Optional<RevocationEntry>> get(String key) {
        return valueCommands.get(keyFor(key)).map(json -> {
            if (json == null) {
                return Optional.<RevocationEntry>empty();
            }
            return Optional.of(deserialize(key, json));
        });
    }

    @Override
    public Uni<Void> put(String key, RevocationEntry entry, Duration ttl) {
        var ttlSeconds = toSeconds(ttl);
        var json = serialize(entry);
        return valueCommands
                .setex(keyFor(key), ttlSeconds, json)
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Stored revocation in Redis: %s (TTL: %ds)", key, ttlSeconds));
    }

    @Override
    public Uni<Void> delete(String key) {
        return keyCommands.del(keyFor(key)).replaceWithVoid();
    }

    /**
     * Delete every entry whose key matches a glob pattern.
     *
     * <p>Uses {@code SCAN MATCH} in batches of {@code scan-count} keys rather
     * than {@code KEYS}, so large keyspaces are never walked in one call.
     * Only {@code *} and {@code ?} keep their glob meaning; see {@link #scanMatch}.
     */
    @Override
    public Uni<Long> deleteMatching(String pattern) {
        var args = new KeyScanArgs().match(scanMatch(keyPrefix, pattern)).count(scanCount);
        return keyCommands
                .scan(args)
                .toMulti()
                .group()
                .intoLists()
                .of(scanCount)
                .onItem()
                .transformToUniAndConcatenate(batch -> keyCommands.del(batch.toArray(new String[0])))
                .collect()
                .with(Collectors.summingLong(Integer::longValue))
                .invoke(removed -> LOG.debugf("Removed %d Redis revocation entries matching %s", removed, pattern));
    }

    /**
     * Builds the {@code SCAN MATCH} argument. Redis also treats {@code [},
     * {@code ]} and {@code \} as glob syntax, so those are escaped to match
     * literally, as they do in the in-process tiers. The key prefix is
     * escaped entirely.
     */
    static String scanMatch(String keyPrefix, String pattern) {
        var sb = new StringBuilder(keyPrefix.length() + pattern.length() + 8);
        appendEscaped(sb, keyPrefix, "*?[]\\");
        appendEscaped(sb, pattern, "[]\\");
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, String value, String special) {
        for (char c : value.toCharArray()) {
            if (special.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
    }

    private String keyFor(String key) {
        return keyPrefix + key;
    }

    private static long toSeconds(Duration ttl) {
        // SETEX rejects zero; round partial seconds up
        var seconds = ttl.toSeconds();
        return ttl.toNanosPart() > 0 || seconds == 0 ? seconds + 1 : seconds;
    }

    private String serialize(RevocationEntry entry) {
        try {
            return OBJECT_MAPPER.writeValueAsString(RedisRevocationPayload.from(entry));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize revocation entry " + entry.key(), e);
        }
    }

    private RevocationEntry deserialize(String key, String json) {
        try {
            return OBJECT_MAPPER.readValue(json, RedisRevocationPayload.class).toEntry();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid revocation entry in Redis for " + key, e);
        }
    }
}
