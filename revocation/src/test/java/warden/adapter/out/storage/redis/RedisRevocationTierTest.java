package warden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyScanCursor;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.core.model.revocation.RevocationEntry;
import warden.core.model.revocation.RevocationReason;
import warden.core.model.revocation.RevocationRecord;
import warden.core.model.revocation.TierName;
import warden.core.model.revocation.UserRevocationMarker;

@DisplayName("RedisRevocationTier")
@ExtendWith(MockitoExtension.class)
class RedisRevocationTierTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00.250Z");

    @Mock
    private ReactiveRedisDataSource dataSource;

    @Mock
    private ReactiveValueCommands<String, String> valueCommands;

    @Mock
    private ReactiveKeyCommands<String> keyCommands;

    @Mock
    private ReactiveKeyScanCursor<String> scanCursor;

    private RedisRevocationTier tier;

    @BeforeEach
    void setUp() {
        when(dataSource.value(String.class, String.class)).thenReturn(valueCommands);
        when(dataSource.key(String.class)).thenReturn(keyCommands);
        tier = new RedisRevocationTier(dataSource, "warden:revoked:", 1000);
    }

    private String storedJson(String key, RevocationEntry entry, Duration ttl) {
        when(valueCommands.setex(anyString(), anyLong(), anyString())).thenReturn(Uni.createFrom().voidItem());
        tier.put(key, entry, ttl).await().atMost(TIMEOUT);
        var json = ArgumentCaptor.forClass(String.class);
        verify(valueCommands).setex(eq("warden:revoked:" + key), anyLong(), json.capture());
        return json.getValue();
    }

    @Test
    @DisplayName("should report the durable tier name")
    void shouldReportTierName() {
        assertEquals(TierName.DURABLE, tier.tierName());
    }

    @Nested
    @DisplayName("put()")
    class PutTests {

        @Test
        @DisplayName("should SETEX the prefixed key with the TTL in seconds")
        void shouldSetexWithTtl() {
            when(valueCommands.setex(anyString(), anyLong(), anyString())).thenReturn(Uni.createFrom().voidItem());
            var record = new RevocationRecord("jti-1", RevocationReason.LOGOUT, T0, "alice", Duration.ofHours(1));

            tier.put("jti-1", record, Duration.ofHours(1)).await().atMost(TIMEOUT);

            verify(valueCommands).setex(eq("warden:revoked:jti-1"), eq(3600L), anyString());
        }

        @Test
        @DisplayName("should round partial seconds up")
        void shouldRoundUp() {
            when(valueCommands.setex(anyString(), anyLong(), anyString())).thenReturn(Uni.createFrom().voidItem());
            var record = new RevocationRecord("jti-1", RevocationReason.LOGOUT, T0, null, Duration.ofMillis(1500));

            tier.put("jti-1", record, record.ttl()).await().atMost(TIMEOUT);

            verify(valueCommands).setex(eq("warden:revoked:jti-1"), eq(2L), anyString());
        }

        @Test
        @DisplayName("should write the wire value of the reason")
        void shouldWriteWireReason() {
            var record = new RevocationRecord("jti-1", RevocationReason.PASSWORD_CHANGE, T0, null, Duration.ofHours(1));

            var json = storedJson("jti-1", record, record.ttl());

            assertTrue(json.contains("\"reason\":\"password_change\""), json);
            assertTrue(json.contains("\"type\":\"token\""), json);
        }
    }

    @Nested
    @DisplayName("get()")
    class GetTests {

        @Test
        @DisplayName("should read back a stored token record")
        void shouldReadRecord() {
            var record = new RevocationRecord("jti-1", RevocationReason.LOGOUT, T0, "alice", Duration.ofHours(1));
            var json = storedJson("jti-1", record, record.ttl());
            when(valueCommands.get("warden:revoked:jti-1")).thenReturn(Uni.createFrom().item(json));

            var found = tier.get("jti-1").await().atMost(TIMEOUT);

            assertEquals(record, found.orElseThrow());
        }

        @Test
        @DisplayName("should read back a stored user marker with millisecond precision")
        void shouldReadMarker() {
            var marker = new UserRevocationMarker("alice", T0, RevocationReason.SECURITY_BREACH, Duration.ofDays(30));
            var json = storedJson(marker.key(), marker, marker.ttl());
            when(valueCommands.get("warden:revoked:user:alice")).thenReturn(Uni.createFrom().item(json));

            var found = tier.get("user:alice").await().atMost(TIMEOUT);

            assertEquals(marker, found.orElseThrow());
        }

        @Test
        @DisplayName("should return empty for a missing key")
        void shouldReturnEmptyWhenMissing() {
            when(valueCommands.get("warden:revoked:jti-1")).thenReturn(Uni.createFrom().nullItem());

            assertTrue(tier.get("jti-1").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should fail on a corrupt payload")
        void shouldFailOnCorruptPayload() {
            when(valueCommands.get("warden:revoked:jti-1")).thenReturn(Uni.createFrom().item("not json"));

            var uni = tier.get("jti-1");

            assertThrows(IllegalStateException.class, () -> uni.await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should propagate Redis failures")
        void shouldPropagateFailure() {
            when(valueCommands.get("warden:revoked:jti-1"))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection refused")));

            var uni = tier.get("jti-1");

            assertThrows(IllegalStateException.class, () -> uni.await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("delete() and deleteMatching()")
    class DeleteTests {

        @Test
        @DisplayName("delete() should DEL the prefixed key")
        void shouldDelete() {
            when(keyCommands.del("warden:revoked:jti-1")).thenReturn(Uni.createFrom().item(1));

            tier.delete("jti-1").await().atMost(TIMEOUT);

            verify(keyCommands).del("warden:revoked:jti-1");
        }

        @Test
        @DisplayName("deleteMatching() should SCAN the prefixed pattern and delete what it finds")
        void shouldScanAndDelete() {
            when(keyCommands.scan(any(KeyScanArgs.class))).thenReturn(scanCursor);
            when(scanCursor.toMulti())
                    .thenReturn(Multi.createFrom().items("warden:revoked:user:a", "warden:revoked:user:b"));
            when(keyCommands.del("warden:revoked:user:a", "warden:revoked:user:b"))
                    .thenReturn(Uni.createFrom().item(2));

            var removed = tier.deleteMatching("user:*").await().atMost(TIMEOUT);

            assertEquals(2L, removed);
        }

        @Test
        @DisplayName("deleteMatching() should return zero when nothing matches")
        void shouldReturnZeroWhenNothingMatches() {
            when(keyCommands.scan(any(KeyScanArgs.class))).thenReturn(scanCursor);
            when(scanCursor.toMulti()).thenReturn(Multi.createFrom().empty());

            assertEquals(0L, tier.deleteMatching("*").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("SCAN MATCH should keep * and ? as wildcards")
        void scanMatchKeepsWildcards() {
            assertEquals("warden:revoked:user:*", RedisRevocationTier.scanMatch("warden:revoked:", "user:*"));
            assertEquals("warden:revoked:jti-?", RedisRevocationTier.scanMatch("warden:revoked:", "jti-?"));
        }

        @Test
        @DisplayName("SCAN MATCH should treat brackets and backslashes as literal characters")
        void scanMatchEscapesRedisOnlySyntax() {
            assertEquals(
                    "warden:revoked:user:\\[ab\\]*",
                    RedisRevocationTier.scanMatch("warden:revoked:", "user:[ab]*"));
            assertEquals(
                    "warden:revoked:a\\\\b",
                    RedisRevocationTier.scanMatch("warden:revoked:", "a\\b"));
        }

        @Test
        @DisplayName("SCAN MATCH should escape wildcards in the key prefix")
        void scanMatchEscapesPrefix() {
            assertEquals("app\\*:jti-*", RedisRevocationTier.scanMatch("app*:", "jti-*"));
        }
    }
}
