package warden.core.service.revocation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.core.config.TokenRevocationConfig;
import warden.core.model.revocation.RevocationReason;
import warden.core.model.revocation.RevocationRecord;
import warden.core.port.out.RevocationMetrics;
import warden.testing.MutableClock;

@DisplayName("MembershipCleanupJob")
@ExtendWith(MockitoExtension.class)
class MembershipCleanupJobTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private TokenRevocationConfig config;

    @Mock
    private TokenRevocationConfig.CleanupConfig cleanupConfig;

    @Mock
    private RevocationMetrics metrics;

    private MutableClock clock;
    private MembershipRevocationTier tier;
    private MembershipCleanupJob job;

    @BeforeEach
    void setUp() {
        lenient().when(config.enabled()).thenReturn(true);
        lenient().when(config.cleanup()).thenReturn(cleanupConfig);
        lenient().when(cleanupConfig.enabled()).thenReturn(true);

        clock = new MutableClock(T0);
        tier = new MembershipRevocationTier(clock);
        job = new MembershipCleanupJob(config, tier, metrics, clock);
    }

    private void add(String identifier, Duration ttl) {
        var entry = new RevocationRecord(identifier, RevocationReason.LOGOUT, clock.instant(), null, ttl);
        tier.put(identifier, entry, ttl).await().atMost(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("cleanup() should remove exactly the expired entry")
    void shouldRemoveExactlyOneExpiredEntry() {
        add("expired", Duration.ofMinutes(5));
        add("live-1", Duration.ofHours(1));
        add("live-2", Duration.ofHours(2));
        clock.advance(Duration.ofMinutes(10));

        var removed = job.cleanup();

        assertEquals(1, removed);
        assertEquals(2, tier.size());
        verify(metrics).recordCleanup(1);
    }

    @Test
    @DisplayName("cleanup() should record when it ran")
    void shouldRecordLastCleanup() {
        assertEquals(T0, job.lastCleanup());
        clock.advance(Duration.ofMinutes(30));

        job.cleanup();

        assertEquals(T0.plus(Duration.ofMinutes(30)), job.lastCleanup());
    }

    @Test
    @DisplayName("scheduled sweep should do nothing when cleanup is disabled")
    void scheduledSweepSkipsWhenDisabled() {
        when(cleanupConfig.enabled()).thenReturn(false);
        add("expired", Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(10));

        job.scheduledCleanup();

        assertEquals(1, tier.size());
        verify(metrics, never()).recordCleanup(anyInt());
    }

    @Test
    @DisplayName("scheduled sweep should purge when enabled")
    void scheduledSweepPurges() {
        add("expired", Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(10));

        job.scheduledCleanup();

        assertEquals(0, tier.size());
    }
}
