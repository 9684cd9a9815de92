package warden.core.service.revocation;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import warden.core.config.TokenRevocationConfig;
import warden.core.port.out.RevocationMetrics;

/**
 * Periodically removes expired entries from the membership tier.
 *
 * <p>The hot and durable tiers expire entries on their own and are not
 * touched. The sweep runs on the scheduler's thread, removes entries in one
 * pass and never blocks revocation calls.
 */
@ApplicationScoped
public class MembershipCleanupJob {

    private static final Logger LOG = Logger.getLogger(MembershipCleanupJob.class);

    private final TokenRevocationConfig config;
    private final MembershipRevocationTier membershipTier;
    private final RevocationMetrics metrics;
    private final Clock clock;
    private final AtomicReference<Instant> lastCleanup;

    public MembershipCleanupJob(
            TokenRevocationConfig config,
            MembershipRevocationTier membershipTier,
            RevocationMetrics metrics,
            Clock clock) {
        this.config = config;
        this.membershipTier = membershipTier;
        this.metrics = metrics;
        this.clock = clock;
        this.lastCleanup = new AtomicReference<>(clock.instant());
    }

    /**
     * Scheduled sweep.
     */
    @Scheduled(
            every = "${warden.revocation.cleanup.interval:PT1H}",
            delayed = "${warden.revocation.cleanup.interval:PT1H}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledCleanup() {
        if (!config.enabled() || !config.cleanup().enabled()) {
            return;
        }
        cleanup();
    }

    /**
     * Remove expired membership tier entries now.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        var removed = membershipTier.purgeExpired();
        var remaining = membershipTier.size();
        lastCleanup.set(clock.instant());
        metrics.recordCleanup(removed);
        LOG.debugf("Membership tier cleanup: removed %d expired entries, %d remaining", removed, remaining);
        return removed;
    }

    /**
     * Returns when the last sweep finished, or the job's creation time if none ran yet.
     *
     * @return last cleanup time
     */
    public Instant lastCleanup() {
        return lastCleanup.get();
    }
}
