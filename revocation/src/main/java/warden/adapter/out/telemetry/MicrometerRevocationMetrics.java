package warden.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.quarkus.arc.DefaultBean;

import warden.core.config.TokenRevocationConfig;
import warden.core.model.revocation.RevocationReason;
import warden.core.model.revocation.TierName;
import warden.core.port.out.RevocationMetrics;
import warden.core.service.revocation.MembershipRevocationTier;

/**
 * Micrometer metrics for token revocation.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code warden.revocation.revoked} - Single-token revocations by reason and method</li>
 *   <li>{@code warden.revocation.mass} - Per-user mass revocations by reason</li>
 *   <li>{@code warden.revocation.checks} - Checks by result and deciding source</li>
 *   <li>{@code warden.revocation.check.duration} - Check latency histogram</li>
 *   <li>{@code warden.revocation.tier.failures} - Failed or timed-out tier operations</li>
 *   <li>{@code warden.revocation.promotions} - Facts copied into faster tiers</li>
 *   <li>{@code warden.revocation.cleanup.removed} - Expired membership entries purged</li>
 *   <li>{@code warden.revocation.membership.size} - Current membership tier size gauge</li>
 * </ul>
 */
@ApplicationScoped
@DefaultBean
public class MicrometerRevocationMetrics implements RevocationMetrics {

    private final MeterRegistry registry;
    private final MembershipRevocationTier membershipTier;
    private final boolean enabled;

    @Inject
    public MicrometerRevocationMetrics(
            MeterRegistry registry, MembershipRevocationTier membershipTier, TokenRevocationConfig config) {
        this(registry, membershipTier, config.metrics().enabled());
    }

    MicrometerRevocationMetrics(MeterRegistry registry, MembershipRevocationTier membershipTier, boolean enabled) {
        this.registry = registry;
        this.membershipTier = membershipTier;
        this.enabled = enabled;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("warden.revocation.membership.size", membershipTier, MembershipRevocationTier::size)
                .description("Entries currently held by the membership tier")
                .register(registry);
    }

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRevocation(RevocationReason reason, boolean byIdentifier) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.revocation.revoked")
                .description("Single-token revocations")
                .tag("reason", reason.value())
                .tag("method", byIdentifier ? "identifier" : "credential")
                .register(registry)
                .increment();
    }

    @Override
    public void recordMassRevocation(RevocationReason reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.revocation.mass")
                .description("Per-user mass revocations")
                .tag("reason", reason.value())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCheck(boolean revoked, String source, long durationNanos) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.revocation.checks")
                .description("Revocation checks")
                .tag("result", revoked ? "revoked" : "valid")
                .tag("source", nullSafe(source))
                .register(registry)
                .increment();

        Timer.builder("warden.revocation.check.duration")
                .description("Revocation check latency")
                .tag("source", nullSafe(source))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordPromotion(TierName from, TierName to) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.revocation.promotions")
                .description("Revocation facts promoted into faster tiers")
                .tag("from", from.tag())
                .tag("to", to.tag())
                .register(registry)
                .increment();
    }

    @Override
    public void recordTierFailure(TierName tier, String operation, boolean timeout) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.revocation.tier.failures")
                .description("Failed or timed-out tier operations")
                .tag("tier", tier.tag())
                .tag("operation", nullSafe(operation))
                .tag("type", timeout ? "timeout" : "error")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCleanup(int removed) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.revocation.cleanup.removed")
                .description("Expired membership tier entries purged")
                .register(registry)
                .increment(removed);
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
