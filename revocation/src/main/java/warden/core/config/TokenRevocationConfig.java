package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.revocation.FailurePolicy;

/**
 * Configuration mapping for token revocation.
 *
 * <p>Configuration prefix: {@code warden.revocation}
 *
 * <p>Revocation facts are stored in three tiers, consulted fastest first:
 * <ol>
 *   <li>Hot tier - in-process Caffeine cache (sub-millisecond)</li>
 *   <li>Membership tier - exact in-process expiring set (sub-millisecond)</li>
 *   <li>Durable tier - Redis, shared across instances (~1-5ms)</li>
 * </ol>
 */
@ConfigMapping(prefix = "warden.revocation")
public interface TokenRevocationConfig {

    /**
     * Enable token revocation.
     *
     * @return true if revocation is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Enable user-level (mass) revocation checks.
     *
     * @return true if user markers are evaluated (default: true)
     */
    @WithDefault("true")
    boolean checkUserRevocation();

    /**
     * Default lifetime of revocation records and user markers.
     *
     * <p>Must be at least the longest lifetime of any credential the system
     * issues (the refresh-token lifetime), so a record outlives every
     * credential it could apply to.
     *
     * @return default TTL (default: 30 days)
     */
    @WithDefault("P30D")
    Duration defaultTtl();

    /**
     * Result of a check when every storage tier is unreachable.
     *
     * <p>{@code FAIL_OPEN} reports "not revoked" and keeps users logged in
     * during a storage outage; {@code FAIL_CLOSED} reports "revoked" and
     * rejects every credential until storage recovers. Deployment runbooks
     * must state which one is in effect.
     *
     * @return failure policy (default: FAIL_OPEN)
     */
    @WithDefault("FAIL_OPEN")
    FailurePolicy failurePolicy();

    /**
     * Hot tier configuration.
     */
    HotTierConfig hotTier();

    /**
     * Membership tier configuration.
     */
    MembershipTierConfig membershipTier();

    /**
     * Durable tier configuration.
     */
    DurableTierConfig durableTier();

    /**
     * Membership tier cleanup configuration.
     */
    CleanupConfig cleanup();

    /**
     * Credential verification configuration.
     */
    VerificationConfig verification();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * In-process Caffeine cache holding recent revocations.
     */
    interface HotTierConfig {

        /**
         * Maximum number of entries in the cache.
         *
         * @return max size (default: 100,000)
         */
        @WithDefault("100000")
        long maxSize();
    }

    /**
     * Exact expiring set of revoked token identifiers.
     */
    interface MembershipTierConfig {

        /**
         * Enable the membership tier.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }

    /**
     * Redis-backed durable tier.
     */
    interface DurableTierConfig {

        /**
         * Enable the durable tier.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Timeout for a single durable tier operation. The in-process tiers
         * complete synchronously and carry no timeout.
         *
         * @return timeout (default: 50 milliseconds)
         */
        @WithDefault("PT0.05S")
        Duration timeout();

        /**
         * Prefix applied to every durable tier key.
         *
         * @return key prefix (default: warden:revoked:)
         */
        @WithDefault("warden:revoked:")
        String keyPrefix();

        /**
         * Number of keys requested per SCAN round trip.
         *
         * @return scan count hint (default: 1000)
         */
        @WithDefault("1000")
        int scanCount();
    }

    /**
     * Periodic sweep of expired membership tier entries.
     */
    interface CleanupConfig {

        /**
         * Enable the scheduled sweep.
         *
         * <p>Manual cleanup stays available when disabled.
         *
         * @return true if the scheduled sweep runs (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Interval between sweeps.
         *
         * @return sweep interval (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration interval();
    }

    /**
     * Verified decoding of credentials before the unverified fallback.
     */
    interface VerificationConfig {

        /**
         * HMAC secret used to verify HS256 credentials.
         *
         * <p>When absent, verified decoding is skipped and identifiers come
         * from the unverified fallback.
         *
         * @return the shared secret, if configured
         */
        Optional<String> hmacSecret();
    }

    /**
     * Micrometer recording for revocation activity.
     */
    interface MetricsConfig {

        /**
         * Enable revocation metrics.
         *
         * @return true if metrics are recorded (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
