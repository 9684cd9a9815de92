package warden.core.service.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import warden.core.config.TokenRevocationConfig;
import warden.core.model.revocation.RevocationAuditEvent;
import warden.core.model.revocation.RevocationEntry;
import warden.core.model.revocation.RevocationOptions;
import warden.core.model.revocation.RevocationReason;
import warden.core.model.revocation.RevocationRecord;
import warden.core.model.revocation.RevocationResult;
import warden.core.model.revocation.RevocationStats;
import warden.core.model.revocation.TierName;
import warden.core.model.revocation.TierOutcome;
import warden.core.model.revocation.TierWriteException;
import warden.core.model.revocation.TokenClaims;
import warden.core.model.revocation.UserRevocationMarker;
import warden.core.port.out.RevocationAuditSink;
import warden.core.port.out.RevocationMetrics;
import warden.core.port.out.RevocationTier;

/**
 * Entry point for revoking credentials and checking revocation status.
 *
 * <p>Revocation facts are kept in three tiers, consulted fastest first:
 * <ol>
 *   <li><b>Hot tier</b> - in-process Caffeine cache (~1μs)</li>
 *   <li><b>Membership tier</b> - exact in-process expiring set (~1μs)</li>
 *   <li><b>Durable tier</b> - Redis, shared by all instances (~1-5ms)</li>
 * </ol>
 *
 * <p>Writes go to the hot tier first and must succeed there; the other tiers
 * are written best-effort. Reads cascade through the tiers and a fact found in
 * a slower tier is promoted into every faster one. A credential with no
 * revocation record of its own is still revoked when its user has a marker
 * newer than its issued-at claim.
 *
 * <p>A tier that fails or times out is skipped. When no tier could be read at
 * all, checks answer according to {@link TokenRevocationConfig#failurePolicy()}.
 */
@ApplicationScoped
public class TokenRevocationService {

    private static final Logger LOG = Logger.getLogger(TokenRevocationService.class);

    private final TokenRevocationConfig config;
    private final TokenClaimsExtractor claimsExtractor;
    private final RevocationAuditSink auditSink;
    private final RevocationMetrics metrics;
    private final MembershipCleanupJob cleanupJob;
    private final MembershipRevocationTier membershipTier;
    private final Clock clock;

    private final List<GuardedTier> tokenTiers;
    private final List<GuardedTier> markerTiers;

    private final Instant startedAt;
    private final AtomicLong revocationCount = new AtomicLong();
    private final AtomicLong userRevocationCount = new AtomicLong();

    public TokenRevocationService(
            TokenRevocationConfig config,
            HotRevocationTier hotTier,
            MembershipRevocationTier membershipTier,
            RevocationTier durableTier,
            TokenClaimsExtractor claimsExtractor,
            RevocationAuditSink auditSink,
            RevocationMetrics metrics,
            MembershipCleanupJob cleanupJob,
            Clock clock) {
        this.config = config;
        this.claimsExtractor = claimsExtractor;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.cleanupJob = cleanupJob;
        this.membershipTier = membershipTier;
        this.clock = clock;
        this.startedAt = clock.instant();

        var hot = GuardedTier.untimed(hotTier, metrics);
        var tokens = new ArrayList<GuardedTier>();
        var markers = new ArrayList<GuardedTier>();
        tokens.add(hot);
        markers.add(hot);
        // Markers are per user; the membership tier only holds per-token facts.
        if (config.membershipTier().enabled()) {
            tokens.add(GuardedTier.untimed(membershipTier, metrics));
        }
        if (config.durableTier().enabled()) {
            var durable = new GuardedTier(durableTier, config.durableTier().timeout(), metrics);
            tokens.add(durable);
            markers.add(durable);
        }
        this.tokenTiers = List.copyOf(tokens);
        this.markerTiers = List.copyOf(markers);

        LOG.infof(
                "Token revocation service started (enabled: %s, tiers: %s, failurePolicy: %s)",
                config.enabled(), tokenTiers.stream().map(t -> t.name().tag()).toList(), config.failurePolicy());
    }

    // -------------------------------------------------------------------------
    // Revocation
    // -------------------------------------------------------------------------

    /**
     * Revoke a credential for a reason given by its wire value.
     *
     * @param credential the raw credential
     * @param reason     the reason wire value (e.g. {@code logout})
     * @return Uni with the per-tier outcome; fails with
     *         {@link warden.core.model.revocation.InvalidRevocationReasonException}
     *         for an unknown reason before anything is written
     */
    public Uni<RevocationResult> revoke(String credential, String reason) {
        return Uni.createFrom().deferred(() -> revoke(credential, RevocationOptions.of(RevocationReason.fromValue(reason))));
    }

    /**
     * Revoke a credential.
     *
     * <p>The identifier is the credential's {@code jti} when one can be decoded,
     * otherwise a hash of the credential itself. An audit entry is written when
     * the options carry a user ID.
     *
     * @param credential the raw credential
     * @param options    reason (default {@code logout}), TTL, user and metadata
     * @return Uni with the per-tier outcome; fails with {@link TierWriteException}
     *         if the hot tier could not be written, in which case the revocation
     *         did not take effect
     */
    public Uni<RevocationResult> revoke(String credential, RevocationOptions options) {
        if (credential == null || credential.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Credential cannot be null or blank"));
        }
        if (!config.enabled()) {
            LOG.warn("Token revocation is disabled, ignoring revoke request");
            return Uni.createFrom().item(disabledResult(null));
        }
        return Uni.createFrom()
                .item(() -> claimsExtractor.extractIdentifier(credential))
                .flatMap(identifier -> revokeRecord(identifier, options, false));
    }

    /**
     * Revoke a credential by its already known identifier, for a reason given by its wire value.
     *
     * @param identifier the credential's {@code jti}
     * @param reason     the reason wire value
     * @return Uni with the per-tier outcome
     */
    public Uni<RevocationResult> revokeByIdentifier(String identifier, String reason) {
        return Uni.createFrom()
                .deferred(() -> revokeByIdentifier(identifier, RevocationOptions.of(RevocationReason.fromValue(reason))));
    }

    /**
     * Revoke a credential by its already known identifier.
     *
     * <p>Same as {@link #revoke(String, RevocationOptions)} without decoding a credential.
     *
     * @param identifier the credential's {@code jti}
     * @param options    reason (default {@code logout}), TTL, user and metadata
     * @return Uni with the per-tier outcome
     */
    public Uni<RevocationResult> revokeByIdentifier(String identifier, RevocationOptions options) {
        if (identifier == null || identifier.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Identifier cannot be null or blank"));
        }
        if (!config.enabled()) {
            LOG.warn("Token revocation is disabled, ignoring revoke request");
            return Uni.createFrom().item(disabledResult(identifier));
        }
        return revokeRecord(identifier, options, true);
    }

    /**
     * Revoke every credential of a user, for a reason given by its wire value.
     *
     * @param userId the user whose credentials are revoked
     * @param reason the reason wire value
     * @return Uni with the per-tier outcome
     */
    public Uni<RevocationResult> revokeAllForUser(String userId, String reason) {
        return Uni.createFrom()
                .deferred(() -> revokeAllForUser(userId, RevocationOptions.of(RevocationReason.fromValue(reason))));
    }

    /**
     * Revoke every credential issued to a user before now.
     *
     * <p>Stores a user marker in the hot and durable tiers with the default
     * TTL and always writes an audit entry.
     *
     * @param userId  the user whose credentials are revoked
     * @param options reason (default {@code security_breach}) and audit metadata
     * @return Uni with the per-tier outcome
     */
    public Uni<RevocationResult> revokeAllForUser(String userId, RevocationOptions options) {
        if (userId == null || userId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("User ID cannot be null or blank"));
        }
        if (!config.enabled()) {
            LOG.warn("Token revocation is disabled, ignoring user revoke request");
            return Uni.createFrom().item(disabledResult(UserRevocationMarker.keyFor(userId)));
        }

        final var reason = options.reasonOr(RevocationReason.SECURITY_BREACH);
        final var now = clock.instant();
        final var marker = new UserRevocationMarker(userId, now, reason, config.defaultTtl());

        return write(marker, markerTiers).invoke(result -> {
            userRevocationCount.incrementAndGet();
            metrics.recordMassRevocation(reason);
            LOG.infof("Revoked all tokens for user %s (reason: %s, revokedBefore: %s)", userId, reason.value(), now);
            fireAudit(new RevocationAuditEvent(
                    RevocationAuditEvent.Type.MASS_TOKEN_REVOCATION, userId, reason, options.metadata(), now));
        });
    }

    private Uni<RevocationResult> revokeRecord(String identifier, RevocationOptions options, boolean byIdentifier) {
        final var reason = options.reasonOr(RevocationReason.LOGOUT);
        final var now = clock.instant();
        final var record =
                new RevocationRecord(identifier, reason, now, options.userId(), options.ttlOr(config.defaultTtl()));

        return write(record, tokenTiers).invoke(result -> {
            revocationCount.incrementAndGet();
            metrics.recordRevocation(reason, byIdentifier);
            LOG.infof("Revoked token %s (reason: %s)", identifier, reason.value());
            if (options.userId() != null) {
                fireAudit(new RevocationAuditEvent(
                        RevocationAuditEvent.Type.TOKEN_REVOKED, options.userId(), reason, options.metadata(), now));
            }
        });
    }

    /**
     * Write an entry to the first tier, which must succeed, then best-effort to the rest.
     */
    private Uni<RevocationResult> write(RevocationEntry entry, List<GuardedTier> tiers) {
        final var key = entry.key();
        final var ttl = entry.ttl();
        final var primary = tiers.get(0);

        Uni<List<TierOutcome>> outcomes = primary.put(key, entry, ttl)
                .onFailure()
                .transform(error -> new TierWriteException(primary.name(), key, error))
                .replaceWith(() -> {
                    List<TierOutcome> written = new ArrayList<>();
                    written.add(TierOutcome.written(primary.name()));
                    return written;
                });

        for (var tier : tiers.subList(1, tiers.size())) {
            outcomes = outcomes.flatMap(written -> writeBestEffort(tier, key, entry, ttl).map(outcome -> {
                written.add(outcome);
                return written;
            }));
        }

        return outcomes.map(written -> new RevocationResult(key, withSkippedTiers(written)));
    }

    private Uni<TierOutcome> writeBestEffort(GuardedTier tier, String key, RevocationEntry entry, Duration ttl) {
        return tier.put(key, entry, ttl)
                .replaceWith(() -> TierOutcome.written(tier.name()))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to store revocation %s in %s tier: %s", key, tier.name().tag(), error.getMessage());
                    return TierOutcome.failed(tier.name(), error);
                });
    }

    private List<TierOutcome> withSkippedTiers(List<TierOutcome> written) {
        var byTier = new EnumMap<TierName, TierOutcome>(TierName.class);
        for (var tier : TierName.values()) {
            byTier.put(tier, TierOutcome.skipped(tier, "not used for this entry"));
        }
        written.forEach(outcome -> byTier.put(outcome.tier(), outcome));
        return List.copyOf(byTier.values());
    }

    private RevocationResult disabledResult(String key) {
        var skipped = new ArrayList<TierOutcome>();
        for (var tier : TierName.values()) {
            skipped.add(TierOutcome.skipped(tier, "revocation disabled"));
        }
        return new RevocationResult(key, skipped);
    }

    private void fireAudit(RevocationAuditEvent event) {
        Uni.createFrom()
                .deferred(() -> auditSink.record(event))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Recorded %s audit entry for user %s", event.type().value(), event.userId()),
                        error -> LOG.warnf(
                                "Failed to record %s audit entry for user %s: %s",
                                event.type().value(), event.userId(), error.getMessage()));
    }

    // -------------------------------------------------------------------------
    // Checks
    // -------------------------------------------------------------------------

    /**
     * Check whether a credential is revoked, including user-level revocation.
     *
     * @param credential the raw credential
     * @return Uni with true if revoked
     */
    public Uni<Boolean> isRevoked(String credential) {
        return isRevoked(credential, true);
    }

    /**
     * Check whether a credential is revoked.
     *
     * <p>Looks up the credential's own record in every tier, fastest first.
     * If none exists and {@code checkUserMarker} is set, the credential is
     * revoked when its subject has a marker newer than its issued-at claim.
     * Credentials without both claims skip the user-level check.
     *
     * @param credential      the raw credential
     * @param checkUserMarker whether to evaluate the user's mass revocation marker
     * @return Uni with true if revoked
     */
    public Uni<Boolean> isRevoked(String credential, boolean checkUserMarker) {
        if (!config.enabled() || credential == null || credential.isBlank()) {
            return Uni.createFrom().item(false);
        }

        final var start = System.nanoTime();
        return Uni.createFrom()
                .item(() -> claimsExtractor.decode(credential))
                .flatMap(claims -> lookup(tokenTiers, claims.identifier()).flatMap(tokenLookup -> {
                    if (tokenLookup.isHit()) {
                        return Uni.createFrom().item(CheckResult.revokedBy(tokenLookup.servedBy().tag()));
                    }
                    if (!checkUserMarker || !config.checkUserRevocation() || !claims.hasSubjectAndIssuedAt()) {
                        return Uni.createFrom().item(miss(tokenLookup.unavailable()));
                    }
                    return checkMarker(claims, tokenLookup);
                }))
                .map(result -> recordCheck(result, start));
    }

    private Uni<CheckResult> checkMarker(TokenClaims claims, Lookup tokenLookup) {
        return lookup(markerTiers, UserRevocationMarker.keyFor(claims.subject())).map(markerLookup -> {
            if (markerLookup.isHit()
                    && markerLookup.entry() instanceof UserRevocationMarker marker
                    && marker.revokes(claims.issuedAt())) {
                LOG.debugf("User marker revokes token of %s (issuedAt: %s)", claims.subject(), claims.issuedAt());
                return CheckResult.revokedBy("user_marker");
            }
            return miss(tokenLookup.unavailable() || markerLookup.unavailable());
        });
    }

    /**
     * Check whether a credential identifier is revoked.
     *
     * <p>Same cascade as {@link #isRevoked(String)} without the user-level
     * check, since there is no credential to read a subject from.
     *
     * @param identifier the credential's {@code jti}
     * @return Uni with true if revoked
     */
    public Uni<Boolean> isRevokedByIdentifier(String identifier) {
        if (!config.enabled() || identifier == null || identifier.isBlank()) {
            return Uni.createFrom().item(false);
        }

        final var start = System.nanoTime();
        return lookup(tokenTiers, identifier)
                .map(lookup -> lookup.isHit()
                        ? CheckResult.revokedBy(lookup.servedBy().tag())
                        : miss(lookup.unavailable()))
                .map(result -> recordCheck(result, start));
    }

    /**
     * Returns the cutoff of a user's mass revocation.
     *
     * @param userId the user ID
     * @return Uni with the instant before which the user's credentials are revoked, or empty
     */
    public Uni<Optional<Instant>> userRevokedBefore(String userId) {
        if (!config.enabled() || userId == null || userId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }

        return lookup(markerTiers, UserRevocationMarker.keyFor(userId)).map(lookup -> {
            if (lookup.isHit() && lookup.entry() instanceof UserRevocationMarker marker) {
                return Optional.of(marker.revokedBefore());
            }
            return Optional.empty();
        });
    }

    private CheckResult miss(boolean degraded) {
        if (!degraded) {
            return CheckResult.notRevoked();
        }
        var revoked = config.failurePolicy().treatAsRevoked();
        LOG.warnf("No revocation tier could be read; answering revoked=%s (%s)", revoked, config.failurePolicy());
        return new CheckResult(revoked, "degraded");
    }

    private boolean recordCheck(CheckResult result, long startNanos) {
        metrics.recordCheck(result.revoked(), result.source(), System.nanoTime() - startNanos);
        return result.revoked();
    }

    /**
     * Look a key up in each tier in turn and promote a hit into the faster tiers.
     */
    private Uni<Lookup> lookup(List<GuardedTier> tiers, String key) {
        return lookupFrom(tiers, 0, key, false);
    }

    private Uni<Lookup> lookupFrom(List<GuardedTier> tiers, int index, String key, boolean anyTierAnswered) {
        if (index == tiers.size()) {
            return Uni.createFrom().item(anyTierAnswered ? Lookup.MISS : Lookup.UNAVAILABLE);
        }

        final var tier = tiers.get(index);
        return tier.get(key)
                .map(TierRead::answered)
                .onFailure()
                .recoverWithItem(error -> TierRead.FAILED)
                .flatMap(read -> {
                    var entry = read.entry().filter(e -> !e.isExpired(clock.instant()));
                    if (entry.isPresent()) {
                        return promote(tiers.subList(0, index), tier.name(), key, entry.get())
                                .replaceWith(Lookup.hit(entry.get(), tier.name()));
                    }
                    return lookupFrom(tiers, index + 1, key, anyTierAnswered || !read.failed());
                });
    }

    private Uni<Void> promote(List<GuardedTier> fasterTiers, TierName from, String key, RevocationEntry entry) {
        var ttl = entry.remainingTtl(clock.instant());
        Uni<Void> chain = Uni.createFrom().voidItem();
        if (ttl.isZero()) {
            return chain;
        }
        for (var tier : fasterTiers) {
            chain = chain.flatMap(ignored -> tier.put(key, entry, ttl)
                    .invoke(() -> {
                        metrics.recordPromotion(from, tier.name());
                        LOG.debugf("Promoted %s from %s to %s tier", key, from.tag(), tier.name().tag());
                    })
                    .onFailure()
                    .recoverWithItem(error -> {
                        LOG.warnf("Failed to promote %s into %s tier: %s", key, tier.name().tag(), error.getMessage());
                        return null;
                    }));
        }
        return chain;
    }

    // -------------------------------------------------------------------------
    // Maintenance
    // -------------------------------------------------------------------------

    /**
     * Remove expired membership tier entries now.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        return cleanupJob.cleanup();
    }

    /**
     * Drop every entry from the in-process tiers.
     *
     * <p>The durable tier is left alone, so revocations survive and are
     * promoted back on the next check. A tier that fails to clear is logged
     * and counted as zero; the remaining tiers are still cleared.
     *
     * @return Uni with the number of entries dropped
     */
    public Uni<Long> invalidateLocalTiers() {
        var local = tokenTiers.stream().filter(t -> t.name() != TierName.DURABLE).toList();
        Uni<Long> total = Uni.createFrom().item(0L);
        for (var tier : local) {
            total = total.flatMap(sum -> tier.deleteMatching("*")
                    .onFailure()
                    .recoverWithItem(error -> {
                        LOG.warnf("Failed to invalidate %s tier: %s", tier.name().tag(), error.getMessage());
                        return 0L;
                    })
                    .map(removed -> sum + removed));
        }
        return total.invoke(removed -> LOG.infof("Invalidated %d local revocation entries", removed));
    }

    /**
     * Returns service statistics.
     *
     * @return current statistics
     */
    public RevocationStats stats() {
        return new RevocationStats(
                revocationCount.get(),
                userRevocationCount.get(),
                startedAt,
                Duration.between(startedAt, clock.instant()).toSeconds(),
                membershipTier.size(),
                cleanupJob.lastCleanup());
    }

    /**
     * Check if revocation is enabled.
     *
     * @return true if token revocation is enabled
     */
    public boolean isEnabled() {
        return config.enabled();
    }

    private record TierRead(Optional<RevocationEntry> entry, boolean failed) {

        static final TierRead FAILED = new TierRead(Optional.empty(), true);

        static TierRead answered(Optional<RevocationEntry> entry) {
            return new TierRead(entry, false);
        }
    }

    private record Lookup(RevocationEntry entry, TierName servedBy, boolean unavailable) {

        static final Lookup MISS = new Lookup(null, null, false);
        static final Lookup UNAVAILABLE = new Lookup(null, null, true);

        static Lookup hit(RevocationEntry entry, TierName servedBy) {
            return new Lookup(entry, servedBy, false);
        }

        boolean isHit() {
            return entry != null;
        }
    }

    private record CheckResult(boolean revoked, String source) {

        static CheckResult revokedBy(String source) {
            return new CheckResult(true, source);
        }

        static CheckResult notRevoked() {
            return new CheckResult(false, "none");
        }
    }
}
