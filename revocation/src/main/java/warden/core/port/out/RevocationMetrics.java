package warden.core.port.out;

import warden.core.model.revocation.RevocationReason;
import warden.core.model.revocation.TierName;

/**
 * Port interface for recording revocation metrics.
 *
 * <p>Purely observational; implementations must never throw.
 */
public interface RevocationMetrics {

    /**
     * Record a single-token revocation.
     *
     * @param reason       why the token was revoked
     * @param byIdentifier true if revoked by a known identifier rather than a credential
     */
    void recordRevocation(RevocationReason reason, boolean byIdentifier);

    /**
     * Record a mass revocation of a user's credentials.
     *
     * @param reason why the user's credentials were revoked
     */
    void recordMassRevocation(RevocationReason reason);

    /**
     * Record the outcome of a revocation check.
     *
     * @param revoked       the check result
     * @param source        what decided the result ({@code hot}, {@code membership},
     *                      {@code durable}, {@code user_marker}, {@code none} or {@code degraded})
     * @param durationNanos check latency in nanoseconds
     */
    void recordCheck(boolean revoked, String source, long durationNanos);

    /**
     * Record a fact promoted from a slower tier into a faster one.
     *
     * @param from the tier the fact was found in
     * @param to   the tier the fact was copied into
     */
    void recordPromotion(TierName from, TierName to);

    /**
     * Record a failed or timed-out tier operation.
     *
     * @param tier      the tier
     * @param operation the operation name
     * @param timeout   true if the operation timed out
     */
    void recordTierFailure(TierName tier, String operation, boolean timeout);

    /**
     * Record a membership tier sweep.
     *
     * @param removed number of expired entries removed
     */
    void recordCleanup(int removed);
}
