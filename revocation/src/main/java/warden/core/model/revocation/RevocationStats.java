package warden.core.model.revocation;

import java.time.Instant;

/**
 * Point-in-time statistics of the revocation service.
 *
 * @param revocationCount     successful single-token revocations since start
 * @param userRevocationCount successful mass revocations since start
 * @param startedAt           when the service started
 * @param uptimeSeconds       seconds since start
 * @param membershipTierSize  entries currently held by the membership tier, expired ones included
 * @param lastCleanup         when the membership tier was last swept
 */
public record RevocationStats(
        long revocationCount,
        long userRevocationCount,
        Instant startedAt,
        long uptimeSeconds,
        long membershipTierSize,
        Instant lastCleanup) {}
