package warden.core.model.revocation;

import java.time.Instant;

/**
 * Claims recovered from a credential for revocation bookkeeping.
 *
 * <p>Claims from an {@link ClaimsSource#UNVERIFIED} decode are not trustworthy
 * and must never feed an authorization decision.
 *
 * @param identifier the {@code jti} claim (may be null)
 * @param subject    the {@code sub} claim (may be null)
 * @param issuedAt   the {@code iat} claim (may be null)
 * @param expiresAt  the {@code exp} claim (may be null)
 * @param source     how the claims were obtained
 */
public record TokenClaims(String identifier, String subject, Instant issuedAt, Instant expiresAt, ClaimsSource source) {

    /**
     * Check whether the claims carry a usable {@code jti}.
     *
     * @return true if the identifier is present and not blank
     */
    public boolean hasIdentifier() {
        return identifier != null && !identifier.isBlank();
    }

    /**
     * Check whether user-level revocation can be evaluated for these claims.
     *
     * @return true if both subject and issued-at are present
     */
    public boolean hasSubjectAndIssuedAt() {
        return subject != null && !subject.isBlank() && issuedAt != null;
    }
}
