package warden.core.service.revocation;

import java.time.Instant;

import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;

import warden.core.model.revocation.ClaimsSource;
import warden.core.model.revocation.TokenClaims;

/**
 * Maps jose4j claims onto {@link TokenClaims}.
 *
 * <p>A malformed individual claim (wrong JSON type) is read as absent.
 */
public final class JwtClaimsReader {

    private JwtClaimsReader() {}

    /**
     * Read the revocation-relevant claims.
     *
     * @param claims the decoded JWT claims
     * @param source how the claims were decoded
     * @return the mapped claims
     */
    public static TokenClaims read(JwtClaims claims, ClaimsSource source) {
        return new TokenClaims(jwtId(claims), subject(claims), issuedAt(claims), expiresAt(claims), source);
    }

    private static String jwtId(JwtClaims claims) {
        try {
            return claims.getJwtId();
        } catch (MalformedClaimException e) {
            return null;
        }
    }

    private static String subject(JwtClaims claims) {
        try {
            return claims.getSubject();
        } catch (MalformedClaimException e) {
            return null;
        }
    }

    private static Instant issuedAt(JwtClaims claims) {
        try {
            return toInstant(claims.getIssuedAt());
        } catch (MalformedClaimException e) {
            return null;
        }
    }

    private static Instant expiresAt(JwtClaims claims) {
        try {
            return toInstant(claims.getExpirationTime());
        } catch (MalformedClaimException e) {
            return null;
        }
    }

    private static Instant toInstant(NumericDate date) {
        return date != null ? Instant.ofEpochSecond(date.getValue()) : null;
    }
}
