package warden.core.service.revocation;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import com.google.common.base.Splitter;
import com.google.common.hash.Hashing;
import org.jboss.logging.Logger;
import org.jose4j.base64url.Base64Url;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.consumer.InvalidJwtException;

import warden.core.model.revocation.ClaimsSource;
import warden.core.model.revocation.TokenClaims;
import warden.core.port.out.CredentialVerifier;

/**
 * Recovers a storage identifier and user claims from a credential.
 *
 * <p>Three strategies are tried in order of decreasing trust:
 * <ol>
 *   <li>Verified decode through the {@link CredentialVerifier}</li>
 *   <li>Unverified decode of the JWT payload, so expired or otherwise
 *       unverifiable tokens can still be revoked by {@code jti}</li>
 *   <li>A SHA-256 content hash of the raw credential, so any opaque string
 *       stays revocable by value</li>
 * </ol>
 *
 * <p><strong>Not a security boundary.</strong> Claims from the unverified decode
 * are attacker-controlled. They are used only to find revocation records and
 * user markers, which can only ever turn a check into "revoked". They must
 * never be used to authenticate or authorize anything.
 */
@ApplicationScoped
public class TokenClaimsExtractor {

    private static final Logger LOG = Logger.getLogger(TokenClaimsExtractor.class);
    private static final int HASH_HEX_LENGTH = 32;
    private static final int JWS_SEGMENTS = 3;
    private static final Splitter SEGMENT_SPLITTER = Splitter.on('.');

    private final CredentialVerifier verifier;

    public TokenClaimsExtractor(CredentialVerifier verifier) {
        this.verifier = verifier;
    }

    /**
     * Returns the storage identifier of a credential.
     *
     * @param credential the raw credential
     * @return the {@code jti} claim if recoverable, otherwise the content hash
     */
    public String extractIdentifier(String credential) {
        return decode(credential).identifier();
    }

    /**
     * Returns the subject and issued-at claims needed for user-level checks.
     *
     * @param credential the raw credential
     * @return claims carrying both subject and issued-at, or empty
     */
    public Optional<TokenClaims> extractClaims(String credential) {
        return Optional.of(decode(credential)).filter(TokenClaims::hasSubjectAndIssuedAt);
    }

    /**
     * Decode a credential with the three-step fallback.
     *
     * <p>Never fails. The returned identifier is always present: the
     * {@code jti} when one was decoded, the content hash otherwise.
     *
     * @param credential the raw credential
     * @return decoded claims
     */
    public TokenClaims decode(String credential) {
        var claims = verify(credential).or(() -> decodeUnverified(credential));
        if (claims.isEmpty()) {
            return new TokenClaims(contentHash(credential), null, null, null, ClaimsSource.CONTENT_HASH);
        }

        var decoded = claims.get();
        if (decoded.hasIdentifier()) {
            return decoded;
        }
        return new TokenClaims(
                contentHash(credential), decoded.subject(), decoded.issuedAt(), decoded.expiresAt(), decoded.source());
    }

    /**
     * Returns the content hash used as identifier for undecodable credentials.
     *
     * @param credential the raw credential
     * @return the first 32 lowercase hex characters of its SHA-256 digest
     */
    public String contentHash(String credential) {
        return Hashing.sha256()
                .hashString(credential != null ? credential : "", StandardCharsets.UTF_8)
                .toString()
                .substring(0, HASH_HEX_LENGTH);
    }

    private Optional<TokenClaims> verify(String credential) {
        try {
            return verifier.verify(credential);
        } catch (RuntimeException e) {
            LOG.debugf("Verified decode failed: %s", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Decodes only the payload segment of a three-segment credential. The
     * header and signature segments are never inspected.
     */
    private Optional<TokenClaims> decodeUnverified(String credential) {
        if (credential == null) {
            return Optional.empty();
        }
        var segments = SEGMENT_SPLITTER.splitToList(credential);
        if (segments.size() != JWS_SEGMENTS) {
            LOG.debugf("Credential has %d segments, falling back to content hash", segments.size());
            return Optional.empty();
        }
        try {
            var claims = JwtClaims.parse(Base64Url.decodeToUtf8String(segments.get(1)));
            return Optional.of(JwtClaimsReader.read(claims, ClaimsSource.UNVERIFIED));
        } catch (InvalidJwtException | RuntimeException e) {
            LOG.debugf("Credential is not a decodable JWT, falling back to content hash: %s", e.getMessage());
            return Optional.empty();
        }
    }
}
