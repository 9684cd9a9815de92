package warden.core.service.revocation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.jose4j.base64url.Base64Url;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.revocation.ClaimsSource;
import warden.core.model.revocation.TokenClaims;
import warden.core.port.out.CredentialVerifier;
import warden.testing.TestTokens;

@DisplayName("TokenClaimsExtractor")
class TokenClaimsExtractorTest {

    private static final Instant ISSUED_AT = Instant.parse("2026-03-01T12:00:00Z");

    private static final CredentialVerifier NEVER_VERIFIES = credential -> Optional.empty();

    private final TokenClaimsExtractor extractor = new TokenClaimsExtractor(NEVER_VERIFIES);

    @Nested
    @DisplayName("extractIdentifier()")
    class ExtractIdentifierTests {

        @Test
        @DisplayName("should return the verified jti when the verifier accepts the credential")
        void shouldPreferVerifiedClaims() {
            CredentialVerifier verifier = credential ->
                    Optional.of(new TokenClaims("verified-jti", "alice", ISSUED_AT, null, ClaimsSource.VERIFIED));
            var verifying = new TokenClaimsExtractor(verifier);
            var token = TestTokens.builder().jti("payload-jti").sign();

            assertEquals("verified-jti", verifying.extractIdentifier(token));
        }

        @Test
        @DisplayName("should decode jti without verification when the verifier rejects the credential")
        void shouldFallBackToUnverifiedDecode() {
            var token = TestTokens.builder()
                    .jti("jti-123")
                    .secret("some-other-secret-we-do-not-know-about")
                    .sign();

            assertEquals("jti-123", extractor.extractIdentifier(token));
        }

        @Test
        @DisplayName("should decode jti of an expired token")
        void shouldDecodeExpiredToken() {
            var token = TestTokens.builder()
                    .jti("expired-jti")
                    .issuedAt(ISSUED_AT.minus(Duration.ofDays(2)))
                    .expiresAt(ISSUED_AT.minus(Duration.ofDays(1)))
                    .sign();

            assertEquals("expired-jti", extractor.extractIdentifier(token));
        }

        @Test
        @DisplayName("should decode the payload segment even when header and signature are garbage")
        void shouldDecodePayloadSegmentOnly() {
            var payload = Base64Url.encodeUtf8ByteRepresentation(
                    "{\"jti\":\"J1\",\"sub\":\"alice\",\"iat\":1772366400}");
            var credential = "xxx." + payload + ".yyy";

            var claims = extractor.decode(credential);

            assertEquals("J1", claims.identifier());
            assertEquals("alice", claims.subject());
            assertEquals(ISSUED_AT, claims.issuedAt());
            assertEquals(ClaimsSource.UNVERIFIED, claims.source());
        }

        @Test
        @DisplayName("should hash a credential whose payload segment is not JSON")
        void shouldHashUndecodablePayload() {
            var credential = "xxx." + Base64Url.encodeUtf8ByteRepresentation("not json") + ".yyy";

            assertEquals(extractor.contentHash(credential), extractor.extractIdentifier(credential));
        }

        @Test
        @DisplayName("should hash a credential with the wrong number of segments")
        void shouldHashWrongSegmentCount() {
            var payload = Base64Url.encodeUtf8ByteRepresentation("{\"jti\":\"J1\"}");
            var credential = "xxx." + payload;

            assertEquals(extractor.contentHash(credential), extractor.extractIdentifier(credential));
        }

        @Test
        @DisplayName("should hash an opaque credential to 32 lowercase hex characters")
        void shouldHashOpaqueCredential() {
            var id = extractor.extractIdentifier("not-a-jwt-at-all");

            assertEquals(32, id.length());
            assertTrue(id.matches("[0-9a-f]{32}"));
            assertEquals(id, extractor.extractIdentifier("not-a-jwt-at-all"));
            assertNotEquals(id, extractor.extractIdentifier("not-a-jwt-at-all-2"));
        }

        @Test
        @DisplayName("should hash a JWT that carries no jti")
        void shouldHashJwtWithoutJti() {
            var token = TestTokens.builder().subject("alice").issuedAt(ISSUED_AT).sign();

            assertEquals(extractor.contentHash(token), extractor.extractIdentifier(token));
        }

        @Test
        @DisplayName("should fall back when the verifier throws")
        void shouldSurviveThrowingVerifier() {
            CredentialVerifier broken = credential -> {
                throw new IllegalStateException("verifier down");
            };
            var token = TestTokens.builder().jti("jti-9").sign();

            assertEquals("jti-9", new TokenClaimsExtractor(broken).extractIdentifier(token));
        }

        @Test
        @DisplayName("should match the known SHA-256 prefix")
        void shouldMatchKnownDigest() {
            // sha256("abc") = ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad
            assertEquals("ba7816bf8f01cfea414140de5dae2223", extractor.contentHash("abc"));
        }
    }

    @Nested
    @DisplayName("extractClaims()")
    class ExtractClaimsTests {

        @Test
        @DisplayName("should return subject and issued-at")
        void shouldReturnSubjectAndIssuedAt() {
            var token = TestTokens.builder().jti("j").subject("alice").issuedAt(ISSUED_AT).sign();

            var claims = extractor.extractClaims(token).orElseThrow();

            assertEquals("alice", claims.subject());
            assertEquals(ISSUED_AT, claims.issuedAt());
            assertEquals(ClaimsSource.UNVERIFIED, claims.source());
        }

        @Test
        @DisplayName("should be empty when issued-at is missing")
        void shouldBeEmptyWithoutIssuedAt() {
            var token = TestTokens.builder().jti("j").subject("alice").sign();

            assertTrue(extractor.extractClaims(token).isEmpty());
        }

        @Test
        @DisplayName("should be empty for opaque credentials")
        void shouldBeEmptyForOpaque() {
            assertTrue(extractor.extractClaims("opaque").isEmpty());
        }
    }

    @Test
    @DisplayName("decode() should report the content hash source for opaque credentials")
    void decodeShouldReportContentHash() {
        var claims = extractor.decode("opaque");

        assertEquals(ClaimsSource.CONTENT_HASH, claims.source());
        assertNull(claims.subject());
    }
}
