package warden.adapter.out.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.revocation.ClaimsSource;
import warden.testing.TestTokens;

@DisplayName("Jose4jCredentialVerifier")
class Jose4jCredentialVerifierTest {

    private static String validToken(String jti) {
        var now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        return TestTokens.builder()
                .jti(jti)
                .subject("alice")
                .issuedAt(now)
                .expiresAt(now.plus(Duration.ofMinutes(15)))
                .sign();
    }

    @Nested
    @DisplayName("with a secret")
    class WithSecretTests {

        private final Jose4jCredentialVerifier verifier = new Jose4jCredentialVerifier(Optional.of(TestTokens.SECRET));

        @Test
        @DisplayName("should return verified claims for a correctly signed token")
        void shouldVerifyValidToken() {
            var claims = verifier.verify(validToken("jti-1")).orElseThrow();

            assertEquals("jti-1", claims.identifier());
            assertEquals("alice", claims.subject());
            assertEquals(ClaimsSource.VERIFIED, claims.source());
        }

        @Test
        @DisplayName("should reject a token signed with another key")
        void shouldRejectWrongKey() {
            var token = TestTokens.builder()
                    .jti("jti-1")
                    .secret("a-completely-different-secret-of-decent-size")
                    .sign();

            assertTrue(verifier.verify(token).isEmpty());
        }

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpired() {
            var past = Instant.now().minus(Duration.ofHours(2));
            var token = TestTokens.builder()
                    .jti("jti-1")
                    .issuedAt(past)
                    .expiresAt(past.plus(Duration.ofMinutes(15)))
                    .sign();

            assertTrue(verifier.verify(token).isEmpty());
        }

        @Test
        @DisplayName("should reject garbage")
        void shouldRejectGarbage() {
            assertTrue(verifier.verify("not.a.jwt").isEmpty());
            assertTrue(verifier.verify("").isEmpty());
        }
    }

    @Test
    @DisplayName("should verify nothing without a secret")
    void shouldVerifyNothingWithoutSecret() {
        var verifier = new Jose4jCredentialVerifier(Optional.empty());

        assertTrue(verifier.verify(validToken("jti-1")).isEmpty());
    }
}
