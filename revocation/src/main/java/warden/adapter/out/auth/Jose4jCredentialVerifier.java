package warden.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import warden.core.config.TokenRevocationConfig;
import warden.core.model.revocation.ClaimsSource;
import warden.core.model.revocation.TokenClaims;
import warden.core.port.out.CredentialVerifier;
import warden.core.service.revocation.JwtClaimsReader;

/**
 * Verifies HMAC-signed JWTs with jose4j.
 *
 * <p>Active only when {@code warden.revocation.verification.hmac-secret} is
 * set; without a secret every credential is reported unverifiable and the
 * claims extractor falls back to its unverified decode. Deployments with a
 * real authentication subsystem replace this bean with their own
 * {@link CredentialVerifier}.
 */
@ApplicationScoped
@DefaultBean
public class Jose4jCredentialVerifier implements CredentialVerifier {

    private static final Logger LOG = Logger.getLogger(Jose4jCredentialVerifier.class);
    private static final int CLOCK_SKEW_SECONDS = 30;

    private final JwtConsumer consumer;

    @Inject
    public Jose4jCredentialVerifier(TokenRevocationConfig config) {
        this(config.verification().hmacSecret());
    }

    Jose4jCredentialVerifier(Optional<String> hmacSecret) {
        this.consumer = hmacSecret.filter(s -> !s.isBlank()).map(Jose4jCredentialVerifier::buildConsumer).orElse(null);
        if (consumer == null) {
            LOG.info("No verification secret configured, credentials will not be verified");
        }
    }

    private static JwtConsumer buildConsumer(String secret) {
        return new JwtConsumerBuilder()
                .setAllowedClockSkewInSeconds(CLOCK_SKEW_SECONDS)
                .setSkipDefaultAudienceValidation()
                .setVerificationKey(new HmacKey(secret.getBytes(StandardCharsets.UTF_8)))
                .setRelaxVerificationKeyValidation()
                .setJwsAlgorithmConstraints(new AlgorithmConstraints(
                        ConstraintType.PERMIT,
                        AlgorithmIdentifiers.HMAC_SHA256,
                        AlgorithmIdentifiers.HMAC_SHA384,
                        AlgorithmIdentifiers.HMAC_SHA512))
                .build();
    }

    @Override
    public Optional<TokenClaims> verify(String credential) {
        if (consumer == null || credential == null || credential.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JwtClaimsReader.read(consumer.processToClaims(credential), ClaimsSource.VERIFIED));
        } catch (InvalidJwtException e) {
            LOG.debugf("Credential failed verification: %s", e.getMessage());
            return Optional.empty();
        }
    }
}
