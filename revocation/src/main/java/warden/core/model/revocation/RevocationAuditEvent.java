package warden.core.model.revocation;

import java.time.Instant;
import java.util.Map;

/**
 * Structured audit entry for a revocation.
 *
 * @param type      the kind of revocation
 * @param userId    the affected user
 * @param reason    why the revocation happened
 * @param metadata  caller-supplied metadata (never null)
 * @param timestamp when the revocation was recorded
 */
public record RevocationAuditEvent(
        Type type, String userId, RevocationReason reason, Map<String, Object> metadata, Instant timestamp) {

    public RevocationAuditEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Audit event types.
     */
    public enum Type {
        TOKEN_REVOKED("token_revoked"),
        MASS_TOKEN_REVOCATION("mass_token_revocation");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }
}
