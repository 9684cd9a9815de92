package warden.core.model.revocation;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Closed set of reasons a credential can be revoked for.
 *
 * <p>Each reason has a stable wire value used in audit entries, metric tags
 * and durable-tier payloads.
 */
public enum RevocationReason {
    LOGOUT("logout"),
    PASSWORD_CHANGE("password_change"),
    SECURITY_BREACH("security_breach"),
    ADMIN_ACTION("admin_action"),
    SESSION_REVOKED("session_revoked"),
    ACCOUNT_DELETED("account_deleted"),
    TOKEN_REFRESH("token_refresh");

    private final String value;

    RevocationReason(String value) {
        this.value = value;
    }

    /**
     * Returns the wire value of this reason.
     *
     * @return lowercase wire value (e.g. {@code password_change})
     */
    public String value() {
        return value;
    }

    /**
     * Parse a reason from its wire value.
     *
     * @param value the wire value
     * @return the matching reason
     * @throws InvalidRevocationReasonException if the value is not one of the known reasons
     */
    public static RevocationReason fromValue(String value) {
        if (value != null) {
            for (var reason : values()) {
                if (reason.value.equals(value)) {
                    return reason;
                }
            }
        }
        throw new InvalidRevocationReasonException(value);
    }

    /**
     * Returns all wire values, comma separated.
     *
     * @return the accepted wire values
     */
    public static String acceptedValues() {
        return Arrays.stream(values()).map(RevocationReason::value).collect(Collectors.joining(", "));
    }
}
