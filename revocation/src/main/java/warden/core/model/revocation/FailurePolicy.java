package warden.core.model.revocation;

/**
 * Answer given by a revocation check when no storage tier could be read.
 */
public enum FailurePolicy {
    /** Report the credential as not revoked. Availability over safety. */
    FAIL_OPEN,
    /** Report the credential as revoked. Safety over availability. */
    FAIL_CLOSED;

    /**
     * Returns the check result to use when storage is unreachable.
     *
     * @return true if the credential must be treated as revoked
     */
    public boolean treatAsRevoked() {
        return this == FAIL_CLOSED;
    }
}
