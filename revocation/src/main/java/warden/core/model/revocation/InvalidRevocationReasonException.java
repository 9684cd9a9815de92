package warden.core.model.revocation;

/**
 * Thrown when a revocation is requested with a reason outside {@link RevocationReason}.
 *
 * <p>Raised before any tier is written.
 */
public class InvalidRevocationReasonException extends IllegalArgumentException {

    private final String rejectedValue;

    public InvalidRevocationReasonException(String rejectedValue) {
        super("Invalid revocation reason: " + rejectedValue + ". Must be one of: "
                + RevocationReason.acceptedValues());
        this.rejectedValue = rejectedValue;
    }

    /** Returns the reason value that was rejected. */
    public String getRejectedValue() {
        return rejectedValue;
    }
}
