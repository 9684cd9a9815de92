package warden.core.model.revocation;

import java.time.Duration;

/**
 * A tier operation did not complete within its timeout.
 */
public class TierTimeoutException extends RuntimeException {

    private final TierName tier;
    private final String operation;

    public TierTimeoutException(TierName tier, String operation, Duration timeout) {
        super("Tier operation timeout: " + operation + " in " + tier.tag() + " tier after " + timeout);
        this.tier = tier;
        this.operation = operation;
    }

    /** Returns the tier that timed out. */
    public TierName getTier() {
        return tier;
    }

    /** Returns the name of the operation that timed out. */
    public String getOperation() {
        return operation;
    }
}
