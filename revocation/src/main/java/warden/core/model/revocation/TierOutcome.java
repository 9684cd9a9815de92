package warden.core.model.revocation;

/**
 * Result of writing a revocation fact to one tier.
 *
 * @param tier   the tier written
 * @param status what happened
 * @param detail failure message, or null
 */
public record TierOutcome(TierName tier, Status status, String detail) {

    /**
     * Per-tier write status.
     */
    public enum Status {
        WRITTEN,
        FAILED,
        SKIPPED
    }

    public static TierOutcome written(TierName tier) {
        return new TierOutcome(tier, Status.WRITTEN, null);
    }

    public static TierOutcome failed(TierName tier, Throwable error) {
        return new TierOutcome(tier, Status.FAILED, error.getMessage());
    }

    public static TierOutcome skipped(TierName tier, String why) {
        return new TierOutcome(tier, Status.SKIPPED, why);
    }

    public boolean isWritten() {
        return status == Status.WRITTEN;
    }
}
