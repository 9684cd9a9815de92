package warden.core.model.revocation;

/**
 * A revocation could not be stored in the hot tier and did not take effect.
 *
 * <p>Callers must treat the logout or revocation as failed and retry or escalate.
 */
public class TierWriteException extends RuntimeException {

    private final TierName tier;
    private final String key;

    public TierWriteException(TierName tier, String key, Throwable cause) {
        super("Failed to write revocation to " + tier.tag() + " tier: " + key, cause);
        this.tier = tier;
        this.key = key;
    }

    /** Returns the tier that rejected the write. */
    public TierName getTier() {
        return tier;
    }

    /** Returns the key that could not be written. */
    public String getKey() {
        return key;
    }
}
