package warden.core.model.revocation;

/**
 * Storage tiers, fastest first.
 */
public enum TierName {
    HOT,
    MEMBERSHIP,
    DURABLE;

    /**
     * Returns the lowercase name used in logs and metric tags.
     *
     * @return tag value
     */
    public String tag() {
        return name().toLowerCase();
    }
}
