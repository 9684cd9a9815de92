package warden.core.model.revocation;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a successful revocation.
 *
 * <p>A revocation succeeds once the hot tier holds the fact. The slower tiers
 * are written best-effort; their individual outcomes are listed here so
 * callers can tell a fully replicated revocation from a degraded one.
 *
 * @param key      the tier key the fact was stored under
 * @param outcomes one outcome per tier, fastest first
 */
public record RevocationResult(String key, List<TierOutcome> outcomes) {

    public RevocationResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Returns the outcome for a tier.
     *
     * @param tier the tier
     * @return the outcome, if the tier was part of the write
     */
    public Optional<TierOutcome> outcomeFor(TierName tier) {
        return outcomes.stream().filter(o -> o.tier() == tier).findFirst();
    }

    /**
     * Check whether no tier reported a failure.
     *
     * @return true if every attempted tier was written
     */
    public boolean fullyReplicated() {
        return outcomes.stream().noneMatch(o -> o.status() == TierOutcome.Status.FAILED);
    }
}
