package warden.core.service.revocation;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.revocation.RevocationEntry;
import warden.core.model.revocation.TierName;
import warden.core.model.revocation.TierTimeoutException;
import warden.core.port.out.RevocationMetrics;
import warden.core.port.out.RevocationTier;

/**
 * Applies failure accounting, and for remote tiers a timeout, to every tier operation.
 *
 * <p>In-process tiers complete on the calling thread, so they are guarded
 * without a timer. A wall-clock deadline there only races work that has
 * already finished. For remote tiers a timeout fails the operation with {@link TierTimeoutException}; any other
 * failure, including an exception thrown synchronously by the tier, is
 * propagated unchanged. Both are logged and counted under
 * {@code warden.revocation.tier.failures}. Callers decide whether a failure
 * falls through to the next tier or aborts the operation.
 */
class GuardedTier {

    private static final Logger LOG = Logger.getLogger(GuardedTier.class);

    private final RevocationTier tier;
    private final Duration timeout;
    private final RevocationMetrics metrics;

    GuardedTier(RevocationTier tier, Duration timeout, RevocationMetrics metrics) {
        this.tier = tier;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * Guards a tier that completes synchronously; no timeout is applied.
     */
    static GuardedTier untimed(RevocationTier tier, RevocationMetrics metrics) {
        return new GuardedTier(tier, null, metrics);
    }

    TierName name() {
        return tier.tierName();
    }

    Uni<Optional<RevocationEntry>> get(String key) {
        return guard(() -> tier.get(key), "get");
    }

    Uni<Void> put(String key, RevocationEntry entry, Duration ttl) {
        return guard(() -> tier.put(key, entry, ttl), "put");
    }

    Uni<Long> deleteMatching(String pattern) {
        return guard(() -> tier.deleteMatching(pattern), "deleteMatching");
    }

    private <T> Uni<T> guard(Supplier<Uni<? extends T>> operation, String operationName) {
        Uni<T> call = Uni.createFrom().deferred(operation);
        if (timeout != null) {
            call = call.ifNoItem().after(timeout).failWith(() -> {
                LOG.warnv("Tier operation timeout: {0} in {1} tier after {2}", operationName, name().tag(), timeout);
                metrics.recordTierFailure(name(), operationName, true);
                return new TierTimeoutException(name(), operationName, timeout);
            });
        }
        return call.onFailure(error -> !(error instanceof TierTimeoutException))
                .invoke(error -> {
                    LOG.warnv("Tier operation failure: {0} in {1} tier: {2}", operationName, name().tag(), error.getMessage());
                    metrics.recordTierFailure(name(), operationName, false);
                });
    }
}
