package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.revocation.RevocationAuditEvent;

/**
 * Port for recording revocation audit entries.
 *
 * <p>The revocation service fires entries without waiting for them and
 * discards failures after logging them; a sink can never make a revocation fail.
 */
public interface RevocationAuditSink {

    /**
     * Record an audit entry.
     *
     * @param event the audit entry
     * @return Uni completing when the entry is recorded
     */
    Uni<Void> record(RevocationAuditEvent event);
}
