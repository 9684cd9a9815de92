package warden.adapter.out.audit;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.revocation.RevocationAuditEvent;
import warden.core.port.out.RevocationAuditSink;

/**
 * Writes revocation audit entries to the {@code warden.audit} log category.
 *
 * <p>Entries are single-line key=value records so log shippers can index them.
 * Route the category to a dedicated handler to keep an audit trail apart from
 * application logs.
 */
@ApplicationScoped
@DefaultBean
public class LoggingRevocationAuditSink implements RevocationAuditSink {

    static final String CATEGORY = "warden.audit";

    private static final Logger AUDIT = Logger.getLogger(CATEGORY);

    @Override
    public Uni<Void> record(RevocationAuditEvent event) {
        return Uni.createFrom().item(() -> {
            AUDIT.infof(
                    "event=%s userId=%s reason=%s timestamp=%s metadata=%s",
                    event.type().value(),
                    event.userId(),
                    event.reason().value(),
                    event.timestamp(),
                    event.metadata());
            return null;
        });
    }
}
