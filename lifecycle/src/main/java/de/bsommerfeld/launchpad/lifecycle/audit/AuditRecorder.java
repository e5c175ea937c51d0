package de.bsommerfeld.launchpad.lifecycle.audit;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.spi.AuditAction;
import de.bsommerfeld.launchpad.core.spi.AuditEntry;
import de.bsommerfeld.launchpad.core.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Builds audit entries and hands them to the {@link AuditSink}. A failing
 * sink is logged and otherwise ignored; auditing never changes the outcome
 * of the action being audited.
 */
@Singleton
public class AuditRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditSink sink;

    @Inject
    public AuditRecorder(AuditSink sink) {
        this.sink = sink;
    }

    public void record(String principal, AuditAction action, ApplicationDescriptor descriptor, boolean success,
            String details) {
        AuditEntry entry = new AuditEntry(Instant.now(), principal, action, descriptor.id(), descriptor.name(),
                success, details);
        try {
            sink.record(entry);
        } catch (RuntimeException e) {
            LOG.warn("Audit sink rejected {} for {}", action, descriptor.id(), e);
        }
    }

    public void record(InstanceSnapshot instance, AuditAction action, boolean success, String details) {
        record(instance.principal(), action, instance.descriptor(), success,
                "instance=" + instance.instanceId() + (details == null || details.isEmpty() ? "" : ", " + details));
    }
}
