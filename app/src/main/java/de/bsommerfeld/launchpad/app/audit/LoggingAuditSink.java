package de.bsommerfeld.launchpad.app.audit;

import de.bsommerfeld.launchpad.core.spi.AuditEntry;
import de.bsommerfeld.launchpad.core.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit entries to the {@code AUDIT} logger. The logback setup
 * routes that logger to its own {@code audit.log}.
 */
public class LoggingAuditSink implements AuditSink {

    static final String LOGGER_NAME = "AUDIT";

    private final Logger audit;

    public LoggingAuditSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    LoggingAuditSink(Logger audit) {
        this.audit = audit;
    }

    @Override
    public void record(AuditEntry entry) {
        String line = format(entry);
        if (entry.success()) {
            audit.info(line);
        } else {
            audit.warn(line);
        }
    }

    static String format(AuditEntry entry) {
        StringBuilder sb = new StringBuilder()
                .append(entry.timestamp())
                .append(" principal=").append(entry.principal())
                .append(" action=").append(entry.action())
                .append(" app=").append(entry.descriptorId())
                .append(" name=\"").append(entry.applicationName()).append('"')
                .append(" result=").append(entry.success() ? "OK" : "FAILED");
        if (!entry.details().isEmpty()) {
            sb.append(" details=\"").append(entry.details()).append('"');
        }
        return sb.toString();
    }
}
