package de.bsommerfeld.launchpad.core.spi;

/**
 * Destination for audit entries. Recording is fire-and-forget: callers log
 * and drop any exception an implementation throws.
 */
public interface AuditSink {

    void record(AuditEntry entry);
}
