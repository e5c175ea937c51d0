package de.bsommerfeld.launchpad.core.spi;

import java.time.Instant;

/**
 * One line of the audit trail.
 *
 * @param timestamp     when the action happened
 * @param principal     user on whose behalf the action ran
 * @param action        what was attempted
 * @param descriptorId  catalog id of the application involved
 * @param applicationName display name of the application involved
 * @param success       whether the action succeeded
 * @param details       free text, may be empty
 */
public record AuditEntry(
        Instant timestamp,
        String principal,
        AuditAction action,
        String descriptorId,
        String applicationName,
        boolean success,
        String details) {

    public AuditEntry {
        timestamp = timestamp == null ? Instant.now() : timestamp;
        details = details == null ? "" : details;
    }
}
