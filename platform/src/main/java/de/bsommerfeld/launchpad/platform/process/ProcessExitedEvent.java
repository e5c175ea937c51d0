package de.bsommerfeld.launchpad.platform.process;

import java.time.Instant;

/**
 * @param processId id of the process that went away
 * @param exitedAt  time the exit was observed, not the exact exit time
 */
public record ProcessExitedEvent(long processId, Instant exitedAt) {
}
