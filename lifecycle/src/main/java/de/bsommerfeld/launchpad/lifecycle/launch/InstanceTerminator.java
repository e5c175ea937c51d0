package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;

import java.time.Duration;

/**
 * Capability of launchers that need their own way of closing an instance.
 * Both methods return {@code true} once the instance is gone.
 */
public interface InstanceTerminator {

    /** Polite close. Must not escalate to a kill. */
    boolean requestClose(InstanceSnapshot instance, Duration timeout);

    boolean kill(InstanceSnapshot instance, Duration timeout);
}
