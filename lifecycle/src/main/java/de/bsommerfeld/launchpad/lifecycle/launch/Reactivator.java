package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;

/**
 * Capability of launchers that can bring an instance back to the front
 * without a usable window handle, typically by launching the target again.
 */
public interface Reactivator {

    boolean reactivate(InstanceSnapshot instance);
}
