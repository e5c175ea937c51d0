package de.bsommerfeld.launchpad.lifecycle.instance;

import de.bsommerfeld.launchpad.core.event.InstanceEvent;

/**
 * Receives every lifecycle event of the registry in transition order.
 * Called while the registry's write lock is held, so implementations must
 * only hand the event off and must not call back into the manager.
 */
@FunctionalInterface
public interface InstanceListener {

    void onInstanceEvent(InstanceEvent event);
}
