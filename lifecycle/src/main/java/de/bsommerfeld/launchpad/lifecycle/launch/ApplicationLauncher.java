package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;

/**
 * Strategy that knows how to start one kind of application.
 *
 * <p>
 * Launchers may additionally implement {@link WindowEventSource},
 * {@link Reactivator} or {@link InstanceTerminator}; the engine checks for
 * these capabilities with {@code instanceof}.
 */
public interface ApplicationLauncher {

    ApplicationKind supportedKind();

    /**
     * Capability predicate. The default accepts every descriptor of the
     * supported kind; launchers narrow it when the target must have a
     * particular shape.
     */
    default boolean canLaunch(ApplicationDescriptor descriptor) {
        return descriptor.kind() == supportedKind();
    }

    /**
     * Starts the descriptor's target.
     *
     * @throws LaunchException if the target cannot be started
     */
    LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) throws LaunchException;
}
