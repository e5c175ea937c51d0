package de.bsommerfeld.launchpad.core.event;

import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.InstanceState;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle notification for a single instance. Events for the same
 * instance are published in the order the transitions happened.
 *
 * @param type          what happened
 * @param instance      snapshot taken right after the change
 * @param timestamp     when the change happened
 * @param previousState state before the change, {@code null} for
 *                      {@link InstanceEventType#STARTED}
 * @param newState      state after the change
 * @param reason        human readable cause, may be {@code null}
 * @param source        component that caused the change, may be {@code null}
 */
public record InstanceEvent(
        InstanceEventType type,
        InstanceSnapshot instance,
        Instant timestamp,
        InstanceState previousState,
        InstanceState newState,
        String reason,
        String source) {

    public InstanceEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(instance, "instance");
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public String instanceId() {
        return instance.instanceId();
    }

    public Optional<InstanceState> previous() {
        return Optional.ofNullable(previousState);
    }

    public Optional<String> reasonText() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return "InstanceEvent[" + type + " " + instance.instanceId() + " (" + instance.displayName() + ") "
                + previousState + " -> " + newState + (reason != null ? ", reason=" + reason : "") + "]";
    }
}
