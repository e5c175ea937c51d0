package de.bsommerfeld.launchpad.core.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of an instance at one point in time. Snapshots are what
 * queries return and what events carry, so consumers never hold a reference
 * into the live registry.
 *
 * @param instanceId     unique id assigned at launch
 * @param descriptor     the catalog entry the instance was launched from
 * @param principal      user that launched it
 * @param processId      OS process id, {@code 0} if unknown
 * @param window         correlated window, {@code null} if none yet
 * @param state          current lifecycle state
 * @param startedAt      launch time
 * @param lastUpdatedAt  time of the last state or window change
 * @param endedAt        time the instance reached a terminal state, or
 *                       {@code null}
 * @param metadata       kind specific key/value pairs
 * @param lastError      last error message, or {@code null}
 */
public record InstanceSnapshot(
        String instanceId,
        ApplicationDescriptor descriptor,
        String principal,
        long processId,
        WindowInfo window,
        InstanceState state,
        Instant startedAt,
        Instant lastUpdatedAt,
        Instant endedAt,
        Map<String, String> metadata,
        String lastError) {

    public InstanceSnapshot {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Optional<WindowInfo> windowInfo() {
        return Optional.ofNullable(window);
    }

    public boolean hasRealWindow() {
        return window != null && window.isReal();
    }

    public boolean hasPlaceholderWindow() {
        return window != null && window.placeholder();
    }

    public String displayName() {
        return descriptor.name();
    }
}
