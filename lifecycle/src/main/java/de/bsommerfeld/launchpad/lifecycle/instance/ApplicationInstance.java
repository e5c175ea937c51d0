package de.bsommerfeld.launchpad.lifecycle.instance;

import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.InstanceState;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Live record of one launch. Mutated only by {@link InstanceManager} under
 * its write lock; everything outside the package sees
 * {@link InstanceSnapshot}s.
 */
public final class ApplicationInstance {

    private final String instanceId;
    private final ApplicationDescriptor descriptor;
    private final String principal;
    private final long processId;
    private final boolean processTracked;
    private final Instant startedAt;
    private final Map<String, String> metadata;

    private InstanceState state = InstanceState.STARTING;
    private WindowInfo window;
    private Instant lastUpdatedAt;
    private Instant endedAt;
    private String lastError;

    ApplicationInstance(String instanceId, ApplicationDescriptor descriptor, String principal, long processId,
            boolean processTracked, Instant startedAt, Map<String, String> metadata) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.principal = Objects.requireNonNull(principal, "principal");
        this.processId = Math.max(0, processId);
        this.processTracked = processTracked && processId > 0;
        this.startedAt = startedAt != null ? startedAt : Instant.now();
        this.lastUpdatedAt = this.startedAt;
        this.metadata = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
    }

    public String getInstanceId() {
        return instanceId;
    }

    public ApplicationDescriptor getDescriptor() {
        return descriptor;
    }

    public String getPrincipal() {
        return principal;
    }

    public long getProcessId() {
        return processId;
    }

    public boolean isProcessTracked() {
        return processTracked;
    }

    InstanceState getState() {
        return state;
    }

    WindowInfo getWindow() {
        return window;
    }

    Instant getEndedAt() {
        return endedAt;
    }

    void setState(InstanceState state, Instant at) {
        this.state = state;
        this.lastUpdatedAt = at;
        if (state.isTerminal() && endedAt == null) {
            this.endedAt = at;
        }
    }

    void setWindow(WindowInfo window, Instant at) {
        this.window = window;
        this.lastUpdatedAt = at;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    void putMetadata(String key, String value) {
        metadata.put(key, value);
    }

    InstanceSnapshot snapshot() {
        return new InstanceSnapshot(instanceId, descriptor, principal, processId, window, state, startedAt,
                lastUpdatedAt, endedAt, metadata, lastError);
    }

    @Override
    public String toString() {
        return "ApplicationInstance[" + instanceId + " '" + descriptor.name() + "' " + state + "]";
    }
}
