package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.domain.WindowInfo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw result of a successful launcher call, before the engine has
 * registered an instance for it. Built with {@link #builder(CorrelationMode)}.
 */
public final class LaunchAttempt {

    private final long processId;
    private final boolean processTracked;
    private final CorrelationMode correlationMode;
    private final String windowHint;
    private final List<String> windowClasses;
    private final WindowInfo window;
    private final Map<String, String> metadata;
    private final Instant launchedAt;
    private final int correlationAttempts;
    private final boolean placeholderAllowed;

    private LaunchAttempt(Builder builder) {
        this.processId = builder.processId;
        this.processTracked = builder.processTracked && builder.processId > 0;
        this.correlationMode = builder.correlationMode;
        this.windowHint = builder.windowHint;
        this.windowClasses = List.copyOf(builder.windowClasses);
        this.window = builder.window;
        this.metadata = Map.copyOf(builder.metadata);
        this.launchedAt = builder.launchedAt != null ? builder.launchedAt : Instant.now();
        this.correlationAttempts = builder.correlationAttempts;
        this.placeholderAllowed = builder.placeholderAllowed;
    }

    public static Builder builder(CorrelationMode mode) {
        return new Builder(mode);
    }

    /** OS process id, {@code 0} if the launcher did not start a process of its own. */
    public long processId() {
        return processId;
    }

    /** Whether the process belongs to this launch and may be watched for exit. */
    public boolean processTracked() {
        return processTracked;
    }

    public CorrelationMode correlationMode() {
        return correlationMode;
    }

    public String windowHint() {
        return windowHint;
    }

    public List<String> windowClasses() {
        return windowClasses;
    }

    /** Window the launcher already knows, skipping correlation. */
    public Optional<WindowInfo> window() {
        return Optional.ofNullable(window);
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Instant launchedAt() {
        return launchedAt;
    }

    /** Correlation attempts to make, {@code 0} means the configured default. */
    public int correlationAttempts() {
        return correlationAttempts;
    }

    public boolean placeholderAllowed() {
        return placeholderAllowed;
    }

    public static final class Builder {

        private final CorrelationMode correlationMode;
        private long processId;
        private boolean processTracked;
        private String windowHint = "";
        private List<String> windowClasses = List.of();
        private WindowInfo window;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private Instant launchedAt;
        private int correlationAttempts;
        private boolean placeholderAllowed = true;

        private Builder(CorrelationMode correlationMode) {
            this.correlationMode = correlationMode;
        }

        public Builder process(long processId, boolean tracked) {
            this.processId = processId;
            this.processTracked = tracked;
            return this;
        }

        public Builder windowHint(String windowHint) {
            this.windowHint = windowHint == null ? "" : windowHint;
            return this;
        }

        public Builder windowClasses(List<String> windowClasses) {
            this.windowClasses = windowClasses == null ? List.of() : windowClasses;
            return this;
        }

        public Builder window(WindowInfo window) {
            this.window = window;
            return this;
        }

        public Builder metadata(String key, String value) {
            if (value != null && !value.isEmpty()) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder launchedAt(Instant launchedAt) {
            this.launchedAt = launchedAt;
            return this;
        }

        public Builder correlationAttempts(int correlationAttempts) {
            this.correlationAttempts = correlationAttempts;
            return this;
        }

        public Builder placeholderAllowed(boolean placeholderAllowed) {
            this.placeholderAllowed = placeholderAllowed;
            return this;
        }

        public LaunchAttempt build() {
            return new LaunchAttempt(this);
        }
    }
}
