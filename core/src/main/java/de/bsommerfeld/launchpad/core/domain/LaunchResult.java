package de.bsommerfeld.launchpad.core.domain;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a launch request as seen by the caller.
 *
 * <p>
 * A successful result always carries an instance id. A {@code degraded}
 * success means the instance runs with a placeholder window. A result with
 * {@code alreadyRunning} set means no new process was started and the
 * caller was switched to an existing instance.
 */
public final class LaunchResult {

    private final boolean success;
    private final String instanceId;
    private final long processId;
    private final String errorMessage;
    private final LaunchFailureReason failureReason;
    private final Duration elapsed;
    private final boolean degraded;
    private final boolean alreadyRunning;

    private LaunchResult(boolean success, String instanceId, long processId, String errorMessage,
            LaunchFailureReason failureReason, Duration elapsed, boolean degraded, boolean alreadyRunning) {
        this.success = success;
        this.instanceId = instanceId;
        this.processId = processId;
        this.errorMessage = errorMessage;
        this.failureReason = failureReason;
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
        this.degraded = degraded;
        this.alreadyRunning = alreadyRunning;
    }

    public static LaunchResult success(String instanceId, long processId, Duration elapsed, boolean degraded) {
        return new LaunchResult(true, instanceId, processId, null, null, elapsed, degraded, false);
    }

    public static LaunchResult alreadyRunning(String instanceId, long processId, Duration elapsed) {
        return new LaunchResult(true, instanceId, processId, null, null, elapsed, false, true);
    }

    public static LaunchResult failure(LaunchFailureReason reason, String errorMessage, Duration elapsed) {
        return new LaunchResult(false, null, 0, errorMessage, reason, elapsed, false, false);
    }

    /**
     * Failure that still left a registered instance behind, e.g. a window that
     * never appeared with the placeholder disabled.
     */
    public static LaunchResult failure(LaunchFailureReason reason, String errorMessage, String instanceId,
            long processId, Duration elapsed) {
        return new LaunchResult(false, instanceId, processId, errorMessage, reason, elapsed, false, false);
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<String> getInstanceId() {
        return Optional.ofNullable(instanceId);
    }

    public Optional<Long> getProcessId() {
        return processId > 0 ? Optional.of(processId) : Optional.empty();
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<LaunchFailureReason> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isAlreadyRunning() {
        return alreadyRunning;
    }

    @Override
    public String toString() {
        if (success) {
            return "LaunchResult[success, id=" + instanceId + ", pid=" + processId + ", elapsed=" + elapsed.toMillis()
                    + "ms" + (degraded ? ", degraded" : "") + (alreadyRunning ? ", alreadyRunning" : "") + "]";
        }
        return "LaunchResult[failed, reason=" + failureReason + ", error=" + errorMessage + "]";
    }
}
