package de.bsommerfeld.launchpad.lifecycle;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of {@link LifecycleOrchestrator#shutdownAll(Duration)}.
 *
 * @param closed    number of instances that closed within the deadline
 * @param remaining ids of instances that were still alive afterwards
 * @param elapsed   total time spent
 */
public record ShutdownResult(int closed, List<String> remaining, Duration elapsed) {

    public ShutdownResult {
        remaining = List.copyOf(remaining);
    }

    public boolean isComplete() {
        return remaining.isEmpty();
    }
}
