package de.bsommerfeld.launchpad.platform.process;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Watches tracked OS processes by polling and reports their exit.
 *
 * <p>
 * Queries never throw for unknown or invalid process ids: a pid of zero or
 * below, or one that does not exist, is simply not alive.
 */
public interface ProcessMonitor {

    /** Starts the polling loop. Calling it on a running monitor does nothing. */
    void start();

    /** Stops the polling loop. Calling it on a stopped monitor does nothing. */
    void stop();

    boolean isRunning();

    /**
     * Starts watching a process for exit.
     *
     * @return {@code false} if the process does not exist (anymore)
     */
    boolean track(long processId);

    void untrack(long processId);

    Set<Long> trackedProcesses();

    boolean isAlive(long processId);

    boolean isResponding(long processId);

    Optional<ProcessInfo> getProcessInfo(long processId);

    /**
     * Asks the process to exit and waits at most {@code timeout}.
     *
     * @return {@code true} if the process is gone afterwards
     */
    boolean closeGracefully(long processId, Duration timeout);

    /**
     * Kills the process and its descendants, waiting at most {@code timeout}.
     *
     * @return {@code true} if the process is gone afterwards
     */
    boolean kill(long processId, Duration timeout);

    /**
     * Waits for a process to exit on its own.
     *
     * @return {@code true} if the process is gone within the timeout
     */
    boolean awaitExit(long processId, Duration timeout);

    void addListener(ProcessListener listener);

    void removeListener(ProcessListener listener);
}
