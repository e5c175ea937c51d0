package de.bsommerfeld.launchpad.platform.process;

/**
 * Receives notifications from the process monitor's polling thread.
 * Implementations must return quickly and must not call back into the
 * monitor's start or stop.
 */
public interface ProcessListener {

    void onProcessExited(ProcessExitedEvent event);

    default void onProcessNotResponding(long processId) {
    }

    default void onProcessResponding(long processId) {
    }
}
