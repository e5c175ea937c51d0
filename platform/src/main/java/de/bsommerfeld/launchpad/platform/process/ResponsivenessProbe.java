package de.bsommerfeld.launchpad.platform.process;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Answers whether a live process still services its user interface.
 */
@FunctionalInterface
public interface ResponsivenessProbe {

    ResponsivenessProbe ALWAYS_RESPONDING = processId -> true;

    boolean isProcessResponding(long processId);

    /**
     * Batch form used once per monitor tick. Implementations that have to
     * enumerate windows should override it and enumerate only once.
     *
     * @return the subset of {@code processIds} that is not responding
     */
    default Set<Long> unresponsiveProcesses(Collection<Long> processIds) {
        Set<Long> hung = new HashSet<>();
        for (long pid : processIds) {
            if (!isProcessResponding(pid)) {
                hung.add(pid);
            }
        }
        return hung;
    }
}
