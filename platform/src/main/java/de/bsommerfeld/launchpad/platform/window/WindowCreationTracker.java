package de.bsommerfeld.launchpad.platform.window;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;

/**
 * Approximates window creation times from successive enumerations.
 *
 * <p>
 * Windows present at the first enumeration ({@link #prime}) are stamped with
 * the start time of their owning process. Every window that appears in a
 * later enumeration is stamped with the time it was first seen, so the
 * tracker has to be primed before the first launch is correlated.
 */
final class WindowCreationTracker {

    private final LongFunction<Optional<Instant>> processStart;
    private final Clock clock;
    private final Map<Long, Instant> firstSeen = new ConcurrentHashMap<>();
    private volatile boolean primed;

    WindowCreationTracker(LongFunction<Optional<Instant>> processStart, Clock clock) {
        this.processStart = processStart;
        this.clock = clock;
    }

    /**
     * @param windows handle to owning pid of every current top-level window
     */
    synchronized void prime(Map<Long, Long> windows) {
        if (primed) {
            return;
        }
        Instant now = clock.instant();
        firstSeen.clear();
        windows.forEach((handle, pid) -> firstSeen.put(handle, startOf(pid, now)));
        primed = true;
    }

    /**
     * Records an enumeration and returns the creation time of each listed
     * window. Handles that disappeared are forgotten, so a reused handle
     * counts as a new window.
     */
    synchronized Map<Long, Instant> update(Map<Long, Long> windows) {
        if (!primed) {
            prime(windows);
        }
        Instant now = clock.instant();
        firstSeen.keySet().retainAll(windows.keySet());
        Map<Long, Instant> created = new HashMap<>();
        for (Long handle : windows.keySet()) {
            created.put(handle, firstSeen.computeIfAbsent(handle, h -> now));
        }
        return created;
    }

    Optional<Instant> createdAt(long handle) {
        return Optional.ofNullable(firstSeen.get(handle));
    }

    boolean isPrimed() {
        return primed;
    }

    private Instant startOf(Long pid, Instant fallback) {
        if (pid == null || pid <= 0) {
            return fallback;
        }
        return processStart.apply(pid).orElse(fallback);
    }
}
