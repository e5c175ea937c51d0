package de.bsommerfeld.launchpad.platform.process;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.MonitoringConfig;
import de.bsommerfeld.launchpad.core.util.PollingLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link ProcessMonitor} on top of {@link ProcessHandle}. Works for any
 * process the current user can see, not only for children of this JVM.
 *
 * <h3>Polling</h3>
 * Each tick checks every tracked process once. An exited process is removed
 * from the tracked set before listeners are told, so each exit is reported
 * exactly once. Exits are reported first; the survivors are then handed to
 * the {@link ResponsivenessProbe} in one batch and only transitions are
 * reported.
 */
@Singleton
public class JdkProcessMonitor implements ProcessMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(JdkProcessMonitor.class);

    private final ResponsivenessProbe responsivenessProbe;
    private final PollingLoop loop;
    private final Map<Long, TrackedProcess> tracked = new ConcurrentHashMap<>();
    private final List<ProcessListener> listeners = new CopyOnWriteArrayList<>();

    @Inject
    public JdkProcessMonitor(MonitoringConfig config, ResponsivenessProbe responsivenessProbe) {
        this(config.processPollInterval(), responsivenessProbe);
    }

    public JdkProcessMonitor(Duration pollInterval, ResponsivenessProbe responsivenessProbe) {
        this.responsivenessProbe = responsivenessProbe;
        this.loop = new PollingLoop("process-monitor", pollInterval, this::poll);
    }

    // -- Lifecycle --

    @Override
    public void start() {
        if (!loop.isRunning()) {
            LOG.info("Starting process monitor ({} tracked)", tracked.size());
        }
        loop.start();
    }

    @Override
    public void stop() {
        if (loop.isRunning()) {
            LOG.info("Stopping process monitor");
        }
        loop.stop();
    }

    @Override
    public boolean isRunning() {
        return loop.isRunning();
    }

    // -- Tracking --

    @Override
    public boolean track(long processId) {
        Optional<ProcessHandle> handle = lookup(processId);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            LOG.debug("Cannot track pid {}: no such process", processId);
            return false;
        }
        tracked.putIfAbsent(processId, new TrackedProcess(handle.get()));
        LOG.debug("Tracking pid {}", processId);
        return true;
    }

    @Override
    public void untrack(long processId) {
        if (tracked.remove(processId) != null) {
            LOG.debug("Untracked pid {}", processId);
        }
    }

    @Override
    public Set<Long> trackedProcesses() {
        return Set.copyOf(tracked.keySet());
    }

    /**
     * One polling tick. Public so callers driving their own schedule (and
     * tests) can poll synchronously.
     */
    public void poll() {
        List<Long> alive = new ArrayList<>();
        for (Map.Entry<Long, TrackedProcess> entry : tracked.entrySet()) {
            long pid = entry.getKey();
            TrackedProcess process = entry.getValue();
            if (process.handle.isAlive()) {
                alive.add(pid);
            } else if (tracked.remove(pid, process)) {
                LOG.info("Process {} exited", pid);
                fireExited(new ProcessExitedEvent(pid, Instant.now()));
            }
        }
        if (alive.isEmpty()) {
            return;
        }

        // Exits are out before the probe touches any window.
        Set<Long> hung = safeUnresponsive(alive);
        for (long pid : alive) {
            TrackedProcess process = tracked.get(pid);
            if (process == null) {
                continue;
            }
            boolean responding = !hung.contains(pid);
            if (responding != process.responding) {
                process.responding = responding;
                if (responding) {
                    LOG.info("Process {} is responding again", pid);
                    fire(l -> l.onProcessResponding(pid));
                } else {
                    LOG.warn("Process {} is not responding", pid);
                    fire(l -> l.onProcessNotResponding(pid));
                }
            }
        }
    }

    // -- Queries --

    @Override
    public boolean isAlive(long processId) {
        return lookup(processId).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean isResponding(long processId) {
        return isAlive(processId) && safeIsResponding(processId);
    }

    @Override
    public Optional<ProcessInfo> getProcessInfo(long processId) {
        return lookup(processId).map(handle -> {
            ProcessHandle.Info info = handle.info();
            return new ProcessInfo(
                    processId,
                    info.command(),
                    info.arguments().map(List::of).orElse(List.of()),
                    info.startInstant(),
                    info.user(),
                    handle.isAlive(),
                    info.totalCpuDuration());
        });
    }

    // -- Termination --

    @Override
    public boolean closeGracefully(long processId, Duration timeout) {
        Optional<ProcessHandle> handle = lookup(processId);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return true;
        }
        if (!handle.get().destroy()) {
            LOG.debug("Graceful termination not supported for pid {}", processId);
        }
        return awaitExit(handle.get(), timeout);
    }

    @Override
    public boolean kill(long processId, Duration timeout) {
        Optional<ProcessHandle> handle = lookup(processId);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return true;
        }
        List<ProcessHandle> descendants = handle.get().descendants().collect(Collectors.toList());
        handle.get().destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
        LOG.info("Killed pid {} and {} descendant(s)", processId, descendants.size());
        return awaitExit(handle.get(), timeout);
    }

    @Override
    public boolean awaitExit(long processId, Duration timeout) {
        Optional<ProcessHandle> handle = lookup(processId);
        return handle.isEmpty() || awaitExit(handle.get(), timeout);
    }

    private boolean awaitExit(ProcessHandle handle, Duration timeout) {
        try {
            handle.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return !handle.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !handle.isAlive();
        } catch (ExecutionException e) {
            LOG.warn("Waiting for pid {} failed", handle.pid(), e);
            return !handle.isAlive();
        }
    }

    // -- Listeners --

    @Override
    public void addListener(ProcessListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ProcessListener listener) {
        listeners.remove(listener);
    }

    private void fireExited(ProcessExitedEvent event) {
        fire(l -> l.onProcessExited(event));
    }

    private void fire(Consumer<ProcessListener> action) {
        for (ProcessListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                LOG.error("Process listener {} failed", listener.getClass().getName(), e);
            }
        }
    }

    private boolean safeIsResponding(long pid) {
        try {
            return responsivenessProbe.isProcessResponding(pid);
        } catch (Exception e) {
            LOG.debug("Responsiveness probe failed for pid {}", pid, e);
            return true;
        }
    }

    private Set<Long> safeUnresponsive(List<Long> pids) {
        try {
            return responsivenessProbe.unresponsiveProcesses(pids);
        } catch (Exception e) {
            LOG.debug("Responsiveness probe failed for {} process(es)", pids.size(), e);
            return Set.of();
        }
    }

    private static Optional<ProcessHandle> lookup(long processId) {
        if (processId <= 0) {
            return Optional.empty();
        }
        try {
            return ProcessHandle.of(processId);
        } catch (SecurityException e) {
            LOG.debug("Not allowed to inspect pid {}", processId);
            return Optional.empty();
        }
    }

    private static final class TrackedProcess {
        private final ProcessHandle handle;
        private volatile boolean responding = true;

        private TrackedProcess(ProcessHandle handle) {
            this.handle = handle;
        }
    }
}
