package de.bsommerfeld.launchpad.lifecycle.instance;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.MonitoringConfig;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.InstanceState;
import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import de.bsommerfeld.launchpad.core.event.InstanceEvent;
import de.bsommerfeld.launchpad.core.event.InstanceEventType;
import de.bsommerfeld.launchpad.lifecycle.launch.InstanceTerminator;
import de.bsommerfeld.launchpad.platform.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Registry of all known instances and owner of their state machine.
 *
 * <h3>Locking</h3>
 * One {@link ReentrantReadWriteLock} guards the registry. Queries copy
 * snapshots under the read lock, every mutation runs under the write lock.
 * Calls that reach the operating system (switching windows, closing or
 * killing processes) are made with no lock held; the outcome is applied
 * afterwards in a short write section.
 *
 * <h3>Events</h3>
 * Every applied change produces exactly one {@link InstanceEvent}:
 * {@code STARTED} on registration, {@code STOPPED} on reaching
 * {@code TERMINATED}, {@code ERROR} on reaching {@code ERROR},
 * {@code ACTIVATED} on activation and {@code STATE_CHANGED} for everything
 * else. Listeners are invoked under the write lock, so the events of one
 * instance arrive in the order the changes happened.
 */
@Singleton
public class InstanceManager {

    private static final Logger LOG = LoggerFactory.getLogger(InstanceManager.class);

    /** Metadata flag telling terminators whether the instance owns its pid. */
    public static final String META_PROCESS_TRACKED = "process.tracked";

    private static final String SOURCE = "instance-manager";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ApplicationInstance> instances = new LinkedHashMap<>();
    private final List<InstanceListener> listeners = new CopyOnWriteArrayList<>();

    private final WindowManager windowManager;
    private final InstanceTerminator defaultTerminator;
    private final MonitoringConfig config;
    private final Clock clock;

    @Inject
    public InstanceManager(WindowManager windowManager, ProcessTerminator defaultTerminator,
            MonitoringConfig config) {
        this(windowManager, defaultTerminator, config, Clock.systemUTC());
    }

    public InstanceManager(WindowManager windowManager, InstanceTerminator defaultTerminator,
            MonitoringConfig config, Clock clock) {
        this.windowManager = windowManager;
        this.defaultTerminator = defaultTerminator;
        this.config = config;
        this.clock = clock;
    }

    public void addListener(InstanceListener listener) {
        listeners.add(listener);
    }

    public void removeListener(InstanceListener listener) {
        listeners.remove(listener);
    }

    // =====================================================================
    // Registration and transitions
    // =====================================================================

    /**
     * Adds a new instance in {@code STARTING} and emits {@code STARTED}.
     *
     * @throws DuplicateInstanceException if the id is already registered
     */
    public InstanceSnapshot register(String instanceId, ApplicationDescriptor descriptor, String principal,
            long processId, boolean processTracked, Map<String, String> metadata) {
        Preconditions.checkArgument(instanceId != null && !instanceId.isBlank(), "instanceId must not be blank");
        Preconditions.checkArgument(descriptor != null, "descriptor must not be null");
        Preconditions.checkArgument(principal != null && !principal.isBlank(), "principal must not be blank");

        ApplicationInstance instance = new ApplicationInstance(instanceId, descriptor, principal, processId,
                processTracked, clock.instant(), metadata);
        instance.putMetadata(META_PROCESS_TRACKED, String.valueOf(instance.isProcessTracked()));

        lock.writeLock().lock();
        try {
            if (instances.containsKey(instanceId)) {
                throw new DuplicateInstanceException(instanceId);
            }
            instances.put(instanceId, instance);
            LOG.info("Registered {} '{}' for {} (pid {})", instanceId, descriptor.name(), principal,
                    instance.getProcessId());
            emit(InstanceEventType.STARTED, instance, null, "registered", SOURCE);
            return instance.snapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves an instance to {@code target}. Requesting the current state is a
     * no-op; a transition the state machine does not allow is logged and
     * refused.
     *
     * @return {@code true} if the instance is now in {@code target}
     */
    public boolean transition(String instanceId, InstanceState target, String reason, String source) {
        lock.writeLock().lock();
        try {
            ApplicationInstance instance = instances.get(instanceId);
            if (instance == null) {
                return false;
            }
            return applyTransition(instance, target, reason, source);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Brings the instance's real window to the foreground and marks it
     * {@code ACTIVE}. Fails without any change when the instance is unknown,
     * terminal, has no real window or the window manager refuses.
     */
    public boolean activate(String instanceId) {
        InstanceSnapshot snapshot = get(instanceId).orElse(null);
        if (snapshot == null || snapshot.state().isTerminal() || !snapshot.hasRealWindow()) {
            return false;
        }
        WindowHandle handle = snapshot.window().handle();
        if (!windowManager.switchTo(handle)) {
            LOG.debug("Window {} of {} could not be brought to front", handle, instanceId);
            return false;
        }
        return recordActivation(instanceId, "window activated", SOURCE);
    }

    /**
     * Marks an instance as activated by some path other than
     * {@link #activate(String)}, e.g. a relaunch or an observed focus change.
     * Emits {@code ACTIVATED} and demotes every other {@code ACTIVE} instance
     * of the same principal to {@code INACTIVE}.
     */
    public boolean recordActivation(String instanceId, String reason, String source) {
        lock.writeLock().lock();
        try {
            ApplicationInstance instance = instances.get(instanceId);
            if (instance == null || instance.getState().isTerminal()) {
                return false;
            }
            InstanceState previous = instance.getState();
            if (previous != InstanceState.ACTIVE && previous.canTransitionTo(InstanceState.ACTIVE)) {
                instance.setState(InstanceState.ACTIVE, clock.instant());
            }
            emit(InstanceEventType.ACTIVATED, instance, previous, reason, source);

            for (ApplicationInstance sibling : instances.values()) {
                if (sibling != instance && sibling.getState() == InstanceState.ACTIVE
                        && sibling.getPrincipal().equals(instance.getPrincipal())) {
                    applyTransition(sibling, InstanceState.INACTIVE, "another instance activated", source);
                }
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean deactivate(String instanceId, String reason, String source) {
        lock.writeLock().lock();
        try {
            ApplicationInstance instance = instances.get(instanceId);
            if (instance == null || instance.getState() != InstanceState.ACTIVE) {
                return false;
            }
            return applyTransition(instance, InstanceState.INACTIVE, reason, source);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Associates a window with the instance. A placeholder never replaces a
     * real window, and terminal instances accept no window.
     */
    public boolean attachWindow(String instanceId, WindowInfo window) {
        if (window == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            ApplicationInstance instance = instances.get(instanceId);
            if (instance == null || instance.getState().isTerminal()) {
                return false;
            }
            WindowInfo current = instance.getWindow();
            if (window.placeholder() && current != null && current.isReal()) {
                LOG.debug("Keeping real window {} of {} instead of placeholder", current.handle(), instanceId);
                return false;
            }
            instance.setWindow(window, clock.instant());
            LOG.debug("Attached window {} '{}' to {}", window.handle(), window.title(), instanceId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves the instance to {@code TERMINATED}. Idempotent: an instance that
     * already ended is left alone and {@code true} is returned.
     */
    public boolean markTerminated(String instanceId, String reason, String source) {
        lock.writeLock().lock();
        try {
            ApplicationInstance instance = instances.get(instanceId);
            if (instance == null) {
                return false;
            }
            if (instance.getState().isTerminal()) {
                return true;
            }
            return applyTransition(instance, InstanceState.TERMINATED, reason, source);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean markError(String instanceId, String message, String source) {
        lock.writeLock().lock();
        try {
            ApplicationInstance instance = instances.get(instanceId);
            if (instance == null) {
                return false;
            }
            if (instance.getState().isTerminal()) {
                return instance.getState() == InstanceState.ERROR;
            }
            instance.setLastError(message);
            return applyTransition(instance, InstanceState.ERROR, message, source);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // =====================================================================
    // Termination
    // =====================================================================

    public boolean terminate(String instanceId) {
        return terminate(instanceId, config.gracefulCloseTimeout());
    }

    public boolean terminate(String instanceId, Duration timeout) {
        return terminate(instanceId, defaultTerminator, timeout);
    }

    /**
     * Asks the instance to close and waits up to {@code timeout}. A close
     * that does not complete in time leaves the instance untouched and
     * returns {@code false}; it is never escalated to a kill.
     */
    public boolean terminate(String instanceId, InstanceTerminator terminator, Duration timeout) {
        InstanceSnapshot snapshot = get(instanceId).orElse(null);
        if (snapshot == null) {
            return false;
        }
        if (snapshot.state().isTerminal()) {
            return true;
        }

        boolean closed;
        try {
            closed = terminator.requestClose(snapshot, timeout);
        } catch (RuntimeException e) {
            LOG.warn("Close request for {} failed", instanceId, e);
            closed = false;
        }
        if (!closed) {
            LOG.warn("{} did not close within {} ms", instanceId, timeout.toMillis());
            return false;
        }
        return markTerminated(instanceId, "closed on request", "terminate");
    }

    public boolean forceTerminate(String instanceId) {
        return forceTerminate(instanceId, defaultTerminator, config.killTimeout());
    }

    public boolean forceTerminate(String instanceId, InstanceTerminator terminator, Duration timeout) {
        InstanceSnapshot snapshot = get(instanceId).orElse(null);
        if (snapshot == null) {
            return false;
        }
        if (snapshot.state().isTerminal()) {
            return true;
        }

        boolean killed;
        try {
            killed = terminator.kill(snapshot, timeout);
        } catch (RuntimeException e) {
            LOG.warn("Kill of {} failed", instanceId, e);
            killed = false;
        }
        if (!killed) {
            LOG.warn("{} survived forced termination", instanceId);
            return false;
        }
        return markTerminated(instanceId, "killed on request", "force-terminate");
    }

    // =====================================================================
    // Focus
    // =====================================================================

    /**
     * Aligns {@code ACTIVE} / {@code INACTIVE} with the window that currently
     * has the foreground. Only instances with a real window take part.
     */
    public void reconcileFocus(WindowHandle foreground) {
        if (foreground == null || foreground.isNone()) {
            return;
        }
        String focusedId = null;
        lock.readLock().lock();
        try {
            for (ApplicationInstance instance : instances.values()) {
                WindowInfo window = instance.getWindow();
                if (window != null && window.isReal() && window.handle().equals(foreground)
                        && instance.getState().isAlive()) {
                    focusedId = instance.getInstanceId();
                    break;
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (focusedId != null) {
            InstanceSnapshot focused = get(focusedId).orElse(null);
            if (focused != null && focused.state() != InstanceState.ACTIVE) {
                recordActivation(focusedId, "gained focus", "focus-reconciler");
            }
            return;
        }

        lock.writeLock().lock();
        try {
            for (ApplicationInstance instance : instances.values()) {
                WindowInfo window = instance.getWindow();
                if (instance.getState() == InstanceState.ACTIVE && window != null && window.isReal()) {
                    applyTransition(instance, InstanceState.INACTIVE, "lost focus", "focus-reconciler");
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // =====================================================================
    // Queries
    // =====================================================================

    public Optional<InstanceSnapshot> get(String instanceId) {
        if (instanceId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            ApplicationInstance instance = instances.get(instanceId);
            return instance == null ? Optional.empty() : Optional.of(instance.snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<InstanceSnapshot> getAll() {
        return select(instance -> true);
    }

    public List<InstanceSnapshot> getForPrincipal(String principal) {
        return select(instance -> instance.getPrincipal().equals(principal));
    }

    public List<InstanceSnapshot> findByProcessId(long processId) {
        if (processId <= 0) {
            return List.of();
        }
        return select(instance -> instance.getProcessId() == processId);
    }

    public List<InstanceSnapshot> findByDescriptor(String descriptorId) {
        return select(instance -> instance.getDescriptor().id().equals(descriptorId));
    }

    /** Number of registered instances per state, including zero counts. */
    public Map<InstanceState, Integer> stateStatistics() {
        Map<InstanceState, Integer> stats = new EnumMap<>(InstanceState.class);
        for (InstanceState state : InstanceState.values()) {
            stats.put(state, 0);
        }
        lock.readLock().lock();
        try {
            for (ApplicationInstance instance : instances.values()) {
                stats.merge(instance.getState(), 1, Integer::sum);
            }
        } finally {
            lock.readLock().unlock();
        }
        return stats;
    }

    // =====================================================================
    // Cleanup
    // =====================================================================

    public int cleanup() {
        return cleanup(config.retention());
    }

    /**
     * Removes terminal instances that ended more than {@code retention} ago.
     *
     * @return the number of removed instances
     */
    public int cleanup(Duration retention) {
        Instant threshold = clock.instant().minus(retention);
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<ApplicationInstance> it = instances.values().iterator();
            while (it.hasNext()) {
                ApplicationInstance instance = it.next();
                Instant endedAt = instance.getEndedAt();
                if (instance.getState().isTerminal() && endedAt != null && !endedAt.isAfter(threshold)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            LOG.debug("Removed {} ended instance(s)", removed);
        }
        return removed;
    }

    // -- Internals (write lock held) --

    private boolean applyTransition(ApplicationInstance instance, InstanceState target, String reason,
            String source) {
        InstanceState previous = instance.getState();
        if (previous == target) {
            return true;
        }
        if (!previous.canTransitionTo(target)) {
            LOG.warn("Refusing transition {} -> {} for {}", previous, target, instance.getInstanceId());
            return false;
        }
        instance.setState(target, clock.instant());
        LOG.info("{} '{}': {} -> {}{}", instance.getInstanceId(), instance.getDescriptor().name(), previous,
                target, reason != null ? " (" + reason + ")" : "");
        emit(eventTypeFor(target), instance, previous, reason, source);
        return true;
    }

    private static InstanceEventType eventTypeFor(InstanceState target) {
        switch (target) {
            case TERMINATED:
                return InstanceEventType.STOPPED;
            case ERROR:
                return InstanceEventType.ERROR;
            default:
                return InstanceEventType.STATE_CHANGED;
        }
    }

    private void emit(InstanceEventType type, ApplicationInstance instance, InstanceState previous, String reason,
            String source) {
        InstanceEvent event = new InstanceEvent(type, instance.snapshot(), clock.instant(), previous,
                instance.getState(), reason, source);
        for (InstanceListener listener : listeners) {
            try {
                listener.onInstanceEvent(event);
            } catch (RuntimeException e) {
                LOG.error("Instance listener failed on {}", event, e);
            }
        }
    }

    private List<InstanceSnapshot> select(Predicate<ApplicationInstance> filter) {
        lock.readLock().lock();
        try {
            ImmutableList.Builder<InstanceSnapshot> result = ImmutableList.builder();
            for (ApplicationInstance instance : instances.values()) {
                if (filter.test(instance)) {
                    result.add(instance.snapshot());
                }
            }
            return result.build();
        } finally {
            lock.readLock().unlock();
        }
    }
}
