package de.bsommerfeld.launchpad.lifecycle;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Striped;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.MonitoringConfig;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.InstanceState;
import de.bsommerfeld.launchpad.core.domain.LaunchFailureReason;
import de.bsommerfeld.launchpad.core.domain.LaunchResult;
import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import de.bsommerfeld.launchpad.core.event.ApplicationEventBus;
import de.bsommerfeld.launchpad.core.event.InstanceEvent;
import de.bsommerfeld.launchpad.core.event.InstanceEventType;
import de.bsommerfeld.launchpad.core.spi.ApplicationCatalog;
import de.bsommerfeld.launchpad.core.spi.AuditAction;
import de.bsommerfeld.launchpad.core.spi.PrincipalProvider;
import de.bsommerfeld.launchpad.core.util.PollingLoop;
import de.bsommerfeld.launchpad.lifecycle.audit.AuditRecorder;
import de.bsommerfeld.launchpad.lifecycle.correlation.WindowCorrelationService;
import de.bsommerfeld.launchpad.lifecycle.instance.InstanceIdGenerator;
import de.bsommerfeld.launchpad.lifecycle.instance.InstanceManager;
import de.bsommerfeld.launchpad.lifecycle.launch.ApplicationLauncher;
import de.bsommerfeld.launchpad.lifecycle.launch.CorrelationMode;
import de.bsommerfeld.launchpad.lifecycle.launch.InstanceTerminator;
import de.bsommerfeld.launchpad.lifecycle.launch.LaunchAttempt;
import de.bsommerfeld.launchpad.lifecycle.launch.LaunchException;
import de.bsommerfeld.launchpad.lifecycle.launch.LauncherRegistry;
import de.bsommerfeld.launchpad.lifecycle.launch.Reactivator;
import de.bsommerfeld.launchpad.lifecycle.launch.WindowEventListener;
import de.bsommerfeld.launchpad.lifecycle.launch.WindowEventSource;
import de.bsommerfeld.launchpad.platform.process.ProcessExitedEvent;
import de.bsommerfeld.launchpad.platform.process.ProcessListener;
import de.bsommerfeld.launchpad.platform.process.ProcessMonitor;
import de.bsommerfeld.launchpad.platform.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.Lock;

/**
 * Entry point of the lifecycle engine. Launches applications through the
 * matching {@link ApplicationLauncher}, registers the resulting instance,
 * correlates its window and keeps it up to date from process, window and
 * focus observations.
 *
 * <h3>Threads</h3>
 * <ul>
 * <li>callers: launch, switch and terminate run on the calling thread</li>
 * <li>process monitor loop: exit and responsiveness notifications</li>
 * <li>refresh loop: focus, lazy window discovery and cleanup</li>
 * <li>event forwarder: a single thread that republishes
 * {@link InstanceEvent}s on the {@link ApplicationEventBus}, so subscribers
 * never run while the registry is locked</li>
 * </ul>
 */
@Singleton
public class LifecycleOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(LifecycleOrchestrator.class);
    private static final String SOURCE = "orchestrator";

    private final LauncherRegistry launchers;
    private final InstanceManager instances;
    private final WindowCorrelationService correlation;
    private final ProcessMonitor processMonitor;
    private final WindowManager windowManager;
    private final ApplicationEventBus eventBus;
    private final AuditRecorder audit;
    private final ApplicationCatalog catalog;
    private final PrincipalProvider principalProvider;
    private final MonitoringConfig config;
    private final InstanceIdGenerator idGenerator;
    private final Executor eventExecutor;
    private final PollingLoop refreshLoop;
    private final Striped<Lock> singleInstanceLocks = Striped.lazyWeakLock(64);

    private volatile boolean monitoring;

    @Inject
    public LifecycleOrchestrator(LauncherRegistry launchers, InstanceManager instances,
            WindowCorrelationService correlation, ProcessMonitor processMonitor, WindowManager windowManager,
            ApplicationEventBus eventBus, AuditRecorder audit, ApplicationCatalog catalog,
            PrincipalProvider principalProvider, MonitoringConfig config, InstanceIdGenerator idGenerator) {
        this(launchers, instances, correlation, processMonitor, windowManager, eventBus, audit, catalog,
                principalProvider, config, idGenerator, Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                        .setNameFormat("instance-events-%d")
                        .setDaemon(true)
                        .build()));
    }

    public LifecycleOrchestrator(LauncherRegistry launchers, InstanceManager instances,
            WindowCorrelationService correlation, ProcessMonitor processMonitor, WindowManager windowManager,
            ApplicationEventBus eventBus, AuditRecorder audit, ApplicationCatalog catalog,
            PrincipalProvider principalProvider, MonitoringConfig config, InstanceIdGenerator idGenerator,
            Executor eventExecutor) {
        this.launchers = launchers;
        this.instances = instances;
        this.correlation = correlation;
        this.processMonitor = processMonitor;
        this.windowManager = windowManager;
        this.eventBus = eventBus;
        this.audit = audit;
        this.catalog = catalog;
        this.principalProvider = principalProvider;
        this.config = config;
        this.idGenerator = idGenerator;
        this.eventExecutor = eventExecutor;
        this.refreshLoop = new PollingLoop("instance-refresh", config.refreshInterval(), this::refresh);

        instances.addListener(this::forward);
        processMonitor.addListener(new ProcessEvents());
        WindowEventListener windowEvents = new WindowEvents();
        for (WindowEventSource source : launchers.withCapability(WindowEventSource.class)) {
            source.addWindowEventListener(windowEvents);
        }
    }

    // =====================================================================
    // Launch
    // =====================================================================

    /**
     * Launches {@code descriptor} on behalf of {@code principal}. Never
     * throws for launch problems; those are reported in the returned
     * {@link LaunchResult}.
     *
     * @throws IllegalArgumentException if the descriptor is {@code null} or
     *                                  the principal blank
     */
    public LaunchResult launch(ApplicationDescriptor descriptor, String principal) {
        Preconditions.checkArgument(descriptor != null, "descriptor must not be null");
        Preconditions.checkArgument(principal != null && !principal.isBlank(), "principal must not be blank");
        Stopwatch stopwatch = Stopwatch.createStarted();

        if (!descriptor.singleInstance()) {
            return doLaunch(descriptor, principal, stopwatch);
        }
        // Check and registration must not interleave for the same user and application.
        Lock lock = singleInstanceLocks.get(descriptor.id() + '\u0000' + principal);
        lock.lock();
        try {
            return doLaunch(descriptor, principal, stopwatch);
        } finally {
            lock.unlock();
        }
    }

    private LaunchResult doLaunch(ApplicationDescriptor descriptor, String principal, Stopwatch stopwatch) {
        if (descriptor.singleInstance()) {
            Optional<InstanceSnapshot> existing = instances.findByDescriptor(descriptor.id()).stream()
                    .filter(i -> i.principal().equals(principal) && i.state().isAlive())
                    .findFirst();
            if (existing.isPresent()) {
                InstanceSnapshot instance = existing.get();
                LOG.info("'{}' already runs as {}, switching to it", descriptor.name(), instance.instanceId());
                switchTo(instance.instanceId());
                return LaunchResult.alreadyRunning(instance.instanceId(), instance.processId(), stopwatch.elapsed());
            }
        }

        Optional<ApplicationLauncher> launcher = launchers.find(descriptor);
        if (launcher.isEmpty()) {
            String message = "No launcher for " + descriptor.kind() + " application '" + descriptor.name() + "'";
            LOG.error(message);
            audit.record(principal, AuditAction.LAUNCH, descriptor, false, message);
            return LaunchResult.failure(LaunchFailureReason.NO_SUITABLE_LAUNCHER, message, stopwatch.elapsed());
        }

        LaunchAttempt attempt;
        try {
            attempt = launcher.get().launch(descriptor, principal);
        } catch (LaunchException | RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOG.error("Failed to launch '{}': {}", descriptor.name(), message, e);
            audit.record(principal, AuditAction.LAUNCH, descriptor, false, message);
            return LaunchResult.failure(LaunchFailureReason.LAUNCH_FAILED, message, stopwatch.elapsed());
        }

        String instanceId = idGenerator.next(descriptor.kind());
        Map<String, String> metadata = new LinkedHashMap<>(attempt.metadata());
        metadata.put(WindowCorrelationService.META_MODE, attempt.correlationMode().name().toLowerCase(Locale.ROOT));
        if (attempt.windowHint() != null && !attempt.windowHint().isEmpty()) {
            metadata.put(WindowCorrelationService.META_HINT, attempt.windowHint());
        }
        long pid = attempt.processId();
        instances.register(instanceId, descriptor, principal, pid, attempt.processTracked(), metadata);

        if (attempt.processTracked() && !processMonitor.track(pid)) {
            String message = "Process " + pid + " of '" + descriptor.name() + "' exited during launch";
            LOG.error(message);
            instances.markTerminated(instanceId, "exited during launch", SOURCE);
            audit.record(principal, AuditAction.LAUNCH, descriptor, false, message);
            return LaunchResult.failure(LaunchFailureReason.LAUNCH_FAILED, message, instanceId, pid,
                    stopwatch.elapsed());
        }

        boolean degraded = false;
        Optional<WindowInfo> window = correlation.correlate(attempt);
        if (window.isPresent()) {
            instances.attachWindow(instanceId, window.get());
        } else if (attempt.correlationMode() == CorrelationMode.HEURISTIC) {
            if (!attempt.placeholderAllowed()) {
                String message = "No window found for '" + descriptor.name() + "'";
                LOG.error("{} and placeholder is disabled", message);
                instances.markError(instanceId, message, SOURCE);
                audit.record(principal, AuditAction.LAUNCH, descriptor, false, message);
                return LaunchResult.failure(LaunchFailureReason.WINDOW_NOT_FOUND, message, instanceId, pid,
                        stopwatch.elapsed());
            }
            LOG.warn("No window found for '{}', continuing with a placeholder", descriptor.name());
            instances.attachWindow(instanceId, WindowInfo.placeholder(descriptor.name() + " (Android)"));
            degraded = true;
        } else if (attempt.correlationMode() != CorrelationMode.NONE) {
            LOG.debug("No window yet for {}, the refresh loop keeps looking", instanceId);
        }

        if (!instances.transition(instanceId, InstanceState.RUNNING, "launched", SOURCE)) {
            InstanceState state = instances.get(instanceId)
                    .map(InstanceSnapshot::state)
                    .orElse(InstanceState.TERMINATED);
            String message = "'" + descriptor.name() + "' ended during launch (" + state + ")";
            LOG.error(message);
            audit.record(principal, AuditAction.LAUNCH, descriptor, false, message);
            return LaunchResult.failure(LaunchFailureReason.LAUNCH_FAILED, message, instanceId, pid,
                    stopwatch.elapsed());
        }

        if (window.isPresent() && launcher.get() instanceof WindowEventSource) {
            ((WindowEventSource) launcher.get()).watch(instanceId, window.get().handle());
        }

        Duration elapsed = stopwatch.elapsed();
        LOG.info("Launched '{}' as {} in {} ms{}", descriptor.name(), instanceId, elapsed.toMillis(),
                degraded ? " (placeholder window)" : "");
        audit.record(principal, AuditAction.LAUNCH, descriptor, true,
                "instance=" + instanceId + (pid > 0 ? ", pid=" + pid : "") + (degraded ? ", placeholder" : ""));
        return LaunchResult.success(instanceId, pid, elapsed, degraded);
    }

    /**
     * Looks the application up in the catalog and launches it for the
     * current principal.
     */
    public LaunchResult launchById(String descriptorId) {
        Preconditions.checkArgument(descriptorId != null && !descriptorId.isBlank(),
                "descriptorId must not be blank");
        Optional<ApplicationDescriptor> descriptor = catalog.find(descriptorId);
        if (descriptor.isEmpty()) {
            return LaunchResult.failure(LaunchFailureReason.UNKNOWN_APPLICATION,
                    "Unknown application: " + descriptorId, Duration.ZERO);
        }
        return launch(descriptor.get(), principalProvider.currentPrincipal());
    }

    /**
     * Adopts a process that was started outside the launcher. The process
     * must be alive; its main window is looked up once.
     */
    public Optional<InstanceSnapshot> registerExisting(ApplicationDescriptor descriptor, long processId,
            String principal) {
        Preconditions.checkArgument(descriptor != null, "descriptor must not be null");
        Preconditions.checkArgument(principal != null && !principal.isBlank(), "principal must not be blank");
        if (!processMonitor.track(processId)) {
            LOG.warn("Cannot adopt pid {} for '{}': process not alive", processId, descriptor.name());
            return Optional.empty();
        }

        String instanceId = idGenerator.next(descriptor.kind());
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(WindowCorrelationService.META_MODE, CorrelationMode.PROCESS.name().toLowerCase(Locale.ROOT));
        metadata.put("adopted", "true");
        instances.register(instanceId, descriptor, principal, processId, true, metadata);
        windowManager.findMainWindow(processId).ifPresent(w -> instances.attachWindow(instanceId, w));
        instances.transition(instanceId, InstanceState.RUNNING, "adopted running process", SOURCE);
        return instances.get(instanceId);
    }

    // =====================================================================
    // Commands
    // =====================================================================

    /**
     * Brings an instance to the front. Tries the correlated window first,
     * then a fresh window lookup, then the launcher's own reactivation path.
     */
    public boolean switchTo(String instanceId) {
        requireId(instanceId);
        InstanceSnapshot instance = instances.get(instanceId).orElse(null);
        if (instance == null || instance.state().isTerminal()) {
            return false;
        }

        boolean switched = instance.hasRealWindow()
                && windowManager.isWindowValid(instance.window().handle())
                && instances.activate(instanceId);

        CorrelationMode mode = WindowCorrelationService.modeOf(instance);
        if (!switched && (mode == CorrelationMode.PROCESS || mode == CorrelationMode.TITLE)) {
            Optional<WindowInfo> window = correlation.rediscover(instance);
            if (window.isPresent() && instances.attachWindow(instanceId, window.get())) {
                switched = instances.activate(instanceId);
            }
        }

        if (!switched) {
            Optional<Reactivator> reactivator = capability(instance, Reactivator.class);
            if (reactivator.isPresent() && reactivator.get().reactivate(instance)) {
                switched = instances.recordActivation(instanceId, "reactivated", SOURCE);
            }
        }

        if (!switched) {
            LOG.warn("Could not switch to {} '{}'", instanceId, instance.displayName());
        }
        audit.record(instance, AuditAction.SWITCH, switched, null);
        return switched;
    }

    public boolean minimize(String instanceId) {
        requireId(instanceId);
        InstanceSnapshot instance = instances.get(instanceId).orElse(null);
        if (instance == null || instance.state().isTerminal() || !instance.hasRealWindow()) {
            return false;
        }
        if (!windowManager.minimize(instance.window().handle())) {
            return false;
        }
        instances.deactivate(instanceId, "minimized", SOURCE);
        return true;
    }

    /**
     * Asks the instance to close and waits a bounded time. Does not kill
     * when the instance refuses; use {@link #forceTerminate(String)} for
     * that.
     */
    public boolean terminate(String instanceId) {
        requireId(instanceId);
        InstanceSnapshot instance = instances.get(instanceId).orElse(null);
        if (instance == null) {
            return false;
        }
        if (instance.state().isTerminal()) {
            return true;
        }
        Optional<InstanceTerminator> terminator = capability(instance, InstanceTerminator.class);
        boolean closed = terminator.isPresent()
                ? instances.terminate(instanceId, terminator.get(), config.gracefulCloseTimeout())
                : instances.terminate(instanceId);
        audit.record(instance, AuditAction.TERMINATE, closed, null);
        return closed;
    }

    public boolean forceTerminate(String instanceId) {
        requireId(instanceId);
        InstanceSnapshot instance = instances.get(instanceId).orElse(null);
        if (instance == null) {
            return false;
        }
        if (instance.state().isTerminal()) {
            return true;
        }
        Optional<InstanceTerminator> terminator = capability(instance, InstanceTerminator.class);
        boolean killed = terminator.isPresent()
                ? instances.forceTerminate(instanceId, terminator.get(), config.killTimeout())
                : instances.forceTerminate(instanceId);
        audit.record(instance, AuditAction.FORCE_TERMINATE, killed, null);
        return killed;
    }

    /**
     * Gracefully closes every live instance, sharing {@code timeout} across
     * all of them. Instances still alive at the deadline are reported, not
     * killed.
     */
    public ShutdownResult shutdownAll(Duration timeout) {
        Preconditions.checkArgument(timeout != null && !timeout.isNegative(), "timeout must not be negative");
        Stopwatch stopwatch = Stopwatch.createStarted();
        int closed = 0;
        List<String> remaining = new ArrayList<>();

        for (InstanceSnapshot instance : getRunning()) {
            Duration left = timeout.minus(stopwatch.elapsed());
            if (left.isNegative() || left.isZero()) {
                remaining.add(instance.instanceId());
                continue;
            }
            Optional<InstanceTerminator> terminator = capability(instance, InstanceTerminator.class);
            boolean ok = terminator.isPresent()
                    ? instances.terminate(instance.instanceId(), terminator.get(), left)
                    : instances.terminate(instance.instanceId(), left);
            audit.record(instance, AuditAction.TERMINATE, ok, "shutdown");
            if (ok) {
                closed++;
            } else {
                remaining.add(instance.instanceId());
            }
        }

        ShutdownResult result = new ShutdownResult(closed, remaining, stopwatch.elapsed());
        LOG.info("Shutdown closed {} instance(s), {} still running", closed, remaining.size());
        return result;
    }

    // =====================================================================
    // Queries
    // =====================================================================

    public List<InstanceSnapshot> getRunning() {
        return alive(instances.getAll());
    }

    public List<InstanceSnapshot> getRunningForUser(String principal) {
        Preconditions.checkArgument(principal != null && !principal.isBlank(), "principal must not be blank");
        return alive(instances.getForPrincipal(principal));
    }

    public List<InstanceSnapshot> getRunningForCurrentUser() {
        return getRunningForUser(principalProvider.currentPrincipal());
    }

    public Optional<InstanceSnapshot> get(String instanceId) {
        return instances.get(instanceId);
    }

    public boolean isRunning(String descriptorId) {
        return instances.findByDescriptor(descriptorId).stream().anyMatch(i -> i.state().isAlive());
    }

    public int cleanup() {
        return instances.cleanup();
    }

    // =====================================================================
    // Monitoring
    // =====================================================================

    public synchronized void startMonitoring() {
        if (monitoring) {
            return;
        }
        processMonitor.start();
        for (WindowEventSource source : launchers.withCapability(WindowEventSource.class)) {
            source.startWatching();
        }
        refreshLoop.start();
        monitoring = true;
        LOG.info("Lifecycle monitoring started");
    }

    /** Stops every polling loop. Registered instances are left as they are. */
    public synchronized void stopMonitoring() {
        if (!monitoring) {
            return;
        }
        refreshLoop.stop();
        for (WindowEventSource source : launchers.withCapability(WindowEventSource.class)) {
            source.stopWatching();
        }
        processMonitor.stop();
        monitoring = false;
        LOG.info("Lifecycle monitoring stopped");
    }

    public boolean isMonitoring() {
        return monitoring;
    }

    /**
     * One pass of the refresh loop. Public so tests can drive it without
     * waiting for the schedule.
     */
    public void refresh() {
        Optional<WindowHandle> foreground = windowManager.foregroundWindow();
        foreground.ifPresent(instances::reconcileFocus);

        for (InstanceSnapshot instance : getRunning()) {
            CorrelationMode mode = WindowCorrelationService.modeOf(instance);
            if (mode == CorrelationMode.PROCESS && !instance.hasRealWindow() && instance.processId() > 0) {
                windowManager.findMainWindow(instance.processId())
                        .ifPresent(w -> instances.attachWindow(instance.instanceId(), w));
            } else if (mode == CorrelationMode.TITLE) {
                refreshTitleInstance(instance);
            }
        }
        instances.cleanup();
    }

    // -- Internals --

    private void refreshTitleInstance(InstanceSnapshot instance) {
        if (!instance.hasRealWindow()) {
            correlation.rediscover(instance).ifPresent(w -> instances.attachWindow(instance.instanceId(), w));
        } else if (!windowManager.isWindowValid(instance.window().handle())) {
            instances.markTerminated(instance.instanceId(), "window closed", "refresh");
        }
    }

    private void forward(InstanceEvent event) {
        eventExecutor.execute(() -> {
            if (event.type() == InstanceEventType.STOPPED || event.type() == InstanceEventType.ERROR) {
                release(event.instance());
            }
            eventBus.post(event);
        });
    }

    private void release(InstanceSnapshot instance) {
        if (Boolean.parseBoolean(instance.metadata().get(InstanceManager.META_PROCESS_TRACKED))) {
            processMonitor.untrack(instance.processId());
        }
        capability(instance, WindowEventSource.class).ifPresent(source -> source.unwatch(instance.instanceId()));
        correlation.invalidate();
    }

    private <T> Optional<T> capability(InstanceSnapshot instance, Class<T> type) {
        return launchers.find(instance.descriptor()).filter(type::isInstance).map(type::cast);
    }

    private static List<InstanceSnapshot> alive(List<InstanceSnapshot> snapshots) {
        ImmutableList.Builder<InstanceSnapshot> result = ImmutableList.builder();
        for (InstanceSnapshot snapshot : snapshots) {
            if (snapshot.state().isAlive()) {
                result.add(snapshot);
            }
        }
        return result.build();
    }

    private static void requireId(String instanceId) {
        Preconditions.checkArgument(instanceId != null && !instanceId.isBlank(), "instanceId must not be blank");
    }

    private final class ProcessEvents implements ProcessListener {

        @Override
        public void onProcessExited(ProcessExitedEvent event) {
            for (InstanceSnapshot instance : instances.findByProcessId(event.processId())) {
                if (instance.state().isAlive()) {
                    instances.markTerminated(instance.instanceId(), "process exited", "process-monitor");
                }
            }
        }

        @Override
        public void onProcessNotResponding(long processId) {
            for (InstanceSnapshot instance : instances.findByProcessId(processId)) {
                instances.transition(instance.instanceId(), InstanceState.NOT_RESPONDING, "process hung",
                        "process-monitor");
            }
        }

        @Override
        public void onProcessResponding(long processId) {
            for (InstanceSnapshot instance : instances.findByProcessId(processId)) {
                if (instance.state() == InstanceState.NOT_RESPONDING) {
                    instances.transition(instance.instanceId(), InstanceState.RUNNING, "process recovered",
                            "process-monitor");
                }
            }
        }
    }

    private final class WindowEvents implements WindowEventListener {

        @Override
        public void onWindowActivated(String instanceId) {
            correlation.invalidate();
            instances.recordActivation(instanceId, "window focused", "window-watcher");
        }

        @Override
        public void onWindowClosed(String instanceId) {
            correlation.invalidate();
            instances.markTerminated(instanceId, "window closed", "window-watcher");
        }
    }
}
