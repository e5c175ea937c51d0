package de.bsommerfeld.launchpad.lifecycle;

import com.google.common.eventbus.Subscribe;
import com.google.common.util.concurrent.MoreExecutors;
import de.bsommerfeld.launchpad.core.config.CorrelationConfig;
import de.bsommerfeld.launchpad.core.config.MonitoringConfig;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.InstanceState;
import de.bsommerfeld.launchpad.core.domain.LaunchFailureReason;
import de.bsommerfeld.launchpad.core.domain.LaunchResult;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import de.bsommerfeld.launchpad.core.event.ApplicationEventBus;
import de.bsommerfeld.launchpad.core.event.InstanceEvent;
import de.bsommerfeld.launchpad.core.event.InstanceEventType;
import de.bsommerfeld.launchpad.core.spi.ApplicationCatalog;
import de.bsommerfeld.launchpad.core.spi.AuditAction;
import de.bsommerfeld.launchpad.core.spi.AuditEntry;
import de.bsommerfeld.launchpad.core.spi.AuditSink;
import de.bsommerfeld.launchpad.lifecycle.audit.AuditRecorder;
import de.bsommerfeld.launchpad.lifecycle.correlation.AndroidWindowCorrelator;
import de.bsommerfeld.launchpad.lifecycle.correlation.WindowCorrelationService;
import de.bsommerfeld.launchpad.lifecycle.instance.InstanceIdGenerator;
import de.bsommerfeld.launchpad.lifecycle.instance.InstanceManager;
import de.bsommerfeld.launchpad.lifecycle.instance.ProcessTerminator;
import de.bsommerfeld.launchpad.lifecycle.launch.ApplicationLauncher;
import de.bsommerfeld.launchpad.lifecycle.launch.CorrelationMode;
import de.bsommerfeld.launchpad.lifecycle.launch.LaunchAttempt;
import de.bsommerfeld.launchpad.lifecycle.launch.LaunchException;
import de.bsommerfeld.launchpad.lifecycle.launch.LauncherRegistry;
import de.bsommerfeld.launchpad.lifecycle.launch.Reactivator;
import de.bsommerfeld.launchpad.lifecycle.testing.FakeProcessMonitor;
import de.bsommerfeld.launchpad.lifecycle.testing.FakeWindowManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.any;

class LifecycleOrchestratorTest {

    private static final ApplicationDescriptor EDITOR = new ApplicationDescriptor("editor", "Editor",
            ApplicationKind.NATIVE_PROCESS, "editor.exe", "");
    private static final ApplicationDescriptor MAPS = new ApplicationDescriptor("maps", "Maps",
            ApplicationKind.ANDROID_PACKAGE, "com.google.maps", "");
    private static final ApplicationDescriptor WIKI = new ApplicationDescriptor("wiki", "Wiki",
            ApplicationKind.WEB_PAGE, "wiki.example.com", "", "", "", false);

    private FakeProcessMonitor processes;
    private FakeWindowManager windows;
    private InstanceManager instances;
    private NativeStub nativeLauncher;
    private AndroidStub androidLauncher;
    private WebStub webLauncher;
    private AuditSink auditSink;
    private ApplicationCatalog catalog;
    private EventCollector collector;
    private LifecycleOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        processes = new FakeProcessMonitor();
        windows = new FakeWindowManager();
        MonitoringConfig monitoring = new MonitoringConfig();
        CorrelationConfig correlationConfig = new CorrelationConfig();
        correlationConfig.setAttemptDelayMillis(5);
        correlationConfig.setProcessWindowTimeoutMillis(10);
        correlationConfig.setAttempts(2);

        instances = new InstanceManager(windows, new ProcessTerminator(processes, windows), monitoring,
                Clock.systemUTC());
        nativeLauncher = new NativeStub();
        androidLauncher = new AndroidStub();
        webLauncher = new WebStub();
        auditSink = mock(AuditSink.class);
        catalog = mock(ApplicationCatalog.class);
        ApplicationEventBus eventBus = new ApplicationEventBus();
        collector = new EventCollector();
        eventBus.register(collector);

        orchestrator = new LifecycleOrchestrator(
                new LauncherRegistry(List.<ApplicationLauncher>of(nativeLauncher, androidLauncher, webLauncher)),
                instances,
                new WindowCorrelationService(windows, new AndroidWindowCorrelator(windows, correlationConfig),
                        correlationConfig),
                processes,
                windows,
                eventBus,
                new AuditRecorder(auditSink),
                catalog,
                () -> "alice",
                monitoring,
                new InstanceIdGenerator(),
                MoreExecutors.directExecutor());
    }

    @AfterEach
    void tearDown() {
        orchestrator.stopMonitoring();
    }

    // -- Launch --

    @Test
    void launch_shouldRegisterRunningInstanceAndPublishStartedOnce() {
        nativeLauncher.windowTitle = "Editor - untitled";

        LaunchResult result = orchestrator.launch(EDITOR, "alice");

        assertTrue(result.isSuccess());
        assertFalse(result.isDegraded());
        String id = result.getInstanceId().orElseThrow();
        InstanceSnapshot instance = orchestrator.get(id).orElseThrow();
        assertEquals(InstanceState.RUNNING, instance.state());
        assertTrue(instance.hasRealWindow());
        assertEquals(1, orchestrator.getRunning().size());
        assertEquals(1, collector.count(id, InstanceEventType.STARTED));
        assertTrue(processes.trackedProcesses().contains(result.getProcessId().orElseThrow()));
    }

    @Test
    void launch_shouldFailWithoutSuitableLauncher() {
        ApplicationDescriptor folder = new ApplicationDescriptor("docs", "Docs", ApplicationKind.FOLDER, "C:\\Docs",
                "");

        LaunchResult result = orchestrator.launch(folder, "alice");

        assertFalse(result.isSuccess());
        assertEquals(Optional.of(LaunchFailureReason.NO_SUITABLE_LAUNCHER), result.getFailureReason());
        assertTrue(orchestrator.getRunning().isEmpty());
    }

    @Test
    void launch_shouldConvertLauncherExceptionsToFailedResult() {
        nativeLauncher.failure = new LaunchException("Executable not found: editor.exe");
        LaunchResult checked = orchestrator.launch(EDITOR, "alice");

        nativeLauncher.failure = new IllegalStateException("unexpected");
        LaunchResult unchecked = orchestrator.launch(EDITOR, "alice");

        assertEquals(Optional.of(LaunchFailureReason.LAUNCH_FAILED), checked.getFailureReason());
        assertEquals(Optional.of("Executable not found: editor.exe"), checked.getErrorMessage());
        assertEquals(Optional.of("unexpected"), unchecked.getErrorMessage());
        assertTrue(instances.getAll().isEmpty());
    }

    @Test
    void launch_shouldRejectInvalidArgumentsBeforeAnySideEffect() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.launch(null, "alice"));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.launch(EDITOR, " "));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.launch(EDITOR, null));

        assertEquals(0, nativeLauncher.invocations.get());
        assertTrue(collector.events.isEmpty());
    }

    @Test
    void launch_shouldReuseRunningSingleInstance() {
        nativeLauncher.windowTitle = "Editor";
        LaunchResult first = orchestrator.launch(EDITOR, "alice");

        LaunchResult second = orchestrator.launch(EDITOR, "alice");

        assertTrue(second.isAlreadyRunning());
        assertEquals(first.getInstanceId(), second.getInstanceId());
        assertEquals(1, nativeLauncher.invocations.get());
        assertEquals(InstanceState.ACTIVE, orchestrator.get(first.getInstanceId().orElseThrow()).orElseThrow().state());
    }

    @Test
    void launch_shouldStartSeparateInstancesForOtherPrincipals() {
        LaunchResult alice = orchestrator.launch(EDITOR, "alice");
        LaunchResult bob = orchestrator.launch(EDITOR, "bob");

        assertFalse(bob.isAlreadyRunning());
        assertNotEquals(alice.getInstanceId(), bob.getInstanceId());
        assertEquals(1, orchestrator.getRunningForUser("bob").size());
    }

    @Test
    void launch_shouldFailWhenProcessExitsBeforeTracking() {
        nativeLauncher.exitImmediately = true;

        LaunchResult result = orchestrator.launch(EDITOR, "alice");

        assertFalse(result.isSuccess());
        assertEquals(Optional.of(LaunchFailureReason.LAUNCH_FAILED), result.getFailureReason());
        String id = result.getInstanceId().orElseThrow();
        assertEquals(InstanceState.TERMINATED, orchestrator.get(id).orElseThrow().state());
    }

    @Test
    void launch_shouldFailWhenProcessExitsDuringCorrelation() {
        windows.setLookupHook(pid -> processes.exit(pid));

        LaunchResult result = orchestrator.launch(EDITOR, "alice");

        assertFalse(result.isSuccess());
        assertEquals(Optional.of(LaunchFailureReason.LAUNCH_FAILED), result.getFailureReason());
        String id = result.getInstanceId().orElseThrow();
        assertEquals(InstanceState.TERMINATED, orchestrator.get(id).orElseThrow().state());
        assertEquals(1, collector.count(id, InstanceEventType.STOPPED));
        assertTrue(orchestrator.getRunning().isEmpty());
    }

    @Test
    void launch_shouldStartSingleInstanceOnceUnderConcurrentLaunches() throws Exception {
        nativeLauncher.launchDelayMillis = 200;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Callable<LaunchResult>> tasks = List.of(
                    () -> orchestrator.launch(EDITOR, "alice"),
                    () -> orchestrator.launch(EDITOR, "alice"));
            List<LaunchResult> results = new ArrayList<>();
            for (Future<LaunchResult> future : pool.invokeAll(tasks)) {
                results.add(future.get());
            }

            assertEquals(1, nativeLauncher.invocations.get());
            assertEquals(1, orchestrator.getRunningForUser("alice").size());
            assertTrue(results.stream().allMatch(LaunchResult::isSuccess));
            assertEquals(1, results.stream().filter(LaunchResult::isAlreadyRunning).count());
            assertEquals(results.get(0).getInstanceId(), results.get(1).getInstanceId());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void launch_shouldNotSerializeDifferentPrincipals() throws Exception {
        nativeLauncher.launchDelayMillis = 50;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Callable<LaunchResult>> tasks = List.of(
                    () -> orchestrator.launch(EDITOR, "alice"),
                    () -> orchestrator.launch(EDITOR, "bob"));
            for (Future<LaunchResult> future : pool.invokeAll(tasks)) {
                assertFalse(future.get().isAlreadyRunning());
            }

            assertEquals(2, nativeLauncher.invocations.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void launch_shouldDegradeToPlaceholderWhenAndroidWindowMissing() {
        LaunchResult result = orchestrator.launch(MAPS, "alice");

        assertTrue(result.isSuccess());
        assertTrue(result.isDegraded());
        InstanceSnapshot instance = orchestrator.get(result.getInstanceId().orElseThrow()).orElseThrow();
        assertEquals(InstanceState.RUNNING, instance.state());
        assertTrue(instance.hasPlaceholderWindow());
        assertEquals("Maps (Android)", instance.window().title());
    }

    @Test
    void launch_shouldReportWindowNotFoundWhenPlaceholderDisabled() {
        androidLauncher.placeholderAllowed = false;

        LaunchResult result = orchestrator.launch(MAPS, "alice");

        assertFalse(result.isSuccess());
        assertEquals(Optional.of(LaunchFailureReason.WINDOW_NOT_FOUND), result.getFailureReason());
        String id = result.getInstanceId().orElseThrow();
        assertEquals(InstanceState.ERROR, orchestrator.get(id).orElseThrow().state());
        assertEquals(1, collector.count(id, InstanceEventType.ERROR));
    }

    @Test
    void launch_shouldCorrelateAndroidWindowByTitle() {
        windows.addWindow("Other", 3, "ApplicationFrameWindow", Instant.now().minusSeconds(5));
        WindowInfo maps = windows.addWindow("Maps", 3, "ApplicationFrameWindow", Instant.now());

        LaunchResult result = orchestrator.launch(MAPS, "alice");

        assertFalse(result.isDegraded());
        assertEquals(maps, orchestrator.get(result.getInstanceId().orElseThrow()).orElseThrow().window());
    }

    @Test
    void launch_shouldAssignDistinctIdsUnderConcurrency() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<LaunchResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> orchestrator.launch(WIKI, "alice"));
            }
            Set<String> ids = new HashSet<>();
            for (Future<LaunchResult> future : pool.invokeAll(tasks)) {
                ids.add(future.get().getInstanceId().orElseThrow());
            }

            assertEquals(64, ids.size());
            assertEquals(64, instances.getAll().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void launchById_shouldResolveCatalogEntryForCurrentPrincipal() {
        when(catalog.find("editor")).thenReturn(Optional.of(EDITOR));

        LaunchResult result = orchestrator.launchById("editor");

        assertTrue(result.isSuccess());
        assertEquals("alice", orchestrator.get(result.getInstanceId().orElseThrow()).orElseThrow().principal());
        assertEquals(1, orchestrator.getRunningForCurrentUser().size());
    }

    @Test
    void launchById_shouldReportUnknownApplication() {
        when(catalog.find("nope")).thenReturn(Optional.empty());

        LaunchResult result = orchestrator.launchById("nope");

        assertEquals(Optional.of(LaunchFailureReason.UNKNOWN_APPLICATION), result.getFailureReason());
    }

    // -- Monitoring driven transitions --

    @Test
    void processExit_shouldTerminateInstanceAndPublishStoppedOnce() {
        LaunchResult result = orchestrator.launch(EDITOR, "alice");
        String id = result.getInstanceId().orElseThrow();
        long pid = result.getProcessId().orElseThrow();

        processes.exit(pid);
        processes.exit(pid);

        assertEquals(InstanceState.TERMINATED, orchestrator.get(id).orElseThrow().state());
        assertEquals(1, collector.count(id, InstanceEventType.STOPPED));
        assertFalse(processes.trackedProcesses().contains(pid));
        assertFalse(orchestrator.isRunning("editor"));
    }

    @Test
    void processHang_shouldMoveToNotRespondingAndBack() {
        LaunchResult result = orchestrator.launch(EDITOR, "alice");
        String id = result.getInstanceId().orElseThrow();
        long pid = result.getProcessId().orElseThrow();

        processes.hang(pid);
        assertEquals(InstanceState.NOT_RESPONDING, orchestrator.get(id).orElseThrow().state());

        processes.recover(pid);
        assertEquals(InstanceState.RUNNING, orchestrator.get(id).orElseThrow().state());
    }

    @Test
    void refresh_shouldAttachLateWindow() {
        LaunchResult result = orchestrator.launch(EDITOR, "alice");
        String id = result.getInstanceId().orElseThrow();
        assertNull(orchestrator.get(id).orElseThrow().window());

        windows.addWindow("Editor", result.getProcessId().orElseThrow(), "EditorFrame", Instant.now());
        orchestrator.refresh();

        assertTrue(orchestrator.get(id).orElseThrow().hasRealWindow());
    }

    @Test
    void stopMonitoring_shouldLeaveInstancesUntouched() {
        orchestrator.startMonitoring();
        orchestrator.startMonitoring();
        LaunchResult result = orchestrator.launch(EDITOR, "alice");
        assertTrue(orchestrator.isMonitoring());
        assertTrue(processes.isRunning());

        orchestrator.stopMonitoring();
        orchestrator.stopMonitoring();

        assertFalse(orchestrator.isMonitoring());
        assertFalse(processes.isRunning());
        assertEquals(InstanceState.RUNNING,
                orchestrator.get(result.getInstanceId().orElseThrow()).orElseThrow().state());
    }

    // -- Commands --

    @Test
    void switchTo_shouldActivateRealWindow() {
        nativeLauncher.windowTitle = "Editor";
        String id = orchestrator.launch(EDITOR, "alice").getInstanceId().orElseThrow();

        assertTrue(orchestrator.switchTo(id));

        assertEquals(InstanceState.ACTIVE, orchestrator.get(id).orElseThrow().state());
        assertEquals(1, collector.count(id, InstanceEventType.ACTIVATED));
    }

    @Test
    void switchTo_shouldUseReactivatorForPlaceholder() {
        String id = orchestrator.launch(MAPS, "alice").getInstanceId().orElseThrow();

        assertTrue(orchestrator.switchTo(id));

        assertEquals(1, androidLauncher.reactivations.get());
        assertEquals(1, collector.count(id, InstanceEventType.ACTIVATED));
    }

    @Test
    void switchTo_shouldRediscoverMissingProcessWindow() {
        LaunchResult result = orchestrator.launch(EDITOR, "alice");
        String id = result.getInstanceId().orElseThrow();
        windows.addWindow("Editor", result.getProcessId().orElseThrow(), "EditorFrame", Instant.now());

        assertTrue(orchestrator.switchTo(id));
        assertTrue(orchestrator.get(id).orElseThrow().hasRealWindow());
    }

    @Test
    void commands_shouldReturnFalseForUnknownInstances() {
        assertFalse(orchestrator.switchTo("native-404"));
        assertFalse(orchestrator.minimize("native-404"));
        assertFalse(orchestrator.terminate("native-404"));
        assertFalse(orchestrator.forceTerminate("native-404"));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.switchTo(""));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.terminate(null));
    }

    @Test
    void minimize_shouldDeactivateInstance() {
        nativeLauncher.windowTitle = "Editor";
        String id = orchestrator.launch(EDITOR, "alice").getInstanceId().orElseThrow();
        orchestrator.switchTo(id);

        assertTrue(orchestrator.minimize(id));
        assertEquals(InstanceState.INACTIVE, orchestrator.get(id).orElseThrow().state());
    }

    @Test
    void terminate_shouldCloseWindowAndEndInstance() {
        nativeLauncher.windowTitle = "Editor";
        String id = orchestrator.launch(EDITOR, "alice").getInstanceId().orElseThrow();

        assertTrue(orchestrator.terminate(id));
        assertTrue(orchestrator.terminate(id));

        assertEquals(InstanceState.TERMINATED, orchestrator.get(id).orElseThrow().state());
        assertEquals(1, windows.closeRequests().size());
        assertEquals(1, collector.count(id, InstanceEventType.STOPPED));
    }

    @Test
    void terminate_shouldNotEscalateWhenCloseIsIgnored() {
        nativeLauncher.windowTitle = "Editor";
        LaunchResult result = orchestrator.launch(EDITOR, "alice");
        String id = result.getInstanceId().orElseThrow();
        processes.setCloseSucceeds(false);
        windows.setCloseRemovesWindow(false);

        assertFalse(orchestrator.terminate(id));

        assertEquals(InstanceState.RUNNING, orchestrator.get(id).orElseThrow().state());
        assertTrue(processes.isAlive(result.getProcessId().orElseThrow()));
    }

    @Test
    void forceTerminate_shouldKillProcess() {
        LaunchResult result = orchestrator.launch(EDITOR, "alice");
        String id = result.getInstanceId().orElseThrow();
        processes.setCloseSucceeds(false);

        assertTrue(orchestrator.forceTerminate(id));

        assertEquals(InstanceState.TERMINATED, orchestrator.get(id).orElseThrow().state());
        assertFalse(processes.isAlive(result.getProcessId().orElseThrow()));
    }

    @Test
    void terminate_shouldEndWebPageWithoutProcess() {
        String id = orchestrator.launch(WIKI, "alice").getInstanceId().orElseThrow();

        assertTrue(orchestrator.terminate(id));
        assertEquals(InstanceState.TERMINATED, orchestrator.get(id).orElseThrow().state());
    }

    @Test
    void shutdownAll_shouldCloseEveryLiveInstance() {
        orchestrator.launch(EDITOR, "alice");
        orchestrator.launch(WIKI, "bob");

        ShutdownResult result = orchestrator.shutdownAll(Duration.ofSeconds(5));

        assertTrue(result.isComplete());
        assertEquals(2, result.closed());
        assertTrue(orchestrator.getRunning().isEmpty());
    }

    @Test
    void registerExisting_shouldAdoptOnlyLiveProcesses() {
        processes.spawn(4711);
        windows.addWindow("Legacy Tool", 4711, "LegacyFrame", Instant.now());

        Optional<InstanceSnapshot> adopted = orchestrator.registerExisting(EDITOR, 4711, "alice");
        Optional<InstanceSnapshot> dead = orchestrator.registerExisting(EDITOR, 4712, "alice");

        assertEquals(InstanceState.RUNNING, adopted.orElseThrow().state());
        assertTrue(adopted.get().hasRealWindow());
        assertTrue(dead.isEmpty());
    }

    @Test
    void cleanup_shouldKeepRecentlyEndedInstances() {
        LaunchResult result = orchestrator.launch(EDITOR, "alice");
        processes.exit(result.getProcessId().orElseThrow());

        assertEquals(0, orchestrator.cleanup());
        assertTrue(orchestrator.get(result.getInstanceId().orElseThrow()).isPresent());
    }

    // -- Audit --

    @Test
    void launch_shouldRecordAuditEntry() {
        orchestrator.launch(EDITOR, "alice");

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditSink, atLeastOnce()).record(captor.capture());
        AuditEntry entry = captor.getAllValues().get(0);
        assertEquals(AuditAction.LAUNCH, entry.action());
        assertEquals("alice", entry.principal());
        assertEquals("editor", entry.descriptorId());
        assertTrue(entry.success());
    }

    @Test
    void launch_shouldSucceedWhenAuditSinkFails() {
        doThrow(new IllegalStateException("disk full")).when(auditSink).record(any());

        assertTrue(orchestrator.launch(EDITOR, "alice").isSuccess());
    }

    // -- Test doubles --

    static class EventCollector {

        final List<InstanceEvent> events = Collections.synchronizedList(new ArrayList<>());

        @Subscribe
        public void onInstanceEvent(InstanceEvent event) {
            events.add(event);
        }

        long count(String instanceId, InstanceEventType type) {
            synchronized (events) {
                return events.stream().filter(e -> e.instanceId().equals(instanceId) && e.type() == type).count();
            }
        }
    }

    private class NativeStub implements ApplicationLauncher {

        final AtomicInteger invocations = new AtomicInteger();
        final AtomicLong nextPid = new AtomicLong(1000);
        volatile Exception failure;
        volatile String windowTitle;
        volatile boolean exitImmediately;
        volatile long launchDelayMillis;

        @Override
        public ApplicationKind supportedKind() {
            return ApplicationKind.NATIVE_PROCESS;
        }

        @Override
        public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) throws LaunchException {
            invocations.incrementAndGet();
            if (launchDelayMillis > 0) {
                try {
                    Thread.sleep(launchDelayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failure instanceof LaunchException) {
                throw (LaunchException) failure;
            }
            if (failure instanceof RuntimeException) {
                throw (RuntimeException) failure;
            }
            long pid = nextPid.getAndIncrement();
            if (!exitImmediately) {
                processes.spawn(pid);
            }
            if (windowTitle != null) {
                windows.addWindow(windowTitle, pid, "EditorFrame", Instant.now());
            }
            return LaunchAttempt.builder(CorrelationMode.PROCESS)
                    .process(pid, true)
                    .windowHint(descriptor.name())
                    .build();
        }
    }

    private static class AndroidStub implements ApplicationLauncher, Reactivator {

        final AtomicInteger reactivations = new AtomicInteger();
        volatile boolean placeholderAllowed = true;

        @Override
        public ApplicationKind supportedKind() {
            return ApplicationKind.ANDROID_PACKAGE;
        }

        @Override
        public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) {
            return LaunchAttempt.builder(CorrelationMode.HEURISTIC)
                    .windowHint(descriptor.name())
                    .launchedAt(Instant.now())
                    .correlationAttempts(1)
                    .placeholderAllowed(placeholderAllowed)
                    .build();
        }

        @Override
        public boolean reactivate(InstanceSnapshot instance) {
            reactivations.incrementAndGet();
            return true;
        }
    }

    private static class WebStub implements ApplicationLauncher {

        @Override
        public ApplicationKind supportedKind() {
            return ApplicationKind.WEB_PAGE;
        }

        @Override
        public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) {
            return LaunchAttempt.builder(CorrelationMode.NONE).windowHint(descriptor.name()).build();
        }
    }
}
