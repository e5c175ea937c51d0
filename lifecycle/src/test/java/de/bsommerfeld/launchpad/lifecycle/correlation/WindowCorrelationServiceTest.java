package de.bsommerfeld.launchpad.lifecycle.correlation;

import de.bsommerfeld.launchpad.core.config.CorrelationConfig;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.InstanceState;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import de.bsommerfeld.launchpad.lifecycle.launch.CorrelationMode;
import de.bsommerfeld.launchpad.lifecycle.launch.LaunchAttempt;
import de.bsommerfeld.launchpad.lifecycle.testing.FakeWindowManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WindowCorrelationServiceTest {

    private FakeWindowManager windows;
    private WindowCorrelationService service;

    @BeforeEach
    void setUp() {
        CorrelationConfig config = new CorrelationConfig();
        config.setAttemptDelayMillis(10);
        config.setProcessWindowTimeoutMillis(30);
        windows = new FakeWindowManager();
        service = new WindowCorrelationService(windows, new AndroidWindowCorrelator(windows, config), config);
    }

    @Test
    void correlate_shouldFindMainWindowOfProcess() {
        WindowInfo window = windows.addWindow("Editor", 42, "Notepad", Instant.now());
        LaunchAttempt attempt = LaunchAttempt.builder(CorrelationMode.PROCESS).process(42, true).build();

        assertEquals(Optional.of(window), service.correlate(attempt));
    }

    @Test
    void correlate_shouldMatchTitleWithinClassFilter() {
        windows.addWindow("Reports - Notepad", 9, "Notepad", Instant.now());
        WindowInfo folder = windows.addWindow("Reports", 9, "CabinetWClass", Instant.now());
        LaunchAttempt attempt = LaunchAttempt.builder(CorrelationMode.TITLE)
                .windowHint("reports")
                .windowClasses(List.of("CabinetWClass"))
                .build();

        assertEquals(Optional.of(folder), service.correlate(attempt));
    }

    @Test
    void correlate_shouldGiveUpAfterConfiguredAttempts() {
        LaunchAttempt attempt = LaunchAttempt.builder(CorrelationMode.HEURISTIC)
                .windowHint("Maps")
                .correlationAttempts(2)
                .build();

        assertTrue(service.correlate(attempt).isEmpty());
    }

    @Test
    void correlate_shouldReturnEmptyForNoneMode() {
        windows.addWindow("Anything", 1, "X", Instant.now());

        assertTrue(service.correlate(LaunchAttempt.builder(CorrelationMode.NONE).build()).isEmpty());
    }

    @Test
    void modeOf_shouldReadMetadataAndDefaultToNone() {
        assertEquals(CorrelationMode.TITLE, WindowCorrelationService.modeOf(snapshot(Map.of(
                WindowCorrelationService.META_MODE, "title"))));
        assertEquals(CorrelationMode.NONE, WindowCorrelationService.modeOf(snapshot(Map.of())));
        assertEquals(CorrelationMode.NONE, WindowCorrelationService.modeOf(snapshot(Map.of(
                WindowCorrelationService.META_MODE, "bogus"))));
    }

    @Test
    void rediscover_shouldUseHintForTitleInstances() {
        WindowInfo folder = windows.addWindow("Invoices", 9, "CabinetWClass", Instant.now());

        Optional<WindowInfo> found = service.rediscover(snapshot(Map.of(
                WindowCorrelationService.META_MODE, "title",
                WindowCorrelationService.META_HINT, "Invoices")));

        assertEquals(Optional.of(folder), found);
    }

    private static InstanceSnapshot snapshot(Map<String, String> metadata) {
        ApplicationDescriptor descriptor = new ApplicationDescriptor("invoices", "Invoices", ApplicationKind.FOLDER,
                "C:\\Invoices", "");
        Instant now = Instant.now();
        return new InstanceSnapshot("folder-1", descriptor, "alice", 0, null, InstanceState.RUNNING, now, now, null,
                metadata, null);
    }
}
