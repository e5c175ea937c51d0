package de.bsommerfeld.launchpad.lifecycle.launch.android;

import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import de.bsommerfeld.launchpad.lifecycle.launch.WindowEventListener;
import de.bsommerfeld.launchpad.lifecycle.testing.FakeWindowManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AndroidWindowWatcherTest {

    private FakeWindowManager windows;
    private AndroidWindowWatcher watcher;
    private final List<String> activated = new ArrayList<>();
    private final List<String> closed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        windows = new FakeWindowManager();
        watcher = new AndroidWindowWatcher(windows, Duration.ofMillis(50));
        watcher.addListener(new WindowEventListener() {
            @Override
            public void onWindowActivated(String instanceId) {
                activated.add(instanceId);
            }

            @Override
            public void onWindowClosed(String instanceId) {
                closed.add(instanceId);
            }
        });
    }

    @Test
    void poll_shouldReportClosedWindowOnce() {
        WindowInfo window = windows.addWindow("Maps", 7, "ApplicationFrameWindow", Instant.now());
        watcher.watch("android-1", window.handle());

        windows.removeWindow(window.handle());
        watcher.poll();
        watcher.poll();

        assertEquals(List.of("android-1"), closed);
        assertFalse(watcher.isWatching("android-1"));
    }

    @Test
    void poll_shouldReportActivationOnlyOnFocusGain() {
        WindowInfo window = windows.addWindow("Maps", 7, "ApplicationFrameWindow", Instant.now());
        watcher.watch("android-1", window.handle());

        windows.setForeground(window.handle());
        watcher.poll();
        watcher.poll();
        windows.setForeground(null);
        watcher.poll();
        windows.setForeground(window.handle());
        watcher.poll();

        assertEquals(List.of("android-1", "android-1"), activated);
    }

    @Test
    void watch_shouldIgnorePlaceholderHandle() {
        watcher.watch("android-1", WindowHandle.NONE);

        assertFalse(watcher.isWatching("android-1"));
    }

    @Test
    void poll_shouldSurviveFailingListener() {
        WindowInfo window = windows.addWindow("Maps", 7, "ApplicationFrameWindow", Instant.now());
        watcher.watch("android-1", window.handle());
        watcher.addListener(new WindowEventListener() {
            @Override
            public void onWindowActivated(String instanceId) {
            }

            @Override
            public void onWindowClosed(String instanceId) {
                throw new IllegalStateException("listener failure");
            }
        });

        windows.removeWindow(window.handle());
        watcher.poll();

        assertEquals(List.of("android-1"), closed);
    }

    @Test
    void startAndStop_shouldBeIdempotent() {
        watcher.start();
        watcher.start();
        assertTrue(watcher.isRunning());

        watcher.stop();
        watcher.stop();
        assertFalse(watcher.isRunning());
    }
}
