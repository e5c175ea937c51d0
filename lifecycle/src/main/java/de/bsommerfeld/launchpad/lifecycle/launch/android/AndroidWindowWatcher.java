package de.bsommerfeld.launchpad.lifecycle.launch.android;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.MonitoringConfig;
import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.core.util.PollingLoop;
import de.bsommerfeld.launchpad.lifecycle.launch.WindowEventListener;
import de.bsommerfeld.launchpad.platform.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Polls the windows of Android instances. All Android apps share the
 * subsystem's host process, so exit cannot be detected through a pid; a
 * window that is no longer valid is reported as closed instead. Focus
 * changes are reported when a watched window becomes the foreground window.
 */
@Singleton
public class AndroidWindowWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AndroidWindowWatcher.class);

    private final WindowManager windowManager;
    private final PollingLoop loop;
    private final Map<String, Watched> watched = new ConcurrentHashMap<>();
    private final List<WindowEventListener> listeners = new CopyOnWriteArrayList<>();

    @Inject
    public AndroidWindowWatcher(WindowManager windowManager, MonitoringConfig config) {
        this(windowManager, config.windowWatchInterval());
    }

    public AndroidWindowWatcher(WindowManager windowManager, Duration interval) {
        this.windowManager = windowManager;
        this.loop = new PollingLoop("android-window-watcher", interval, this::poll);
    }

    public void watch(String instanceId, WindowHandle handle) {
        if (handle.isNone()) {
            LOG.debug("Not watching placeholder window of {}", instanceId);
            return;
        }
        watched.put(instanceId, new Watched(handle));
        LOG.debug("Watching window {} of {}", handle, instanceId);
    }

    public void unwatch(String instanceId) {
        watched.remove(instanceId);
    }

    public boolean isWatching(String instanceId) {
        return watched.containsKey(instanceId);
    }

    public void start() {
        loop.start();
    }

    public void stop() {
        loop.stop();
    }

    public boolean isRunning() {
        return loop.isRunning();
    }

    public void addListener(WindowEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(WindowEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * One watch tick. Public so it can be driven synchronously.
     */
    public void poll() {
        for (Map.Entry<String, Watched> entry : watched.entrySet()) {
            String instanceId = entry.getKey();
            Watched window = entry.getValue();

            if (!windowManager.isWindowValid(window.handle)) {
                if (watched.remove(instanceId, window)) {
                    LOG.info("Android window {} of {} closed", window.handle, instanceId);
                    fire(l -> l.onWindowClosed(instanceId));
                }
                continue;
            }

            boolean foreground = windowManager.isForeground(window.handle);
            if (foreground && !window.foreground) {
                fire(l -> l.onWindowActivated(instanceId));
            }
            window.foreground = foreground;
        }
    }

    private void fire(Consumer<WindowEventListener> action) {
        for (WindowEventListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                LOG.error("Window event listener {} failed", listener.getClass().getName(), e);
            }
        }
    }

    private static final class Watched {
        private final WindowHandle handle;
        private volatile boolean foreground;

        private Watched(WindowHandle handle) {
            this.handle = handle;
        }
    }
}
