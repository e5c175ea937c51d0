package de.bsommerfeld.launchpad.lifecycle.instance;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.lifecycle.launch.InstanceTerminator;
import de.bsommerfeld.launchpad.platform.process.ProcessMonitor;
import de.bsommerfeld.launchpad.platform.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Default way of closing an instance, used when its launcher has no
 * {@link InstanceTerminator} of its own.
 *
 * <ul>
 * <li>with a real window: ask the window to close, then wait for the owned
 * process to exit (or for the window to disappear)</li>
 * <li>with only an owned process: ask the process to exit</li>
 * <li>with neither (a page in the shared browser): nothing to close</li>
 * </ul>
 * Processes the instance does not own are never signalled.
 */
@Singleton
public class ProcessTerminator implements InstanceTerminator {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessTerminator.class);
    private static final long WINDOW_POLL_MILLIS = 200;

    private final ProcessMonitor processMonitor;
    private final WindowManager windowManager;

    @Inject
    public ProcessTerminator(ProcessMonitor processMonitor, WindowManager windowManager) {
        this.processMonitor = processMonitor;
        this.windowManager = windowManager;
    }

    @Override
    public boolean requestClose(InstanceSnapshot instance, Duration timeout) {
        long pid = ownedPid(instance);

        if (instance.hasRealWindow() && windowManager.closeWindow(instance.window().handle())) {
            LOG.debug("Sent close request to window {} of {}", instance.window().handle(), instance.instanceId());
            return pid > 0
                    ? processMonitor.awaitExit(pid, timeout)
                    : awaitWindowGone(instance.window().handle(), timeout);
        }
        if (pid > 0) {
            return processMonitor.closeGracefully(pid, timeout);
        }
        LOG.debug("{} owns no window or process, nothing to close", instance.instanceId());
        return true;
    }

    @Override
    public boolean kill(InstanceSnapshot instance, Duration timeout) {
        long pid = ownedPid(instance);
        if (pid > 0) {
            return processMonitor.kill(pid, timeout);
        }
        if (instance.hasRealWindow()) {
            windowManager.closeWindow(instance.window().handle());
            return awaitWindowGone(instance.window().handle(), timeout);
        }
        return true;
    }

    private long ownedPid(InstanceSnapshot instance) {
        return Boolean.parseBoolean(instance.metadata().get(InstanceManager.META_PROCESS_TRACKED))
                ? instance.processId()
                : 0;
    }

    private boolean awaitWindowGone(WindowHandle handle, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (windowManager.isWindowValid(handle)) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(WINDOW_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return !windowManager.isWindowValid(handle);
            }
        }
        return true;
    }
}
