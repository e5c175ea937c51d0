package de.bsommerfeld.launchpad.lifecycle.launch.android;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.CorrelationConfig;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.lifecycle.launch.ApplicationLauncher;
import de.bsommerfeld.launchpad.lifecycle.launch.CorrelationMode;
import de.bsommerfeld.launchpad.lifecycle.launch.InstanceTerminator;
import de.bsommerfeld.launchpad.lifecycle.launch.LaunchAttempt;
import de.bsommerfeld.launchpad.lifecycle.launch.LaunchException;
import de.bsommerfeld.launchpad.lifecycle.launch.Reactivator;
import de.bsommerfeld.launchpad.lifecycle.launch.WindowEventListener;
import de.bsommerfeld.launchpad.lifecycle.launch.WindowEventSource;
import de.bsommerfeld.launchpad.platform.android.AndroidSubsystem;
import de.bsommerfeld.launchpad.platform.android.AndroidSubsystemException;
import de.bsommerfeld.launchpad.platform.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Launches Android packages inside the compatibility subsystem.
 *
 * <h3>Windows</h3>
 * Every Android app is hosted by the same subsystem process and uses the
 * same generic frame window class, so the engine finds the window with the
 * launch-time heuristic. The launch timestamp is taken when the subsystem
 * confirms the start. Exit and focus are observed through
 * {@link AndroidWindowWatcher}.
 *
 * <h3>Switching and closing</h3>
 * Without a usable window the package is started again, which brings its
 * existing task to the front. Closing asks the window to close; with no
 * window, or on kill, the package is force-stopped.
 */
@Singleton
public class AndroidPackageLauncher implements ApplicationLauncher, WindowEventSource, Reactivator,
        InstanceTerminator {

    private static final Logger LOG = LoggerFactory.getLogger(AndroidPackageLauncher.class);

    public static final String META_PACKAGE = "android.package";
    public static final String META_ACTIVITY = "android.activity";
    public static final String META_WINDOW_NAME = "android.window_name";
    public static final String META_PID = "android.pid";

    private static final Pattern PACKAGE_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*(\\.[a-zA-Z][a-zA-Z0-9_]*)+$");
    private static final Duration CLOSE_POLL = Duration.ofMillis(200);

    private final AndroidSubsystem subsystem;
    private final AndroidWindowWatcher watcher;
    private final WindowManager windowManager;
    private final CorrelationConfig correlationConfig;

    @Inject
    public AndroidPackageLauncher(AndroidSubsystem subsystem, AndroidWindowWatcher watcher,
            WindowManager windowManager, CorrelationConfig correlationConfig) {
        this.subsystem = subsystem;
        this.watcher = watcher;
        this.windowManager = windowManager;
        this.correlationConfig = correlationConfig;
    }

    @Override
    public ApplicationKind supportedKind() {
        return ApplicationKind.ANDROID_PACKAGE;
    }

    @Override
    public boolean canLaunch(ApplicationDescriptor descriptor) {
        return descriptor.kind() == ApplicationKind.ANDROID_PACKAGE
                && PACKAGE_NAME.matcher(descriptor.target()).matches();
    }

    // =====================================================================
    // Launch
    // =====================================================================

    @Override
    public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) throws LaunchException {
        String packageName = descriptor.target();
        AndroidArguments arguments = AndroidArguments.parse(descriptor.arguments());

        if (!subsystem.isAvailable()) {
            throw new LaunchException("Android subsystem is not available");
        }
        if (!subsystem.isPackageInstalled(packageName)) {
            throw new LaunchException("Android package is not installed: " + packageName);
        }

        try {
            subsystem.launchPackage(packageName, arguments.activityName().orElse(null));
        } catch (AndroidSubsystemException e) {
            throw new LaunchException(e.getMessage(), e);
        }
        Instant launchedAt = Instant.now();
        LOG.info("Launched Android package {} for {}", packageName, principal);

        OptionalLong androidPid = subsystem.findPackageProcess(packageName);

        return LaunchAttempt.builder(CorrelationMode.HEURISTIC)
                .launchedAt(launchedAt)
                .windowHint(arguments.windowName().orElse(descriptor.name()))
                .correlationAttempts(correlationAttempts(arguments))
                .placeholderAllowed(arguments.virtualFallback())
                .metadata(META_PACKAGE, packageName)
                .metadata(META_ACTIVITY, arguments.activityName().orElse(null))
                .metadata(META_WINDOW_NAME, arguments.windowName().orElse(null))
                .metadata(META_PID, androidPid.isPresent() ? Long.toString(androidPid.getAsLong()) : null)
                .build();
    }

    int correlationAttempts(AndroidArguments arguments) {
        if (!arguments.waitForWindow()) {
            return 1;
        }
        if (arguments.launchTimeout().isPresent()) {
            long delay = Math.max(1, correlationConfig.attemptDelay().toMillis());
            return (int) Math.max(1, arguments.launchTimeout().get().toMillis() / delay);
        }
        return correlationConfig.getAttempts();
    }

    // =====================================================================
    // Window events
    // =====================================================================

    @Override
    public void watch(String instanceId, WindowHandle handle) {
        watcher.watch(instanceId, handle);
    }

    @Override
    public void unwatch(String instanceId) {
        watcher.unwatch(instanceId);
    }

    @Override
    public void startWatching() {
        watcher.start();
    }

    @Override
    public void stopWatching() {
        watcher.stop();
    }

    @Override
    public void addWindowEventListener(WindowEventListener listener) {
        watcher.addListener(listener);
    }

    @Override
    public void removeWindowEventListener(WindowEventListener listener) {
        watcher.removeListener(listener);
    }

    // =====================================================================
    // Switching and closing
    // =====================================================================

    @Override
    public boolean reactivate(InstanceSnapshot instance) {
        String packageName = packageOf(instance);
        try {
            subsystem.launchPackage(packageName, instance.metadata().get(META_ACTIVITY));
            return true;
        } catch (AndroidSubsystemException e) {
            LOG.warn("Could not bring {} to the front: {}", packageName, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean requestClose(InstanceSnapshot instance, Duration timeout) {
        if (instance.hasRealWindow() && windowManager.isWindowValid(instance.window().handle())) {
            WindowHandle handle = instance.window().handle();
            windowManager.closeWindow(handle);
            return awaitWindowGone(handle, timeout);
        }
        return subsystem.stopPackage(packageOf(instance));
    }

    @Override
    public boolean kill(InstanceSnapshot instance, Duration timeout) {
        boolean stopped = subsystem.stopPackage(packageOf(instance));
        if (instance.hasRealWindow() && windowManager.isWindowValid(instance.window().handle())) {
            windowManager.closeWindow(instance.window().handle());
            return awaitWindowGone(instance.window().handle(), timeout) || stopped;
        }
        return stopped;
    }

    private boolean awaitWindowGone(WindowHandle handle, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (windowManager.isWindowValid(handle)) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(CLOSE_POLL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return !windowManager.isWindowValid(handle);
            }
        }
        return true;
    }

    private static String packageOf(InstanceSnapshot instance) {
        return instance.metadata().getOrDefault(META_PACKAGE, instance.descriptor().target());
    }
}
