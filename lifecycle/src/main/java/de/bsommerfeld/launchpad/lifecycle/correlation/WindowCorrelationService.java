package de.bsommerfeld.launchpad.lifecycle.correlation;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.CorrelationConfig;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import de.bsommerfeld.launchpad.lifecycle.launch.CorrelationMode;
import de.bsommerfeld.launchpad.lifecycle.launch.LaunchAttempt;
import de.bsommerfeld.launchpad.platform.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps a launch to its OS window according to the launch's
 * {@link CorrelationMode}, retrying while the window is still being
 * created.
 */
@Singleton
public class WindowCorrelationService {

    private static final Logger LOG = LoggerFactory.getLogger(WindowCorrelationService.class);

    public static final String META_MODE = "window.detection";
    public static final String META_HINT = "window.hint";

    private final WindowManager windowManager;
    private final AndroidWindowCorrelator androidCorrelator;
    private final CorrelationConfig config;

    @Inject
    public WindowCorrelationService(WindowManager windowManager, AndroidWindowCorrelator androidCorrelator,
            CorrelationConfig config) {
        this.windowManager = windowManager;
        this.androidCorrelator = androidCorrelator;
        this.config = config;
    }

    /**
     * Looks for the window of a fresh launch, blocking for at most the
     * configured number of attempts.
     */
    public Optional<WindowInfo> correlate(LaunchAttempt attempt) {
        if (attempt.window().isPresent()) {
            return attempt.window();
        }
        switch (attempt.correlationMode()) {
            case PROCESS:
                return retry(processAttempts(), () -> windowManager.findMainWindow(attempt.processId()));
            case TITLE:
                return retry(processAttempts(), () -> findByTitle(attempt.windowHint(), attempt.windowClasses()));
            case HEURISTIC:
                int attempts = attempt.correlationAttempts() > 0 ? attempt.correlationAttempts() : config.getAttempts();
                return retry(attempts, () -> androidCorrelator.correlate(attempt.windowHint(), attempt.launchedAt()));
            default:
                return Optional.empty();
        }
    }

    /**
     * Single lookup for an existing instance whose window went missing.
     */
    public Optional<WindowInfo> rediscover(InstanceSnapshot instance) {
        CorrelationMode mode = modeOf(instance);
        String hint = instance.metadata().getOrDefault(META_HINT, instance.displayName());
        switch (mode) {
            case PROCESS:
                return windowManager.findMainWindow(instance.processId());
            case TITLE:
                return windowManager.findWindowByTitle(hint, false);
            case HEURISTIC:
                return androidCorrelator.correlate(hint, instance.startedAt());
            default:
                return Optional.empty();
        }
    }

    public void invalidate() {
        androidCorrelator.invalidateAll();
    }

    public static CorrelationMode modeOf(InstanceSnapshot instance) {
        String mode = instance.metadata().get(META_MODE);
        if (mode == null) {
            return CorrelationMode.NONE;
        }
        try {
            return CorrelationMode.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.debug("Unknown correlation mode '{}' on {}", mode, instance.instanceId());
            return CorrelationMode.NONE;
        }
    }

    private Optional<WindowInfo> findByTitle(String hint, List<String> classes) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        if (classes.isEmpty()) {
            return windowManager.findWindowByTitle(hint, false);
        }
        String needle = hint.toLowerCase(Locale.ROOT);
        for (String windowClass : classes) {
            Optional<WindowInfo> match = windowManager.findWindowsByClass(windowClass).stream()
                    .filter(w -> w.title().toLowerCase(Locale.ROOT).contains(needle))
                    .findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private int processAttempts() {
        long delay = Math.max(1, config.attemptDelay().toMillis());
        return (int) Math.max(1, config.processWindowTimeout().toMillis() / delay);
    }

    private Optional<WindowInfo> retry(int attempts, Supplier<Optional<WindowInfo>> lookup) {
        Duration delay = config.attemptDelay();
        for (int i = 0; i < attempts; i++) {
            Optional<WindowInfo> window = lookup.get();
            if (window.isPresent()) {
                return window;
            }
            if (i < attempts - 1 && !sleep(delay)) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
