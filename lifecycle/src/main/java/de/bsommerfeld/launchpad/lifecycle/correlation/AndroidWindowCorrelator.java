package de.bsommerfeld.launchpad.lifecycle.correlation;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.CorrelationConfig;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import de.bsommerfeld.launchpad.platform.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Finds the window of an Android app hosted by the compatibility subsystem.
 *
 * <h3>Heuristic</h3>
 * <ol>
 * <li>enumerate windows of the subsystem's frame class</li>
 * <li>keep windows created within the tolerance around the launch time</li>
 * <li>prefer a window whose title contains the expected name, ignoring
 * case</li>
 * <li>otherwise take the earliest remaining window by creation time</li>
 * </ol>
 * Step 4 can pick the wrong window when several Android apps are launched
 * within one tolerance window; there is no information to tell them apart.
 *
 * <p>
 * Matches are cached per expected name for a short time so repeated lookups
 * (switching, refresh) do not enumerate all windows. The cache must be
 * invalidated whenever a window closes or changes state.
 */
@Singleton
public class AndroidWindowCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(AndroidWindowCorrelator.class);

    private final WindowManager windowManager;
    private final String frameClass;
    private final Duration tolerance;
    private final Cache<String, WindowInfo> cache;

    @Inject
    public AndroidWindowCorrelator(WindowManager windowManager, CorrelationConfig config) {
        this.windowManager = windowManager;
        this.frameClass = config.getFrameWindowClass();
        this.tolerance = config.launchTolerance();
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(config.getCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(256)
                .build();
    }

    /**
     * @param expectedTitle display name or explicit window name
     * @param launchedAt    time the subsystem confirmed the launch
     * @return the best matching window, or empty if no candidate survived the
     *         time filter
     */
    public Optional<WindowInfo> correlate(String expectedTitle, Instant launchedAt) {
        String key = expectedTitle.toLowerCase(Locale.ROOT);

        WindowInfo cached = cache.getIfPresent(key);
        if (cached != null) {
            if (windowManager.isWindowValid(cached.handle())) {
                LOG.debug("Correlation cache hit for '{}': {}", expectedTitle, cached.handle());
                return Optional.of(cached);
            }
            cache.invalidate(key);
        }

        List<WindowInfo> candidates = windowManager.findWindowsByClass(frameClass).stream()
                .filter(w -> withinTolerance(w.createdAt(), launchedAt))
                .sorted(Comparator.comparing(WindowInfo::createdAt))
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            LOG.debug("No {} window within {}s of launch for '{}'", frameClass, tolerance.toSeconds(),
                    expectedTitle);
            return Optional.empty();
        }

        Optional<WindowInfo> titled = candidates.stream()
                .filter(w -> w.title().toLowerCase(Locale.ROOT).contains(key))
                .findFirst();

        WindowInfo match;
        if (titled.isPresent()) {
            match = titled.get();
        } else {
            match = candidates.get(0);
            LOG.info("No window titled '{}' among {} candidate(s), using earliest: '{}'", expectedTitle,
                    candidates.size(), match.title());
        }

        cache.put(key, match);
        return Optional.of(match);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private boolean withinTolerance(Instant createdAt, Instant launchedAt) {
        return Duration.between(launchedAt, createdAt).abs().compareTo(tolerance) <= 0;
    }
}
