package de.bsommerfeld.launchpad.lifecycle.launch.android;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Android specific options carried in a descriptor's argument string, e.g.
 * {@code --window_name='Maps' --launch_timeout=20 --virtual_fallback=false}.
 * Values may be quoted with single or double quotes. Unknown options are
 * kept in {@link #custom()}, malformed values are ignored with a warning.
 *
 * @param windowName      title to look for instead of the display name
 * @param activityName    activity to start instead of the launcher activity
 * @param launchTimeout   total time to spend looking for the window
 * @param waitForWindow   {@code false} to look for the window only once
 * @param virtualFallback {@code false} to fail instead of using a
 *                        placeholder window
 * @param custom          all other {@code --key=value} options
 */
public record AndroidArguments(
        Optional<String> windowName,
        Optional<String> activityName,
        Optional<Duration> launchTimeout,
        boolean waitForWindow,
        boolean virtualFallback,
        Map<String, String> custom) {

    private static final Logger LOG = LoggerFactory.getLogger(AndroidArguments.class);

    private static final Pattern ARGUMENT = Pattern.compile(
            "--(\\w+)=['\"]([^'\"]*)['\"]|--(\\w+)=(\\S+)");

    public static final AndroidArguments DEFAULTS = new AndroidArguments(
            Optional.empty(), Optional.empty(), Optional.empty(), true, true, Map.of());

    public AndroidArguments {
        custom = Map.copyOf(custom);
    }

    public static AndroidArguments parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULTS;
        }

        String windowName = null;
        String activityName = null;
        Duration launchTimeout = null;
        boolean waitForWindow = true;
        boolean virtualFallback = true;
        Map<String, String> custom = new LinkedHashMap<>();

        Matcher matcher = ARGUMENT.matcher(raw);
        while (matcher.find()) {
            String name = (matcher.group(1) != null ? matcher.group(1) : matcher.group(3)).toLowerCase(Locale.ROOT);
            String value = matcher.group(1) != null ? matcher.group(2) : matcher.group(4);

            switch (name) {
                case "window_name":
                    windowName = value;
                    break;
                case "activity_name":
                    activityName = value;
                    break;
                case "launch_timeout":
                    launchTimeout = parseSeconds(value);
                    break;
                case "wait_for_window":
                    waitForWindow = parseBoolean(name, value, waitForWindow);
                    break;
                case "virtual_fallback":
                    virtualFallback = parseBoolean(name, value, virtualFallback);
                    break;
                default:
                    custom.put(name, value);
            }
        }

        return new AndroidArguments(
                Optional.ofNullable(windowName).filter(s -> !s.isBlank()),
                Optional.ofNullable(activityName).filter(s -> !s.isBlank()),
                Optional.ofNullable(launchTimeout),
                waitForWindow,
                virtualFallback,
                custom);
    }

    private static Duration parseSeconds(String value) {
        try {
            long seconds = Long.parseLong(value);
            if (seconds > 0) {
                return Duration.ofSeconds(seconds);
            }
        } catch (NumberFormatException e) {
            LOG.warn("Invalid launch_timeout value '{}'", value);
            return null;
        }
        LOG.warn("Ignoring non-positive launch_timeout '{}'", value);
        return null;
    }

    private static boolean parseBoolean(String name, String value, boolean fallback) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        LOG.warn("Invalid {} value '{}'", name, value);
        return fallback;
    }
}
