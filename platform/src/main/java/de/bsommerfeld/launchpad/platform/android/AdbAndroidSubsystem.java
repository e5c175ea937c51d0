package de.bsommerfeld.launchpad.platform.android;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.AndroidConfig;
import de.bsommerfeld.launchpad.platform.command.CommandResult;
import de.bsommerfeld.launchpad.platform.command.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

/**
 * {@link AndroidSubsystem} driven through {@code adb} against the
 * subsystem's local endpoint.
 *
 * <h3>Commands</h3>
 * <ul>
 * <li>connect: {@code adb connect <device>}, confirmed by {@code adb devices}</li>
 * <li>launch: {@code monkey} with the launcher category, or
 * {@code am start -n} when an activity is given</li>
 * <li>stop: {@code am force-stop}</li>
 * <li>installed: {@code pm list packages <package>}</li>
 * <li>running: {@code pidof}</li>
 * </ul>
 */
@Singleton
public class AdbAndroidSubsystem implements AndroidSubsystem {

    private static final Logger LOG = LoggerFactory.getLogger(AdbAndroidSubsystem.class);

    private final CommandRunner runner;
    private final String adbPath;
    private final String device;
    private final Duration timeout;

    @Inject
    public AdbAndroidSubsystem(CommandRunner runner, AndroidConfig config) {
        this.runner = runner;
        this.adbPath = config.getAdbPath();
        this.device = config.getDevice();
        this.timeout = config.commandTimeout();
    }

    // -- Connection --

    @Override
    public boolean isAvailable() {
        if (isDeviceListed()) {
            return true;
        }
        CommandResult connect = adb(List.of("connect", device));
        if (connect == null || connect.timedOut()) {
            LOG.warn("Could not reach Android subsystem at {}", device);
            return false;
        }
        boolean listed = isDeviceListed();
        if (!listed) {
            LOG.warn("Android subsystem at {} did not come online: {}", device, connect.output());
        }
        return listed;
    }

    private boolean isDeviceListed() {
        CommandResult devices = adb(List.of("devices"));
        if (devices == null || !devices.isSuccess()) {
            return false;
        }
        return devices.output().lines()
                .map(String::strip)
                .anyMatch(line -> line.startsWith(device) && line.endsWith("device"));
    }

    // -- Packages --

    @Override
    public boolean isPackageInstalled(String packageName) {
        CommandResult result = shell("pm", "list", "packages", packageName);
        if (result == null || !result.isSuccess()) {
            return false;
        }
        String expected = "package:" + packageName;
        return result.output().lines().map(String::strip).anyMatch(expected::equals);
    }

    @Override
    public void launchPackage(String packageName, String activityName) throws AndroidSubsystemException {
        CommandResult result;
        if (activityName != null && !activityName.isBlank()) {
            String component = activityName.contains("/") ? activityName : packageName + "/" + activityName;
            result = shell("am", "start", "-n", component);
        } else {
            result = shell("monkey", "-p", packageName, "-c", "android.intent.category.LAUNCHER", "1");
        }

        if (result == null) {
            throw new AndroidSubsystemException("adb could not be started for " + packageName);
        }
        if (result.timedOut()) {
            throw new AndroidSubsystemException("Launching " + packageName + " timed out");
        }
        if (!result.isSuccess() || result.outputContains("aborted") || result.outputContains("Error:")) {
            throw new AndroidSubsystemException("Launching " + packageName + " failed: " + result.output());
        }
        LOG.info("Launched Android package {}", packageName);
    }

    @Override
    public boolean stopPackage(String packageName) {
        CommandResult result = shell("am", "force-stop", packageName);
        boolean stopped = result != null && result.isSuccess();
        if (stopped) {
            LOG.info("Stopped Android package {}", packageName);
        } else {
            LOG.warn("Failed to stop Android package {}", packageName);
        }
        return stopped;
    }

    @Override
    public OptionalLong findPackageProcess(String packageName) {
        CommandResult result = shell("pidof", packageName);
        if (result == null || !result.isSuccess() || result.output().isBlank()) {
            return OptionalLong.empty();
        }
        String first = result.output().strip().split("\\s+")[0];
        try {
            return OptionalLong.of(Long.parseLong(first));
        } catch (NumberFormatException e) {
            LOG.debug("Unexpected pidof output for {}: {}", packageName, result.output());
            return OptionalLong.empty();
        }
    }

    // -- adb plumbing --

    private CommandResult shell(String... args) {
        ImmutableList.Builder<String> command = ImmutableList.<String>builder()
                .add("-s", device, "shell")
                .add(args);
        return adb(command.build());
    }

    /**
     * @return the result, or {@code null} if adb itself could not be run
     */
    private CommandResult adb(List<String> args) {
        List<String> command = ImmutableList.<String>builder().add(adbPath).addAll(args).build();
        try {
            return runner.run(command, timeout);
        } catch (IOException e) {
            LOG.warn("Failed to run {}: {}", adbPath, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }
}
