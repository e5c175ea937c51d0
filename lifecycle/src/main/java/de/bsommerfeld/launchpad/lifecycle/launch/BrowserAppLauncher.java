package de.bsommerfeld.launchpad.lifecycle.launch;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.BrowserConfig;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.util.CommandLineTokenizer;
import de.bsommerfeld.launchpad.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Opens a web application in a chromeless Chromium-family window
 * ({@code --app=<url>}).
 *
 * <p>
 * Each descriptor gets its own browser profile directory. Without it a
 * running browser would absorb the new window into its existing process and
 * the launched process would exit immediately, leaving nothing to track.
 */
@Singleton
public class BrowserAppLauncher implements ApplicationLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(BrowserAppLauncher.class);

    private static final List<String> PATH_NAMES = List.of(
            "chrome", "google-chrome", "google-chrome-stable", "chromium", "chromium-browser", "msedge");

    private final BrowserConfig config;
    private final Path profilesDir;

    @Inject
    public BrowserAppLauncher(BrowserConfig config) {
        this(config, StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("browser-profiles"));
    }

    BrowserAppLauncher(BrowserConfig config, Path profilesDir) {
        this.config = config;
        this.profilesDir = profilesDir;
    }

    @Override
    public ApplicationKind supportedKind() {
        return ApplicationKind.BROWSER_APP;
    }

    @Override
    public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) throws LaunchException {
        String url = WebPageLauncher.normalizeUrl(descriptor.target());
        Path browser = locateBrowser()
                .orElseThrow(() -> new LaunchException("No Chromium-based browser found for " + descriptor.name()));

        List<String> command = buildCommand(browser, url, descriptor);
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new LaunchException("Failed to start browser: " + e.getMessage(), e);
        }
        LOG.info("Started app window '{}' ({}) as pid {} for {}", descriptor.name(), url, process.pid(), principal);

        return LaunchAttempt.builder(CorrelationMode.PROCESS)
                .process(process.pid(), true)
                .windowHint(descriptor.name())
                .metadata("url", url)
                .metadata("browser", browser.toString())
                .build();
    }

    List<String> buildCommand(Path browser, String url, ApplicationDescriptor descriptor) {
        List<String> command = new ArrayList<>();
        command.add(browser.toString());
        command.add("--app=" + url);
        command.add("--user-data-dir=" + profilesDir.resolve(descriptor.id()));
        command.addAll(config.getAppModeFlags());
        command.addAll(CommandLineTokenizer.tokenize(descriptor.arguments()));
        return command;
    }

    Optional<Path> locateBrowser() {
        if (!config.getExecutable().isBlank()) {
            Optional<Path> configured = ExecutableResolver.resolve(config.getExecutable());
            if (configured.isEmpty()) {
                LOG.warn("Configured browser '{}' not found, falling back to auto-detection", config.getExecutable());
            } else {
                return configured;
            }
        }
        for (Path candidate : wellKnownLocations()) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        for (String name : PATH_NAMES) {
            Optional<Path> found = ExecutableResolver.resolve(name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static List<Path> wellKnownLocations() {
        List<Path> locations = new ArrayList<>();
        if (StorageUtils.isWindows()) {
            addIfSet(locations, "ProgramFiles", "Google", "Chrome", "Application", "chrome.exe");
            addIfSet(locations, "ProgramFiles(x86)", "Google", "Chrome", "Application", "chrome.exe");
            addIfSet(locations, "LOCALAPPDATA", "Google", "Chrome", "Application", "chrome.exe");
            addIfSet(locations, "ProgramFiles(x86)", "Microsoft", "Edge", "Application", "msedge.exe");
            addIfSet(locations, "ProgramFiles", "Microsoft", "Edge", "Application", "msedge.exe");
        } else if (StorageUtils.isMac()) {
            locations.add(Paths.get("/Applications/Google Chrome.app/Contents/MacOS/Google Chrome"));
            locations.add(Paths.get("/Applications/Microsoft Edge.app/Contents/MacOS/Microsoft Edge"));
        }
        return locations;
    }

    private static void addIfSet(List<Path> locations, String envVar, String... segments) {
        String base = System.getenv(envVar);
        if (base != null && !base.isBlank()) {
            locations.add(Paths.get(base, segments));
        }
    }
}
