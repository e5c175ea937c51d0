package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.config.BrowserConfig;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BrowserAppLauncherTest {

    @TempDir
    Path tempDir;

    @Test
    void buildCommand_shouldUseAppModeWithIsolatedProfile() {
        BrowserConfig config = new BrowserConfig();
        config.setAppModeFlags(List.of("--no-first-run"));
        Path profiles = tempDir.resolve("profiles");
        BrowserAppLauncher launcher = new BrowserAppLauncher(config, profiles);
        Path browser = tempDir.resolve("chrome");

        List<String> command = launcher.buildCommand(browser, "https://crm.corp/",
                new ApplicationDescriptor("crm", "CRM", ApplicationKind.BROWSER_APP, "crm.corp",
                        "--window-size=\"1200,800\""));

        assertEquals(List.of(
                browser.toString(),
                "--app=https://crm.corp/",
                "--user-data-dir=" + profiles.resolve("crm"),
                "--no-first-run",
                "--window-size=1200,800"), command);
    }

    @Test
    void locateBrowser_shouldPreferConfiguredExecutable() throws Exception {
        Path browser = Files.createFile(tempDir.resolve("my-browser"));
        BrowserConfig config = new BrowserConfig();
        config.setExecutable(browser.toString());

        Optional<Path> located = new BrowserAppLauncher(config, tempDir).locateBrowser();

        assertEquals(Optional.of(browser.toAbsolutePath()), located);
    }

    @Test
    void supportedKind_shouldBeBrowserApp() {
        assertEquals(ApplicationKind.BROWSER_APP,
                new BrowserAppLauncher(new BrowserConfig(), tempDir).supportedKind());
    }
}
