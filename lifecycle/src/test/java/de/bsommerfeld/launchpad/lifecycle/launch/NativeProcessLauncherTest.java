package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NativeProcessLauncherTest {

    @TempDir
    Path tempDir;

    private final NativeProcessLauncher launcher = new NativeProcessLauncher();

    @Test
    void launch_shouldStartProcessAndTrackIt() throws Exception {
        Path java = Paths.get(System.getProperty("java.home"), "bin", isWindows() ? "java.exe" : "java");
        ApplicationDescriptor descriptor = new ApplicationDescriptor("java", "Java", ApplicationKind.NATIVE_PROCESS,
                java.toString(), "-version");

        LaunchAttempt attempt = launcher.launch(descriptor, "alice");

        assertTrue(attempt.processId() > 0);
        assertTrue(attempt.processTracked());
        assertEquals(CorrelationMode.PROCESS, attempt.correlationMode());
        ProcessHandle.of(attempt.processId()).ifPresent(p -> p.onExit().orTimeout(10, TimeUnit.SECONDS).join());
    }

    @Test
    void launch_shouldFailForMissingExecutable() {
        ApplicationDescriptor descriptor = new ApplicationDescriptor("ghost", "Ghost", ApplicationKind.NATIVE_PROCESS,
                tempDir.resolve("ghost.exe").toString(), "");

        assertThrows(LaunchException.class, () -> launcher.launch(descriptor, "alice"));
    }

    @Test
    void launch_shouldFailForUnknownCommandName() {
        ApplicationDescriptor descriptor = new ApplicationDescriptor("ghost", "Ghost", ApplicationKind.NATIVE_PROCESS,
                "no-such-command-launchpad-test", "");

        assertThrows(LaunchException.class, () -> launcher.launch(descriptor, "alice"));
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().contains("win");
    }
}
