package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LauncherRegistryTest {

    private static final ApplicationDescriptor NOTEPAD = new ApplicationDescriptor("notepad", "Notepad",
            ApplicationKind.NATIVE_PROCESS, "notepad.exe", "");

    @Test
    void find_shouldReturnFirstMatchingLauncher() {
        ApplicationLauncher first = new StubLauncher(ApplicationKind.NATIVE_PROCESS);
        ApplicationLauncher second = new StubLauncher(ApplicationKind.NATIVE_PROCESS);
        LauncherRegistry registry = new LauncherRegistry(List.of(first, second));

        assertSame(first, registry.find(NOTEPAD).orElseThrow());
    }

    @Test
    void find_shouldReturnEmptyWhenNoLauncherClaimsKind() {
        LauncherRegistry registry = new LauncherRegistry(List.of(new StubLauncher(ApplicationKind.WEB_PAGE)));

        assertTrue(registry.find(NOTEPAD).isEmpty());
    }

    @Test
    void withCapability_shouldSelectByInterface() {
        ApplicationLauncher plain = new StubLauncher(ApplicationKind.NATIVE_PROCESS);
        ReactivatingLauncher reactivating = new ReactivatingLauncher();
        LauncherRegistry registry = new LauncherRegistry(List.of(plain, reactivating));

        assertEquals(List.of(reactivating), registry.withCapability(Reactivator.class));
        assertEquals(2, registry.all().size());
    }

    private static class StubLauncher implements ApplicationLauncher {

        private final ApplicationKind kind;

        StubLauncher(ApplicationKind kind) {
            this.kind = kind;
        }

        @Override
        public ApplicationKind supportedKind() {
            return kind;
        }

        @Override
        public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) {
            return LaunchAttempt.builder(CorrelationMode.NONE).build();
        }
    }

    private static class ReactivatingLauncher extends StubLauncher implements Reactivator {

        ReactivatingLauncher() {
            super(ApplicationKind.FOLDER);
        }

        @Override
        public boolean reactivate(InstanceSnapshot instance) {
            return true;
        }
    }
}
