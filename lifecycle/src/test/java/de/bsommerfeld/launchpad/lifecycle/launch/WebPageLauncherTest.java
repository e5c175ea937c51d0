package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebPageLauncherTest {

    @Mock
    private DesktopOpener opener;

    @Test
    void normalizeUrl_shouldAddHttpsToSchemelessTargets() throws LaunchException {
        assertEquals("https://intranet.example.com/wiki", WebPageLauncher.normalizeUrl("intranet.example.com/wiki"));
        assertEquals("http://localhost:8080", WebPageLauncher.normalizeUrl("  http://localhost:8080 "));
    }

    @Test
    void normalizeUrl_shouldRejectUnsupportedSchemes() {
        assertThrows(LaunchException.class, () -> WebPageLauncher.normalizeUrl("ftp://files.example.com"));
        assertThrows(LaunchException.class, () -> WebPageLauncher.normalizeUrl("javascript://alert(1)"));
    }

    @Test
    void normalizeUrl_shouldRequireHostForWebUrls() {
        assertThrows(LaunchException.class, () -> WebPageLauncher.normalizeUrl("https://"));
    }

    @Test
    void launch_shouldOpenUrlWithoutTrackingProcess() throws Exception {
        when(opener.isAvailable()).thenReturn(true);
        WebPageLauncher launcher = new WebPageLauncher(opener);

        LaunchAttempt attempt = launcher.launch(descriptor("example.com"), "alice");

        verify(opener).open("https://example.com");
        assertEquals(CorrelationMode.NONE, attempt.correlationMode());
        assertFalse(attempt.processTracked());
        assertEquals("https://example.com", attempt.metadata().get("url"));
    }

    @Test
    void launch_shouldFailWhenNoBrowserAvailable() throws Exception {
        when(opener.isAvailable()).thenReturn(false);
        WebPageLauncher launcher = new WebPageLauncher(opener);

        assertThrows(LaunchException.class, () -> launcher.launch(descriptor("example.com"), "alice"));
        verify(opener, never()).open(anyString());
    }

    @Test
    void launch_shouldWrapOpenerFailure() throws Exception {
        when(opener.isAvailable()).thenReturn(true);
        doThrow(new IOException("no handler")).when(opener).open(anyString());
        WebPageLauncher launcher = new WebPageLauncher(opener);

        LaunchException e = assertThrows(LaunchException.class,
                () -> launcher.launch(descriptor("example.com"), "alice"));
        assertTrue(e.getMessage().contains("no handler"));
    }

    private static ApplicationDescriptor descriptor(String target) {
        return new ApplicationDescriptor("wiki", "Wiki", ApplicationKind.WEB_PAGE, target, "");
    }
}
