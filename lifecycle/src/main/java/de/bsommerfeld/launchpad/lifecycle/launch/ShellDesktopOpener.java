package de.bsommerfeld.launchpad.lifecycle.launch;

import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * {@link DesktopOpener} that shells out to the platform's opener:
 * {@code rundll32 url.dll} and {@code explorer.exe} on Windows,
 * {@code open} on macOS, {@code xdg-open} elsewhere.
 */
@Singleton
public class ShellDesktopOpener implements DesktopOpener {

    private static final Logger LOG = LoggerFactory.getLogger(ShellDesktopOpener.class);

    @Override
    public boolean isAvailable() {
        if (StorageUtils.isWindows() || StorageUtils.isMac()) {
            return true;
        }
        return ExecutableResolver.resolve("xdg-open").isPresent();
    }

    @Override
    public void open(String target) throws IOException {
        if (StorageUtils.isWindows()) {
            start(List.of("rundll32", "url.dll,FileProtocolHandler", target));
        } else if (StorageUtils.isMac()) {
            start(List.of("open", target));
        } else {
            start(List.of("xdg-open", target));
        }
    }

    @Override
    public void openFolder(String path) throws IOException {
        if (StorageUtils.isWindows()) {
            start(List.of("explorer.exe", path));
        } else {
            open(path);
        }
    }

    private void start(List<String> command) throws IOException {
        LOG.debug("Opening via {}", command);
        new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
    }
}
