package de.bsommerfeld.launchpad.lifecycle.launch;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.CorrelationConfig;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Opens a folder in the platform file browser. The file browser process is
 * shared, so the instance is found by its window title (the folder name)
 * and is never watched through a process id.
 */
@Singleton
public class FolderLauncher implements ApplicationLauncher, Reactivator {

    private static final Logger LOG = LoggerFactory.getLogger(FolderLauncher.class);

    private final DesktopOpener opener;
    private final CorrelationConfig correlationConfig;

    @Inject
    public FolderLauncher(DesktopOpener opener, CorrelationConfig correlationConfig) {
        this.opener = opener;
        this.correlationConfig = correlationConfig;
    }

    @Override
    public ApplicationKind supportedKind() {
        return ApplicationKind.FOLDER;
    }

    @Override
    public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) throws LaunchException {
        Path folder = resolveFolder(descriptor.target());
        try {
            opener.openFolder(folder.toString());
        } catch (IOException e) {
            throw new LaunchException("Failed to open folder " + folder + ": " + e.getMessage(), e);
        }
        LOG.info("Opened folder '{}' for {}", folder, principal);

        Path name = folder.getFileName();
        return LaunchAttempt.builder(CorrelationMode.TITLE)
                .windowHint(name != null ? name.toString() : folder.toString())
                .windowClasses(correlationConfig.getFolderWindowClasses())
                .metadata("folder", folder.toString())
                .build();
    }

    @Override
    public boolean reactivate(InstanceSnapshot instance) {
        String folder = instance.metadata().getOrDefault("folder", instance.descriptor().target());
        try {
            opener.openFolder(folder);
            return true;
        } catch (IOException e) {
            LOG.warn("Could not reopen folder {}: {}", folder, e.getMessage());
            return false;
        }
    }

    private static Path resolveFolder(String target) throws LaunchException {
        Path folder;
        try {
            folder = Path.of(target).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new LaunchException("Invalid folder path: " + target, e);
        }
        if (!Files.isDirectory(folder)) {
            throw new LaunchException("Folder does not exist: " + folder);
        }
        return folder;
    }
}
