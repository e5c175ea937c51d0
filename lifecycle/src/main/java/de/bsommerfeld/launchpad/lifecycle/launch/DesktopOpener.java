package de.bsommerfeld.launchpad.lifecycle.launch;

import java.io.IOException;

/**
 * Hands URLs and folders to the desktop's default handler (browser, file
 * manager).
 */
public interface DesktopOpener {

    boolean isAvailable();

    /**
     * @throws IOException if the handler cannot be started
     */
    void open(String target) throws IOException;

    /**
     * Opens a folder in the platform file browser.
     *
     * @throws IOException if the file browser cannot be started
     */
    void openFolder(String path) throws IOException;
}
