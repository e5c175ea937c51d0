package de.bsommerfeld.launchpad.platform.window;

import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import de.bsommerfeld.launchpad.platform.process.ResponsivenessProbe;

import java.util.List;
import java.util.Optional;

/**
 * Enumerates and manipulates top-level OS windows.
 *
 * <p>
 * Every command returns {@code false} instead of throwing when the window is
 * gone or the OS refuses. Placeholder handles ({@link WindowHandle#NONE})
 * are never valid.
 */
public interface WindowManager extends ResponsivenessProbe {

    /**
     * The window a user would consider "the" window of a process: visible,
     * not owned by another window, with a title.
     */
    Optional<WindowInfo> findMainWindow(long processId);

    List<WindowInfo> getWindowsForProcess(long processId);

    List<WindowInfo> findWindowsByClass(String className);

    /**
     * @param exact {@code true} for a case-sensitive full match, {@code false}
     *              for a case-insensitive substring match
     */
    Optional<WindowInfo> findWindowByTitle(String title, boolean exact);

    Optional<WindowInfo> getWindow(WindowHandle handle);

    boolean isWindowValid(WindowHandle handle);

    boolean isWindowVisible(WindowHandle handle);

    boolean isWindowMinimized(WindowHandle handle);

    boolean isForeground(WindowHandle handle);

    Optional<WindowHandle> foregroundWindow();

    /** Restores the window if minimized and brings it to the foreground. */
    boolean switchTo(WindowHandle handle);

    boolean minimize(WindowHandle handle);

    /** Politely asks the window to close. Does not wait. */
    boolean closeWindow(WindowHandle handle);

    boolean isResponding(WindowHandle handle);
}
