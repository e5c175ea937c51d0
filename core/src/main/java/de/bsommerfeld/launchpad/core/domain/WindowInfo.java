package de.bsommerfeld.launchpad.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of an OS window as seen by the window manager.
 *
 * @param handle      OS handle, {@link WindowHandle#NONE} for placeholders
 * @param title       window caption at the time of the snapshot
 * @param processId   owning process id, {@code -1} if unknown
 * @param className   OS window class, empty if unknown
 * @param createdAt   best-effort creation time
 * @param visible     whether the window was visible
 * @param placeholder {@code true} for the synthetic stand-in used when no real
 *                    window could be found
 */
public record WindowInfo(
        WindowHandle handle,
        String title,
        long processId,
        String className,
        Instant createdAt,
        boolean visible,
        boolean placeholder) {

    public WindowInfo {
        Objects.requireNonNull(handle, "handle");
        title = title == null ? "" : title;
        className = className == null ? "" : className;
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public WindowInfo(WindowHandle handle, String title, long processId, String className, Instant createdAt,
            boolean visible) {
        this(handle, title, processId, className, createdAt, visible, false);
    }

    /**
     * Builds the stand-in window used when correlation failed. It has no OS
     * handle and no owning process, and is never valid for activation.
     */
    public static WindowInfo placeholder(String title) {
        return new WindowInfo(WindowHandle.NONE, title, -1, "", Instant.now(), true, true);
    }

    public boolean isReal() {
        return !placeholder && !handle.isNone();
    }

    public WindowInfo withTitle(String newTitle) {
        return new WindowInfo(handle, newTitle, processId, className, createdAt, visible, placeholder);
    }
}
