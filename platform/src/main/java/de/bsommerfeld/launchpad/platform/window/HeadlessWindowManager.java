package de.bsommerfeld.launchpad.platform.window;

import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;

import java.util.List;
import java.util.Optional;

/**
 * Window manager for machines without a supported desktop. Finds nothing
 * and refuses every command, so the engine runs with placeholder windows.
 */
@Singleton
public class HeadlessWindowManager implements WindowManager {

    @Override
    public Optional<WindowInfo> findMainWindow(long processId) {
        return Optional.empty();
    }

    @Override
    public List<WindowInfo> getWindowsForProcess(long processId) {
        return List.of();
    }

    @Override
    public List<WindowInfo> findWindowsByClass(String className) {
        return List.of();
    }

    @Override
    public Optional<WindowInfo> findWindowByTitle(String title, boolean exact) {
        return Optional.empty();
    }

    @Override
    public Optional<WindowInfo> getWindow(WindowHandle handle) {
        return Optional.empty();
    }

    @Override
    public boolean isWindowValid(WindowHandle handle) {
        return false;
    }

    @Override
    public boolean isWindowVisible(WindowHandle handle) {
        return false;
    }

    @Override
    public boolean isWindowMinimized(WindowHandle handle) {
        return false;
    }

    @Override
    public boolean isForeground(WindowHandle handle) {
        return false;
    }

    @Override
    public Optional<WindowHandle> foregroundWindow() {
        return Optional.empty();
    }

    @Override
    public boolean switchTo(WindowHandle handle) {
        return false;
    }

    @Override
    public boolean minimize(WindowHandle handle) {
        return false;
    }

    @Override
    public boolean closeWindow(WindowHandle handle) {
        return false;
    }

    @Override
    public boolean isResponding(WindowHandle handle) {
        return true;
    }

    @Override
    public boolean isProcessResponding(long processId) {
        return true;
    }
}
