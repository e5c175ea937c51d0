package de.bsommerfeld.launchpad.platform.window;

import com.google.inject.Singleton;
import com.sun.jna.Pointer;
import com.sun.jna.platform.win32.WinDef.DWORD;
import com.sun.jna.platform.win32.WinDef.HWND;
import com.sun.jna.platform.win32.WinUser;
import com.sun.jna.ptr.IntByReference;
import de.bsommerfeld.launchpad.core.domain.WindowHandle;
import de.bsommerfeld.launchpad.core.domain.WindowInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link WindowManager} backed by user32 through JNA.
 *
 * <h3>Creation time</h3>
 * Win32 does not expose when a window was created. The manager enumerates
 * once on construction and stamps every existing window with its owning
 * process' start time; windows that show up later are stamped with the time
 * they were first seen (see {@link WindowCreationTracker}).
 */
@Singleton
public class Win32WindowManager implements WindowManager {

    private static final Logger LOG = LoggerFactory.getLogger(Win32WindowManager.class);
    private static final int MAX_TEXT = 512;

    private final User32Ex user32;
    private final WindowCreationTracker creation =
            new WindowCreationTracker(Win32WindowManager::processStart, Clock.systemUTC());

    public Win32WindowManager() {
        this(User32Ex.INSTANCE);
    }

    Win32WindowManager(User32Ex user32) {
        this.user32 = user32;
        List<WindowInfo> initial = enumerate();
        LOG.debug("Primed window creation times with {} existing windows", initial.size());
    }

    // =====================================================================
    // Enumeration
    // =====================================================================

    @Override
    public Optional<WindowInfo> findMainWindow(long processId) {
        if (processId <= 0) {
            return Optional.empty();
        }
        return enumerate().stream()
                .filter(w -> w.processId() == processId)
                .filter(WindowInfo::visible)
                .filter(w -> !w.title().isEmpty())
                .filter(w -> user32.GetWindow(toHwnd(w.handle()), new DWORD(WinUser.GW_OWNER)) == null)
                .findFirst();
    }

    @Override
    public List<WindowInfo> getWindowsForProcess(long processId) {
        if (processId <= 0) {
            return List.of();
        }
        return enumerate().stream()
                .filter(w -> w.processId() == processId)
                .collect(Collectors.toList());
    }

    @Override
    public List<WindowInfo> findWindowsByClass(String className) {
        return enumerate().stream()
                .filter(w -> w.className().equals(className))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<WindowInfo> findWindowByTitle(String title, boolean exact) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String needle = title.toLowerCase(Locale.ROOT);
        return enumerate().stream()
                .filter(WindowInfo::visible)
                .filter(w -> exact ? w.title().equals(title) : w.title().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }

    @Override
    public Optional<WindowInfo> getWindow(WindowHandle handle) {
        if (!isWindowValid(handle)) {
            return Optional.empty();
        }
        HWND hwnd = toHwnd(handle);
        return Optional.of(describe(hwnd, creation.createdAt(handle.value()).orElse(null)));
    }

    /**
     * Lists all top-level windows and updates the creation-time bookkeeping.
     */
    private synchronized List<WindowInfo> enumerate() {
        List<HWND> handles = new ArrayList<>();
        boolean ok = user32.EnumWindows((hwnd, data) -> {
            handles.add(hwnd);
            return true;
        }, null);
        if (!ok) {
            LOG.debug("EnumWindows reported failure after {} windows", handles.size());
        }

        List<WindowInfo> described = new ArrayList<>(handles.size());
        Map<Long, Long> owners = new LinkedHashMap<>();
        for (HWND hwnd : handles) {
            WindowInfo info = describe(hwnd, null);
            described.add(info);
            owners.put(info.handle().value(), info.processId());
        }

        Map<Long, Instant> created = creation.update(owners);
        List<WindowInfo> windows = new ArrayList<>(described.size());
        for (WindowInfo info : described) {
            windows.add(new WindowInfo(info.handle(), info.title(), info.processId(), info.className(),
                    created.getOrDefault(info.handle().value(), info.createdAt()), info.visible()));
        }
        return windows;
    }

    private WindowInfo describe(HWND hwnd, Instant createdAt) {
        char[] text = new char[MAX_TEXT];
        int titleLength = user32.GetWindowText(hwnd, text, text.length);
        String title = titleLength > 0 ? new String(text, 0, titleLength) : "";

        char[] cls = new char[MAX_TEXT];
        int classLength = user32.GetClassName(hwnd, cls, cls.length);
        String className = classLength > 0 ? new String(cls, 0, classLength) : "";

        IntByReference pidRef = new IntByReference();
        user32.GetWindowThreadProcessId(hwnd, pidRef);

        return new WindowInfo(new WindowHandle(Pointer.nativeValue(hwnd.getPointer())), title, pidRef.getValue(),
                className, createdAt != null ? createdAt : Instant.now(), user32.IsWindowVisible(hwnd));
    }

    private static Optional<Instant> processStart(long pid) {
        return ProcessHandle.of(pid).flatMap(h -> h.info().startInstant());
    }

    // =====================================================================
    // State queries
    // =====================================================================

    @Override
    public boolean isWindowValid(WindowHandle handle) {
        return handle != null && !handle.isNone() && user32.IsWindow(toHwnd(handle));
    }

    @Override
    public boolean isWindowVisible(WindowHandle handle) {
        return isWindowValid(handle) && user32.IsWindowVisible(toHwnd(handle));
    }

    @Override
    public boolean isWindowMinimized(WindowHandle handle) {
        return isWindowValid(handle) && user32.IsIconic(toHwnd(handle));
    }

    @Override
    public boolean isForeground(WindowHandle handle) {
        return foregroundWindow().map(fg -> fg.equals(handle)).orElse(false);
    }

    @Override
    public Optional<WindowHandle> foregroundWindow() {
        HWND hwnd = user32.GetForegroundWindow();
        if (hwnd == null) {
            return Optional.empty();
        }
        return Optional.of(new WindowHandle(Pointer.nativeValue(hwnd.getPointer())));
    }

    @Override
    public boolean isResponding(WindowHandle handle) {
        return !isWindowValid(handle) || !user32.IsHungAppWindow(toHwnd(handle));
    }

    @Override
    public boolean isProcessResponding(long processId) {
        return !unresponsiveProcesses(List.of(processId)).contains(processId);
    }

    /**
     * One enumeration for all pids: a process is hung if any of its visible
     * windows is.
     */
    @Override
    public Set<Long> unresponsiveProcesses(Collection<Long> processIds) {
        if (processIds.isEmpty()) {
            return Set.of();
        }
        Set<Long> wanted = new HashSet<>(processIds);
        Set<Long> hung = new HashSet<>();
        for (WindowInfo window : enumerate()) {
            if (window.visible() && wanted.contains(window.processId()) && !hung.contains(window.processId())
                    && !isResponding(window.handle())) {
                hung.add(window.processId());
            }
        }
        return hung;
    }

    // =====================================================================
    // Commands
    // =====================================================================

    @Override
    public boolean switchTo(WindowHandle handle) {
        if (!isWindowValid(handle)) {
            return false;
        }
        HWND hwnd = toHwnd(handle);
        if (user32.IsIconic(hwnd)) {
            user32.ShowWindow(hwnd, User32Ex.SW_RESTORE);
        }
        boolean focused = user32.SetForegroundWindow(hwnd);
        if (!focused) {
            LOG.debug("SetForegroundWindow refused for {}", handle);
        }
        return focused;
    }

    @Override
    public boolean minimize(WindowHandle handle) {
        if (!isWindowValid(handle)) {
            return false;
        }
        user32.ShowWindow(toHwnd(handle), User32Ex.SW_MINIMIZE);
        return true;
    }

    @Override
    public boolean closeWindow(WindowHandle handle) {
        if (!isWindowValid(handle)) {
            return false;
        }
        user32.PostMessage(toHwnd(handle), User32Ex.WM_CLOSE, null, null);
        return true;
    }

    private static HWND toHwnd(WindowHandle handle) {
        return new HWND(new Pointer(handle.value()));
    }
}
