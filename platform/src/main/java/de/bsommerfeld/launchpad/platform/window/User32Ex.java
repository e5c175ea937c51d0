package de.bsommerfeld.launchpad.platform.window;

import com.sun.jna.Native;
import com.sun.jna.platform.win32.User32;
import com.sun.jna.platform.win32.WinDef.HWND;
import com.sun.jna.win32.W32APIOptions;

/**
 * user32 entry points jna-platform does not map.
 */
interface User32Ex extends User32 {

    User32Ex INSTANCE = Native.load("user32", User32Ex.class, W32APIOptions.DEFAULT_OPTIONS);

    int SW_MINIMIZE = 6;
    int SW_RESTORE = 9;
    int WM_CLOSE = 0x0010;

    boolean IsIconic(HWND hWnd);

    boolean IsHungAppWindow(HWND hWnd);
}
