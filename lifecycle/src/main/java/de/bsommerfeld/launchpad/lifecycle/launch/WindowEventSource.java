package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.domain.WindowHandle;

/**
 * Capability of launchers whose instances cannot be watched through their
 * process: the launcher watches the windows itself and reports focus and
 * close.
 */
public interface WindowEventSource {

    void watch(String instanceId, WindowHandle handle);

    void unwatch(String instanceId);

    void startWatching();

    void stopWatching();

    void addWindowEventListener(WindowEventListener listener);

    void removeWindowEventListener(WindowEventListener listener);
}
