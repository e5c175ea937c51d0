package de.bsommerfeld.launchpad.lifecycle.launch;

public interface WindowEventListener {

    void onWindowActivated(String instanceId);

    void onWindowClosed(String instanceId);
}
