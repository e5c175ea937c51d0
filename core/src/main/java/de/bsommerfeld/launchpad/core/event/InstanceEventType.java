package de.bsommerfeld.launchpad.core.event;

public enum InstanceEventType {
    STARTED,
    STOPPED,
    STATE_CHANGED,
    ACTIVATED,
    ERROR
}
