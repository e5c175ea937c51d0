package de.bsommerfeld.launchpad.core.domain;

public enum LaunchFailureReason {
    UNKNOWN_APPLICATION,
    NO_SUITABLE_LAUNCHER,
    LAUNCH_FAILED,
    WINDOW_NOT_FOUND
}
