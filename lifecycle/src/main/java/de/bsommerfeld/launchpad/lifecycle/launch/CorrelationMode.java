package de.bsommerfeld.launchpad.lifecycle.launch;

/**
 * How the window of a fresh launch is found.
 */
public enum CorrelationMode {

    /** Main window of the launched process. */
    PROCESS,

    /** First window whose title contains the hint, optionally limited to window classes. */
    TITLE,

    /** Time-window heuristic for hosts that share one process across many apps. */
    HEURISTIC,

    /** The launch has no window of its own to track. */
    NONE
}
