package de.bsommerfeld.launchpad.lifecycle.launch;

/**
 * A launcher could not start its target. The message is shown to the user
 * as the launch error.
 */
public class LaunchException extends Exception {

    public LaunchException(String message) {
        super(message);
    }

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
