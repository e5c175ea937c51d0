package de.bsommerfeld.launchpad.platform.android;

/**
 * The compatibility subsystem rejected or failed a request.
 */
public class AndroidSubsystemException extends Exception {

    public AndroidSubsystemException(String message) {
        super(message);
    }

    public AndroidSubsystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
