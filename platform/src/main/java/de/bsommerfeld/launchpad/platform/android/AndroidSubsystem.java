package de.bsommerfeld.launchpad.platform.android;

import java.util.OptionalLong;

/**
 * Client for the Android compatibility subsystem that hosts Android
 * packages on the desktop.
 */
public interface AndroidSubsystem {

    /**
     * Connects to the subsystem if necessary.
     *
     * @return {@code true} if the subsystem is up and accepts commands
     */
    boolean isAvailable();

    boolean isPackageInstalled(String packageName);

    /**
     * Starts a package. With an activity name the activity is started
     * explicitly, otherwise the package's launcher activity is used.
     *
     * @param activityName fully qualified or relative activity, may be
     *                     {@code null}
     */
    void launchPackage(String packageName, String activityName) throws AndroidSubsystemException;

    /**
     * Force-stops a package.
     *
     * @return {@code true} if the subsystem confirmed the stop
     */
    boolean stopPackage(String packageName);

    /**
     * @return pid of the package's process inside the subsystem, if running
     */
    OptionalLong findPackageProcess(String packageName);

    default boolean isPackageRunning(String packageName) {
        return findPackageProcess(packageName).isPresent();
    }
}
