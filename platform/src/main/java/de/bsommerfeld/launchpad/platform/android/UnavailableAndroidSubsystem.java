package de.bsommerfeld.launchpad.platform.android;

import java.util.OptionalLong;

/**
 * Used where no compatibility subsystem exists. Every Android launch is
 * rejected before anything is started.
 */
public class UnavailableAndroidSubsystem implements AndroidSubsystem {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public boolean isPackageInstalled(String packageName) {
        return false;
    }

    @Override
    public void launchPackage(String packageName, String activityName) throws AndroidSubsystemException {
        throw new AndroidSubsystemException("Android subsystem is not available on this machine");
    }

    @Override
    public boolean stopPackage(String packageName) {
        return false;
    }

    @Override
    public OptionalLong findPackageProcess(String packageName) {
        return OptionalLong.empty();
    }
}
