package de.bsommerfeld.launchpad.platform;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.AndroidConfig;
import de.bsommerfeld.launchpad.core.config.ApplicationMode;
import de.bsommerfeld.launchpad.core.util.StorageUtils;
import de.bsommerfeld.launchpad.platform.android.AdbAndroidSubsystem;
import de.bsommerfeld.launchpad.platform.android.AndroidSubsystem;
import de.bsommerfeld.launchpad.platform.android.UnavailableAndroidSubsystem;
import de.bsommerfeld.launchpad.platform.command.CommandRunner;
import de.bsommerfeld.launchpad.platform.command.ProcessCommandRunner;
import de.bsommerfeld.launchpad.platform.process.JdkProcessMonitor;
import de.bsommerfeld.launchpad.platform.process.ProcessMonitor;
import de.bsommerfeld.launchpad.platform.process.ResponsivenessProbe;
import de.bsommerfeld.launchpad.platform.window.HeadlessWindowManager;
import de.bsommerfeld.launchpad.platform.window.Win32WindowManager;
import de.bsommerfeld.launchpad.platform.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds the OS-facing services. Outside Windows, and always in
 * {@link ApplicationMode#TEST}, the headless window manager and the
 * unavailable Android subsystem are used.
 */
public class PlatformModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(PlatformModule.class);

    private final ApplicationMode mode;

    public PlatformModule(ApplicationMode mode) {
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(CommandRunner.class).to(ProcessCommandRunner.class);
        bind(ProcessMonitor.class).to(JdkProcessMonitor.class);
    }

    @Provides
    @Singleton
    WindowManager provideWindowManager() {
        if (mode.isTest() || !StorageUtils.isWindows()) {
            LOG.info("Using headless window manager (mode={}, os={})", mode, System.getProperty("os.name"));
            return new HeadlessWindowManager();
        }
        return new Win32WindowManager();
    }

    @Provides
    ResponsivenessProbe provideResponsivenessProbe(WindowManager windowManager) {
        return windowManager;
    }

    @Provides
    @Singleton
    AndroidSubsystem provideAndroidSubsystem(AndroidConfig config, CommandRunner runner) {
        if (mode.isTest() || !config.isEnabled() || !StorageUtils.isWindows()) {
            LOG.info("Android subsystem disabled");
            return new UnavailableAndroidSubsystem();
        }
        return new AdbAndroidSubsystem(runner, config);
    }
}
