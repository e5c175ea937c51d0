package de.bsommerfeld.launchpad.lifecycle;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import de.bsommerfeld.launchpad.lifecycle.audit.LifecycleAuditSubscriber;
import de.bsommerfeld.launchpad.lifecycle.launch.ApplicationLauncher;
import de.bsommerfeld.launchpad.lifecycle.launch.BrowserAppLauncher;
import de.bsommerfeld.launchpad.lifecycle.launch.DesktopOpener;
import de.bsommerfeld.launchpad.lifecycle.launch.FolderLauncher;
import de.bsommerfeld.launchpad.lifecycle.launch.NativeProcessLauncher;
import de.bsommerfeld.launchpad.lifecycle.launch.ShellDesktopOpener;
import de.bsommerfeld.launchpad.lifecycle.launch.WebPageLauncher;
import de.bsommerfeld.launchpad.lifecycle.launch.android.AndroidPackageLauncher;

/**
 * Wires the launchers and the lifecycle engine. Expects the configuration
 * sections, the platform services and the catalog / audit / principal
 * implementations to be bound elsewhere.
 */
public class LifecycleModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(DesktopOpener.class).to(ShellDesktopOpener.class);

        // Registration order is lookup order.
        Multibinder<ApplicationLauncher> launchers = Multibinder.newSetBinder(binder(), ApplicationLauncher.class);
        launchers.addBinding().to(AndroidPackageLauncher.class);
        launchers.addBinding().to(NativeProcessLauncher.class);
        launchers.addBinding().to(WebPageLauncher.class);
        launchers.addBinding().to(BrowserAppLauncher.class);
        launchers.addBinding().to(FolderLauncher.class);

        bind(LifecycleAuditSubscriber.class).asEagerSingleton();
    }
}
