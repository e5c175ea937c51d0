package de.bsommerfeld.launchpad.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.launchpad.app.config.AppModule;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.LaunchResult;
import de.bsommerfeld.launchpad.core.spi.ApplicationCatalog;
import de.bsommerfeld.launchpad.core.util.StorageUtils;
import de.bsommerfeld.launchpad.lifecycle.LifecycleOrchestrator;
import de.bsommerfeld.launchpad.lifecycle.ShutdownResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <pre>
 * launchpad list              print the catalog
 * launchpad launch id [id..]  launch entries, then keep monitoring
 * launchpad                   monitor until interrupted
 * </pre>
 *
 * A shutdown hook closes every running instance before the JVM exits.
 */
public class LaunchpadMain {

    static {
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(LaunchpadMain.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    public static void main(String[] args) throws InterruptedException {
        LOG.info("Starting launchpad...");
        Injector injector = Guice.createInjector(new AppModule());

        if (args.length > 0 && "list".equals(args[0])) {
            printCatalog(injector.getInstance(ApplicationCatalog.class));
            return;
        }

        LifecycleOrchestrator orchestrator = injector.getInstance(LifecycleOrchestrator.class);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down...");
            ShutdownResult result = orchestrator.shutdownAll(SHUTDOWN_TIMEOUT);
            if (!result.isComplete()) {
                LOG.warn("Instances still running after shutdown: {}", result.remaining());
            }
            orchestrator.stopMonitoring();
            stopped.countDown();
        }, "launchpad-shutdown"));

        orchestrator.startMonitoring();

        if (args.length > 0 && "launch".equals(args[0])) {
            Arrays.stream(args).skip(1).forEach(id -> {
                LaunchResult result = orchestrator.launchById(id);
                LOG.info("{}: {}", id, result);
            });
        } else if (args.length > 0) {
            System.err.println("Usage: launchpad [list | launch <id>...]");
            System.exit(2);
        }

        for (InstanceSnapshot instance : orchestrator.getRunning()) {
            LOG.info("Running: {} ({}) state={}", instance.instanceId(), instance.descriptor().name(),
                    instance.state());
        }
        stopped.await();
    }

    private static void printCatalog(ApplicationCatalog catalog) {
        for (ApplicationDescriptor descriptor : catalog.all()) {
            System.out.printf("%-20s %-8s %s%n", descriptor.id(), descriptor.kind().idPrefix(), descriptor.name());
        }
    }
}
