package de.bsommerfeld.launchpad.app.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.app.audit.LoggingAuditSink;
import de.bsommerfeld.launchpad.app.catalog.TomlApplicationCatalog;
import de.bsommerfeld.launchpad.app.identity.SystemPrincipalProvider;
import de.bsommerfeld.launchpad.core.config.AndroidConfig;
import de.bsommerfeld.launchpad.core.config.ApplicationMode;
import de.bsommerfeld.launchpad.core.config.BrowserConfig;
import de.bsommerfeld.launchpad.core.config.ConfigLoader;
import de.bsommerfeld.launchpad.core.config.CorrelationConfig;
import de.bsommerfeld.launchpad.core.config.LaunchpadConfig;
import de.bsommerfeld.launchpad.core.config.MonitoringConfig;
import de.bsommerfeld.launchpad.core.spi.ApplicationCatalog;
import de.bsommerfeld.launchpad.core.spi.AuditSink;
import de.bsommerfeld.launchpad.core.spi.PrincipalProvider;
import de.bsommerfeld.launchpad.core.util.StorageUtils;
import de.bsommerfeld.launchpad.lifecycle.LifecycleModule;
import de.bsommerfeld.launchpad.platform.PlatformModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Top-level wiring: loads {@code config.toml} from the data directory, binds
 * the configuration sections and the file-backed adapters, then installs the
 * platform and lifecycle modules.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path dataDir;
    private final ApplicationMode mode;

    public AppModule() {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME), ApplicationMode.get());
    }

    public AppModule(Path dataDir, ApplicationMode mode) {
        this.dataDir = dataDir;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        try {
            if (!Files.exists(dataDir)) {
                Files.createDirectories(dataDir);
            }
            Path configPath = dataDir.resolve("config.toml");
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());

            LaunchpadConfig config = ConfigLoader.load(configPath);

            bind(LaunchpadConfig.class).toInstance(config);
            bind(MonitoringConfig.class).toInstance(config.getMonitoring());
            bind(CorrelationConfig.class).toInstance(config.getCorrelation());
            bind(AndroidConfig.class).toInstance(config.getAndroid());
            bind(BrowserConfig.class).toInstance(config.getBrowser());
        } catch (Exception e) {
            throw new RuntimeException("Failed to load application configuration", e);
        }

        LOG.info("Application mode initialized: {}", mode);

        bind(AuditSink.class).to(LoggingAuditSink.class).in(Singleton.class);
        bind(PrincipalProvider.class).to(SystemPrincipalProvider.class);

        install(new PlatformModule(mode));
        install(new LifecycleModule());
    }

    @Provides
    @Singleton
    ApplicationCatalog provideCatalog() {
        return new TomlApplicationCatalog(dataDir.resolve("catalog.toml"));
    }
}
