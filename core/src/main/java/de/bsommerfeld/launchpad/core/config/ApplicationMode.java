package de.bsommerfeld.launchpad.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the launcher. {@link #TEST} replaces every OS-backed
 * collaborator (window enumeration, adb) with a headless stand-in so the
 * engine can run on build machines without a desktop.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code app.mode} system property, then the
     * {@code APP_MODE} environment variable. Defaults to PROD if neither is
     * set or the value is unknown.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("APP_MODE");
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
