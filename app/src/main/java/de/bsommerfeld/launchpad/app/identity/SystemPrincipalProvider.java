package de.bsommerfeld.launchpad.app.identity;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.config.LaunchpadConfig;
import de.bsommerfeld.launchpad.core.spi.PrincipalProvider;

/**
 * Uses the principal from {@code config.toml} if one is set, otherwise the
 * operating system user.
 */
@Singleton
public class SystemPrincipalProvider implements PrincipalProvider {

    private final String principal;

    @Inject
    public SystemPrincipalProvider(LaunchpadConfig config) {
        this(config.getPrincipal(), System.getProperty("user.name"));
    }

    SystemPrincipalProvider(String configured, String systemUser) {
        if (configured != null && !configured.isBlank()) {
            this.principal = configured.trim();
        } else if (systemUser != null && !systemUser.isBlank()) {
            this.principal = systemUser;
        } else {
            this.principal = "unknown";
        }
    }

    @Override
    public String currentPrincipal() {
        return principal;
    }
}
