package de.bsommerfeld.launchpad.lifecycle.launch;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Opens a web page in the user's default browser. The browser is shared
 * with everything else the user does, so neither its process nor its window
 * belongs to the instance.
 */
@Singleton
public class WebPageLauncher implements ApplicationLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(WebPageLauncher.class);
    private static final Set<String> SCHEMES = Set.of("http", "https", "file");

    private final DesktopOpener opener;

    @Inject
    public WebPageLauncher(DesktopOpener opener) {
        this.opener = opener;
    }

    @Override
    public ApplicationKind supportedKind() {
        return ApplicationKind.WEB_PAGE;
    }

    @Override
    public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) throws LaunchException {
        String url = normalizeUrl(descriptor.target());
        if (!opener.isAvailable()) {
            throw new LaunchException("No browser available to open " + url);
        }
        try {
            opener.open(url);
        } catch (IOException e) {
            throw new LaunchException("Failed to open " + url + ": " + e.getMessage(), e);
        }
        LOG.info("Opened '{}' at {} for {}", descriptor.name(), url, principal);

        return LaunchAttempt.builder(CorrelationMode.NONE)
                .windowHint(descriptor.name())
                .metadata("url", url)
                .build();
    }

    /**
     * Adds {@code https://} to scheme-less targets and rejects anything that
     * is not a web or file URL.
     *
     * @throws LaunchException for malformed URLs or unsupported schemes
     */
    static String normalizeUrl(String target) throws LaunchException {
        String candidate = target.strip();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new LaunchException("Invalid URL: " + target, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!SCHEMES.contains(scheme)) {
            throw new LaunchException("Unsupported URL scheme: " + scheme);
        }
        if (!"file".equals(scheme) && (uri.getHost() == null || uri.getHost().isBlank())) {
            throw new LaunchException("URL has no host: " + target);
        }
        return uri.toString();
    }
}
