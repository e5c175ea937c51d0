package de.bsommerfeld.launchpad.lifecycle.launch;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered set of launchers. The first launcher whose capability predicate
 * accepts a descriptor wins.
 */
@Singleton
public class LauncherRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(LauncherRegistry.class);

    private final List<ApplicationLauncher> launchers;

    @Inject
    public LauncherRegistry(Set<ApplicationLauncher> launchers) {
        this((Collection<ApplicationLauncher>) launchers);
    }

    public LauncherRegistry(Collection<ApplicationLauncher> launchers) {
        this.launchers = ImmutableList.copyOf(launchers);
        LOG.debug("Registered launchers: {}", this.launchers.stream()
                .map(l -> l.getClass().getSimpleName())
                .collect(Collectors.joining(", ")));
    }

    public Optional<ApplicationLauncher> find(ApplicationDescriptor descriptor) {
        List<ApplicationLauncher> claimants = launchers.stream()
                .filter(l -> l.canLaunch(descriptor))
                .collect(Collectors.toList());
        if (claimants.size() > 1) {
            LOG.warn("{} launchers claim '{}', using {}", claimants.size(), descriptor.id(),
                    claimants.get(0).getClass().getSimpleName());
        }
        return claimants.stream().findFirst();
    }

    public List<ApplicationLauncher> all() {
        return launchers;
    }

    /**
     * Launchers that also implement the given capability.
     */
    public <T> List<T> withCapability(Class<T> capability) {
        return launchers.stream()
                .filter(capability::isInstance)
                .map(capability::cast)
                .collect(Collectors.toList());
    }
}
