package de.bsommerfeld.launchpad.core.spi;

import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the configured applications. Where the entries come from
 * (file, directory service, database) is up to the implementation.
 */
public interface ApplicationCatalog {

    Optional<ApplicationDescriptor> find(String descriptorId);

    List<ApplicationDescriptor> all();
}
