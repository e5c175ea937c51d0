package de.bsommerfeld.launchpad.core.spi;

/**
 * Supplies the identity of the user the launcher acts for.
 */
public interface PrincipalProvider {

    String currentPrincipal();
}
