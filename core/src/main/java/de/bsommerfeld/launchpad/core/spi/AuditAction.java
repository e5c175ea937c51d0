package de.bsommerfeld.launchpad.core.spi;

public enum AuditAction {
    LAUNCH,
    SWITCH,
    TERMINATE,
    FORCE_TERMINATE,
    STATE_CHANGE
}
