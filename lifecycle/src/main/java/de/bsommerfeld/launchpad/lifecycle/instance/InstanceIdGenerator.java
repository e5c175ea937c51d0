package de.bsommerfeld.launchpad.lifecycle.instance;

import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates instance ids of the form {@code <kind>-<sequence>-<random>}.
 * The sequence makes ids unique for the lifetime of the process, the random
 * part keeps them from colliding with ids of earlier runs in logs and audit
 * records.
 */
@Singleton
public class InstanceIdGenerator {

    private final AtomicLong sequence = new AtomicLong();

    public String next(ApplicationKind kind) {
        String random = UUID.randomUUID().toString().substring(0, 8);
        return kind.idPrefix() + "-" + sequence.incrementAndGet() + "-" + random;
    }
}
