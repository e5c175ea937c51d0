package de.bsommerfeld.launchpad.core.util;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A named, cancellable background task running on its own daemon thread
 * with a fixed delay between ticks.
 *
 * <p>
 * A tick that throws is logged and the loop carries on with the next tick.
 * {@link #start()} on a running loop and {@link #stop()} on a stopped loop
 * are no-ops. A stopped loop can be started again.
 */
public final class PollingLoop {

    private static final Logger LOG = LoggerFactory.getLogger(PollingLoop.class);

    private final String name;
    private final Duration interval;
    private final Runnable tick;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> future;

    public PollingLoop(String name, Duration interval, Runnable tick) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        this.name = name;
        this.interval = interval;
        this.tick = tick;
    }

    public synchronized void start() {
        if (future != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .setDaemon(true)
                .build());
        long millis = interval.toMillis();
        future = executor.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
        LOG.debug("Started polling loop '{}' every {} ms", name, millis);
    }

    public synchronized void stop() {
        if (future == null) {
            return;
        }
        future.cancel(false);
        executor.shutdownNow();
        future = null;
        executor = null;
        LOG.debug("Stopped polling loop '{}'", name);
    }

    public synchronized boolean isRunning() {
        return future != null;
    }

    /**
     * Runs a single tick on the calling thread. Exceptions are logged, never
     * propagated.
     */
    public void runOnce() {
        try {
            tick.run();
        } catch (Exception e) {
            LOG.warn("Polling loop '{}' tick failed, retrying next tick", name, e);
        }
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }
}
