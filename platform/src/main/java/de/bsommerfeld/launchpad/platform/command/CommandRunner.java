package de.bsommerfeld.launchpad.platform.command;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs short-lived external commands with a deadline.
 */
public interface CommandRunner {

    /**
     * @throws IOException          if the command cannot be started
     * @throws InterruptedException if the caller is interrupted while waiting
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
