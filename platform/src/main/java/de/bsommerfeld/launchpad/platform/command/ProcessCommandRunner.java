package de.bsommerfeld.launchpad.platform.command;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link CommandRunner} using {@link ProcessBuilder}. Output is drained on a
 * separate thread so a chatty command cannot block on a full pipe, and a
 * command that misses its deadline is force-killed.
 */
@Singleton
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        LOG.debug("Running {}", command);
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process));

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            LOG.warn("Command {} timed out after {} ms", command.get(0), timeout.toMillis());
            return CommandResult.timeout(collect(output));
        }

        CommandResult result = new CommandResult(process.exitValue(), collect(output), false);
        if (!result.isSuccess()) {
            LOG.debug("Command {} exited with code {}", command, result.exitCode());
        }
        return result;
    }

    private static String drain(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(1, TimeUnit.SECONDS).strip();
        } catch (ExecutionException | TimeoutException e) {
            LOG.debug("Could not collect command output", e);
            return "";
        }
    }
}
