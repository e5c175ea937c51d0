package de.bsommerfeld.launchpad.platform.process;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Best-effort description of an OS process. Any field the OS refuses to
 * reveal (other users' processes, protected processes) is empty.
 *
 * @param processId process id
 * @param command   executable path
 * @param arguments command line arguments
 * @param startedAt process start time
 * @param user      owning user
 * @param alive     whether the process was alive when queried
 * @param cpuTime   accumulated CPU time
 */
public record ProcessInfo(
        long processId,
        Optional<String> command,
        List<String> arguments,
        Optional<Instant> startedAt,
        Optional<String> user,
        boolean alive,
        Optional<Duration> cpuTime) {

    public ProcessInfo {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public String executableName() {
        return command.map(c -> {
            String normalized = c.replace('\\', '/');
            return normalized.substring(normalized.lastIndexOf('/') + 1);
        }).orElse("");
    }
}
