package de.bsommerfeld.launchpad.platform.command;

/**
 * Outcome of an external command.
 *
 * @param exitCode process exit code, {@code -1} if it timed out
 * @param output   merged stdout and stderr
 * @param timedOut {@code true} if the command was killed at its deadline
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public CommandResult {
        output = output == null ? "" : output;
    }

    public static CommandResult timeout(String partialOutput) {
        return new CommandResult(-1, partialOutput, true);
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    public boolean outputContains(String text) {
        return output.contains(text);
    }
}
