package de.bsommerfeld.launchpad.lifecycle.launch;

import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.util.CommandLineTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts a desktop executable as a child process. The executable's
 * directory becomes the working directory, which is what most legacy
 * desktop applications expect.
 */
@Singleton
public class NativeProcessLauncher implements ApplicationLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(NativeProcessLauncher.class);

    @Override
    public ApplicationKind supportedKind() {
        return ApplicationKind.NATIVE_PROCESS;
    }

    @Override
    public LaunchAttempt launch(ApplicationDescriptor descriptor, String principal) throws LaunchException {
        Path executable = ExecutableResolver.resolve(descriptor.target())
                .orElseThrow(() -> new LaunchException("Executable not found: " + descriptor.target()));

        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(CommandLineTokenizer.tokenize(descriptor.arguments()));

        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        Path workingDir = executable.getParent();
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new LaunchException("Failed to start " + executable.getFileName() + ": " + e.getMessage(), e);
        }
        LOG.info("Started '{}' as pid {} for {}", descriptor.name(), process.pid(), principal);

        return LaunchAttempt.builder(CorrelationMode.PROCESS)
                .process(process.pid(), true)
                .windowHint(descriptor.name())
                .metadata("executable", executable.toString())
                .build();
    }
}
