package de.bsommerfeld.launchpad.lifecycle.launch;

import de.bsommerfeld.launchpad.core.util.StorageUtils;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves an executable given as a path or as a bare name looked up on
 * {@code PATH}. On Windows the {@code PATHEXT} extensions are tried for bare
 * names.
 */
public final class ExecutableResolver {

    private ExecutableResolver() {
    }

    public static Optional<Path> resolve(String nameOrPath) {
        if (nameOrPath == null || nameOrPath.isBlank()) {
            return Optional.empty();
        }
        Path direct;
        try {
            direct = Path.of(nameOrPath);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }

        if (direct.isAbsolute() || direct.getNameCount() > 1) {
            return Files.isRegularFile(direct) ? Optional.of(direct.toAbsolutePath()) : Optional.empty();
        }

        String path = System.getenv("PATH");
        if (path == null) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String candidate : candidateNames(nameOrPath)) {
                Optional<Path> file = executableIn(dir, candidate);
                if (file.isPresent()) {
                    return file;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> executableIn(String dir, String name) {
        try {
            Path file = Path.of(dir, name);
            return Files.isRegularFile(file) && Files.isExecutable(file)
                    ? Optional.of(file.toAbsolutePath())
                    : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static List<String> candidateNames(String name) {
        List<String> names = new ArrayList<>();
        names.add(name);
        if (StorageUtils.isWindows() && !name.contains(".")) {
            String pathExt = System.getenv().getOrDefault("PATHEXT", ".EXE;.BAT;.CMD;.COM");
            for (String ext : pathExt.split(";")) {
                if (!ext.isBlank()) {
                    names.add(name + ext.toLowerCase(Locale.ROOT));
                }
            }
        }
        return names;
    }
}
