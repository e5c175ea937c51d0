package de.bsommerfeld.launchpad.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link LaunchpadConfig} as TOML. A missing file is
 * created with defaults so users always have a template to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * @param file path of {@code config.toml}
     * @return the parsed configuration, or defaults if the file did not exist
     * @throws IOException if the file exists but cannot be read or parsed, or
     *                     the defaults cannot be written
     */
    public static LaunchpadConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            LaunchpadConfig defaults = new LaunchpadConfig();
            save(defaults, file);
            LOG.info("No configuration found, wrote defaults to {}", file);
            return defaults;
        }
        LaunchpadConfig config = MAPPER.readValue(file.toFile(), LaunchpadConfig.class);
        LOG.info("Loaded configuration from {}", file);
        return config;
    }

    public static void save(LaunchpadConfig config, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(file.toFile(), config);
    }
}
