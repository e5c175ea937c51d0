package de.bsommerfeld.launchpad.app.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.spi.ApplicationCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog backed by a {@code catalog.toml} file of {@code [[applications]]}
 * tables:
 *
 * <pre>
 * [[applications]]
 * id = "notepad"
 * name = "Notepad"
 * kind = "native"
 * target = "notepad.exe"
 * arguments = ""
 * category = "Tools"
 * single-instance = true
 * </pre>
 *
 * <p>
 * {@code kind} accepts the instance id prefix ({@code native}, {@code web},
 * {@code app}, {@code folder}, {@code android}) or the enum name. Invalid
 * entries are logged and skipped, duplicate ids keep the first entry.
 */
public class TomlApplicationCatalog implements ApplicationCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(TomlApplicationCatalog.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final Path file;
    private volatile Map<String, ApplicationDescriptor> entries = Map.of();

    public TomlApplicationCatalog(Path file) {
        this.file = file;
        reload();
    }

    /**
     * Re-reads the file. On a read or parse error the previously loaded
     * entries are kept.
     */
    public void reload() {
        if (!Files.exists(file)) {
            LOG.info("No application catalog at {}, catalog is empty", file);
            entries = Map.of();
            return;
        }
        try {
            CatalogFile parsed = MAPPER.readValue(file.toFile(), CatalogFile.class);
            entries = toDescriptors(parsed);
            LOG.info("Loaded {} application(s) from {}", entries.size(), file);
        } catch (IOException e) {
            LOG.error("Failed to read application catalog {}, keeping {} previous entries", file, entries.size(), e);
        }
    }

    @Override
    public Optional<ApplicationDescriptor> find(String descriptorId) {
        return Optional.ofNullable(entries.get(descriptorId));
    }

    @Override
    public List<ApplicationDescriptor> all() {
        return ImmutableList.copyOf(entries.values());
    }

    private static Map<String, ApplicationDescriptor> toDescriptors(CatalogFile parsed) {
        Map<String, ApplicationDescriptor> result = new LinkedHashMap<>();
        if (parsed == null || parsed.applications == null) {
            return result;
        }
        for (Entry entry : parsed.applications) {
            Optional<ApplicationDescriptor> descriptor = toDescriptor(entry);
            if (descriptor.isEmpty()) {
                continue;
            }
            ApplicationDescriptor d = descriptor.get();
            if (result.putIfAbsent(d.id(), d) != null) {
                LOG.warn("Duplicate catalog id '{}', keeping the first entry", d.id());
            }
        }
        return result;
    }

    static Optional<ApplicationDescriptor> toDescriptor(Entry entry) {
        Optional<ApplicationKind> kind = parseKind(entry.kind);
        if (kind.isEmpty()) {
            LOG.warn("Skipping catalog entry '{}': unknown kind '{}'", entry.id, entry.kind);
            return Optional.empty();
        }
        boolean singleInstance = entry.singleInstance != null
                ? entry.singleInstance
                : kind.get() != ApplicationKind.FOLDER;
        try {
            return Optional.of(new ApplicationDescriptor(entry.id, entry.name, kind.get(), entry.target,
                    entry.arguments, entry.description, entry.category, singleInstance));
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping catalog entry '{}': {}", entry.id, e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<ApplicationKind> parseKind(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (ApplicationKind kind : ApplicationKind.values()) {
            if (kind.idPrefix().equalsIgnoreCase(normalized)
                    || kind.name().equals(normalized.toUpperCase(Locale.ROOT).replace('-', '_'))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    // -- TOML binding --

    static class CatalogFile {
        public List<Entry> applications = new ArrayList<>();
    }

    static class Entry {
        public String id;
        public String name;
        public String kind;
        public String target;
        public String arguments;
        public String description;
        public String category;
        @JsonProperty("single-instance")
        public Boolean singleInstance;
    }
}
