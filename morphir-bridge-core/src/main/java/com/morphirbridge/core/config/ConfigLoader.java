package com.morphirbridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.morphirbridge.core.error.IrException;
import com.morphirbridge.core.error.IrIoException;
import com.morphirbridge.core.error.IrNotFoundException;
import com.morphirbridge.core.error.IrParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link ProjectConfig} from {@code morphir.toml} or a legacy {@code morphir.json}.
 *
 * <p>The format is chosen by file extension. JSON files use the legacy camelCase keys
 * ({@code name}, {@code sourceDirectory}, {@code exposedModules}, {@code dependencies},
 * {@code localDependencies}); TOML files use a {@code [project]} table with snake_case keys and
 * an optional {@code [dependencies]} table.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.loadOrDefaults(Paths.get("morphir.toml"));
 * Path output = Paths.get(config.outputDirectory());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String TOML_FILE = "morphir.toml";
    public static final String LEGACY_FILE = "morphir.json";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TomlMapper TOML_MAPPER = new TomlMapper();

    private ConfigLoader() {
        // Utility class
    }

    /**
     * @throws IrNotFoundException if the file does not exist
     * @throws IrParseException    if the file is not valid JSON/TOML or lacks required fields
     * @throws IrIoException       for any other read failure
     */
    public static ProjectConfig load(Path configPath) {
        byte[] content;
        try {
            content = Files.readAllBytes(configPath);
        } catch (NoSuchFileException e) {
            throw new IrNotFoundException(configPath.toString());
        } catch (IOException e) {
            throw new IrIoException(configPath.toString(), e);
        }

        log.debug("Loading configuration from: {}", configPath);
        try {
            ProjectConfig config = isToml(configPath) ? fromToml(content) : fromLegacyJson(content);
            log.info("Loaded configuration for project '{}' from: {}", config.name(), configPath);
            return config;
        } catch (JsonProcessingException e) {
            throw new IrParseException("/", e.getOriginalMessage(), e).inFile(configPath.toString());
        } catch (IOException e) {
            throw new IrIoException(configPath.toString(), e);
        } catch (IrParseException e) {
            throw e.inFile(configPath.toString());
        }
    }

    /**
     * Like {@link #load(Path)} but logs a warning and returns {@link ProjectConfig#defaults()}
     * when the file is missing or unusable.
     */
    public static ProjectConfig loadOrDefaults(Path configPath) {
        try {
            return load(configPath);
        } catch (IrException e) {
            log.warn("Using default project configuration: {}", e.getMessage());
            return ProjectConfig.defaults();
        }
    }

    /**
     * Finds {@code morphir.toml}, then {@code morphir.json}, in {@code directory}.
     *
     * @return the configuration file, or {@code null} if the directory has neither
     */
    public static Path find(Path directory) {
        for (String candidate : List.of(TOML_FILE, LEGACY_FILE)) {
            Path file = directory.resolve(candidate);
            if (Files.isRegularFile(file)) {
                return file;
            }
        }
        return null;
    }

    private static boolean isToml(Path configPath) {
        return configPath.getFileName() != null && configPath.getFileName().toString().endsWith(".toml");
    }

    // ==================== Legacy morphir.json ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LegacyProjectFile(
        @JsonProperty("name") String name,
        @JsonProperty("sourceDirectory") String sourceDirectory,
        @JsonProperty("exposedModules") List<String> exposedModules,
        @JsonProperty("dependencies") Map<String, String> dependencies,
        @JsonProperty("localDependencies") List<String> localDependencies
    ) {}

    private static ProjectConfig fromLegacyJson(byte[] content) throws IOException {
        LegacyProjectFile file = JSON_MAPPER.readValue(content, LegacyProjectFile.class);
        if (file == null || file.name() == null) {
            throw new IrParseException("/name", "missing required field 'name'");
        }
        return new ProjectConfig(file.name(), ProjectConfig.DEFAULT_VERSION, file.sourceDirectory(),
            file.exposedModules(), null, file.dependencies(), file.localDependencies());
    }

    // ==================== morphir.toml ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TomlFile(
        @JsonProperty("project") ProjectTable project,
        @JsonProperty("dependencies") Map<String, JsonNode> dependencies
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProjectTable(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("source_directory") String sourceDirectory,
        @JsonProperty("exposed_modules") List<String> exposedModules,
        @JsonProperty("output_directory") String outputDirectory
    ) {}

    private static ProjectConfig fromToml(byte[] content) throws IOException {
        TomlFile file = TOML_MAPPER.readValue(content, TomlFile.class);
        if (file == null || file.project() == null) {
            throw new IrParseException("/project", "missing [project] table");
        }
        ProjectTable project = file.project();
        if (project.name() == null) {
            throw new IrParseException("/project/name", "missing required field 'name'");
        }
        return new ProjectConfig(project.name(), project.version(), project.sourceDirectory(),
            project.exposedModules(), project.outputDirectory(), dependencies(file.dependencies()), List.of());
    }

    /**
     * A dependency is a version string or a table; tables contribute their version, path or
     * git location, in that order of preference.
     */
    private static Map<String, String> dependencies(Map<String, JsonNode> table) {
        Map<String, String> dependencies = new LinkedHashMap<>();
        if (table == null) {
            return dependencies;
        }
        table.forEach((name, spec) -> {
            if (spec.isTextual()) {
                dependencies.put(name, spec.asText());
                return;
            }
            for (String key : List.of("version", "path", "git")) {
                if (spec.hasNonNull(key)) {
                    dependencies.put(name, spec.get(key).asText());
                    return;
                }
            }
            throw new IrParseException("/dependencies/" + name, "expected a version string or a table with version, path or git");
        });
        return dependencies;
    }
}
