package com.morphirbridge.core.config;

import java.util.List;
import java.util.Map;

/**
 * Project settings read from {@code morphir.toml} or a legacy {@code morphir.json}.
 *
 * <p>Only naming and output locations come from here. Migration never consults the project
 * configuration: a migrated distribution keeps the package name recorded in its IR.
 *
 * <p><b>Example TOML:</b>
 * <pre>{@code
 * [project]
 * name = "my-org/my-project"
 * version = "1.2.0"
 * source_directory = "src"
 * exposed_modules = ["App"]
 * output_directory = ".morphir-dist"
 *
 * [dependencies]
 * "morphir/sdk" = "3.0.0"
 * }</pre>
 *
 * @param name              project name, as written (for example {@code Legacy.Project})
 * @param version           project version, {@value #DEFAULT_VERSION} when not given
 * @param sourceDirectory   source root, {@value #DEFAULT_SOURCE_DIRECTORY} when not given
 * @param exposedModules    modules exposed to dependents
 * @param outputDirectory   build output root, {@value #DEFAULT_OUTPUT_DIRECTORY} when not given
 * @param dependencies      dependency name to version, path or git location
 * @param localDependencies paths of local IR files this project depends on
 */
public record ProjectConfig(
    String name,
    String version,
    String sourceDirectory,
    List<String> exposedModules,
    String outputDirectory,
    Map<String, String> dependencies,
    List<String> localDependencies
) {

    public static final String DEFAULT_NAME = "project";
    public static final String DEFAULT_VERSION = "0.1.0";
    public static final String DEFAULT_SOURCE_DIRECTORY = "src";
    public static final String DEFAULT_OUTPUT_DIRECTORY = ".morphir-dist";

    public ProjectConfig {
        name = blankToDefault(name, DEFAULT_NAME);
        version = blankToDefault(version, DEFAULT_VERSION);
        sourceDirectory = blankToDefault(sourceDirectory, DEFAULT_SOURCE_DIRECTORY);
        outputDirectory = blankToDefault(outputDirectory, DEFAULT_OUTPUT_DIRECTORY);
        exposedModules = exposedModules == null ? List.of() : List.copyOf(exposedModules);
        dependencies = dependencies == null ? Map.of() : Map.copyOf(dependencies);
        localDependencies = localDependencies == null ? List.of() : List.copyOf(localDependencies);
    }

    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null, null, null);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
