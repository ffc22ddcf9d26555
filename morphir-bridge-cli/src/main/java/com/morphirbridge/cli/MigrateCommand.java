package com.morphirbridge.cli;

import com.morphirbridge.core.config.ConfigLoader;
import com.morphirbridge.core.config.ProjectConfig;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.migration.MigrationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.TypeConversionException;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command to migrate IR to another format version.
 *
 * <p>Without {@code -o} the output goes to the project's output directory from
 * {@code morphir.toml} or {@code morphir.json} ({@code -c}, or found in the working directory),
 * falling back to {@code .morphir-dist}.
 */
@Command(
    name = "migrate",
    description = "Migrate IR between classic and V4 formats",
    mixinStandardHelpOptions = true
)
public class MigrateCommand extends IrCommand {

    @Parameters(index = "0", description = "IR file or document tree directory")
    private Path input;

    @Option(names = {"-t", "--target"}, defaultValue = "latest", converter = TargetConverter.class,
        description = "Target version: latest, v4, classic, v3, v2 or v1 (default: ${DEFAULT-VALUE})")
    private IrVersion target;

    @Option(names = {"-o", "--output"},
        description = "Output .json file, or directory (document tree for V4)")
    private Path output;

    @Option(names = {"-c", "--config"}, description = "Project configuration file")
    private Path config;

    @Override
    protected void execute() {
        ParsedDistribution parsed = load(input);
        MigrationResult result = bridge.migrate(parsed, target);

        Path destination = output != null ? output : defaultOutput();
        VfsLocation location = VfsLocation.forOutput(destination);
        int files = bridge.write(result, location.vfs(), location.path());

        out().printf("Migrated %s from %s to %s: %d file(s) written to %s%n",
            result.distribution().packageName().toCanonicalString(), parsed.version(), result.target(),
            files, destination);
        out().flush();
    }

    private Path defaultOutput() {
        Path configFile = config != null ? config : ConfigLoader.find(Paths.get("."));
        ProjectConfig project = configFile == null ? ProjectConfig.defaults() : ConfigLoader.loadOrDefaults(configFile);
        log.info("Writing to output directory of project '{}'", project.name());
        return Paths.get(project.outputDirectory());
    }

    static class TargetConverter implements ITypeConverter<IrVersion> {
        @Override
        public IrVersion convert(String value) {
            try {
                return IrVersion.resolveTarget(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
