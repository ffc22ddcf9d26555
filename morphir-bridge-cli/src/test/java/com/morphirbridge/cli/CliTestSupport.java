package com.morphirbridge.cli;

import com.morphirbridge.MorphirBridgeCLI;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the command line against captured output streams and stages fixtures on disk.
 */
final class CliTestSupport {

    static final String CLASSIC_V3 = "classic-v3.json";
    static final String V4_BUNDLED = "v4-bundled.json";
    static final String V4_INCOMPLETE = "v4-incomplete.json";

    private CliTestSupport() {
        // Utility class
    }

    record Run(int exitCode, String out, String err) {}

    static Run run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = MorphirBridgeCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    /**
     * Copies a fixture from the test classpath into {@code directory}.
     */
    static Path stage(String fixture, Path directory) throws IOException {
        Path target = directory.resolve(fixture);
        try (InputStream in = CliTestSupport.class.getResourceAsStream("/fixtures/" + fixture)) {
            if (in == null) {
                throw new IllegalArgumentException("no fixture named " + fixture);
            }
            Files.copy(in, target);
        }
        return target;
    }
}
