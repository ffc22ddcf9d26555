package com.morphirbridge.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link VisitCommand}.
 */
class VisitCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void visit_modules_printsCount() throws IOException {
        Path input = CliTestSupport.stage(CliTestSupport.CLASSIC_V3, tempDir);

        CliTestSupport.Run run = CliTestSupport.run("visit", input.toString(), "--analysis", "modules");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out().trim()).isEqualTo("Modules: 2");
    }

    @Test
    void visit_nodes_totalMatchesVisitedCount() throws IOException {
        Path input = CliTestSupport.stage(CliTestSupport.V4_BUNDLED, tempDir);

        CliTestSupport.Run run = CliTestSupport.run("visit", input.toString(), "-a", "nodes");

        assertThat(run.exitCode()).isZero();
        String total = run.out().lines()
            .filter(line -> line.startsWith("Total:"))
            .findFirst()
            .orElseThrow();
        String counted = total.replaceAll("Total:\\s+(\\d+) .*", "$1");
        assertThat(total).endsWith("(visited " + counted + ")");
    }

    @Test
    void visit_references_listsSitesWithArity() throws IOException {
        Path input = CliTestSupport.stage(CliTestSupport.V4_BUNDLED, tempDir);

        CliTestSupport.Run run = CliTestSupport.run("visit", input.toString(), "-a", "references");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out().lines().findFirst())
            .contains("acme/payments:invoicing#invoice-id -> morphir/sdk:string#string/0");
    }

    @Test
    void visit_freeVariables_listsEveryExpressionBody() throws IOException {
        Path input = CliTestSupport.stage(CliTestSupport.V4_INCOMPLETE, tempDir);

        CliTestSupport.Run run = CliTestSupport.run("visit", input.toString(), "-a", "free-variables");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("acme/drafts:pricing#base-price: ");
        assertThat(run.out()).doesNotContain("pricing#round");
    }

    @Test
    void visit_unknownAnalysis_isUsageError() throws IOException {
        Path input = CliTestSupport.stage(CliTestSupport.CLASSIC_V3, tempDir);

        CliTestSupport.Run run = CliTestSupport.run("visit", input.toString(), "-a", "cycles");

        assertThat(run.exitCode()).isEqualTo(2);
        assertThat(run.err()).contains("unknown analysis 'cycles'");
    }
}
