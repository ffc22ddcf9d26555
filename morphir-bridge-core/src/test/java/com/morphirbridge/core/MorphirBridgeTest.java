package com.morphirbridge.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.loader.DocumentTreeLayout;
import com.morphirbridge.core.migration.MigrationResult;
import com.morphirbridge.core.vfs.MemoryVfs;
import com.morphirbridge.core.vfs.OsVfs;
import com.morphirbridge.core.visitor.IrNodeCounter;
import com.morphirbridge.core.visitor.Reducer;
import com.morphirbridge.core.visitor.impl.ModuleCounter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MorphirBridge}.
 */
class MorphirBridgeTest {

    private MorphirBridge bridge;
    private MemoryVfs vfs;

    @BeforeEach
    void setUp() {
        bridge = new MorphirBridge();
        vfs = IrFixtures.vfs(IrFixtures.CLASSIC_V3);
    }

    @Test
    void write_jsonPath_writesSingleDocument() {
        MigrationResult result = bridge.migrate(bridge.load(vfs, IrFixtures.CLASSIC_V3), IrVersion.V4);

        int files = bridge.write(result, vfs, "out/migrated.json");

        JsonNode written = IrJson.read(vfs.read("out/migrated.json"), "out/migrated.json");
        assertThat(files).isEqualTo(1);
        assertThat(written).isEqualTo(result.document());
    }

    @Test
    void write_v4ToDirectory_writesDocumentTree() {
        MigrationResult result = bridge.migrate(bridge.load(vfs, IrFixtures.CLASSIC_V3), IrVersion.V4);

        int files = bridge.write(result, vfs, "out");

        assertThat(vfs.exists("out/" + DocumentTreeLayout.FORMAT_FILE)).isTrue();
        assertThat(vfs.glob("out/**/*.json").count()).isEqualTo(files);

        ParsedDistribution reloaded = bridge.load(vfs, "out");
        assertThat(reloaded.version()).isEqualTo(IrVersion.V4);
        assertThat(reloaded.distribution()).isEqualTo(result.distribution());
    }

    @Test
    void write_classicToDirectory_writesMorphirIrJson() {
        MemoryVfs v4 = IrFixtures.vfs(IrFixtures.V4_BUNDLED);
        MigrationResult result = bridge.migrate(bridge.load(v4, IrFixtures.V4_BUNDLED), IrVersion.CLASSIC_V3);

        int files = bridge.write(result, v4, "legacy");

        assertThat(files).isEqualTo(1);
        assertThat(v4.exists("legacy/" + MorphirBridge.CLASSIC_OUTPUT_FILE)).isTrue();
        assertThat(bridge.load(v4, "legacy/" + MorphirBridge.CLASSIC_OUTPUT_FILE).version())
            .isEqualTo(IrVersion.CLASSIC_V3);
    }

    @Test
    void write_osVfs_createsDirectories(@TempDir Path tempDir) {
        OsVfs os = new OsVfs(tempDir);
        os.write(MorphirBridge.CLASSIC_OUTPUT_FILE, vfs.read(IrFixtures.CLASSIC_V3));
        MigrationResult result = bridge.migrate(bridge.load(os, MorphirBridge.CLASSIC_OUTPUT_FILE), IrVersion.V4);

        bridge.write(result, os, "dist/ir");

        assertThat(Files.isRegularFile(tempDir.resolve("dist/ir").resolve(DocumentTreeLayout.FORMAT_FILE))).isTrue();
    }

    @Test
    void visit_runsWalker() {
        ParsedDistribution parsed = bridge.load(vfs, IrFixtures.CLASSIC_V3);

        assertThat(bridge.visit(parsed.distribution(), new ModuleCounter(), Reducer.sum()).value()).isEqualTo(2);
        assertThat(bridge.visit(parsed.distribution(), new ModuleCounter(), Reducer.sum()).nodesVisited())
            .isEqualTo(IrNodeCounter.count(parsed.distribution()).modules());
    }
}
