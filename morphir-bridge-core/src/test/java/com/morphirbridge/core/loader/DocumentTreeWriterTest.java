package com.morphirbridge.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.v4.V4Parser;
import com.morphirbridge.core.format.v4.V4Writer;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.naming.Path;
import com.morphirbridge.core.vfs.MemoryVfs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocumentTreeWriter}.
 */
class DocumentTreeWriterTest {

    private Distribution distribution;
    private MemoryVfs vfs;

    @BeforeEach
    void setUp() {
        distribution = new V4Parser().parse(IrFixtures.json(IrFixtures.V4_BUNDLED)).distribution();
        vfs = new MemoryVfs();
    }

    @Test
    void write_producesOneFilePerDefinition() {
        int files = new DocumentTreeWriter().write(distribution, vfs, "out");

        assertThat(files).isEqualTo(8);
        assertThat(vfs.size()).isEqualTo(8);
        try (Stream<String> fragments = vfs.glob("out/pkg/**/*.json")) {
            assertThat(fragments).containsExactly(
                "out/pkg/acme/payments/invoicing/module.json",
                "out/pkg/acme/payments/invoicing/types/invoice-id.type.json",
                "out/pkg/acme/payments/invoicing/types/invoice.type.json",
                "out/pkg/acme/payments/invoicing/types/status.type.json",
                "out/pkg/acme/payments/invoicing/values/is-overdue.value.json",
                "out/pkg/acme/payments/invoicing/values/mark-paid.value.json");
        }
    }

    @Test
    void write_formatDescriptor_namesPackageAndLayout() {
        new DocumentTreeWriter().write(distribution, vfs, "out");

        JsonNode descriptor = IrJson.read(vfs.read("out/format.json"), "format.json");

        assertThat(descriptor.get("formatVersion").asText()).isEqualTo(V4Writer.FORMAT_VERSION);
        assertThat(descriptor.get("distribution").asText()).isEqualTo("Library");
        assertThat(descriptor.get("packageName").asText()).isEqualTo("acme/payments");
        assertThat(descriptor.get("layout").asText()).isEqualTo(DocumentTreeLayout.LAYOUT);
    }

    @Test
    void write_manifest_listsDefinitionsInDeclarationOrder() {
        new DocumentTreeWriter().write(distribution, vfs, "out");

        JsonNode manifest = IrJson.read(vfs.read("out/pkg/acme/payments/invoicing/module.json"), "module.json");

        assertThat(manifest.get("module").asText()).isEqualTo("invoicing");
        assertThat(manifest.get("access").asText()).isEqualTo("Public");
        assertThat(manifest.get("doc").asText()).isEqualTo("Invoices and their lifecycle");
        assertThat(manifest.get("types").toString()).isEqualTo("[\"invoice-id\",\"status\",\"invoice\"]");
        assertThat(manifest.get("values").toString()).isEqualTo("[\"is-overdue\",\"mark-paid\"]");
    }

    @Test
    void write_noDependencies_skipsDependenciesFile() {
        Distribution withoutDependencies = new Distribution(distribution.packageName(), null, distribution.modules());

        int files = new DocumentTreeWriter().write(withoutDependencies, vfs, "");

        assertThat(files).isEqualTo(7);
        assertThat(vfs.exists(DocumentTreeLayout.DEPENDENCIES_FILE)).isFalse();
        assertThat(vfs.exists(DocumentTreeLayout.FORMAT_FILE)).isTrue();
    }

    @Test
    void write_existingTree_dropsModulesOfEarlierWrite() {
        Map<Path, AccessControlled<ModuleDefinition>> modules = new LinkedHashMap<>(distribution.modules());
        modules.put(Path.parse("ledger"), AccessControlled.publicly(new ModuleDefinition(Map.of(), Map.of(), null)));
        DocumentTreeWriter writer = new DocumentTreeWriter();
        writer.write(new Distribution(distribution.packageName(), distribution.dependencies(), modules), vfs, "out");
        Distribution withoutDependencies = new Distribution(distribution.packageName(), null, distribution.modules());

        int files = writer.write(withoutDependencies, vfs, "out");

        assertThat(files).isEqualTo(7);
        assertThat(vfs.size()).isEqualTo(7);
        assertThat(vfs.exists("out/pkg/acme/payments/ledger")).isFalse();
        assertThat(vfs.exists("out/" + DocumentTreeLayout.DEPENDENCIES_FILE)).isFalse();
        assertThat(new DocumentTreeLoader().load(vfs, "out").distribution()).isEqualTo(withoutDependencies);
    }

    @Test
    void write_existingTree_keepsFilesOutsideTheTree() {
        vfs.writeString("notes.txt", "keep");
        vfs.writeString("out/README.md", "keep");

        new DocumentTreeWriter().write(distribution, vfs, "out");
        new DocumentTreeWriter().write(distribution, vfs, "out");

        assertThat(vfs.readString("notes.txt")).isEqualTo("keep");
        assertThat(vfs.readString("out/README.md")).isEqualTo("keep");
    }

    @Test
    void write_formatDescriptor_listsModulesInDeclarationOrder() {
        Map<Path, AccessControlled<ModuleDefinition>> modules = new LinkedHashMap<>();
        modules.put(Path.parse("zeta"), AccessControlled.publicly(new ModuleDefinition(Map.of(), Map.of(), null)));
        modules.put(Path.parse("alpha"), AccessControlled.publicly(new ModuleDefinition(Map.of(), Map.of(), null)));
        Distribution unsorted = new Distribution(distribution.packageName(), null, modules);

        new DocumentTreeWriter().write(unsorted, vfs, "out");

        JsonNode descriptor = IrJson.read(vfs.read("out/format.json"), "format.json");
        assertThat(descriptor.get("modules").toString()).isEqualTo("[\"zeta\",\"alpha\"]");
        assertThat(new DocumentTreeLoader().load(vfs, "out").distribution().modules().keySet())
            .containsExactly(Path.parse("zeta"), Path.parse("alpha"));
    }
}
