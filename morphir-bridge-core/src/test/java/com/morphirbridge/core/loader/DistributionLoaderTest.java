package com.morphirbridge.core.loader;

import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.error.ErrorKind;
import com.morphirbridge.core.error.IrException;
import com.morphirbridge.core.error.IrNotFoundException;
import com.morphirbridge.core.error.IrParseException;
import com.morphirbridge.core.error.UnrecognizedFormatException;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.vfs.MemoryVfs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DistributionLoader}.
 */
class DistributionLoaderTest {

    private final DistributionLoader loader = new DistributionLoader();

    @ParameterizedTest
    @CsvSource({
        "classic-v1.json, CLASSIC_V1",
        "classic-v2.json, CLASSIC_V2",
        "classic-v3.json, CLASSIC_V3",
        "v4-bundled.json, V4"
    })
    void load_singleFile_detectsVersion(String fixture, IrVersion expected) {
        ParsedDistribution parsed = loader.load(IrFixtures.vfs(fixture), fixture);

        assertThat(parsed.version()).isEqualTo(expected);
        assertThat(parsed.distribution().modules()).isNotEmpty();
    }

    @Test
    void load_directoryOrFormatFile_readsDocumentTree() {
        ParsedDistribution bundled = loader.load(IrFixtures.vfs(IrFixtures.V4_BUNDLED), IrFixtures.V4_BUNDLED);
        MemoryVfs vfs = new MemoryVfs();
        new DocumentTreeWriter().write(bundled.distribution(), vfs, "tree");

        assertThat(loader.load(vfs, "tree").distribution()).isEqualTo(bundled.distribution());
        assertThat(loader.load(vfs, "tree/format.json").distribution()).isEqualTo(bundled.distribution());
    }

    @Test
    void load_directoryWithoutDescriptor_throwsNotFound() {
        MemoryVfs vfs = MemoryVfs.of(Map.of("plain/readme.txt", "hello"));

        assertThatThrownBy(() -> loader.load(vfs, "plain"))
            .isInstanceOf(IrNotFoundException.class)
            .hasMessageContaining("'plain' is a directory but not a document tree");
    }

    @Test
    void load_missingFile_throwsNotFound() {
        assertThatThrownBy(() -> loader.load(new MemoryVfs(), "absent.json"))
            .isInstanceOf(IrException.class)
            .satisfies(e -> assertThat(((IrException) e).kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void load_malformedJson_namesFile() {
        MemoryVfs vfs = MemoryVfs.of(Map.of("broken.json", "{\"distribution\": ["));

        assertThatThrownBy(() -> loader.load(vfs, "broken.json"))
            .isInstanceOf(IrParseException.class)
            .hasMessageContaining("malformed JSON")
            .satisfies(e -> assertThat(((IrParseException) e).sourcePath()).isEqualTo("broken.json"));
    }

    @Test
    void load_unknownDocument_namesFile() {
        MemoryVfs vfs = MemoryVfs.of(Map.of("package.json", "{\"name\": \"not-ir\"}"));

        assertThatThrownBy(() -> loader.load(vfs, "package.json"))
            .isInstanceOf(UnrecognizedFormatException.class)
            .hasMessageStartingWith("'package.json': ");
    }

    @Test
    void load_parseErrorInsideDocument_namesFileAndPointer() {
        MemoryVfs vfs = MemoryVfs.of(Map.of("bad.json",
            "{\"distribution\": [\"Library\", [[\"acme\"]], [], {\"modules\": [[[[\"m\"]], {\"access\": \"Everyone\", \"value\": {}}]]}]}"));

        assertThatThrownBy(() -> loader.load(vfs, "bad.json"))
            .isInstanceOf(IrParseException.class)
            .hasMessageContaining("unknown access 'Everyone'")
            .satisfies(e -> {
                IrParseException parseError = (IrParseException) e;
                assertThat(parseError.sourcePath()).isEqualTo("bad.json");
                assertThat(parseError.pointer()).isEqualTo("/distribution/3/modules/0/1/access");
            });
    }
}
