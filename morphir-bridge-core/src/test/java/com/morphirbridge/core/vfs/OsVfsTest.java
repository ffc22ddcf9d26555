package com.morphirbridge.core.vfs;

import com.morphirbridge.core.error.IrIoException;
import com.morphirbridge.core.error.IrNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OsVfs}.
 */
class OsVfsTest {

    @TempDir
    Path tempDir;

    @Test
    void glob_anyDepth_matchesRootAndNestedFiles() throws IOException {
        Files.writeString(tempDir.resolve("foo.txt"), "foo");
        Files.writeString(tempDir.resolve("bar.rs"), "bar");
        Files.createDirectories(tempDir.resolve("baz"));
        Files.writeString(tempDir.resolve("baz/qux.txt"), "qux");

        OsVfs vfs = new OsVfs(tempDir);

        try (Stream<String> matches = vfs.glob("**/*.txt")) {
            assertThat(matches.sorted()).containsExactly("baz/qux.txt", "foo.txt");
        }
    }

    @Test
    void glob_missingPrefix_isEmpty() {
        OsVfs vfs = new OsVfs(tempDir);

        try (Stream<String> matches = vfs.glob("pkg/**/module.json")) {
            assertThat(matches).isEmpty();
        }
    }

    @Test
    void write_createsParentDirectories() throws IOException {
        OsVfs vfs = new OsVfs(tempDir);

        vfs.writeString("a/b/c.json", "{}");

        assertThat(Files.readString(tempDir.resolve("a/b/c.json"))).isEqualTo("{}");
        assertThat(vfs.isDirectory("a/b")).isTrue();
        assertThat(vfs.list("a")).containsExactly("a/b");
    }

    @Test
    void read_missingFile_throwsNotFound() {
        OsVfs vfs = new OsVfs(tempDir);

        assertThatThrownBy(() -> vfs.read("missing.json"))
            .isInstanceOf(IrNotFoundException.class)
            .hasMessageContaining("missing.json");
    }

    @Test
    void list_missingDirectory_throwsNotFound() {
        OsVfs vfs = new OsVfs(tempDir);

        assertThatThrownBy(() -> vfs.list("nope")).isInstanceOf(IrNotFoundException.class);
    }

    @Test
    void delete_directory_removesNestedFiles() throws IOException {
        Files.createDirectories(tempDir.resolve("tree/pkg/nested"));
        Files.writeString(tempDir.resolve("tree/pkg/a.json"), "a");
        Files.writeString(tempDir.resolve("tree/pkg/nested/b.json"), "b");
        Files.writeString(tempDir.resolve("tree/format.json"), "{}");
        OsVfs vfs = new OsVfs(tempDir);

        int removed = vfs.delete("tree/pkg");

        assertThat(removed).isEqualTo(2);
        assertThat(Files.exists(tempDir.resolve("tree/pkg"))).isFalse();
        assertThat(Files.exists(tempDir.resolve("tree/format.json"))).isTrue();
        assertThat(vfs.delete("tree/pkg")).isZero();
    }

    @Test
    void resolve_escapingRoot_throwsIoError() {
        OsVfs vfs = new OsVfs(tempDir);

        assertThatThrownBy(() -> vfs.exists("../sibling")).isInstanceOf(IrIoException.class);
    }
}
