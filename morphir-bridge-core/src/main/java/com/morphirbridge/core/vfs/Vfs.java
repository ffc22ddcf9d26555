package com.morphirbridge.core.vfs;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

/**
 * Hierarchical file abstraction the IR loaders and writers work against.
 *
 * <p>Paths are relative, use {@code /} as separator and are normalized with
 * {@link VfsPaths#normalize(String)}; the empty string is the root. Implementations must be
 * safe for concurrent reads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Vfs vfs = new OsVfs(Paths.get("out"));
 * try (Stream<String> modules = vfs.glob("pkg/**&#47;module.json")) {
 *     modules.forEach(path -> process(vfs.readString(path)));
 * }
 * }</pre>
 *
 * @see MemoryVfs
 * @see OsVfs
 */
public interface Vfs {

    /**
     * Reads a whole file.
     *
     * @throws com.morphirbridge.core.error.IrNotFoundException if the file does not exist
     * @throws com.morphirbridge.core.error.IrIoException on any other I/O failure
     */
    byte[] read(String path);

    default String readString(String path) {
        return new String(read(path), StandardCharsets.UTF_8);
    }

    /**
     * Writes a file, creating parent directories as needed and replacing existing content.
     */
    void write(String path, byte[] content);

    default void writeString(String path, String content) {
        write(path, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Deletes a file, or a directory with everything below it. A missing path is not an error.
     *
     * @return number of files removed
     * @throws com.morphirbridge.core.error.IrIoException if the path is the VFS root or cannot be removed
     */
    int delete(String path);

    boolean exists(String path);

    boolean isDirectory(String path);

    /**
     * Lists the immediate children (files and directories) of a directory, sorted, as full
     * paths relative to the VFS root.
     *
     * @throws com.morphirbridge.core.error.IrNotFoundException if the directory does not exist
     */
    List<String> list(String directory);

    /**
     * Streams the files matching a glob pattern (see {@link GlobPattern}). The stream is lazy;
     * callers should close it when backed by the OS.
     */
    Stream<String> glob(String pattern);
}
