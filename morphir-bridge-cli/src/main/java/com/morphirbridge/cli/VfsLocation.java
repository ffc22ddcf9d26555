package com.morphirbridge.cli;

import com.morphirbridge.core.vfs.OsVfs;
import com.morphirbridge.core.vfs.Vfs;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A command-line path expressed as an {@link OsVfs} root plus a path inside it.
 */
record VfsLocation(Vfs vfs, String path) {

    /**
     * A directory becomes the VFS root; a file is addressed inside its parent directory.
     */
    static VfsLocation forInput(Path input) {
        Path absolute = input.toAbsolutePath().normalize();
        if (Files.isDirectory(absolute) || absolute.getParent() == null) {
            return new VfsLocation(new OsVfs(absolute), "");
        }
        return new VfsLocation(new OsVfs(absolute.getParent()), absolute.getFileName().toString());
    }

    /**
     * A {@code .json} output is a file inside its parent directory; anything else is a
     * directory that becomes the VFS root.
     */
    static VfsLocation forOutput(Path output) {
        Path absolute = output.toAbsolutePath().normalize();
        if (absolute.getFileName() != null && absolute.getFileName().toString().endsWith(".json")
            && absolute.getParent() != null) {
            return new VfsLocation(new OsVfs(absolute.getParent()), absolute.getFileName().toString());
        }
        return new VfsLocation(new OsVfs(absolute), "");
    }
}
