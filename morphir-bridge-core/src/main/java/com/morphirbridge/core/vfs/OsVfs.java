package com.morphirbridge.core.vfs;

import com.morphirbridge.core.error.IrIoException;
import com.morphirbridge.core.error.IrNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link Vfs} over a directory of the local file system.
 *
 * <p>Globbing walks lazily from the pattern's literal prefix. Symbolic links to directories
 * are not followed and the walk depth is capped at {@value #MAX_DEPTH}, so link cycles cannot
 * make a walk run forever.
 */
public class OsVfs implements Vfs {

    private static final Logger log = LoggerFactory.getLogger(OsVfs.class);

    static final int MAX_DEPTH = 64;

    private final Path root;

    public OsVfs(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public byte[] read(String path) {
        Path file = resolve(path);
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new IrNotFoundException(VfsPaths.normalize(path));
        } catch (IOException e) {
            throw new IrIoException(VfsPaths.normalize(path), e);
        }
    }

    @Override
    public void write(String path, byte[] content) {
        Path file = resolve(path);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, content);
            log.debug("Wrote {} bytes to {}", content.length, file);
        } catch (IOException e) {
            throw new IrIoException(VfsPaths.normalize(path), e);
        }
    }

    @Override
    public int delete(String path) {
        String normalized = VfsPaths.normalize(path);
        if (normalized.isEmpty()) {
            throw new IrIoException(normalized, "cannot delete the VFS root");
        }
        Path target = root.resolve(normalized);
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            return 0;
        }
        int removed = 0;
        try (Stream<Path> walk = Files.walk(target)) {
            List<Path> deepestFirst = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path entry : deepestFirst) {
                if (!Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    removed++;
                }
                Files.delete(entry);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new IrIoException(normalized, e instanceof UncheckedIOException ? e.getCause() : e);
        }
        log.debug("Deleted {} files under {}", removed, target);
        return removed;
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public boolean isDirectory(String path) {
        return Files.isDirectory(resolve(path));
    }

    @Override
    public List<String> list(String directory) {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            throw new IrNotFoundException(VfsPaths.normalize(directory));
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children.map(this::relativize).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new IrIoException(VfsPaths.normalize(directory), e);
        }
    }

    @Override
    public Stream<String> glob(String pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        String prefix = glob.literalPrefix();
        Path start = resolve(prefix);
        if (!Files.isDirectory(start)) {
            return Stream.empty();
        }

        Stream<Path> walk;
        try {
            walk = Files.walk(start, MAX_DEPTH);
        } catch (IOException e) {
            throw new IrIoException(prefix, e);
        }

        Iterator<Path> paths = walk.iterator();
        Iterator<String> matches = new Iterator<>() {
            @Override
            public boolean hasNext() {
                try {
                    return paths.hasNext();
                } catch (UncheckedIOException e) {
                    throw new IrIoException(prefix, e.getCause());
                }
            }

            @Override
            public String next() {
                try {
                    return relativize(paths.next());
                } catch (UncheckedIOException e) {
                    throw new IrIoException(prefix, e.getCause());
                }
            }
        };

        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(matches, Spliterator.ORDERED), false)
            .filter(relative -> glob.matches(relative) && Files.isRegularFile(root.resolve(relative)))
            .onClose(walk::close);
    }

    private Path resolve(String path) {
        String normalized = VfsPaths.normalize(path);
        return normalized.isEmpty() ? root : root.resolve(normalized);
    }

    private String relativize(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
