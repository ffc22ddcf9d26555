package com.morphirbridge.core.vfs;

import com.morphirbridge.core.error.IrIoException;
import com.morphirbridge.core.error.IrNotFoundException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;

/**
 * In-memory {@link Vfs} backed by a sorted concurrent map of file path to content.
 *
 * <p>Directories are implicit: a directory exists when some file lives below it. Glob results
 * come back in path order, which keeps loaders deterministic in tests.
 */
public class MemoryVfs implements Vfs {

    private final ConcurrentNavigableMap<String, byte[]> files = new ConcurrentSkipListMap<>();

    public MemoryVfs() {
    }

    /**
     * Creates a VFS pre-populated with UTF-8 text files.
     */
    public static MemoryVfs of(Map<String, String> textFiles) {
        MemoryVfs vfs = new MemoryVfs();
        textFiles.forEach(vfs::writeString);
        return vfs;
    }

    @Override
    public byte[] read(String path) {
        byte[] content = files.get(VfsPaths.normalize(path));
        if (content == null) {
            throw new IrNotFoundException(VfsPaths.normalize(path));
        }
        return Arrays.copyOf(content, content.length);
    }

    @Override
    public void write(String path, byte[] content) {
        Objects.requireNonNull(content, "content must not be null");
        String normalized = VfsPaths.normalize(path);
        if (normalized.isEmpty()) {
            throw new IrIoException(normalized, "cannot write to the VFS root");
        }
        files.put(normalized, Arrays.copyOf(content, content.length));
    }

    @Override
    public int delete(String path) {
        String normalized = VfsPaths.normalize(path);
        if (normalized.isEmpty()) {
            throw new IrIoException(normalized, "cannot delete the VFS root");
        }
        int removed = files.remove(normalized) != null ? 1 : 0;
        // '0' sorts right after '/', so this is exactly the subtree
        ConcurrentNavigableMap<String, byte[]> below = files.subMap(normalized + "/", normalized + "0");
        removed += below.size();
        below.clear();
        return removed;
    }

    @Override
    public boolean exists(String path) {
        String normalized = VfsPaths.normalize(path);
        return files.containsKey(normalized) || isDirectory(normalized);
    }

    @Override
    public boolean isDirectory(String path) {
        String normalized = VfsPaths.normalize(path);
        if (normalized.isEmpty()) {
            return true;
        }
        String prefix = normalized + "/";
        String next = files.ceilingKey(prefix);
        return next != null && next.startsWith(prefix);
    }

    @Override
    public List<String> list(String directory) {
        String normalized = VfsPaths.normalize(directory);
        if (!isDirectory(normalized)) {
            throw new IrNotFoundException(normalized);
        }
        String prefix = normalized.isEmpty() ? "" : normalized + "/";
        TreeSet<String> children = new TreeSet<>();
        for (String file : files.tailMap(prefix).keySet()) {
            if (!file.startsWith(prefix)) {
                break;
            }
            int slash = file.indexOf('/', prefix.length());
            children.add(slash < 0 ? file : file.substring(0, slash));
        }
        return new ArrayList<>(children);
    }

    @Override
    public Stream<String> glob(String pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        return files.keySet().stream().filter(glob::matches);
    }

    /**
     * @return number of files stored
     */
    public int size() {
        return files.size();
    }
}
