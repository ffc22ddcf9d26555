package com.morphirbridge.core.vfs;

import com.morphirbridge.core.error.IrIoException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Path helpers shared by the VFS implementations.
 */
public final class VfsPaths {

    private VfsPaths() {
        // Utility class
    }

    /**
     * Normalizes a VFS path: converts {@code \} to {@code /}, drops empty and {@code .}
     * segments, resolves {@code ..} and strips leading and trailing separators.
     *
     * @throws IrIoException if {@code ..} would escape the root
     */
    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    throw new IrIoException(path, "path escapes the VFS root");
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    /**
     * Joins two path fragments and normalizes the result.
     */
    public static String join(String parent, String child) {
        if (parent == null || parent.isEmpty()) {
            return normalize(child);
        }
        return normalize(parent + "/" + child);
    }

    /**
     * @return the parent directory, or the empty string for a top-level entry
     */
    public static String parent(String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? "" : normalized.substring(0, slash);
    }

    /**
     * @return the last path segment
     */
    public static String fileName(String path) {
        String normalized = normalize(path);
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }
}
