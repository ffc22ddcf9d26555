package com.morphirbridge.core.vfs;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compiled glob over {@code /}-separated VFS paths.
 *
 * <p>Syntax:
 * <ul>
 *   <li>{@code **} as a whole segment matches zero or more segments</li>
 *   <li>{@code *} matches any run of characters within one segment</li>
 *   <li>{@code ?} matches one character within one segment</li>
 *   <li>{@code {a,b}} matches either alternative</li>
 * </ul>
 *
 * <p>Without {@code **} a pattern only matches paths with the same number of segments, so
 * {@code *.txt} matches {@code a.txt} but not {@code dir/a.txt}, while {@code **&#47;*.txt}
 * matches both.
 */
public final class GlobPattern {

    private static final String ANY_DEPTH = "**";

    private final String source;
    private final List<String> rawSegments;
    private final List<Pattern> segments;

    private GlobPattern(String source, List<String> rawSegments, List<Pattern> segments) {
        this.source = source;
        this.rawSegments = rawSegments;
        this.segments = segments;
    }

    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob must not be null");
        List<String> raw = new ArrayList<>();
        List<Pattern> compiled = new ArrayList<>();
        for (String segment : VfsPaths.normalize(glob).split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            raw.add(segment);
            compiled.add(segment.equals(ANY_DEPTH) ? null : Pattern.compile(toRegex(segment)));
        }
        return new GlobPattern(glob, List.copyOf(raw), compiled);
    }

    public boolean matches(String path) {
        String normalized = VfsPaths.normalize(path);
        String[] parts = normalized.isEmpty() ? new String[0] : normalized.split("/");
        return matchFrom(0, parts, 0);
    }

    /**
     * The longest leading run of segments without wildcards. Walking can start there.
     */
    public String literalPrefix() {
        List<String> prefix = new ArrayList<>();
        for (String segment : rawSegments.subList(0, Math.max(0, rawSegments.size() - 1))) {
            if (segment.indexOf('*') >= 0 || segment.indexOf('?') >= 0 || segment.indexOf('{') >= 0) {
                break;
            }
            prefix.add(segment);
        }
        return String.join("/", prefix);
    }

    private boolean matchFrom(int patternIndex, String[] parts, int partIndex) {
        if (patternIndex == segments.size()) {
            return partIndex == parts.length;
        }
        Pattern segment = segments.get(patternIndex);
        if (segment == null) {
            for (int skip = partIndex; skip <= parts.length; skip++) {
                if (matchFrom(patternIndex + 1, parts, skip)) {
                    return true;
                }
            }
            return false;
        }
        return partIndex < parts.length
            && segment.matcher(parts[partIndex]).matches()
            && matchFrom(patternIndex + 1, parts, partIndex + 1);
    }

    private static String toRegex(String segment) {
        StringBuilder regex = new StringBuilder();
        boolean inGroup = false;
        for (char c : segment.toCharArray()) {
            switch (c) {
                case '*' -> regex.append("[^/]*");
                case '?' -> regex.append("[^/]");
                case '{' -> {
                    inGroup = true;
                    regex.append("(?:");
                }
                case '}' -> {
                    inGroup = false;
                    regex.append(')');
                }
                case ',' -> regex.append(inGroup ? "|" : ",");
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return source;
    }
}
