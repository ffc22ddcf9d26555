package com.morphirbridge.core.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered list of {@link Name}s identifying a package or a module.
 *
 * @param names path segments, possibly empty
 */
public record Path(List<Name> names) {

    public Path {
        Objects.requireNonNull(names, "names must not be null");
        names = List.copyOf(names);
    }

    public static Path of(Name... names) {
        return new Path(List.of(names));
    }

    /**
     * Parses a path written with {@code /} or {@code .} separators, such as
     * {@code "morphir/sdk"} or {@code "Morphir.SDK"}. Each segment is tokenized with
     * {@link Name#fromString(String)}.
     */
    public static Path parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<Name> names = new ArrayList<>();
        for (String segment : text.split("[/.]")) {
            if (!segment.isBlank()) {
                names.add(Name.fromString(segment));
            }
        }
        return new Path(names);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public boolean isPrefixOf(Path other) {
        return other.names.size() >= names.size() && other.names.subList(0, names.size()).equals(names);
    }

    public Path append(Name name) {
        List<Name> extended = new ArrayList<>(names);
        extended.add(name);
        return new Path(extended);
    }

    /**
     * @return the V4 rendering, kebab names joined with {@code /}
     */
    public String toCanonicalString() {
        return names.stream().map(Name::toKebabCase).collect(Collectors.joining("/"));
    }

    /**
     * @return the display rendering, title-case names joined with {@code .}
     */
    public String toDisplayString() {
        return names.stream().map(Name::toTitleCase).collect(Collectors.joining("."));
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
