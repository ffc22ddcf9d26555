package com.morphirbridge.core.naming;

import java.util.Objects;

/**
 * Fully-qualified name of a type, value or constructor: package path, module path and
 * local name.
 *
 * <p>The canonical string form is {@code package:module#local}, e.g.
 * {@code morphir/sdk:basics#int}.
 */
public record FQName(Path packagePath, Path modulePath, Name localName) {

    public FQName {
        Objects.requireNonNull(packagePath, "packagePath must not be null");
        Objects.requireNonNull(modulePath, "modulePath must not be null");
        Objects.requireNonNull(localName, "localName must not be null");
    }

    public static FQName of(String packagePath, String modulePath, String localName) {
        return new FQName(Path.parse(packagePath), Path.parse(modulePath), Name.fromString(localName));
    }

    /**
     * Parses {@code package:module#local}.
     *
     * @throws IllegalArgumentException if a separator is missing
     */
    public static FQName parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        int colon = text.indexOf(':');
        int hash = text.lastIndexOf('#');
        if (colon < 0 || hash < colon) {
            throw new IllegalArgumentException("expected 'package:module#name' but got '" + text + "'");
        }
        return new FQName(
            Path.parse(text.substring(0, colon)),
            Path.parse(text.substring(colon + 1, hash)),
            Name.fromString(text.substring(hash + 1)));
    }

    public String toCanonicalString() {
        return packagePath.toCanonicalString() + ":" + modulePath.toCanonicalString() + "#" + localName.toKebabCase();
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
