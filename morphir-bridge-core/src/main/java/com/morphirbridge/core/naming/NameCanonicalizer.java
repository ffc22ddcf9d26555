package com.morphirbridge.core.naming;

/**
 * The single kebab-case renderer used wherever a V4 name is written, so that declarations
 * and references to them always agree.
 *
 * <p>Canonicalization is idempotent: {@code canonicalize(canonicalize(s)).equals(canonicalize(s))}.
 */
public final class NameCanonicalizer {

    private NameCanonicalizer() {
        // Utility class
    }

    /**
     * @param text any spelling of a name, e.g. {@code "BusinessTerms"}
     * @return kebab form, e.g. {@code "business-terms"}
     */
    public static String canonicalize(String text) {
        return render(Name.fromString(text));
    }

    public static String render(Name name) {
        return name.toKebabCase();
    }

    public static String render(Path path) {
        return path.toCanonicalString();
    }

    public static String render(FQName fqName) {
        return fqName.toCanonicalString();
    }
}
