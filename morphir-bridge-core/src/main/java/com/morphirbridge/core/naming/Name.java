package com.morphirbridge.core.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A human-readable identifier stored as a list of lower-case words.
 *
 * <p>Each word is either lower-case ASCII letters or a run of digits. The word list is the
 * identity of the name; the different spellings used on the wire (kebab in V4, word arrays in
 * classic) are renderings of it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Name name = Name.fromString("BusinessTerms");
 * name.words();          // [business, terms]
 * name.toKebabCase();    // business-terms
 * name.toCamelCase();    // businessTerms
 * }</pre>
 *
 * @param words non-empty list of words
 */
public record Name(List<String> words) implements Comparable<Name> {

    private static final Pattern WORD = Pattern.compile("[a-z]+|[0-9]+");
    private static final Pattern TOKEN = Pattern.compile("[a-zA-Z][a-z]*|[0-9]+");

    public Name {
        Objects.requireNonNull(words, "words must not be null");
        if (words.isEmpty()) {
            throw new IllegalArgumentException("a name needs at least one word");
        }
        for (String word : words) {
            if (word == null || !WORD.matcher(word).matches()) {
                throw new IllegalArgumentException("invalid name word: '" + word + "'");
            }
        }
        words = List.copyOf(words);
    }

    public static Name of(String... words) {
        return new Name(List.of(words));
    }

    /**
     * Tokenizes free text into a name. A word is one letter followed by lower-case letters,
     * or a run of digits; everything else separates words.
     *
     * @param text text such as {@code "BusinessTerms"}, {@code "business_terms"} or {@code "value2x"}
     * @return the name
     * @throws IllegalArgumentException if the text contains no word
     */
    public static Name fromString(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<String> words = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            words.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        if (words.isEmpty()) {
            throw new IllegalArgumentException("no words in name '" + text + "'");
        }
        return new Name(words);
    }

    /**
     * Builds a name from classic word-array segments, tokenizing each segment so that
     * {@code ["SDK"]} becomes {@code [s, d, k]}.
     */
    public static Name fromSegments(List<String> segments) {
        List<String> words = new ArrayList<>();
        for (String segment : segments) {
            words.addAll(fromString(segment).words());
        }
        return new Name(words);
    }

    public String toKebabCase() {
        return String.join("-", words);
    }

    public String toSnakeCase() {
        return String.join("_", words);
    }

    public String toTitleCase() {
        return words.stream().map(Name::capitalize).collect(Collectors.joining());
    }

    public String toCamelCase() {
        return words.get(0) + words.stream().skip(1).map(Name::capitalize).collect(Collectors.joining());
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    @Override
    public int compareTo(Name other) {
        return toKebabCase().compareTo(other.toKebabCase());
    }

    @Override
    public String toString() {
        return toKebabCase();
    }
}
