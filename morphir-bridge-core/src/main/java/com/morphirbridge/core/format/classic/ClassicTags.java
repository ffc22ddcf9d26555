package com.morphirbridge.core.format.classic;

import java.util.Map;

/**
 * Tag spelling rules shared by the classic readers and the classic writer.
 */
final class ClassicTags {

    private static final Map<String, String> ALIASES = Map.of(
        "Update", "UpdateRecord",
        "IntLiteral", "WholeNumberLiteral");

    private ClassicTags() {
        // Utility class
    }

    /**
     * Maps a wire tag to its V2/V3 spelling: {@code type_alias_definition} becomes
     * {@code TypeAliasDefinition}, and legacy aliases such as {@code Update} are resolved.
     */
    static String normalize(String tag) {
        String pascal = tag.indexOf('_') >= 0 || (!tag.isEmpty() && Character.isLowerCase(tag.charAt(0)))
            ? toPascalCase(tag)
            : tag;
        return ALIASES.getOrDefault(pascal, pascal);
    }

    private static String toPascalCase(String snake) {
        StringBuilder result = new StringBuilder(snake.length());
        for (String part : snake.split("_")) {
            if (!part.isEmpty()) {
                result.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return result.toString();
    }
}
