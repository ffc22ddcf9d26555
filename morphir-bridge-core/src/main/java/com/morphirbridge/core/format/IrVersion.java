package com.morphirbridge.core.format;

import java.util.Locale;

/**
 * The IR serialization versions this library can read. {@link #CLASSIC_V3} and {@link #V4}
 * are also write targets.
 */
public enum IrVersion {
    CLASSIC_V1("classic-v1", 1),
    CLASSIC_V2("classic-v2", 2),
    CLASSIC_V3("classic-v3", 3),
    V4("v4", 4);

    private final String label;
    private final int formatVersion;

    IrVersion(String label, int formatVersion) {
        this.label = label;
        this.formatVersion = formatVersion;
    }

    public String label() {
        return label;
    }

    public int formatVersion() {
        return formatVersion;
    }

    public boolean isClassic() {
        return this != V4;
    }

    /**
     * Resolves a user-supplied migration target. {@code latest}, {@code v4} and {@code 4} mean
     * V4; {@code classic} and every classic version number mean the classic writer, which always
     * produces the V3 shape.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static IrVersion resolveTarget(String target) {
        return switch (target.trim().toLowerCase(Locale.ROOT)) {
            case "latest", "v4", "4" -> V4;
            case "classic", "v3", "3", "v2", "2", "v1", "1" -> CLASSIC_V3;
            default -> throw new IllegalArgumentException(
                "unknown target '" + target + "'; expected one of latest, v4, classic, v3, v2, v1");
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
