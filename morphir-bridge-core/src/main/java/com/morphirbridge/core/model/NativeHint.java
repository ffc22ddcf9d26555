package com.morphirbridge.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Category of a V4 native body.
 */
public enum NativeHint {
    ARITHMETIC("Arithmetic"),
    COMPARISON("Comparison"),
    STRING_OP("StringOp"),
    COLLECTION_OP("CollectionOp"),
    PLATFORM_SPECIFIC("PlatformSpecific");

    private final String wireName;

    NativeHint(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<NativeHint> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(h -> h.wireName.equals(wireName)).findFirst();
    }
}
