package com.morphirbridge.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.vfs.MemoryVfs;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Access to the IR documents under {@code src/test/resources/fixtures}.
 *
 * <p>Both classic fixtures and {@code v4-bundled.json} describe complete, migratable packages;
 * {@code v4-incomplete.json} holds the V4-only constructs the classic writer rejects.
 */
public final class IrFixtures {

    public static final String CLASSIC_V1 = "classic-v1.json";
    public static final String CLASSIC_V2 = "classic-v2.json";
    public static final String CLASSIC_V3 = "classic-v3.json";
    public static final String V4_BUNDLED = "v4-bundled.json";
    public static final String V4_INCOMPLETE = "v4-incomplete.json";
    public static final String LEGACY_CONFIG = "morphir.json";

    private IrFixtures() {
        // Utility class
    }

    public static String text(String fixture) {
        try (InputStream in = IrFixtures.class.getResourceAsStream("/fixtures/" + fixture)) {
            if (in == null) {
                throw new IllegalArgumentException("no fixture named " + fixture);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode json(String fixture) {
        return IrJson.read(text(fixture), fixture);
    }

    /**
     * @return a VFS holding the fixture at its own file name
     */
    public static MemoryVfs vfs(String fixture) {
        return MemoryVfs.of(Map.of(fixture, text(fixture)));
    }
}
