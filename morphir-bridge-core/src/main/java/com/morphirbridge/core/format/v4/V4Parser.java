package com.morphirbridge.core.format.v4;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.format.IrParser;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.model.Distribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Parser for bundled V4 documents: object-wrapped nodes, kebab-case names and
 * {@code package:module#name} references.
 *
 * <p>Detection: {@code distribution} is an object keyed by the distribution kind, and
 * {@code formatVersion}, when present, is {@code 4} or a string starting with {@code "4"}.
 */
public class V4Parser implements IrParser {

    private static final Logger log = LoggerFactory.getLogger(V4Parser.class);

    private static final Set<String> DISTRIBUTION_KINDS = Set.of("Library", "Specs", "Application");

    @Override
    public IrVersion version() {
        return IrVersion.V4;
    }

    @Override
    public boolean accepts(JsonNode root) {
        JsonNode distribution = root.path("distribution");
        if (!distribution.isObject()) {
            return false;
        }
        boolean tagged = false;
        for (String kind : DISTRIBUTION_KINDS) {
            tagged |= distribution.has(kind);
        }
        return tagged && isV4Label(root.path("formatVersion"));
    }

    /**
     * @return {@code true} if a {@code formatVersion} node is absent, {@code 4}, or a string starting with {@code "4"}
     */
    public static boolean isV4Label(JsonNode formatVersion) {
        if (formatVersion.isMissingNode()) {
            return true;
        }
        if (formatVersion.isTextual()) {
            return formatVersion.asText().startsWith("4");
        }
        return formatVersion.isIntegralNumber() && formatVersion.asInt() == 4;
    }

    @Override
    public ParsedDistribution parse(JsonNode root) {
        V4Reader reader = new V4Reader();
        Distribution distribution = reader.readDistribution(root);
        log.debug("Parsed V4 distribution '{}' with {} modules", distribution.packageName(), distribution.modules().size());
        return new ParsedDistribution(version(), distribution, reader.losses());
    }
}
