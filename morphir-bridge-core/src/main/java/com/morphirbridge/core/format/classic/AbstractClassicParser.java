package com.morphirbridge.core.format.classic;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.format.IrParser;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.model.Distribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Base class for the classic parsers.
 *
 * <p>All classic versions share one reader; subclasses only contribute their detection clause,
 * built from the shape checks below. The checks use {@link JsonNode#path(String)} navigation so they
 * never throw on unexpected input.
 */
public abstract class AbstractClassicParser implements IrParser {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public ParsedDistribution parse(JsonNode root) {
        ClassicReader reader = new ClassicReader();
        Distribution distribution = reader.readDistribution(root);
        log.debug("Parsed {} distribution '{}' with {} modules", version(), distribution.packageName(),
            distribution.modules().size());
        return new ParsedDistribution(version(), distribution, reader.losses());
    }

    /**
     * @return the literal distribution tag ({@code "Library"}, {@code "library"}, ...) if the
     *         document is a tagged-array distribution
     */
    protected static Optional<String> distributionTag(JsonNode root) {
        JsonNode distribution = root.path("distribution");
        if (!distribution.isArray() || distribution.isEmpty() || !distribution.get(0).isTextual()) {
            return Optional.empty();
        }
        return Optional.of(distribution.get(0).asText());
    }

    /**
     * @return the declared {@code formatVersion} when it is a whole number
     */
    protected static Optional<Integer> declaredFormatVersion(JsonNode root) {
        JsonNode formatVersion = root.path("formatVersion");
        return formatVersion.isIntegralNumber() ? Optional.of(formatVersion.asInt()) : Optional.empty();
    }

    /**
     * Looks at the first type or value definition of the package and reports whether it is
     * wrapped in a documentation object. Empty when the package defines nothing.
     */
    protected static Optional<Boolean> firstDefinitionDocumented(JsonNode root) {
        JsonNode modules = root.path("distribution").path(3).path("modules");
        for (JsonNode entry : modules) {
            JsonNode moduleDef = entry.isObject() ? entry.path("def") : entry.path(1);
            JsonNode module = moduleDef.path("value");
            for (String section : new String[] {"types", "values"}) {
                for (JsonNode definition : module.path(section)) {
                    JsonNode accessControlled = definition.path(1);
                    if (accessControlled.isObject()) {
                        return Optional.of(ClassicReader.isDocumentedWrapper(accessControlled.path("value")));
                    }
                }
            }
        }
        return Optional.empty();
    }
}
