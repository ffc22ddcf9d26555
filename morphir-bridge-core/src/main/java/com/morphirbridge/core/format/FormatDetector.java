package com.morphirbridge.core.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.error.UnrecognizedFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Decides which IR version a JSON document is in and hands it to the matching parser.
 *
 * <p>Parsers are discovered with {@link ServiceLoader}. Detection asks every parser's
 * {@link IrParser#accepts(JsonNode)} clause; exactly one must answer yes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FormatDetector detector = new FormatDetector();
 * IrVersion version = detector.detect(root);
 * ParsedDistribution parsed = detector.parse(root);
 * }</pre>
 */
public class FormatDetector {

    private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);

    private final List<IrParser> parsers;

    public FormatDetector() {
        this(discoverParsers());
    }

    public FormatDetector(List<IrParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    private static List<IrParser> discoverParsers() {
        log.debug("Discovering IR parsers via ServiceLoader");
        List<IrParser> found = new ArrayList<>();
        ServiceLoader.load(IrParser.class).forEach(found::add);
        found.sort(Comparator.comparing(IrParser::version));
        log.debug("Found {} IR parsers: {}", found.size(),
            found.stream().map(p -> p.version().label()).collect(Collectors.joining(", ")));
        return found;
    }

    public List<IrParser> parsers() {
        return parsers;
    }

    /**
     * @throws UnrecognizedFormatException if no parser, or more than one, accepts the document
     */
    public IrVersion detect(JsonNode root) {
        return parserFor(root).version();
    }

    public IrParser parserFor(JsonNode root) {
        List<IrParser> matching = parsers.stream().filter(parser -> parser.accepts(root)).toList();
        if (matching.isEmpty()) {
            throw new UnrecognizedFormatException("document matches no known IR version ("
                + parsers.stream().map(p -> p.version().label()).collect(Collectors.joining(", ")) + ")");
        }
        if (matching.size() > 1) {
            throw new UnrecognizedFormatException("document is ambiguous, it matches "
                + matching.stream().map(p -> p.version().label()).collect(Collectors.joining(" and ")));
        }
        IrParser parser = matching.get(0);
        log.debug("Detected IR version {}", parser.version());
        return parser;
    }

    public ParsedDistribution parse(JsonNode root) {
        return parserFor(root).parse(root);
    }

    /**
     * @throws UnrecognizedFormatException if no parser is registered for the version
     */
    public IrParser parser(IrVersion version) {
        return parsers.stream()
            .filter(parser -> parser.version() == version)
            .findFirst()
            .orElseThrow(() -> new UnrecognizedFormatException("no parser registered for " + version));
    }
}
