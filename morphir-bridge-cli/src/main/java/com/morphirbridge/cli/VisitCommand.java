package com.morphirbridge.cli;

import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.visitor.IrNodeCounter;
import com.morphirbridge.core.visitor.IrVisitor;
import com.morphirbridge.core.visitor.Reducer;
import com.morphirbridge.core.visitor.TraversalResult;
import com.morphirbridge.core.visitor.impl.FreeVariableCollector;
import com.morphirbridge.core.visitor.impl.ModuleCounter;
import com.morphirbridge.core.visitor.impl.TypeReferenceCollector;
import com.morphirbridge.core.visitor.impl.TypeReferenceSite;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.TypeConversionException;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Command to run one of the built-in analyses over IR.
 */
@Command(
    name = "visit",
    description = "Run a built-in analysis over IR",
    mixinStandardHelpOptions = true
)
public class VisitCommand extends IrCommand {

    enum Analysis { MODULES, NODES, FREE_VARIABLES, REFERENCES }

    @Parameters(index = "0", description = "IR file or document tree directory")
    private Path input;

    @Option(names = {"-a", "--analysis"}, required = true, converter = AnalysisConverter.class,
        description = "One of: modules, nodes, free-variables, references")
    private Analysis analysis;

    @Override
    protected void execute() {
        Distribution distribution = load(input).distribution();
        PrintWriter out = out();
        switch (analysis) {
            case MODULES -> {
                TraversalResult<Integer> result = bridge.visit(distribution, new ModuleCounter(), Reducer.sum());
                out.println("Modules: " + result.value());
            }
            case NODES -> {
                IrNodeCounter.NodeCounts counts = IrNodeCounter.count(distribution);
                long visited = bridge.visit(distribution, new IrVisitor<Void>() { }, Reducer.<Void>none()).nodesVisited();
                out.println("Modules:           " + counts.modules());
                out.println("Type definitions:  " + counts.typeDefinitions());
                out.println("Value definitions: " + counts.valueDefinitions());
                out.println("Type expressions:  " + counts.types());
                out.println("Value expressions: " + counts.values());
                out.println("Patterns:          " + counts.patterns());
                out.println("Total:             " + counts.total() + " (visited " + visited + ")");
            }
            case FREE_VARIABLES -> {
                Map<FQName, SortedSet<Name>> free = bridge.visit(distribution, new FreeVariableCollector(),
                    Reducer.<FQName, SortedSet<Name>>merge()).value();
                free.forEach((definition, names) -> out.println(definition + ": "
                    + names.stream().map(Name::toKebabCase).collect(Collectors.joining(", "))));
            }
            case REFERENCES -> {
                List<TypeReferenceSite> sites = bridge.visit(distribution, new TypeReferenceCollector(),
                    Reducer.<TypeReferenceSite>concat()).value();
                for (TypeReferenceSite site : sites) {
                    out.println(site.enclosing() + " -> " + site.target() + "/" + site.arity());
                }
            }
        }
        out.flush();
    }

    static class AnalysisConverter implements ITypeConverter<Analysis> {
        @Override
        public Analysis convert(String value) {
            try {
                return Analysis.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException("unknown analysis '" + value
                    + "'; expected one of modules, nodes, free-variables, references");
            }
        }
    }
}
