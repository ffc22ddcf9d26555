package com.morphirbridge.core.visitor;

import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Constructor;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Documented;
import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.model.Parameter;
import com.morphirbridge.core.model.Pattern;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.model.ValueBody;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.model.ValueExpr;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.naming.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Depth-first, pre-order walk of a distribution's module definitions.
 *
 * <p>Order is deterministic: modules, then within a module its types and then its values in
 * declaration order; within a node, children left to right as they appear in the model.
 * Dependency specifications are not walked.
 *
 * <p>The walker rebuilds the tree bottom-up from whatever the visitor returned, so a visitor
 * that only {@link VisitResult#proceed() proceeds} yields an equal distribution. A walker
 * holds no per-walk state and can be reused.
 *
 * @param <R> type of the reduced value
 */
public class IrWalker<R> {

    private static final Logger log = LoggerFactory.getLogger(IrWalker.class);

    private final IrVisitor<R> visitor;
    private final Reducer<R> reducer;

    public IrWalker(IrVisitor<R> visitor, Reducer<R> reducer) {
        this.visitor = Objects.requireNonNull(visitor, "visitor must not be null");
        this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
    }

    public TraversalResult<R> walk(Distribution distribution) {
        Traversal traversal = new Traversal();
        VisitContext root = VisitContext.root(distribution.packageName());
        Map<Path, AccessControlled<ModuleDefinition>> modules = new LinkedHashMap<>();
        distribution.modules().forEach((path, module) ->
            modules.put(path, module.withValue(traversal.module(module.value(), root.inModule(path)))));
        Distribution rewritten = new Distribution(distribution.packageName(), distribution.dependencies(), modules);
        log.debug("Walked {} nodes of {}", traversal.visited, distribution.packageName());
        return new TraversalResult<>(rewritten, traversal.accumulated, traversal.visited);
    }

    private final class Traversal {

        private R accumulated = reducer.identity();
        private long visited;

        private <N> N visit(N node, VisitContext context, BiFunction<N, VisitContext, VisitResult<N, R>> callback,
                            ChildWalker<N> children) {
            visited++;
            VisitResult<N, R> result = callback.apply(node, context);
            if (result.contribution() != null) {
                accumulated = reducer.combine().apply(accumulated, result.contribution());
            }
            return switch (result.action()) {
                case SKIP -> node;
                case REPLACE -> children.walk(result.replacement(), context.deeper());
                case PROCEED -> children.walk(node, context.deeper());
            };
        }

        ModuleDefinition module(ModuleDefinition module, VisitContext context) {
            return visit(module, context, visitor::visitModule, (m, ctx) -> {
                Map<Name, AccessControlled<Documented<TypeDefinition>>> types = new LinkedHashMap<>();
                m.types().forEach((name, entry) -> types.put(name, entry.withValue(entry.value().withValue(
                    typeDefinition(entry.value().value(), ctx.inDefinition(name))))));
                Map<Name, AccessControlled<Documented<ValueDefinition>>> values = new LinkedHashMap<>();
                m.values().forEach((name, entry) -> values.put(name, entry.withValue(entry.value().withValue(
                    valueDefinition(entry.value().value(), ctx.inDefinition(name))))));
                return new ModuleDefinition(types, values, m.doc());
            });
        }

        TypeDefinition typeDefinition(TypeDefinition definition, VisitContext context) {
            return visit(definition, context, visitor::visitTypeDefinition, (d, ctx) -> {
                if (d instanceof TypeDefinition.TypeAlias alias) {
                    return new TypeDefinition.TypeAlias(alias.typeParams(), type(alias.body(), ctx));
                } else if (d instanceof TypeDefinition.CustomType custom) {
                    List<Constructor> constructors = new ArrayList<>();
                    for (Constructor constructor : custom.constructors().value()) {
                        constructors.add(new Constructor(constructor.name(), parameters(constructor.args(), ctx)));
                    }
                    return new TypeDefinition.CustomType(custom.typeParams(), custom.constructors().withValue(constructors));
                }
                return d;
            });
        }

        ValueDefinition valueDefinition(ValueDefinition definition, VisitContext context) {
            return visit(definition, context, visitor::visitValueDefinition, (d, ctx) -> {
                List<Parameter> inputs = parameters(d.inputs(), ctx);
                TypeExpr output = d.outputType() == null ? null : type(d.outputType(), ctx);
                ValueBody body = d.body();
                if (body instanceof ValueBody.Expression expression) {
                    body = new ValueBody.Expression(value(expression.body(), ctx));
                }
                return new ValueDefinition(inputs, output, body);
            });
        }

        private List<Parameter> parameters(List<Parameter> parameters, VisitContext context) {
            List<Parameter> walked = new ArrayList<>(parameters.size());
            for (Parameter parameter : parameters) {
                walked.add(new Parameter(parameter.name(),
                    parameter.type() == null ? null : type(parameter.type(), context)));
            }
            return walked;
        }

        TypeExpr type(TypeExpr type, VisitContext context) {
            return visit(type, context, visitor::visitType, (t, ctx) -> {
                if (t instanceof TypeExpr.Reference reference) {
                    return new TypeExpr.Reference(reference.fqName(), types(reference.args(), ctx));
                } else if (t instanceof TypeExpr.Tuple tuple) {
                    return new TypeExpr.Tuple(types(tuple.elements(), ctx));
                } else if (t instanceof TypeExpr.Record record) {
                    return new TypeExpr.Record(fieldTypes(record.fields(), ctx));
                } else if (t instanceof TypeExpr.ExtensibleRecord record) {
                    return new TypeExpr.ExtensibleRecord(record.variable(), fieldTypes(record.fields(), ctx));
                } else if (t instanceof TypeExpr.Function function) {
                    TypeExpr argument = type(function.argument(), ctx);
                    return new TypeExpr.Function(argument, type(function.result(), ctx));
                }
                return t;
            });
        }

        private List<TypeExpr> types(List<TypeExpr> types, VisitContext context) {
            List<TypeExpr> walked = new ArrayList<>(types.size());
            types.forEach(t -> walked.add(type(t, context)));
            return walked;
        }

        private Map<Name, TypeExpr> fieldTypes(Map<Name, TypeExpr> fields, VisitContext context) {
            Map<Name, TypeExpr> walked = new LinkedHashMap<>();
            fields.forEach((name, t) -> walked.put(name, type(t, context)));
            return walked;
        }

        ValueExpr value(ValueExpr value, VisitContext context) {
            return visit(value, context, visitor::visitValue, this::valueChildren);
        }

        private ValueExpr valueChildren(ValueExpr v, VisitContext ctx) {
            if (v instanceof ValueExpr.Tuple tuple) {
                return new ValueExpr.Tuple(values(tuple.elements(), ctx));
            } else if (v instanceof ValueExpr.ListOf list) {
                return new ValueExpr.ListOf(values(list.items(), ctx));
            } else if (v instanceof ValueExpr.Record record) {
                return new ValueExpr.Record(fieldValues(record.fields(), ctx));
            } else if (v instanceof ValueExpr.Field field) {
                return new ValueExpr.Field(value(field.subject(), ctx), field.name());
            } else if (v instanceof ValueExpr.Apply apply) {
                ValueExpr function = value(apply.function(), ctx);
                return new ValueExpr.Apply(function, value(apply.argument(), ctx));
            } else if (v instanceof ValueExpr.Lambda lambda) {
                Pattern pattern = pattern(lambda.pattern(), ctx);
                return new ValueExpr.Lambda(pattern, value(lambda.body(), ctx));
            } else if (v instanceof ValueExpr.LetDefinition let) {
                ValueDefinition definition = valueDefinition(let.definition(), ctx);
                return new ValueExpr.LetDefinition(let.name(), definition, value(let.in(), ctx));
            } else if (v instanceof ValueExpr.LetRecursion let) {
                Map<Name, ValueDefinition> bindings = new LinkedHashMap<>();
                let.bindings().forEach((name, definition) -> bindings.put(name, valueDefinition(definition, ctx)));
                return new ValueExpr.LetRecursion(bindings, value(let.in(), ctx));
            } else if (v instanceof ValueExpr.Destructure destructure) {
                Pattern pattern = pattern(destructure.pattern(), ctx);
                ValueExpr bound = value(destructure.value(), ctx);
                return new ValueExpr.Destructure(pattern, bound, value(destructure.in(), ctx));
            } else if (v instanceof ValueExpr.IfThenElse ifThenElse) {
                ValueExpr condition = value(ifThenElse.condition(), ctx);
                ValueExpr thenBranch = value(ifThenElse.thenBranch(), ctx);
                return new ValueExpr.IfThenElse(condition, thenBranch, value(ifThenElse.elseBranch(), ctx));
            } else if (v instanceof ValueExpr.PatternMatch match) {
                ValueExpr subject = value(match.subject(), ctx);
                List<ValueExpr.Case> cases = new ArrayList<>();
                for (ValueExpr.Case matchCase : match.cases()) {
                    Pattern pattern = pattern(matchCase.pattern(), ctx);
                    cases.add(new ValueExpr.Case(pattern, value(matchCase.body(), ctx)));
                }
                return new ValueExpr.PatternMatch(subject, cases);
            } else if (v instanceof ValueExpr.UpdateRecord update) {
                ValueExpr target = value(update.target(), ctx);
                return new ValueExpr.UpdateRecord(target, fieldValues(update.updates(), ctx));
            } else if (v instanceof ValueExpr.Hole hole && hole.type() != null) {
                return new ValueExpr.Hole(hole.reason(), type(hole.type(), ctx));
            }
            return v;
        }

        private List<ValueExpr> values(List<ValueExpr> values, VisitContext context) {
            List<ValueExpr> walked = new ArrayList<>(values.size());
            values.forEach(v -> walked.add(value(v, context)));
            return walked;
        }

        private Map<Name, ValueExpr> fieldValues(Map<Name, ValueExpr> fields, VisitContext context) {
            Map<Name, ValueExpr> walked = new LinkedHashMap<>();
            fields.forEach((name, v) -> walked.put(name, value(v, context)));
            return walked;
        }

        Pattern pattern(Pattern pattern, VisitContext context) {
            return visit(pattern, context, visitor::visitPattern, (p, ctx) -> {
                if (p instanceof Pattern.AsPattern as) {
                    return Pattern.as(pattern(as.pattern(), ctx), as.name());
                } else if (p instanceof Pattern.TuplePattern tuple) {
                    return new Pattern.TuplePattern(patterns(tuple.elements(), ctx));
                } else if (p instanceof Pattern.ConstructorPattern constructor) {
                    return new Pattern.ConstructorPattern(constructor.constructor(), patterns(constructor.args(), ctx));
                } else if (p instanceof Pattern.HeadTailPattern headTail) {
                    Pattern head = pattern(headTail.head(), ctx);
                    return new Pattern.HeadTailPattern(head, pattern(headTail.tail(), ctx));
                }
                return p;
            });
        }

        private List<Pattern> patterns(List<Pattern> patterns, VisitContext context) {
            List<Pattern> walked = new ArrayList<>(patterns.size());
            patterns.forEach(p -> walked.add(pattern(p, context)));
            return walked;
        }
    }

    @FunctionalInterface
    private interface ChildWalker<N> {
        N walk(N node, VisitContext context);
    }
}
