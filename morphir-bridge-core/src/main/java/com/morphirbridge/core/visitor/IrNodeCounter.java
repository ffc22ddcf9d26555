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

import java.util.Collection;

/**
 * Counts the nodes of a distribution by kind, directly from the model and without a walker.
 *
 * <p>The counted node kinds are exactly those an {@link IrVisitor} is shown, so
 * {@link NodeCounts#total()} equals {@link TraversalResult#nodesVisited()} of a walk with a
 * visitor that always proceeds.
 */
public final class IrNodeCounter {

    private IrNodeCounter() {
        // Utility class
    }

    public record NodeCounts(long modules, long typeDefinitions, long valueDefinitions,
                             long types, long values, long patterns) {

        public long total() {
            return modules + typeDefinitions + valueDefinitions + types + values + patterns;
        }
    }

    public static NodeCounts count(Distribution distribution) {
        Tally tally = new Tally();
        for (AccessControlled<ModuleDefinition> module : distribution.modules().values()) {
            tally.module(module.value());
        }
        return new NodeCounts(tally.modules, tally.typeDefinitions, tally.valueDefinitions,
            tally.types, tally.values, tally.patterns);
    }

    private static final class Tally {
        long modules;
        long typeDefinitions;
        long valueDefinitions;
        long types;
        long values;
        long patterns;

        void module(ModuleDefinition module) {
            modules++;
            for (AccessControlled<Documented<TypeDefinition>> entry : module.types().values()) {
                typeDefinition(entry.value().value());
            }
            for (AccessControlled<Documented<ValueDefinition>> entry : module.values().values()) {
                valueDefinition(entry.value().value());
            }
        }

        void typeDefinition(TypeDefinition definition) {
            typeDefinitions++;
            if (definition instanceof TypeDefinition.TypeAlias alias) {
                type(alias.body());
            } else if (definition instanceof TypeDefinition.CustomType custom) {
                for (Constructor constructor : custom.constructors().value()) {
                    parameters(constructor.args());
                }
            }
        }

        void valueDefinition(ValueDefinition definition) {
            valueDefinitions++;
            parameters(definition.inputs());
            if (definition.outputType() != null) {
                type(definition.outputType());
            }
            if (definition.body() instanceof ValueBody.Expression expression) {
                value(expression.body());
            }
        }

        void parameters(Collection<Parameter> parameters) {
            for (Parameter parameter : parameters) {
                if (parameter.type() != null) {
                    type(parameter.type());
                }
            }
        }

        void type(TypeExpr type) {
            types++;
            if (type instanceof TypeExpr.Reference reference) {
                reference.args().forEach(this::type);
            } else if (type instanceof TypeExpr.Tuple tuple) {
                tuple.elements().forEach(this::type);
            } else if (type instanceof TypeExpr.Record fields) {
                fields.fields().values().forEach(this::type);
            } else if (type instanceof TypeExpr.ExtensibleRecord fields) {
                fields.fields().values().forEach(this::type);
            } else if (type instanceof TypeExpr.Function function) {
                type(function.argument());
                type(function.result());
            }
        }

        void value(ValueExpr value) {
            values++;
            if (value instanceof ValueExpr.Tuple tuple) {
                tuple.elements().forEach(this::value);
            } else if (value instanceof ValueExpr.ListOf list) {
                list.items().forEach(this::value);
            } else if (value instanceof ValueExpr.Record fields) {
                fields.fields().values().forEach(this::value);
            } else if (value instanceof ValueExpr.Field field) {
                value(field.subject());
            } else if (value instanceof ValueExpr.Apply apply) {
                value(apply.function());
                value(apply.argument());
            } else if (value instanceof ValueExpr.Lambda lambda) {
                pattern(lambda.pattern());
                value(lambda.body());
            } else if (value instanceof ValueExpr.LetDefinition let) {
                valueDefinition(let.definition());
                value(let.in());
            } else if (value instanceof ValueExpr.LetRecursion let) {
                let.bindings().values().forEach(this::valueDefinition);
                value(let.in());
            } else if (value instanceof ValueExpr.Destructure destructure) {
                pattern(destructure.pattern());
                value(destructure.value());
                value(destructure.in());
            } else if (value instanceof ValueExpr.IfThenElse ifThenElse) {
                value(ifThenElse.condition());
                value(ifThenElse.thenBranch());
                value(ifThenElse.elseBranch());
            } else if (value instanceof ValueExpr.PatternMatch match) {
                value(match.subject());
                for (ValueExpr.Case matchCase : match.cases()) {
                    pattern(matchCase.pattern());
                    value(matchCase.body());
                }
            } else if (value instanceof ValueExpr.UpdateRecord update) {
                value(update.target());
                update.updates().values().forEach(this::value);
            } else if (value instanceof ValueExpr.Hole hole && hole.type() != null) {
                type(hole.type());
            }
        }

        void pattern(Pattern pattern) {
            patterns++;
            if (pattern instanceof Pattern.AsPattern as) {
                pattern(as.pattern());
            } else if (pattern instanceof Pattern.TuplePattern tuple) {
                tuple.elements().forEach(this::pattern);
            } else if (pattern instanceof Pattern.ConstructorPattern constructor) {
                constructor.args().forEach(this::pattern);
            } else if (pattern instanceof Pattern.HeadTailPattern headTail) {
                pattern(headTail.head());
                pattern(headTail.tail());
            }
        }
    }
}
