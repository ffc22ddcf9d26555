package com.morphirbridge.core.visitor.impl;

import com.morphirbridge.core.model.Parameter;
import com.morphirbridge.core.model.Pattern;
import com.morphirbridge.core.model.ValueBody;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.model.ValueExpr;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.visitor.IrVisitor;
import com.morphirbridge.core.visitor.VisitContext;
import com.morphirbridge.core.visitor.VisitResult;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Computes the free variables of every top-level value definition with an expression body.
 *
 * <p>A variable is free when no enclosing binder introduces it. Binders are the definition's
 * inputs, lambda, destructuring and case patterns, {@code let} names (in the body of the
 * {@code let} only) and {@code let rec} names (in every binding and the body).
 * Use with {@link com.morphirbridge.core.visitor.Reducer#merge()}.
 */
public class FreeVariableCollector implements IrVisitor<Map<FQName, SortedSet<Name>>> {

    @Override
    public VisitResult<ValueDefinition, Map<FQName, SortedSet<Name>>> visitValueDefinition(
        ValueDefinition definition, VisitContext context) {
        Optional<FQName> fqName = context.currentFQName();
        if (fqName.isEmpty() || !(definition.body() instanceof ValueBody.Expression)) {
            return VisitResult.skip();
        }
        SortedSet<Name> free = new TreeSet<>();
        collect(definition, Set.of(), free);
        return VisitResult.skip(Map.of(fqName.get(), Collections.unmodifiableSortedSet(free)));
    }

    /**
     * Free variables of a single expression, for callers outside a walk.
     */
    public static SortedSet<Name> freeVariables(ValueExpr value) {
        SortedSet<Name> free = new TreeSet<>();
        collect(value, Set.of(), free);
        return free;
    }

    private static void collect(ValueDefinition definition, Set<Name> bound, Set<Name> free) {
        if (definition.body() instanceof ValueBody.Expression expression) {
            Set<Name> inner = new HashSet<>(bound);
            for (Parameter input : definition.inputs()) {
                inner.add(input.name());
            }
            collect(expression.body(), inner, free);
        }
    }

    private static void collect(ValueExpr value, Set<Name> bound, Set<Name> free) {
        if (value instanceof ValueExpr.Variable variable) {
            if (!bound.contains(variable.name())) {
                free.add(variable.name());
            }
        } else if (value instanceof ValueExpr.Tuple tuple) {
            collectAll(tuple.elements(), bound, free);
        } else if (value instanceof ValueExpr.ListOf list) {
            collectAll(list.items(), bound, free);
        } else if (value instanceof ValueExpr.Record fields) {
            collectAll(List.copyOf(fields.fields().values()), bound, free);
        } else if (value instanceof ValueExpr.Field field) {
            collect(field.subject(), bound, free);
        } else if (value instanceof ValueExpr.Apply apply) {
            collect(apply.function(), bound, free);
            collect(apply.argument(), bound, free);
        } else if (value instanceof ValueExpr.Lambda lambda) {
            collect(lambda.body(), bind(bound, lambda.pattern()), free);
        } else if (value instanceof ValueExpr.LetDefinition let) {
            collect(let.definition(), bound, free);
            Set<Name> inner = new HashSet<>(bound);
            inner.add(let.name());
            collect(let.in(), inner, free);
        } else if (value instanceof ValueExpr.LetRecursion let) {
            Set<Name> inner = new HashSet<>(bound);
            inner.addAll(let.bindings().keySet());
            for (ValueDefinition definition : let.bindings().values()) {
                collect(definition, inner, free);
            }
            collect(let.in(), inner, free);
        } else if (value instanceof ValueExpr.Destructure destructure) {
            collect(destructure.value(), bound, free);
            collect(destructure.in(), bind(bound, destructure.pattern()), free);
        } else if (value instanceof ValueExpr.IfThenElse ifThenElse) {
            collect(ifThenElse.condition(), bound, free);
            collect(ifThenElse.thenBranch(), bound, free);
            collect(ifThenElse.elseBranch(), bound, free);
        } else if (value instanceof ValueExpr.PatternMatch match) {
            collect(match.subject(), bound, free);
            for (ValueExpr.Case matchCase : match.cases()) {
                collect(matchCase.body(), bind(bound, matchCase.pattern()), free);
            }
        } else if (value instanceof ValueExpr.UpdateRecord update) {
            collect(update.target(), bound, free);
            collectAll(List.copyOf(update.updates().values()), bound, free);
        }
    }

    private static void collectAll(List<ValueExpr> values, Set<Name> bound, Set<Name> free) {
        for (ValueExpr value : values) {
            collect(value, bound, free);
        }
    }

    private static Set<Name> bind(Set<Name> bound, Pattern pattern) {
        Set<Name> inner = new HashSet<>(bound);
        addBindings(pattern, inner);
        return inner;
    }

    private static void addBindings(Pattern pattern, Set<Name> names) {
        if (pattern instanceof Pattern.VariablePattern variable) {
            names.add(variable.name());
        } else if (pattern instanceof Pattern.AsPattern as) {
            names.add(as.name());
            addBindings(as.pattern(), names);
        } else if (pattern instanceof Pattern.TuplePattern tuple) {
            tuple.elements().forEach(element -> addBindings(element, names));
        } else if (pattern instanceof Pattern.ConstructorPattern constructor) {
            constructor.args().forEach(arg -> addBindings(arg, names));
        } else if (pattern instanceof Pattern.HeadTailPattern headTail) {
            addBindings(headTail.head(), names);
            addBindings(headTail.tail(), names);
        }
    }
}
