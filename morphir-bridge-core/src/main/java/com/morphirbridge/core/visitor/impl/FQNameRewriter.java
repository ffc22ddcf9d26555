package com.morphirbridge.core.visitor.impl;

import com.morphirbridge.core.model.HoleReason;
import com.morphirbridge.core.model.Pattern;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.model.ValueBody;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.model.ValueExpr;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.visitor.IrVisitor;
import com.morphirbridge.core.visitor.VisitContext;
import com.morphirbridge.core.visitor.VisitResult;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Rewrites every embedded {@link FQName}: type references, value references, constructors,
 * constructor patterns and unresolved-reference hole reasons.
 *
 * <p>Declaration sites are keyed by local name and module path and are not touched; rewriting
 * the package of a distribution is the caller's job.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Distribution renamed = new IrWalker<>(new FQNameRewriter(PackageAliases::toV4), Reducer.<Void>none())
 *     .walk(distribution)
 *     .distribution();
 * }</pre>
 */
public class FQNameRewriter implements IrVisitor<Void> {

    private final UnaryOperator<FQName> rewrite;

    public FQNameRewriter(UnaryOperator<FQName> rewrite) {
        this.rewrite = Objects.requireNonNull(rewrite, "rewrite must not be null");
    }

    @Override
    public VisitResult<TypeDefinition, Void> visitTypeDefinition(TypeDefinition definition, VisitContext context) {
        if (definition instanceof TypeDefinition.Incomplete incomplete
            && incomplete.incompleteness() instanceof TypeDefinition.Hole hole) {
            return VisitResult.replace(new TypeDefinition.Incomplete(incomplete.typeParams(),
                new TypeDefinition.Hole(reason(hole.reason()))));
        }
        return VisitResult.proceed();
    }

    @Override
    public VisitResult<ValueDefinition, Void> visitValueDefinition(ValueDefinition definition, VisitContext context) {
        if (definition.body() instanceof ValueBody.Incomplete incomplete) {
            return VisitResult.replace(new ValueDefinition(definition.inputs(), definition.outputType(),
                new ValueBody.Incomplete(reason(incomplete.reason()))));
        }
        return VisitResult.proceed();
    }

    @Override
    public VisitResult<TypeExpr, Void> visitType(TypeExpr type, VisitContext context) {
        if (type instanceof TypeExpr.Reference reference) {
            return VisitResult.replace(new TypeExpr.Reference(rewrite.apply(reference.fqName()), reference.args()));
        }
        return VisitResult.proceed();
    }

    @Override
    public VisitResult<ValueExpr, Void> visitValue(ValueExpr value, VisitContext context) {
        if (value instanceof ValueExpr.Reference reference) {
            return VisitResult.replace(new ValueExpr.Reference(rewrite.apply(reference.fqName())));
        } else if (value instanceof ValueExpr.Constructor constructor) {
            return VisitResult.replace(new ValueExpr.Constructor(rewrite.apply(constructor.fqName())));
        } else if (value instanceof ValueExpr.Hole hole) {
            return VisitResult.replace(new ValueExpr.Hole(reason(hole.reason()), hole.type()));
        }
        return VisitResult.proceed();
    }

    @Override
    public VisitResult<Pattern, Void> visitPattern(Pattern pattern, VisitContext context) {
        if (pattern instanceof Pattern.ConstructorPattern constructor) {
            return VisitResult.replace(
                new Pattern.ConstructorPattern(rewrite.apply(constructor.constructor()), constructor.args()));
        }
        return VisitResult.proceed();
    }

    private HoleReason reason(HoleReason reason) {
        if (reason instanceof HoleReason.UnresolvedReference unresolved) {
            return new HoleReason.UnresolvedReference(rewrite.apply(unresolved.target()));
        }
        return reason;
    }
}
