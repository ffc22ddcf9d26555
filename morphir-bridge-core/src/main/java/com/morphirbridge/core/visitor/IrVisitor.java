package com.morphirbridge.core.visitor;

import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.model.Pattern;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.model.ValueExpr;

/**
 * Callbacks for a walk over a distribution.
 *
 * <p>Every method has a default that proceeds into the children without contributing
 * anything, so a visitor overrides only the node kinds it cares about and still reaches every
 * node. Recursion itself belongs to {@link IrWalker}; visitors never call each other.
 *
 * <p><b>Example:</b> count type references
 * <pre>{@code
 * IrVisitor<Integer> references = new IrVisitor<>() {
 *     @Override
 *     public VisitResult<TypeExpr, Integer> visitType(TypeExpr type, VisitContext context) {
 *         return VisitResult.proceed(type instanceof TypeExpr.Reference ? 1 : 0);
 *     }
 * };
 * int count = new IrWalker<>(references, Reducer.sum()).walk(distribution).value();
 * }</pre>
 *
 * @param <R> type of the contributions
 */
public interface IrVisitor<R> {

    default VisitResult<ModuleDefinition, R> visitModule(ModuleDefinition module, VisitContext context) {
        return VisitResult.proceed();
    }

    default VisitResult<TypeDefinition, R> visitTypeDefinition(TypeDefinition definition, VisitContext context) {
        return VisitResult.proceed();
    }

    /**
     * Called for top-level value definitions and for definitions bound by {@code let}.
     */
    default VisitResult<ValueDefinition, R> visitValueDefinition(ValueDefinition definition, VisitContext context) {
        return VisitResult.proceed();
    }

    default VisitResult<TypeExpr, R> visitType(TypeExpr type, VisitContext context) {
        return VisitResult.proceed();
    }

    default VisitResult<ValueExpr, R> visitValue(ValueExpr value, VisitContext context) {
        return VisitResult.proceed();
    }

    default VisitResult<Pattern, R> visitPattern(Pattern pattern, VisitContext context) {
        return VisitResult.proceed();
    }
}
