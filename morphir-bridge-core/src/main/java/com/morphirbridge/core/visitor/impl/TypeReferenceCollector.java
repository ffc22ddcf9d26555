package com.morphirbridge.core.visitor.impl;

import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.visitor.IrVisitor;
import com.morphirbridge.core.visitor.VisitContext;
import com.morphirbridge.core.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Collects every type reference site in traversal order, including references nested in
 * constructor arguments, let-bound definitions and hole annotations.
 * Use with {@link com.morphirbridge.core.visitor.Reducer#concat()}.
 */
public class TypeReferenceCollector implements IrVisitor<List<TypeReferenceSite>> {

    @Override
    public VisitResult<TypeExpr, List<TypeReferenceSite>> visitType(TypeExpr type, VisitContext context) {
        Optional<FQName> enclosing = context.currentFQName();
        if (type instanceof TypeExpr.Reference reference && enclosing.isPresent()) {
            return VisitResult.proceed(
                List.of(new TypeReferenceSite(reference.fqName(), reference.args().size(), enclosing.get())));
        }
        return VisitResult.proceed();
    }
}
