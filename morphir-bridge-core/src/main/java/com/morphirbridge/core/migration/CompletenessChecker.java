package com.morphirbridge.core.migration;

import com.morphirbridge.core.error.IncompleteDefinitionException;
import com.morphirbridge.core.model.Constructor;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Parameter;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.visitor.IrVisitor;
import com.morphirbridge.core.visitor.IrWalker;
import com.morphirbridge.core.visitor.Reducer;
import com.morphirbridge.core.visitor.VisitContext;
import com.morphirbridge.core.visitor.VisitResult;

/**
 * Fails a migration when a value definition (top-level or let-bound) lacks its body, its
 * output type or an input type, or a constructor argument lacks its type.
 *
 * <p>Explicitly incomplete V4 bodies are not missing; whether they can be encoded is up to the
 * target writer.
 */
public class CompletenessChecker {

    /**
     * @throws IncompleteDefinitionException naming the first offending definition in traversal order
     */
    public void check(Distribution distribution) {
        new IrWalker<>(new Check(), Reducer.<Void>none()).walk(distribution);
    }

    private static final class Check implements IrVisitor<Void> {

        @Override
        public VisitResult<TypeDefinition, Void> visitTypeDefinition(TypeDefinition definition, VisitContext context) {
            if (definition instanceof TypeDefinition.CustomType custom) {
                for (Constructor constructor : custom.constructors().value()) {
                    for (Parameter arg : constructor.args()) {
                        if (arg.type() == null) {
                            throw new IncompleteDefinitionException(enclosing(context),
                                "constructor '" + constructor.name() + "' argument '" + arg.name() + "' has no type");
                        }
                    }
                }
            }
            return VisitResult.proceed();
        }

        @Override
        public VisitResult<ValueDefinition, Void> visitValueDefinition(ValueDefinition definition, VisitContext context) {
            if (definition.body() == null) {
                throw new IncompleteDefinitionException(enclosing(context), "missing body");
            }
            if (definition.outputType() == null) {
                throw new IncompleteDefinitionException(enclosing(context), "missing output type");
            }
            for (Parameter input : definition.inputs()) {
                if (input.type() == null) {
                    throw new IncompleteDefinitionException(enclosing(context),
                        "input '" + input.name() + "' has no type");
                }
            }
            return VisitResult.proceed();
        }

        private static FQName enclosing(VisitContext context) {
            return context.currentFQName()
                .orElseThrow(() -> new IllegalStateException("definition visited outside a module"));
        }
    }
}
