package com.morphirbridge.core.visitor.impl;

import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.visitor.IrVisitor;
import com.morphirbridge.core.visitor.VisitContext;
import com.morphirbridge.core.visitor.VisitResult;

/**
 * Counts modules. Use with {@link com.morphirbridge.core.visitor.Reducer#sum()}.
 */
public class ModuleCounter implements IrVisitor<Integer> {

    @Override
    public VisitResult<ModuleDefinition, Integer> visitModule(ModuleDefinition module, VisitContext context) {
        return VisitResult.skip(1);
    }
}
