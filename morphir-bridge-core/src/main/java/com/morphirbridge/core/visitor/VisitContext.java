package com.morphirbridge.core.visitor;

import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.naming.Path;

import java.util.Objects;
import java.util.Optional;

/**
 * Where the walker currently is: package, module, enclosing top-level definition and nesting
 * depth below the distribution root.
 *
 * @param modulePath     {@code null} before the first module
 * @param definitionName {@code null} outside a type or value definition
 */
public record VisitContext(Path packageName, Path modulePath, Name definitionName, int depth) {

    public VisitContext {
        Objects.requireNonNull(packageName, "packageName must not be null");
    }

    public static VisitContext root(Path packageName) {
        return new VisitContext(packageName, null, null, 0);
    }

    public VisitContext inModule(Path module) {
        return new VisitContext(packageName, module, null, depth + 1);
    }

    public VisitContext inDefinition(Name name) {
        return new VisitContext(packageName, modulePath, name, depth + 1);
    }

    public VisitContext deeper() {
        return new VisitContext(packageName, modulePath, definitionName, depth + 1);
    }

    /**
     * @return the fully-qualified name of the enclosing type or value definition
     */
    public Optional<FQName> currentFQName() {
        if (modulePath == null || definitionName == null) {
            return Optional.empty();
        }
        return Optional.of(new FQName(packageName, modulePath, definitionName));
    }
}
