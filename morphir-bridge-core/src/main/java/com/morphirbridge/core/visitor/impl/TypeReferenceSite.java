package com.morphirbridge.core.visitor.impl;

import com.morphirbridge.core.naming.FQName;

import java.util.Objects;

/**
 * One occurrence of a type reference.
 *
 * @param target    the referenced type
 * @param arity     number of type arguments at this site
 * @param enclosing the type or value definition containing the site
 */
public record TypeReferenceSite(FQName target, int arity, FQName enclosing) {

    public TypeReferenceSite {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(enclosing, "enclosing must not be null");
    }
}
