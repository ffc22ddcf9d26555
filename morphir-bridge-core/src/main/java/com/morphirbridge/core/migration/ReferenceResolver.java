package com.morphirbridge.core.migration;

import com.morphirbridge.core.error.MigrationUnsupportedException;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.PackageAliases;
import com.morphirbridge.core.naming.Path;
import com.morphirbridge.core.visitor.IrWalker;
import com.morphirbridge.core.visitor.Reducer;
import com.morphirbridge.core.visitor.impl.TypeReferenceCollector;
import com.morphirbridge.core.visitor.impl.TypeReferenceSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that every type reference in a distribution names a declared type with the same
 * number of type parameters.
 *
 * <p>Types are declared by the distribution's own modules and by its dependency
 * specifications. The SDK package is intrinsic: references into it resolve by package alone,
 * under either spelling.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    /**
     * @throws MigrationUnsupportedException for an unresolved reference or an arity mismatch
     */
    public void resolve(Distribution distribution) {
        Map<FQName, Integer> declared = declaredTypes(distribution);
        List<TypeReferenceSite> sites = new IrWalker<>(new TypeReferenceCollector(), Reducer.<TypeReferenceSite>concat())
            .walk(distribution)
            .value();
        for (TypeReferenceSite site : sites) {
            if (PackageAliases.isSdk(site.target().packagePath())) {
                continue;
            }
            Integer arity = declared.get(site.target());
            if (arity == null) {
                throw new MigrationUnsupportedException("unresolved type reference '"
                    + site.target().toCanonicalString() + "' in '" + site.enclosing().toCanonicalString() + "'");
            }
            if (arity != site.arity()) {
                throw new MigrationUnsupportedException("type '" + site.target().toCanonicalString()
                    + "' takes " + arity + " type argument(s) but '" + site.enclosing().toCanonicalString()
                    + "' passes " + site.arity());
            }
        }
        log.debug("Resolved {} type references against {} declared types", sites.size(), declared.size());
    }

    static Map<FQName, Integer> declaredTypes(Distribution distribution) {
        Map<FQName, Integer> declared = new HashMap<>();
        Path packageName = distribution.packageName();
        distribution.modules().forEach((modulePath, module) ->
            module.value().types().forEach((name, entry) -> declared.put(
                new FQName(packageName, modulePath, name), entry.value().value().typeParams().size())));
        distribution.dependencies().forEach((dependency, spec) ->
            spec.modules().forEach((modulePath, module) ->
                module.types().forEach((name, entry) -> declared.put(
                    new FQName(dependency, modulePath, name), entry.value().typeParams().size()))));
        return declared;
    }
}
