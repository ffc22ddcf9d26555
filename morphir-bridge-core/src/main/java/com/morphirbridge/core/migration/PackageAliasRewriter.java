package com.morphirbridge.core.migration;

import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.model.Constructor;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Documented;
import com.morphirbridge.core.model.ModuleSpecification;
import com.morphirbridge.core.model.PackageSpecification;
import com.morphirbridge.core.model.Parameter;
import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.model.TypeSpecification;
import com.morphirbridge.core.model.ValueSpecification;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.naming.PackageAliases;
import com.morphirbridge.core.naming.Path;
import com.morphirbridge.core.visitor.IrWalker;
import com.morphirbridge.core.visitor.Reducer;
import com.morphirbridge.core.visitor.impl.FQNameRewriter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Renames packages throughout a distribution: its own name, its dependency keys and every
 * FQName in its definitions and dependency specifications.
 */
public class PackageAliasRewriter {

    private final UnaryOperator<Path> rule;

    public PackageAliasRewriter(UnaryOperator<Path> rule) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
    }

    /**
     * The SDK spelling rule for a target version.
     */
    public static PackageAliasRewriter forTarget(IrVersion target) {
        return target.isClassic()
            ? new PackageAliasRewriter(PackageAliases::toClassic)
            : new PackageAliasRewriter(PackageAliases::toV4);
    }

    public Distribution rewrite(Distribution distribution) {
        Distribution walked = new IrWalker<>(new FQNameRewriter(this::fqName), Reducer.<Void>none())
            .walk(distribution)
            .distribution();
        Map<Path, PackageSpecification> dependencies = new LinkedHashMap<>();
        distribution.dependencies().forEach((path, spec) -> dependencies.put(rule.apply(path), packageSpec(spec)));
        return new Distribution(rule.apply(distribution.packageName()), dependencies, walked.modules());
    }

    private FQName fqName(FQName name) {
        return new FQName(rule.apply(name.packagePath()), name.modulePath(), name.localName());
    }

    // ==================== Dependency specifications ====================

    private PackageSpecification packageSpec(PackageSpecification spec) {
        Map<Path, ModuleSpecification> modules = new LinkedHashMap<>();
        spec.modules().forEach((path, module) -> {
            Map<Name, Documented<TypeSpecification>> types = new LinkedHashMap<>();
            module.types().forEach((name, entry) -> types.put(name, entry.withValue(typeSpec(entry.value()))));
            Map<Name, Documented<ValueSpecification>> values = new LinkedHashMap<>();
            module.values().forEach((name, entry) -> values.put(name, entry.withValue(
                new ValueSpecification(parameters(entry.value().inputs()), type(entry.value().output())))));
            modules.put(path, new ModuleSpecification(types, values, module.doc()));
        });
        return new PackageSpecification(modules);
    }

    private TypeSpecification typeSpec(TypeSpecification spec) {
        if (spec instanceof TypeSpecification.TypeAliasSpecification alias) {
            return new TypeSpecification.TypeAliasSpecification(alias.typeParams(), type(alias.body()));
        } else if (spec instanceof TypeSpecification.CustomTypeSpecification custom) {
            List<Constructor> constructors = custom.constructors().stream()
                .map(c -> new Constructor(c.name(), parameters(c.args())))
                .toList();
            return new TypeSpecification.CustomTypeSpecification(custom.typeParams(), constructors);
        }
        return spec;
    }

    private List<Parameter> parameters(List<Parameter> parameters) {
        return parameters.stream()
            .map(p -> new Parameter(p.name(), p.type() == null ? null : type(p.type())))
            .toList();
    }

    private TypeExpr type(TypeExpr type) {
        if (type instanceof TypeExpr.Reference reference) {
            return new TypeExpr.Reference(fqName(reference.fqName()), types(reference.args()));
        } else if (type instanceof TypeExpr.Tuple tuple) {
            return new TypeExpr.Tuple(types(tuple.elements()));
        } else if (type instanceof TypeExpr.Record fields) {
            return new TypeExpr.Record(fieldTypes(fields.fields()));
        } else if (type instanceof TypeExpr.ExtensibleRecord fields) {
            return new TypeExpr.ExtensibleRecord(fields.variable(), fieldTypes(fields.fields()));
        } else if (type instanceof TypeExpr.Function function) {
            return new TypeExpr.Function(type(function.argument()), type(function.result()));
        }
        return type;
    }

    private List<TypeExpr> types(List<TypeExpr> types) {
        return types.stream().map(this::type).toList();
    }

    private Map<Name, TypeExpr> fieldTypes(Map<Name, TypeExpr> fields) {
        Map<Name, TypeExpr> rewritten = new LinkedHashMap<>();
        fields.forEach((name, t) -> rewritten.put(name, type(t)));
        return rewritten;
    }
}
