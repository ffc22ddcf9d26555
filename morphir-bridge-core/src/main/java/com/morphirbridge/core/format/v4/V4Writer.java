package com.morphirbridge.core.format.v4;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.IrWriter;
import com.morphirbridge.core.model.Access;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Constructor;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Documented;
import com.morphirbridge.core.model.HoleReason;
import com.morphirbridge.core.model.Literal;
import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.model.ModuleSpecification;
import com.morphirbridge.core.model.PackageSpecification;
import com.morphirbridge.core.model.Parameter;
import com.morphirbridge.core.model.Pattern;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.model.TypeSpecification;
import com.morphirbridge.core.model.ValueBody;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.model.ValueExpr;
import com.morphirbridge.core.model.ValueSpecification;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.naming.NameCanonicalizer;
import com.morphirbridge.core.naming.Path;

import java.util.List;
import java.util.Map;

/**
 * Writes V4 JSON.
 *
 * <p>Every name, path and fully-qualified name goes through {@link NameCanonicalizer}, so a
 * declaration and every reference to it are spelled identically. Optional documentation is
 * omitted when empty.
 */
public class V4Writer implements IrWriter {

    public static final String FORMAT_VERSION = "4.0.0";

    @Override
    public IrVersion version() {
        return IrVersion.V4;
    }

    @Override
    public JsonNode write(Distribution distribution) {
        ObjectNode modules = IrJson.object();
        distribution.modules().forEach((path, module) -> {
            ObjectNode entry = IrJson.object();
            entry.put("access", access(module.access()));
            entry.set("value", moduleDefinition(module.value()));
            modules.set(NameCanonicalizer.render(path), entry);
        });
        ObjectNode def = IrJson.object();
        def.set("modules", modules);

        ObjectNode library = IrJson.object();
        library.put("packageName", NameCanonicalizer.render(distribution.packageName()));
        library.set("dependencies", dependencies(distribution.dependencies()));
        library.set("def", def);

        ObjectNode wrapper = IrJson.object();
        wrapper.set("Library", library);

        ObjectNode root = IrJson.object();
        root.put("formatVersion", FORMAT_VERSION);
        root.set("distribution", wrapper);
        return root;
    }

    // ==================== Fragments ====================

    public ObjectNode dependencies(Map<Path, PackageSpecification> dependencies) {
        ObjectNode node = IrJson.object();
        dependencies.forEach((path, spec) -> node.set(NameCanonicalizer.render(path), packageSpecification(spec)));
        return node;
    }

    public ObjectNode moduleDefinition(ModuleDefinition module) {
        ObjectNode types = IrJson.object();
        module.types().forEach((name, entry) -> types.set(NameCanonicalizer.render(name), typeEntry(entry)));
        ObjectNode values = IrJson.object();
        module.values().forEach((name, entry) -> values.set(NameCanonicalizer.render(name), valueEntry(entry)));
        ObjectNode node = IrJson.object();
        node.set("types", types);
        node.set("values", values);
        putModuleDoc(node, module.doc());
        return node;
    }

    public ObjectNode typeEntry(AccessControlled<Documented<TypeDefinition>> entry) {
        return entry(entry.access(), entry.value().doc(), typeDefinition(entry.value().value()));
    }

    public ObjectNode valueEntry(AccessControlled<Documented<ValueDefinition>> entry) {
        return entry(entry.access(), entry.value().doc(), valueDefinition(entry.value().value()));
    }

    private static ObjectNode entry(Access access, String doc, JsonNode value) {
        ObjectNode node = IrJson.object();
        node.put("access", access(access));
        putDoc(node, doc);
        node.set("value", value);
        return node;
    }

    static String access(Access access) {
        return access == Access.PUBLIC ? "Public" : "Private";
    }

    private static void putDoc(ObjectNode node, String doc) {
        if (doc != null && !doc.isEmpty()) {
            node.put("doc", doc);
        }
    }

    // Module docs keep "" apart from an absent doc.
    private static void putModuleDoc(ObjectNode node, String doc) {
        if (doc != null) {
            node.put("doc", doc);
        }
    }

    private static ObjectNode tagged(String tag, JsonNode content) {
        ObjectNode node = IrJson.object();
        node.set(tag, content);
        return node;
    }

    private static ObjectNode tagged(String tag) {
        return tagged(tag, IrJson.object());
    }

    private static String name(Name name) {
        return NameCanonicalizer.render(name);
    }

    private static String fqName(FQName fqName) {
        return NameCanonicalizer.render(fqName);
    }

    private static ArrayNode names(List<Name> names) {
        ArrayNode array = IrJson.array();
        names.forEach(n -> array.add(name(n)));
        return array;
    }

    // ==================== Specifications ====================

    private ObjectNode packageSpecification(PackageSpecification spec) {
        ObjectNode modules = IrJson.object();
        spec.modules().forEach((path, module) -> modules.set(NameCanonicalizer.render(path), moduleSpecification(module)));
        ObjectNode node = IrJson.object();
        node.set("modules", modules);
        return node;
    }

    private ObjectNode moduleSpecification(ModuleSpecification module) {
        ObjectNode types = IrJson.object();
        module.types().forEach((name, documented) -> types.set(name(name), documented(documented.doc(), typeSpecification(documented.value()))));
        ObjectNode values = IrJson.object();
        module.values().forEach((name, documented) -> values.set(name(name), documented(documented.doc(), valueSpecification(documented.value()))));
        ObjectNode node = IrJson.object();
        node.set("types", types);
        node.set("values", values);
        putModuleDoc(node, module.doc());
        return node;
    }

    private static ObjectNode documented(String doc, JsonNode value) {
        ObjectNode node = IrJson.object();
        putDoc(node, doc);
        node.set("value", value);
        return node;
    }

    private ObjectNode typeSpecification(TypeSpecification spec) {
        ObjectNode content = IrJson.object();
        content.set("typeParams", names(spec.typeParams()));
        if (spec instanceof TypeSpecification.TypeAliasSpecification alias) {
            content.set("typeExp", type(alias.body()));
            return tagged("TypeAliasSpecification", content);
        } else if (spec instanceof TypeSpecification.CustomTypeSpecification custom) {
            content.set("constructors", constructors(custom.constructors()));
            return tagged("CustomTypeSpecification", content);
        }
        return tagged("OpaqueTypeSpecification", content);
    }

    private ObjectNode valueSpecification(ValueSpecification spec) {
        ObjectNode inputs = IrJson.object();
        spec.inputs().forEach(input -> inputs.set(name(input.name()), type(input.type())));
        ObjectNode node = IrJson.object();
        node.set("inputs", inputs);
        node.set("output", type(spec.output()));
        return node;
    }

    // ==================== Types ====================

    private ObjectNode typeDefinition(TypeDefinition definition) {
        ObjectNode content = IrJson.object();
        content.set("typeParams", names(definition.typeParams()));
        if (definition instanceof TypeDefinition.TypeAlias alias) {
            content.set("typeExp", type(alias.body()));
            return tagged("TypeAliasDefinition", content);
        } else if (definition instanceof TypeDefinition.CustomType custom) {
            ObjectNode constructors = IrJson.object();
            constructors.put("access", access(custom.constructors().access()));
            constructors.set("value", constructors(custom.constructors().value()));
            content.set("constructors", constructors);
            return tagged("CustomTypeDefinition", content);
        }
        TypeDefinition.Incomplete incomplete = (TypeDefinition.Incomplete) definition;
        content.set("incompleteness", incomplete.incompleteness() instanceof TypeDefinition.Hole hole
            ? tagged("Hole", reasonContent(hole.reason()))
            : tagged("Draft"));
        return tagged("IncompleteTypeDefinition", content);
    }

    private static ObjectNode reasonContent(HoleReason reason) {
        ObjectNode content = IrJson.object();
        content.set("reason", holeReason(reason));
        return content;
    }

    private static ObjectNode holeReason(HoleReason reason) {
        if (reason instanceof HoleReason.UnresolvedReference unresolved) {
            ObjectNode content = IrJson.object();
            content.put("target", fqName(unresolved.target()));
            return tagged("UnresolvedReference", content);
        } else if (reason instanceof HoleReason.DeletedDuringRefactor) {
            return tagged("DeletedDuringRefactor");
        } else if (reason instanceof HoleReason.TypeMismatch) {
            return tagged("TypeMismatch");
        }
        return tagged("Draft");
    }

    private ArrayNode constructors(List<Constructor> constructors) {
        ArrayNode array = IrJson.array();
        for (Constructor constructor : constructors) {
            ArrayNode args = IrJson.array();
            for (Parameter arg : constructor.args()) {
                ObjectNode argNode = IrJson.object();
                argNode.put("name", name(arg.name()));
                argNode.set("type", type(arg.type()));
                args.add(argNode);
            }
            ObjectNode node = IrJson.object();
            node.put("name", name(constructor.name()));
            node.set("args", args);
            array.add(node);
        }
        return array;
    }

    private ObjectNode fieldTypes(Map<Name, TypeExpr> fields) {
        ObjectNode node = IrJson.object();
        fields.forEach((name, type) -> node.set(name(name), type(type)));
        return node;
    }

    private ArrayNode types(List<TypeExpr> types) {
        ArrayNode array = IrJson.array();
        types.forEach(t -> array.add(type(t)));
        return array;
    }

    JsonNode type(TypeExpr type) {
        if (type == null) {
            return NullNode.getInstance();
        }
        ObjectNode content = IrJson.object();
        if (type instanceof TypeExpr.Variable variable) {
            content.put("name", name(variable.name()));
            return tagged("Variable", content);
        } else if (type instanceof TypeExpr.Reference reference) {
            content.put("fqname", fqName(reference.fqName()));
            content.set("args", types(reference.args()));
            return tagged("Reference", content);
        } else if (type instanceof TypeExpr.Tuple tuple) {
            content.set("elements", types(tuple.elements()));
            return tagged("Tuple", content);
        } else if (type instanceof TypeExpr.Record record) {
            content.set("fields", fieldTypes(record.fields()));
            return tagged("Record", content);
        } else if (type instanceof TypeExpr.ExtensibleRecord record) {
            content.put("variable", name(record.variable()));
            content.set("fields", fieldTypes(record.fields()));
            return tagged("ExtensibleRecord", content);
        } else if (type instanceof TypeExpr.Function function) {
            content.set("arg", type(function.argument()));
            content.set("result", type(function.result()));
            return tagged("Function", content);
        }
        return tagged("Unit");
    }

    // ==================== Values ====================

    private ObjectNode valueDefinition(ValueDefinition definition) {
        ObjectNode inputs = IrJson.object();
        for (Parameter input : definition.inputs()) {
            ObjectNode inputNode = IrJson.object();
            if (input.type() != null) {
                inputNode.set("type", type(input.type()));
            }
            inputs.set(name(input.name()), inputNode);
        }
        ObjectNode node = IrJson.object();
        node.set("inputTypes", inputs);
        if (definition.outputType() != null) {
            node.set("outputType", type(definition.outputType()));
        }
        if (definition.body() != null) {
            node.set("body", body(definition.body()));
        }
        return node;
    }

    private ObjectNode body(ValueBody body) {
        ObjectNode content = IrJson.object();
        if (body instanceof ValueBody.Expression expression) {
            content.set("body", value(expression.body()));
            return tagged("ExpressionBody", content);
        } else if (body instanceof ValueBody.Native nativeBody) {
            content.set("hint", tagged(nativeBody.hint().wireName()));
            if (nativeBody.description() != null) {
                content.put("description", nativeBody.description());
            }
            return tagged("NativeBody", content);
        } else if (body instanceof ValueBody.External external) {
            content.put("externalName", external.externalName());
            content.put("targetPlatform", external.targetPlatform());
            return tagged("ExternalBody", content);
        }
        content.set("reason", holeReason(((ValueBody.Incomplete) body).reason()));
        return tagged("IncompleteBody", content);
    }

    private ArrayNode values(List<ValueExpr> values) {
        ArrayNode array = IrJson.array();
        values.forEach(v -> array.add(value(v)));
        return array;
    }

    private ObjectNode fieldValues(Map<Name, ValueExpr> fields) {
        ObjectNode node = IrJson.object();
        fields.forEach((name, value) -> node.set(name(name), value(value)));
        return node;
    }

    JsonNode value(ValueExpr value) {
        ObjectNode c = IrJson.object();
        if (value instanceof ValueExpr.LiteralValue literal) {
            c.set("literal", literal(literal.literal()));
            return tagged("Literal", c);
        } else if (value instanceof ValueExpr.Constructor constructor) {
            c.put("fqname", fqName(constructor.fqName()));
            return tagged("Constructor", c);
        } else if (value instanceof ValueExpr.Tuple tuple) {
            c.set("elements", values(tuple.elements()));
            return tagged("Tuple", c);
        } else if (value instanceof ValueExpr.ListOf list) {
            c.set("items", values(list.items()));
            return tagged("List", c);
        } else if (value instanceof ValueExpr.Record record) {
            c.set("fields", fieldValues(record.fields()));
            return tagged("Record", c);
        } else if (value instanceof ValueExpr.Variable variable) {
            c.put("name", name(variable.name()));
            return tagged("Variable", c);
        } else if (value instanceof ValueExpr.Reference reference) {
            c.put("fqname", fqName(reference.fqName()));
            return tagged("Reference", c);
        } else if (value instanceof ValueExpr.Field field) {
            c.set("value", value(field.subject()));
            c.put("name", name(field.name()));
            return tagged("Field", c);
        } else if (value instanceof ValueExpr.FieldFunction field) {
            c.put("name", name(field.name()));
            return tagged("FieldFunction", c);
        } else if (value instanceof ValueExpr.Apply apply) {
            c.set("function", value(apply.function()));
            c.set("argument", value(apply.argument()));
            return tagged("Apply", c);
        } else if (value instanceof ValueExpr.Lambda lambda) {
            c.set("pattern", pattern(lambda.pattern()));
            c.set("body", value(lambda.body()));
            return tagged("Lambda", c);
        } else if (value instanceof ValueExpr.LetDefinition let) {
            c.put("name", name(let.name()));
            c.set("definition", valueDefinition(let.definition()));
            c.set("body", value(let.in()));
            return tagged("LetDefinition", c);
        } else if (value instanceof ValueExpr.LetRecursion let) {
            ArrayNode bindings = IrJson.array();
            let.bindings().forEach((name, definition) -> {
                ObjectNode binding = IrJson.object();
                binding.put("name", name(name));
                binding.set("definition", valueDefinition(definition));
                bindings.add(binding);
            });
            c.set("bindings", bindings);
            c.set("body", value(let.in()));
            return tagged("LetRecursion", c);
        } else if (value instanceof ValueExpr.Destructure destructure) {
            c.set("pattern", pattern(destructure.pattern()));
            c.set("value", value(destructure.value()));
            c.set("body", value(destructure.in()));
            return tagged("Destructure", c);
        } else if (value instanceof ValueExpr.IfThenElse ifThenElse) {
            c.set("condition", value(ifThenElse.condition()));
            c.set("thenBranch", value(ifThenElse.thenBranch()));
            c.set("elseBranch", value(ifThenElse.elseBranch()));
            return tagged("IfThenElse", c);
        } else if (value instanceof ValueExpr.PatternMatch match) {
            ArrayNode cases = IrJson.array();
            for (ValueExpr.Case matchCase : match.cases()) {
                ObjectNode caseNode = IrJson.object();
                caseNode.set("pattern", pattern(matchCase.pattern()));
                caseNode.set("body", value(matchCase.body()));
                cases.add(caseNode);
            }
            c.set("subject", value(match.subject()));
            c.set("cases", cases);
            return tagged("PatternMatch", c);
        } else if (value instanceof ValueExpr.UpdateRecord update) {
            c.set("record", value(update.target()));
            c.set("updates", fieldValues(update.updates()));
            return tagged("UpdateRecord", c);
        } else if (value instanceof ValueExpr.Hole hole) {
            c.set("reason", holeReason(hole.reason()));
            if (hole.type() != null) {
                c.set("type", type(hole.type()));
            }
            return tagged("Hole", c);
        }
        return tagged("Unit");
    }

    JsonNode pattern(Pattern pattern) {
        ObjectNode c = IrJson.object();
        if (pattern instanceof Pattern.VariablePattern variable) {
            c.set("pattern", tagged("WildcardPattern"));
            c.put("name", name(variable.name()));
            return tagged("AsPattern", c);
        } else if (pattern instanceof Pattern.AsPattern as) {
            c.set("pattern", pattern(as.pattern()));
            c.put("name", name(as.name()));
            return tagged("AsPattern", c);
        } else if (pattern instanceof Pattern.TuplePattern tuple) {
            ArrayNode elements = IrJson.array();
            tuple.elements().forEach(p -> elements.add(pattern(p)));
            c.set("elements", elements);
            return tagged("TuplePattern", c);
        } else if (pattern instanceof Pattern.ConstructorPattern constructor) {
            ArrayNode args = IrJson.array();
            constructor.args().forEach(p -> args.add(pattern(p)));
            c.put("fqname", fqName(constructor.constructor()));
            c.set("args", args);
            return tagged("ConstructorPattern", c);
        } else if (pattern instanceof Pattern.HeadTailPattern headTail) {
            c.set("head", pattern(headTail.head()));
            c.set("tail", pattern(headTail.tail()));
            return tagged("HeadTailPattern", c);
        } else if (pattern instanceof Pattern.LiteralPattern literal) {
            c.set("literal", literal(literal.literal()));
            return tagged("LiteralPattern", c);
        } else if (pattern instanceof Pattern.EmptyListPattern) {
            return tagged("EmptyListPattern");
        } else if (pattern instanceof Pattern.UnitPattern) {
            return tagged("UnitPattern");
        }
        return tagged("WildcardPattern");
    }

    private static JsonNode literal(Literal literal) {
        ObjectNode c = IrJson.object();
        if (literal instanceof Literal.BoolLiteral bool) {
            c.put("value", bool.value());
            return tagged("BoolLiteral", c);
        } else if (literal instanceof Literal.CharLiteral character) {
            c.put("value", character.value());
            return tagged("CharLiteral", c);
        } else if (literal instanceof Literal.StringLiteral string) {
            c.put("value", string.value());
            return tagged("StringLiteral", c);
        } else if (literal instanceof Literal.WholeNumberLiteral number) {
            c.put("value", number.value());
            return tagged("IntegerLiteral", c);
        } else if (literal instanceof Literal.FloatLiteral number) {
            c.put("value", number.value());
            return tagged("FloatLiteral", c);
        }
        c.put("value", ((Literal.DecimalLiteral) literal).value().toString());
        return tagged("DecimalLiteral", c);
    }
}
