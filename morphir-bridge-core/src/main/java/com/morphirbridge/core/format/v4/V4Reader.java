package com.morphirbridge.core.format.v4;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.error.IrParseException;
import com.morphirbridge.core.format.CosmeticLoss;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.JsonDocumentReader;
import com.morphirbridge.core.model.Access;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Constructor;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Documented;
import com.morphirbridge.core.model.HoleReason;
import com.morphirbridge.core.model.Literal;
import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.model.ModuleSpecification;
import com.morphirbridge.core.model.NativeHint;
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
import com.morphirbridge.core.naming.PackageAliases;
import com.morphirbridge.core.naming.Path;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads V4 JSON into the canonical model.
 *
 * <p>Besides whole bundled documents, the reader exposes the fragment-level entry points the
 * Document Tree loader needs (type and value entries, dependency specifications). One reader
 * instance collects the cosmetic losses of everything it reads.
 */
public class V4Reader extends JsonDocumentReader {

    static final String ATTRS = "attrs";
    static final String INPUT_ATTRS = "typeAttributes";

    // Content fields of each attributed node kind; anything else is rejected rather than dropped.
    private static final Map<String, Set<String>> TYPE_FIELDS = Map.ofEntries(
        Map.entry("Variable", Set.of("name")),
        Map.entry("Reference", Set.of("fqname", "args")),
        Map.entry("Tuple", Set.of("elements")),
        Map.entry("Record", Set.of("fields")),
        Map.entry("ExtensibleRecord", Set.of("variable", "fields")),
        Map.entry("Function", Set.of("arg", "result")),
        Map.entry("Unit", Set.of()));

    private static final Map<String, Set<String>> VALUE_FIELDS = Map.ofEntries(
        Map.entry("Literal", Set.of("literal")),
        Map.entry("Constructor", Set.of("fqname")),
        Map.entry("Tuple", Set.of("elements")),
        Map.entry("List", Set.of("items")),
        Map.entry("Record", Set.of("fields")),
        Map.entry("Variable", Set.of("name")),
        Map.entry("Reference", Set.of("fqname")),
        Map.entry("Field", Set.of("value", "name")),
        Map.entry("FieldFunction", Set.of("name")),
        Map.entry("Apply", Set.of("function", "argument")),
        Map.entry("Lambda", Set.of("pattern", "body")),
        Map.entry("LetDefinition", Set.of("name", "definition", "body")),
        Map.entry("LetRecursion", Set.of("bindings", "body")),
        Map.entry("Destructure", Set.of("pattern", "value", "body")),
        Map.entry("IfThenElse", Set.of("condition", "thenBranch", "elseBranch")),
        Map.entry("PatternMatch", Set.of("subject", "cases")),
        Map.entry("UpdateRecord", Set.of("record", "updates")),
        Map.entry("Unit", Set.of()),
        Map.entry("Hole", Set.of("reason", "type", "tpe")));

    private static final Map<String, Set<String>> PATTERN_FIELDS = Map.ofEntries(
        Map.entry("WildcardPattern", Set.of()),
        Map.entry("VariablePattern", Set.of("name")),
        Map.entry("AsPattern", Set.of("pattern", "name")),
        Map.entry("TuplePattern", Set.of("elements")),
        Map.entry("ConstructorPattern", Set.of("fqname", "args")),
        Map.entry("EmptyListPattern", Set.of()),
        Map.entry("HeadTailPattern", Set.of("head", "tail")),
        Map.entry("LiteralPattern", Set.of("literal")),
        Map.entry("UnitPattern", Set.of()));

    private static final Set<String> INPUT_FIELDS = Set.of("type", INPUT_ATTRS);

    public Distribution readDistribution(JsonNode root) {
        requireObject(root, "");
        JsonNode formatVersion = optionalField(root, "formatVersion");
        if (formatVersion != null && !(formatVersion.isTextual() && formatVersion.asText().equals(V4Writer.FORMAT_VERSION))) {
            recordLoss(CosmeticLoss.FORMAT_VERSION_LABEL);
        }
        String at = "/distribution";
        Tagged distribution = tagged(field(root, "distribution", ""), at);
        if (!distribution.tag().equals("Library")) {
            throw new IrParseException(at, "unsupported distribution kind '" + distribution.tag() + "'");
        }
        JsonNode library = distribution.content();
        String libraryAt = distribution.at();
        Path packageName = packagePath(field(library, "packageName", libraryAt), pointer(libraryAt, "packageName"));

        Map<Path, PackageSpecification> dependencies = readDependencies(
            optionalField(library, "dependencies"), pointer(libraryAt, "dependencies"));

        String defAt = pointer(libraryAt, "def");
        JsonNode def = field(library, "def", libraryAt);
        Map<Path, AccessControlled<ModuleDefinition>> modules = new LinkedHashMap<>();
        JsonNode modulesNode = optionalField(def, "modules");
        if (modulesNode != null) {
            String modulesAt = pointer(defAt, "modules");
            requireObject(modulesNode, modulesAt);
            for (Iterator<Map.Entry<String, JsonNode>> it = modulesNode.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String entryAt = pointer(modulesAt, entry.getKey());
                Path modulePath = path(entry.getKey(), entryAt);
                if (modules.containsKey(modulePath)) {
                    throw new IrParseException(entryAt, "duplicate module '" + modulePath + "'");
                }
                modules.put(modulePath, new AccessControlled<>(
                    access(field(entry.getValue(), "access", entryAt), pointer(entryAt, "access")),
                    moduleDefinition(field(entry.getValue(), "value", entryAt), pointer(entryAt, "value"))));
            }
        }
        return new Distribution(packageName, dependencies, modules);
    }

    /**
     * Reads the {@code {"package/path": PackageSpecification}} dependency map.
     */
    public Map<Path, PackageSpecification> readDependencies(JsonNode node, String at) {
        Map<Path, PackageSpecification> dependencies = new LinkedHashMap<>();
        if (node == null) {
            return dependencies;
        }
        requireObject(node, at);
        node.fields().forEachRemaining(entry -> {
            String entryAt = pointer(at, entry.getKey());
            dependencies.put(packagePath(entry.getKey(), entryAt), packageSpecification(entry.getValue(), entryAt));
        });
        return dependencies;
    }

    // ==================== Names ====================

    public Name name(JsonNode node, String at) {
        return name(text(node, at), at);
    }

    private static Name name(String text, String at) {
        try {
            return Name.fromString(text);
        } catch (IllegalArgumentException e) {
            throw invalid(at, e);
        }
    }

    public Path path(String text, String at) {
        try {
            return Path.parse(text);
        } catch (IllegalArgumentException e) {
            throw invalid(at, e);
        }
    }

    public Path packagePath(JsonNode node, String at) {
        return packagePath(text(node, at), at);
    }

    private Path packagePath(String text, String at) {
        return PackageAliases.toV4(path(text, at));
    }

    public Access readAccess(JsonNode node, String at) {
        return access(node, at);
    }

    private FQName fqName(JsonNode node, String at) {
        try {
            return PackageAliases.toV4(FQName.parse(text(node, at)));
        } catch (IllegalArgumentException e) {
            throw invalid(at, e);
        }
    }

    private List<Name> names(JsonNode node, String at) {
        List<Name> names = new ArrayList<>();
        if (node == null) {
            return names;
        }
        requireArray(node, at);
        for (int i = 0; i < node.size(); i++) {
            names.add(name(node.get(i), pointer(at, i)));
        }
        return names;
    }

    // ==================== Tagged wrappers ====================

    /**
     * A single-key wrapper object such as {@code {"Variable": {...}}}. A bare string is accepted
     * as a wrapper with empty content.
     */
    record Tagged(String tag, JsonNode content, String at) {
    }

    private static Tagged tagged(JsonNode node, String at) {
        if (node != null && node.isTextual()) {
            return new Tagged(node.asText(), IrJson.object(), at);
        }
        requireObject(node, at);
        String tag = null;
        for (Iterator<String> names = node.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (name.equals(ATTRS)) {
                continue;
            }
            if (tag != null) {
                throw new IrParseException(at, "expected a single tag but found '" + tag + "' and '" + name + "'");
            }
            tag = name;
        }
        if (tag == null) {
            throw new IrParseException(at, "expected a tagged object but found no tag");
        }
        JsonNode content = node.get(tag);
        return new Tagged(tag, content.isNull() ? IrJson.object() : content, pointer(at, tag));
    }

    private void checkAttributes(Tagged tagged, CosmeticLoss loss) {
        if (tagged.content().isObject() && hasContent(tagged.content().get(ATTRS))) {
            recordLoss(loss);
        }
    }

    private static void checkFields(Tagged tagged, Map<String, Set<String>> known) {
        Set<String> fields = known.get(tagged.tag());
        if (fields == null || !tagged.content().isObject()) {
            return;
        }
        checkFields(tagged.content(), tagged.at(), fields, tagged.tag());
    }

    private static void checkFields(JsonNode node, String at, Set<String> fields, String what) {
        for (Iterator<String> names = node.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (!name.equals(ATTRS) && !fields.contains(name)) {
                throw new IrParseException(pointer(at, name), "unknown field '" + name + "' in " + what);
            }
        }
    }

    private static IrParseException unknownTag(Tagged tagged, String what) {
        return new IrParseException(tagged.at(), "unknown " + what + " tag '" + tagged.tag() + "'");
    }

    // ==================== Modules ====================

    ModuleDefinition moduleDefinition(JsonNode node, String at) {
        requireObject(node, at);
        Map<Name, AccessControlled<Documented<TypeDefinition>>> types = new LinkedHashMap<>();
        forEachEntry(optionalField(node, "types"), pointer(at, "types"),
            (name, entry, entryAt) -> types.put(name, readTypeEntry(entry, entryAt)));
        Map<Name, AccessControlled<Documented<ValueDefinition>>> values = new LinkedHashMap<>();
        forEachEntry(optionalField(node, "values"), pointer(at, "values"),
            (name, entry, entryAt) -> values.put(name, readValueEntry(entry, entryAt)));
        return new ModuleDefinition(types, values, optionalText(node, "doc"));
    }

    /**
     * Reads {@code {"access", "doc"?, "value": TypeDefinition}}: one type of a module, as stored
     * inline in a bundled document or in a {@code .type.json} fragment.
     */
    public AccessControlled<Documented<TypeDefinition>> readTypeEntry(JsonNode node, String at) {
        return new AccessControlled<>(
            access(field(node, "access", at), pointer(at, "access")),
            new Documented<>(optionalText(node, "doc"), typeDefinition(field(node, "value", at), pointer(at, "value"))));
    }

    /**
     * Reads {@code {"access", "doc"?, "value": ValueDefinition}}.
     */
    public AccessControlled<Documented<ValueDefinition>> readValueEntry(JsonNode node, String at) {
        return new AccessControlled<>(
            access(field(node, "access", at), pointer(at, "access")),
            new Documented<>(optionalText(node, "doc"), valueDefinition(field(node, "value", at), pointer(at, "value"))));
    }

    @FunctionalInterface
    private interface EntryConsumer {
        void accept(Name name, JsonNode value, String at);
    }

    private static void forEachEntry(JsonNode node, String at, EntryConsumer consumer) {
        if (node == null) {
            return;
        }
        requireObject(node, at);
        node.fields().forEachRemaining(entry -> {
            String entryAt = pointer(at, entry.getKey());
            consumer.accept(name(entry.getKey(), entryAt), entry.getValue(), entryAt);
        });
    }

    PackageSpecification packageSpecification(JsonNode node, String at) {
        Map<Path, ModuleSpecification> modules = new LinkedHashMap<>();
        JsonNode modulesNode = optionalField(node, "modules");
        String modulesAt = pointer(at, "modules");
        if (modulesNode != null) {
            requireObject(modulesNode, modulesAt);
            modulesNode.fields().forEachRemaining(entry -> {
                String entryAt = pointer(modulesAt, entry.getKey());
                modules.put(path(entry.getKey(), entryAt), moduleSpecification(entry.getValue(), entryAt));
            });
        }
        return new PackageSpecification(modules);
    }

    private ModuleSpecification moduleSpecification(JsonNode node, String at) {
        requireObject(node, at);
        Map<Name, Documented<TypeSpecification>> types = new LinkedHashMap<>();
        forEachEntry(optionalField(node, "types"), pointer(at, "types"), (name, entry, entryAt) ->
            types.put(name, new Documented<>(optionalText(entry, "doc"),
                typeSpecification(field(entry, "value", entryAt), pointer(entryAt, "value")))));
        Map<Name, Documented<ValueSpecification>> values = new LinkedHashMap<>();
        forEachEntry(optionalField(node, "values"), pointer(at, "values"), (name, entry, entryAt) ->
            values.put(name, new Documented<>(optionalText(entry, "doc"),
                valueSpecification(field(entry, "value", entryAt), pointer(entryAt, "value")))));
        return new ModuleSpecification(types, values, optionalText(node, "doc"));
    }

    private TypeSpecification typeSpecification(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        JsonNode content = tagged.content();
        List<Name> params = names(optionalField(content, "typeParams"), pointer(tagged.at(), "typeParams"));
        return switch (tagged.tag()) {
            case "TypeAliasSpecification" -> new TypeSpecification.TypeAliasSpecification(params,
                typeExpr(field(content, "typeExp", tagged.at()), pointer(tagged.at(), "typeExp")));
            case "OpaqueTypeSpecification" -> new TypeSpecification.OpaqueTypeSpecification(params);
            case "CustomTypeSpecification" -> new TypeSpecification.CustomTypeSpecification(params,
                constructors(field(content, "constructors", tagged.at()), pointer(tagged.at(), "constructors")));
            default -> throw unknownTag(tagged, "type specification");
        };
    }

    private ValueSpecification valueSpecification(JsonNode node, String at) {
        requireObject(node, at);
        List<Parameter> inputs = new ArrayList<>();
        forEachEntry(optionalField(node, "inputs"), pointer(at, "inputs"),
            (name, type, entryAt) -> inputs.add(new Parameter(name, typeExpr(type, entryAt))));
        return new ValueSpecification(inputs, typeExpr(field(node, "output", at), pointer(at, "output")));
    }

    // ==================== Types ====================

    TypeDefinition typeDefinition(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        JsonNode content = tagged.content();
        String contentAt = tagged.at();
        List<Name> params = names(optionalField(content, "typeParams"), pointer(contentAt, "typeParams"));
        return switch (tagged.tag()) {
            case "TypeAliasDefinition" -> new TypeDefinition.TypeAlias(params,
                typeExpr(field(content, "typeExp", contentAt), pointer(contentAt, "typeExp")));
            case "CustomTypeDefinition" -> {
                JsonNode constructors = field(content, "constructors", contentAt);
                String constructorsAt = pointer(contentAt, "constructors");
                yield new TypeDefinition.CustomType(params, new AccessControlled<>(
                    access(field(constructors, "access", constructorsAt), pointer(constructorsAt, "access")),
                    constructors(field(constructors, "value", constructorsAt), pointer(constructorsAt, "value"))));
            }
            case "IncompleteTypeDefinition" -> new TypeDefinition.Incomplete(params,
                incompleteness(field(content, "incompleteness", contentAt), pointer(contentAt, "incompleteness")));
            default -> throw unknownTag(tagged, "type definition");
        };
    }

    private TypeDefinition.Incompleteness incompleteness(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        return switch (tagged.tag()) {
            case "Hole" -> new TypeDefinition.Hole(
                holeReason(field(tagged.content(), "reason", tagged.at()), pointer(tagged.at(), "reason")));
            case "Draft" -> new TypeDefinition.Draft();
            default -> throw unknownTag(tagged, "incompleteness");
        };
    }

    private HoleReason holeReason(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        return switch (tagged.tag()) {
            case "UnresolvedReference" -> new HoleReason.UnresolvedReference(
                fqName(field(tagged.content(), "target", tagged.at()), pointer(tagged.at(), "target")));
            case "DeletedDuringRefactor" -> new HoleReason.DeletedDuringRefactor();
            case "TypeMismatch" -> new HoleReason.TypeMismatch();
            case "Draft" -> new HoleReason.Draft();
            default -> throw unknownTag(tagged, "hole reason");
        };
    }

    private List<Constructor> constructors(JsonNode node, String at) {
        requireArray(node, at);
        List<Constructor> constructors = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            String ctorAt = pointer(at, i);
            JsonNode ctor = node.get(i);
            List<Parameter> args = new ArrayList<>();
            JsonNode argsNode = optionalField(ctor, "args");
            if (argsNode != null) {
                String argsAt = pointer(ctorAt, "args");
                requireArray(argsNode, argsAt);
                for (int j = 0; j < argsNode.size(); j++) {
                    String argAt = pointer(argsAt, j);
                    JsonNode arg = argsNode.get(j);
                    args.add(new Parameter(name(field(arg, "name", argAt), pointer(argAt, "name")),
                        typeExpr(field(arg, "type", argAt), pointer(argAt, "type"))));
                }
            }
            constructors.add(new Constructor(name(field(ctor, "name", ctorAt), pointer(ctorAt, "name")), args));
        }
        return constructors;
    }

    TypeExpr typeExpr(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        checkAttributes(tagged, CosmeticLoss.TYPE_ATTRIBUTES);
        checkFields(tagged, TYPE_FIELDS);
        JsonNode content = tagged.content();
        String contentAt = tagged.at();
        return switch (tagged.tag()) {
            case "Variable" -> new TypeExpr.Variable(name(field(content, "name", contentAt), pointer(contentAt, "name")));
            case "Reference" -> new TypeExpr.Reference(
                fqName(field(content, "fqname", contentAt), pointer(contentAt, "fqname")),
                typeExprs(optionalField(content, "args"), pointer(contentAt, "args")));
            case "Tuple" -> new TypeExpr.Tuple(typeExprs(optionalField(content, "elements"), pointer(contentAt, "elements")));
            case "Record" -> new TypeExpr.Record(fieldTypes(optionalField(content, "fields"), pointer(contentAt, "fields")));
            case "ExtensibleRecord" -> new TypeExpr.ExtensibleRecord(
                name(field(content, "variable", contentAt), pointer(contentAt, "variable")),
                fieldTypes(optionalField(content, "fields"), pointer(contentAt, "fields")));
            case "Function" -> new TypeExpr.Function(
                typeExpr(field(content, "arg", contentAt), pointer(contentAt, "arg")),
                typeExpr(field(content, "result", contentAt), pointer(contentAt, "result")));
            case "Unit" -> new TypeExpr.Unit();
            default -> throw unknownTag(tagged, "type");
        };
    }

    private List<TypeExpr> typeExprs(JsonNode node, String at) {
        List<TypeExpr> types = new ArrayList<>();
        if (node == null) {
            return types;
        }
        requireArray(node, at);
        for (int i = 0; i < node.size(); i++) {
            types.add(typeExpr(node.get(i), pointer(at, i)));
        }
        return types;
    }

    private Map<Name, TypeExpr> fieldTypes(JsonNode node, String at) {
        Map<Name, TypeExpr> fields = new LinkedHashMap<>();
        forEachEntry(node, at, (name, type, entryAt) -> fields.put(name, typeExpr(type, entryAt)));
        return fields;
    }

    // ==================== Values ====================

    ValueDefinition valueDefinition(JsonNode node, String at) {
        requireObject(node, at);
        List<Parameter> inputs = new ArrayList<>();
        forEachEntry(optionalField(node, "inputTypes"), pointer(at, "inputTypes"), (name, input, entryAt) -> {
            JsonNode type = input;
            if (input.isObject() && (input.has("type") || input.has(INPUT_ATTRS) || input.isEmpty())) {
                checkFields(input, entryAt, INPUT_FIELDS, "input type");
                if (hasContent(input.get(INPUT_ATTRS))) {
                    recordLoss(CosmeticLoss.VALUE_ATTRIBUTES);
                }
                type = optionalField(input, "type");
            }
            inputs.add(new Parameter(name, type == null ? null : typeExpr(type, pointer(entryAt, "type"))));
        });
        JsonNode output = optionalField(node, "outputType");
        JsonNode body = optionalField(node, "body");
        return new ValueDefinition(inputs,
            output == null ? null : typeExpr(output, pointer(at, "outputType")),
            body == null ? null : body(body, pointer(at, "body")));
    }

    private ValueBody body(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        JsonNode content = tagged.content();
        String contentAt = tagged.at();
        return switch (tagged.tag()) {
            case "ExpressionBody" -> new ValueBody.Expression(value(field(content, "body", contentAt), pointer(contentAt, "body")));
            case "NativeBody" -> {
                Tagged hint = tagged(field(content, "hint", contentAt), pointer(contentAt, "hint"));
                NativeHint nativeHint = NativeHint.fromWireName(hint.tag())
                    .orElseThrow(() -> unknownTag(hint, "native hint"));
                yield new ValueBody.Native(nativeHint, optionalText(content, "description"));
            }
            case "ExternalBody" -> new ValueBody.External(
                text(field(content, "externalName", contentAt), pointer(contentAt, "externalName")),
                text(field(content, "targetPlatform", contentAt), pointer(contentAt, "targetPlatform")));
            case "IncompleteBody" -> new ValueBody.Incomplete(
                holeReason(field(content, "reason", contentAt), pointer(contentAt, "reason")));
            default -> throw unknownTag(tagged, "value body");
        };
    }

    ValueExpr value(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        checkAttributes(tagged, CosmeticLoss.VALUE_ATTRIBUTES);
        checkFields(tagged, VALUE_FIELDS);
        JsonNode c = tagged.content();
        String cAt = tagged.at();
        return switch (tagged.tag()) {
            case "Literal" -> new ValueExpr.LiteralValue(literal(field(c, "literal", cAt), pointer(cAt, "literal")));
            case "Constructor" -> new ValueExpr.Constructor(fqName(field(c, "fqname", cAt), pointer(cAt, "fqname")));
            case "Tuple" -> new ValueExpr.Tuple(values(optionalField(c, "elements"), pointer(cAt, "elements")));
            case "List" -> new ValueExpr.ListOf(values(optionalField(c, "items"), pointer(cAt, "items")));
            case "Record" -> new ValueExpr.Record(fieldValues(optionalField(c, "fields"), pointer(cAt, "fields")));
            case "Variable" -> new ValueExpr.Variable(name(field(c, "name", cAt), pointer(cAt, "name")));
            case "Reference" -> new ValueExpr.Reference(fqName(field(c, "fqname", cAt), pointer(cAt, "fqname")));
            case "Field" -> new ValueExpr.Field(
                value(field(c, "value", cAt), pointer(cAt, "value")),
                name(field(c, "name", cAt), pointer(cAt, "name")));
            case "FieldFunction" -> new ValueExpr.FieldFunction(name(field(c, "name", cAt), pointer(cAt, "name")));
            case "Apply" -> new ValueExpr.Apply(
                value(field(c, "function", cAt), pointer(cAt, "function")),
                value(field(c, "argument", cAt), pointer(cAt, "argument")));
            case "Lambda" -> new ValueExpr.Lambda(
                pattern(field(c, "pattern", cAt), pointer(cAt, "pattern")),
                value(field(c, "body", cAt), pointer(cAt, "body")));
            case "LetDefinition" -> new ValueExpr.LetDefinition(
                name(field(c, "name", cAt), pointer(cAt, "name")),
                valueDefinition(field(c, "definition", cAt), pointer(cAt, "definition")),
                value(field(c, "body", cAt), pointer(cAt, "body")));
            case "LetRecursion" -> new ValueExpr.LetRecursion(
                bindings(field(c, "bindings", cAt), pointer(cAt, "bindings")),
                value(field(c, "body", cAt), pointer(cAt, "body")));
            case "Destructure" -> new ValueExpr.Destructure(
                pattern(field(c, "pattern", cAt), pointer(cAt, "pattern")),
                value(field(c, "value", cAt), pointer(cAt, "value")),
                value(field(c, "body", cAt), pointer(cAt, "body")));
            case "IfThenElse" -> new ValueExpr.IfThenElse(
                value(field(c, "condition", cAt), pointer(cAt, "condition")),
                value(field(c, "thenBranch", cAt), pointer(cAt, "thenBranch")),
                value(field(c, "elseBranch", cAt), pointer(cAt, "elseBranch")));
            case "PatternMatch" -> new ValueExpr.PatternMatch(
                value(field(c, "subject", cAt), pointer(cAt, "subject")),
                cases(field(c, "cases", cAt), pointer(cAt, "cases")));
            case "UpdateRecord" -> new ValueExpr.UpdateRecord(
                value(field(c, "record", cAt), pointer(cAt, "record")),
                fieldValues(optionalField(c, "updates"), pointer(cAt, "updates")));
            case "Unit" -> new ValueExpr.Unit();
            case "Hole" -> {
                JsonNode type = optionalField(c, "type") != null ? c.get("type") : optionalField(c, "tpe");
                yield new ValueExpr.Hole(
                    holeReason(field(c, "reason", cAt), pointer(cAt, "reason")),
                    type == null ? null : typeExpr(type, pointer(cAt, "type")));
            }
            default -> throw unknownTag(tagged, "value");
        };
    }

    private List<ValueExpr> values(JsonNode node, String at) {
        List<ValueExpr> values = new ArrayList<>();
        if (node == null) {
            return values;
        }
        requireArray(node, at);
        for (int i = 0; i < node.size(); i++) {
            values.add(value(node.get(i), pointer(at, i)));
        }
        return values;
    }

    private Map<Name, ValueExpr> fieldValues(JsonNode node, String at) {
        Map<Name, ValueExpr> fields = new LinkedHashMap<>();
        forEachEntry(node, at, (name, value, entryAt) -> fields.put(name, value(value, entryAt)));
        return fields;
    }

    private Map<Name, ValueDefinition> bindings(JsonNode node, String at) {
        requireArray(node, at);
        Map<Name, ValueDefinition> bindings = new LinkedHashMap<>();
        for (int i = 0; i < node.size(); i++) {
            String bindingAt = pointer(at, i);
            JsonNode binding = node.get(i);
            Name name = name(field(binding, "name", bindingAt), pointer(bindingAt, "name"));
            if (bindings.containsKey(name)) {
                throw new IrParseException(bindingAt, "duplicate binding '" + name + "'");
            }
            bindings.put(name, valueDefinition(field(binding, "definition", bindingAt), pointer(bindingAt, "definition")));
        }
        return bindings;
    }

    private List<ValueExpr.Case> cases(JsonNode node, String at) {
        requireArray(node, at);
        List<ValueExpr.Case> cases = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            String caseAt = pointer(at, i);
            JsonNode entry = node.get(i);
            cases.add(new ValueExpr.Case(
                pattern(field(entry, "pattern", caseAt), pointer(caseAt, "pattern")),
                value(field(entry, "body", caseAt), pointer(caseAt, "body"))));
        }
        return cases;
    }

    // ==================== Patterns and literals ====================

    Pattern pattern(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        checkAttributes(tagged, CosmeticLoss.VALUE_ATTRIBUTES);
        checkFields(tagged, PATTERN_FIELDS);
        JsonNode c = tagged.content();
        String cAt = tagged.at();
        return switch (tagged.tag()) {
            case "WildcardPattern" -> new Pattern.WildcardPattern();
            case "VariablePattern" -> new Pattern.VariablePattern(name(field(c, "name", cAt), pointer(cAt, "name")));
            case "AsPattern" -> Pattern.as(
                pattern(field(c, "pattern", cAt), pointer(cAt, "pattern")),
                name(field(c, "name", cAt), pointer(cAt, "name")));
            case "TuplePattern" -> new Pattern.TuplePattern(patterns(optionalField(c, "elements"), pointer(cAt, "elements")));
            case "ConstructorPattern" -> new Pattern.ConstructorPattern(
                fqName(field(c, "fqname", cAt), pointer(cAt, "fqname")),
                patterns(optionalField(c, "args"), pointer(cAt, "args")));
            case "EmptyListPattern" -> new Pattern.EmptyListPattern();
            case "HeadTailPattern" -> new Pattern.HeadTailPattern(
                pattern(field(c, "head", cAt), pointer(cAt, "head")),
                pattern(field(c, "tail", cAt), pointer(cAt, "tail")));
            case "LiteralPattern" -> new Pattern.LiteralPattern(literal(field(c, "literal", cAt), pointer(cAt, "literal")));
            case "UnitPattern" -> new Pattern.UnitPattern();
            default -> throw unknownTag(tagged, "pattern");
        };
    }

    private List<Pattern> patterns(JsonNode node, String at) {
        List<Pattern> patterns = new ArrayList<>();
        if (node == null) {
            return patterns;
        }
        requireArray(node, at);
        for (int i = 0; i < node.size(); i++) {
            patterns.add(pattern(node.get(i), pointer(at, i)));
        }
        return patterns;
    }

    Literal literal(JsonNode node, String at) {
        Tagged tagged = tagged(node, at);
        JsonNode value = field(tagged.content(), "value", tagged.at());
        String valueAt = pointer(tagged.at(), "value");
        return switch (tagged.tag()) {
            case "BoolLiteral" -> {
                if (!value.isBoolean()) {
                    throw new IrParseException(valueAt, "expected a boolean but found " + describe(value));
                }
                yield new Literal.BoolLiteral(value.asBoolean());
            }
            case "CharLiteral" -> new Literal.CharLiteral(text(value, valueAt));
            case "StringLiteral" -> new Literal.StringLiteral(text(value, valueAt));
            case "IntegerLiteral", "WholeNumberLiteral" -> {
                if (!value.isIntegralNumber() || !value.canConvertToLong()) {
                    throw new IrParseException(valueAt, "expected a whole number but found " + describe(value));
                }
                yield new Literal.WholeNumberLiteral(value.asLong());
            }
            case "FloatLiteral" -> {
                if (!value.isNumber()) {
                    throw new IrParseException(valueAt, "expected a number but found " + describe(value));
                }
                yield new Literal.FloatLiteral(value.asDouble());
            }
            case "DecimalLiteral" -> {
                try {
                    yield new Literal.DecimalLiteral(new BigDecimal(value.asText()));
                } catch (NumberFormatException e) {
                    throw new IrParseException(valueAt, "invalid decimal '" + value.asText() + "'", e);
                }
            }
            default -> throw unknownTag(tagged, "literal");
        };
    }
}
