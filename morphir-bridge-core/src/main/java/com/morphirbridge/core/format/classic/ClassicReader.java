package com.morphirbridge.core.format.classic;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.error.IrParseException;
import com.morphirbridge.core.format.CosmeticLoss;
import com.morphirbridge.core.format.JsonDocumentReader;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Constructor;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Documented;
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
import com.morphirbridge.core.naming.PackageAliases;
import com.morphirbridge.core.naming.Path;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one classic (V1, V2 or V3) document into the canonical model.
 *
 * <p>Reading is lenient about the differences between the classic versions (tag casing,
 * documentation wrappers, module entry shape); telling the versions apart is the job of the
 * parsers' detection clauses.
 */
final class ClassicReader extends JsonDocumentReader {

    Distribution readDistribution(JsonNode root) {
        String at = "/distribution";
        JsonNode distribution = requireArray(field(root, "distribution", ""), at);
        String tag = ClassicTags.normalize(text(element(distribution, 0, at), pointer(at, 0)));
        if (!tag.equals("Library")) {
            throw new IrParseException(pointer(at, 0), "unsupported distribution kind '" + tag + "'");
        }
        Path packageName = packagePath(element(distribution, 1, at), pointer(at, 1));

        Map<Path, PackageSpecification> dependencies = new LinkedHashMap<>();
        JsonNode deps = requireArray(element(distribution, 2, at), pointer(at, 2));
        for (int i = 0; i < deps.size(); i++) {
            String entryAt = pointer(pointer(at, 2), i);
            JsonNode entry = deps.get(i);
            dependencies.put(
                packagePath(element(entry, 0, entryAt), pointer(entryAt, 0)),
                packageSpecification(element(entry, 1, entryAt), pointer(entryAt, 1)));
        }

        String defAt = pointer(at, 3);
        JsonNode modulesNode = requireArray(field(element(distribution, 3, at), "modules", defAt), pointer(defAt, "modules"));
        Map<Path, AccessControlled<ModuleDefinition>> modules = new LinkedHashMap<>();
        for (int i = 0; i < modulesNode.size(); i++) {
            String entryAt = pointer(pointer(defAt, "modules"), i);
            JsonNode entry = modulesNode.get(i);
            JsonNode pathNode;
            JsonNode defNode;
            String defNodeAt;
            if (entry.isObject()) {
                pathNode = field(entry, "name", entryAt);
                defNode = field(entry, "def", entryAt);
                defNodeAt = pointer(entryAt, "def");
            } else {
                pathNode = element(entry, 0, entryAt);
                defNode = element(entry, 1, entryAt);
                defNodeAt = pointer(entryAt, 1);
            }
            Path modulePath = path(pathNode, entryAt);
            if (modules.containsKey(modulePath)) {
                throw new IrParseException(entryAt, "duplicate module '" + modulePath + "'");
            }
            modules.put(modulePath, accessControlled(defNode, defNodeAt, this::moduleDefinition));
        }
        return new Distribution(packageName, dependencies, modules);
    }

    // ==================== Names ====================

    Name name(JsonNode node, String at) {
        try {
            if (node != null && node.isTextual()) {
                return Name.fromString(node.asText());
            }
            requireArray(node, at);
            List<String> segments = new ArrayList<>();
            for (int i = 0; i < node.size(); i++) {
                segments.add(text(node.get(i), pointer(at, i)));
            }
            return Name.fromSegments(segments);
        } catch (IllegalArgumentException e) {
            throw invalid(at, e);
        }
    }

    Path path(JsonNode node, String at) {
        if (node != null && node.isTextual()) {
            try {
                return Path.parse(node.asText());
            } catch (IllegalArgumentException e) {
                throw invalid(at, e);
            }
        }
        requireArray(node, at);
        List<Name> names = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            names.add(name(node.get(i), pointer(at, i)));
        }
        return new Path(names);
    }

    Path packagePath(JsonNode node, String at) {
        return PackageAliases.toClassic(path(node, at));
    }

    FQName fqName(JsonNode node, String at) {
        return new FQName(
            packagePath(element(node, 0, at), pointer(at, 0)),
            path(element(node, 1, at), pointer(at, 1)),
            name(element(node, 2, at), pointer(at, 2)));
    }

    private List<Name> names(JsonNode node, String at) {
        requireArray(node, at);
        List<Name> names = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            names.add(name(node.get(i), pointer(at, i)));
        }
        return names;
    }

    // ==================== Wrappers ====================

    @FunctionalInterface
    interface NodeReader<T> {
        T read(JsonNode node, String at);
    }

    private <T> AccessControlled<T> accessControlled(JsonNode node, String at, NodeReader<T> reader) {
        return new AccessControlled<>(
            access(field(node, "access", at), pointer(at, "access")),
            reader.read(field(node, "value", at), pointer(at, "value")));
    }

    /**
     * V3 wraps definitions in {@code {"doc", "value"}}; V1 and V2 do not.
     */
    private <T> Documented<T> maybeDocumented(JsonNode node, String at, NodeReader<T> reader) {
        if (isDocumentedWrapper(node)) {
            return new Documented<>(optionalText(node, "doc"), reader.read(node.get("value"), pointer(at, "value")));
        }
        return Documented.undocumented(reader.read(node, at));
    }

    static boolean isDocumentedWrapper(JsonNode node) {
        return node != null && node.isObject() && node.has("value") && !node.has("inputs");
    }

    private <T> Map<Name, T> namedEntries(JsonNode node, String at, NodeReader<T> reader) {
        Map<Name, T> entries = new LinkedHashMap<>();
        if (node == null) {
            return entries;
        }
        requireArray(node, at);
        for (int i = 0; i < node.size(); i++) {
            String entryAt = pointer(at, i);
            JsonNode entry = node.get(i);
            Name name = name(element(entry, 0, entryAt), pointer(entryAt, 0));
            if (entries.containsKey(name)) {
                throw new IrParseException(entryAt, "duplicate name '" + name + "'");
            }
            entries.put(name, reader.read(element(entry, 1, entryAt), pointer(entryAt, 1)));
        }
        return entries;
    }

    // ==================== Modules and specifications ====================

    ModuleDefinition moduleDefinition(JsonNode node, String at) {
        requireObject(node, at);
        Map<Name, AccessControlled<Documented<TypeDefinition>>> types = namedEntries(
            optionalField(node, "types"), pointer(at, "types"),
            (entry, entryAt) -> accessControlled(entry, entryAt,
                (value, valueAt) -> maybeDocumented(value, valueAt, this::typeDefinition)));
        Map<Name, AccessControlled<Documented<ValueDefinition>>> values = namedEntries(
            optionalField(node, "values"), pointer(at, "values"),
            (entry, entryAt) -> accessControlled(entry, entryAt,
                (value, valueAt) -> maybeDocumented(value, valueAt, this::valueDefinition)));
        return new ModuleDefinition(types, values, optionalText(node, "doc"));
    }

    PackageSpecification packageSpecification(JsonNode node, String at) {
        JsonNode modulesNode = requireArray(field(node, "modules", at), pointer(at, "modules"));
        Map<Path, ModuleSpecification> modules = new LinkedHashMap<>();
        for (int i = 0; i < modulesNode.size(); i++) {
            String entryAt = pointer(pointer(at, "modules"), i);
            JsonNode entry = modulesNode.get(i);
            modules.put(path(element(entry, 0, entryAt), pointer(entryAt, 0)),
                moduleSpecification(element(entry, 1, entryAt), pointer(entryAt, 1)));
        }
        return new PackageSpecification(modules);
    }

    private ModuleSpecification moduleSpecification(JsonNode node, String at) {
        requireObject(node, at);
        Map<Name, Documented<TypeSpecification>> types = namedEntries(optionalField(node, "types"),
            pointer(at, "types"), (entry, entryAt) -> maybeDocumented(entry, entryAt, this::typeSpecification));
        Map<Name, Documented<ValueSpecification>> values = namedEntries(optionalField(node, "values"),
            pointer(at, "values"), (entry, entryAt) -> maybeDocumented(entry, entryAt, this::valueSpecification));
        return new ModuleSpecification(types, values, optionalText(node, "doc"));
    }

    private TypeSpecification typeSpecification(JsonNode node, String at) {
        String tag = tag(node, at);
        List<Name> params = names(element(node, 1, at), pointer(at, 1));
        return switch (tag) {
            case "TypeAliasSpecification" ->
                new TypeSpecification.TypeAliasSpecification(params, typeExpr(element(node, 2, at), pointer(at, 2)));
            case "OpaqueTypeSpecification" -> new TypeSpecification.OpaqueTypeSpecification(params);
            case "CustomTypeSpecification" ->
                new TypeSpecification.CustomTypeSpecification(params, constructors(element(node, 2, at), pointer(at, 2)));
            default -> throw unknownTag(at, "type specification", tag);
        };
    }

    private ValueSpecification valueSpecification(JsonNode node, String at) {
        requireObject(node, at);
        return new ValueSpecification(
            parameters(field(node, "inputs", at), pointer(at, "inputs"), false),
            typeExpr(field(node, "output", at), pointer(at, "output")));
    }

    // ==================== Types ====================

    TypeDefinition typeDefinition(JsonNode node, String at) {
        String tag = tag(node, at);
        List<Name> params = names(element(node, 1, at), pointer(at, 1));
        return switch (tag) {
            case "TypeAliasDefinition" ->
                new TypeDefinition.TypeAlias(params, typeExpr(element(node, 2, at), pointer(at, 2)));
            case "CustomTypeDefinition" ->
                new TypeDefinition.CustomType(params, accessControlled(element(node, 2, at), pointer(at, 2), this::constructors));
            default -> throw unknownTag(at, "type definition", tag);
        };
    }

    private List<Constructor> constructors(JsonNode node, String at) {
        requireArray(node, at);
        List<Constructor> constructors = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            String entryAt = pointer(at, i);
            JsonNode entry = node.get(i);
            constructors.add(new Constructor(
                name(element(entry, 0, entryAt), pointer(entryAt, 0)),
                parameters(element(entry, 1, entryAt), pointer(entryAt, 1), false)));
        }
        return constructors;
    }

    /**
     * Reads {@code [[name, type]...]}, {@code [[name, attrs, type]...]} when {@code withAttributes},
     * or {@code [{"name", "tpe"|"type"}...]}.
     */
    private List<Parameter> parameters(JsonNode node, String at, boolean withAttributes) {
        requireArray(node, at);
        List<Parameter> parameters = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            String entryAt = pointer(at, i);
            JsonNode entry = node.get(i);
            if (entry.isObject()) {
                JsonNode type = optionalField(entry, "tpe") != null ? entry.get("tpe") : optionalField(entry, "type");
                parameters.add(new Parameter(name(field(entry, "name", entryAt), pointer(entryAt, "name")),
                    type == null ? null : typeExpr(type, pointer(entryAt, "type"))));
                continue;
            }
            Name name = name(element(entry, 0, entryAt), pointer(entryAt, 0));
            int typeIndex = withAttributes ? 2 : 1;
            if (withAttributes && hasContent(element(entry, 1, entryAt))) {
                recordLoss(CosmeticLoss.VALUE_ATTRIBUTES);
            }
            JsonNode type = entry.size() > typeIndex ? entry.get(typeIndex) : null;
            parameters.add(new Parameter(name,
                type == null || type.isNull() ? null : typeExpr(type, pointer(entryAt, typeIndex))));
        }
        return parameters;
    }

    TypeExpr typeExpr(JsonNode node, String at) {
        String tag = tag(node, at);
        if (hasContent(element(node, 1, at))) {
            recordLoss(CosmeticLoss.TYPE_ATTRIBUTES);
        }
        return switch (tag) {
            case "Variable" -> new TypeExpr.Variable(name(element(node, 2, at), pointer(at, 2)));
            case "Reference" -> new TypeExpr.Reference(
                fqName(element(node, 2, at), pointer(at, 2)),
                typeExprs(node.size() > 3 ? node.get(3) : null, pointer(at, 3)));
            case "Tuple" -> new TypeExpr.Tuple(typeExprs(element(node, 2, at), pointer(at, 2)));
            case "Record" -> new TypeExpr.Record(fieldTypes(element(node, 2, at), pointer(at, 2)));
            case "ExtensibleRecord" -> new TypeExpr.ExtensibleRecord(
                name(element(node, 2, at), pointer(at, 2)),
                fieldTypes(element(node, 3, at), pointer(at, 3)));
            case "Function" -> new TypeExpr.Function(
                typeExpr(element(node, 2, at), pointer(at, 2)),
                typeExpr(element(node, 3, at), pointer(at, 3)));
            case "Unit" -> new TypeExpr.Unit();
            default -> throw unknownTag(at, "type", tag);
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
        for (Parameter parameter : parameters(node, at, false)) {
            if (parameter.type() == null) {
                throw new IrParseException(at, "record field '" + parameter.name() + "' has no type");
            }
            fields.put(parameter.name(), parameter.type());
        }
        return fields;
    }

    // ==================== Values ====================

    ValueDefinition valueDefinition(JsonNode node, String at) {
        requireObject(node, at);
        JsonNode inputs = optionalField(node, "inputTypes");
        JsonNode output = optionalField(node, "outputType");
        JsonNode body = optionalField(node, "body");
        return new ValueDefinition(
            inputs == null ? List.of() : parameters(inputs, pointer(at, "inputTypes"), true),
            output == null ? null : typeExpr(output, pointer(at, "outputType")),
            body == null ? null : new ValueBody.Expression(value(body, pointer(at, "body"))));
    }

    ValueExpr value(JsonNode node, String at) {
        String tag = tag(node, at);
        if (hasContent(element(node, 1, at))) {
            recordLoss(CosmeticLoss.VALUE_ATTRIBUTES);
        }
        return switch (tag) {
            case "Literal" -> new ValueExpr.LiteralValue(literal(element(node, 2, at), pointer(at, 2)));
            case "Constructor" -> new ValueExpr.Constructor(fqName(element(node, 2, at), pointer(at, 2)));
            case "Tuple" -> new ValueExpr.Tuple(values(element(node, 2, at), pointer(at, 2)));
            case "List" -> new ValueExpr.ListOf(values(element(node, 2, at), pointer(at, 2)));
            case "Record" -> new ValueExpr.Record(fieldValues(element(node, 2, at), pointer(at, 2)));
            case "Variable" -> new ValueExpr.Variable(name(element(node, 2, at), pointer(at, 2)));
            case "Reference" -> new ValueExpr.Reference(fqName(element(node, 2, at), pointer(at, 2)));
            case "Field" -> new ValueExpr.Field(
                value(element(node, 2, at), pointer(at, 2)),
                name(element(node, 3, at), pointer(at, 3)));
            case "FieldFunction" -> new ValueExpr.FieldFunction(name(element(node, 2, at), pointer(at, 2)));
            case "Apply" -> new ValueExpr.Apply(
                value(element(node, 2, at), pointer(at, 2)),
                value(element(node, 3, at), pointer(at, 3)));
            case "Lambda" -> new ValueExpr.Lambda(
                pattern(element(node, 2, at), pointer(at, 2)),
                value(element(node, 3, at), pointer(at, 3)));
            case "LetDefinition" -> new ValueExpr.LetDefinition(
                name(element(node, 2, at), pointer(at, 2)),
                valueDefinition(element(node, 3, at), pointer(at, 3)),
                value(element(node, 4, at), pointer(at, 4)));
            case "LetRecursion" -> new ValueExpr.LetRecursion(
                namedEntries(element(node, 2, at), pointer(at, 2), this::valueDefinition),
                value(element(node, 3, at), pointer(at, 3)));
            case "Destructure" -> new ValueExpr.Destructure(
                pattern(element(node, 2, at), pointer(at, 2)),
                value(element(node, 3, at), pointer(at, 3)),
                value(element(node, 4, at), pointer(at, 4)));
            case "IfThenElse" -> new ValueExpr.IfThenElse(
                value(element(node, 2, at), pointer(at, 2)),
                value(element(node, 3, at), pointer(at, 3)),
                value(element(node, 4, at), pointer(at, 4)));
            case "PatternMatch" -> new ValueExpr.PatternMatch(
                value(element(node, 2, at), pointer(at, 2)),
                cases(element(node, 3, at), pointer(at, 3)));
            case "UpdateRecord" -> new ValueExpr.UpdateRecord(
                value(element(node, 2, at), pointer(at, 2)),
                fieldValues(element(node, 3, at), pointer(at, 3)));
            case "Unit" -> new ValueExpr.Unit();
            default -> throw unknownTag(at, "value", tag);
        };
    }

    private List<ValueExpr> values(JsonNode node, String at) {
        requireArray(node, at);
        List<ValueExpr> values = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            values.add(value(node.get(i), pointer(at, i)));
        }
        return values;
    }

    private Map<Name, ValueExpr> fieldValues(JsonNode node, String at) {
        return namedEntries(node, at, this::value);
    }

    private List<ValueExpr.Case> cases(JsonNode node, String at) {
        requireArray(node, at);
        List<ValueExpr.Case> cases = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            String caseAt = pointer(at, i);
            JsonNode entry = node.get(i);
            cases.add(new ValueExpr.Case(
                pattern(element(entry, 0, caseAt), pointer(caseAt, 0)),
                value(element(entry, 1, caseAt), pointer(caseAt, 1))));
        }
        return cases;
    }

    // ==================== Patterns and literals ====================

    Pattern pattern(JsonNode node, String at) {
        String tag = tag(node, at);
        if (hasContent(element(node, 1, at))) {
            recordLoss(CosmeticLoss.VALUE_ATTRIBUTES);
        }
        return switch (tag) {
            case "WildcardPattern" -> new Pattern.WildcardPattern();
            case "VariablePattern" -> new Pattern.VariablePattern(name(element(node, 2, at), pointer(at, 2)));
            case "AsPattern" -> Pattern.as(
                pattern(element(node, 2, at), pointer(at, 2)),
                name(element(node, 3, at), pointer(at, 3)));
            case "TuplePattern" -> new Pattern.TuplePattern(patterns(element(node, 2, at), pointer(at, 2)));
            case "ConstructorPattern" -> new Pattern.ConstructorPattern(
                fqName(element(node, 2, at), pointer(at, 2)),
                patterns(element(node, 3, at), pointer(at, 3)));
            case "EmptyListPattern" -> new Pattern.EmptyListPattern();
            case "HeadTailPattern" -> new Pattern.HeadTailPattern(
                pattern(element(node, 2, at), pointer(at, 2)),
                pattern(element(node, 3, at), pointer(at, 3)));
            case "LiteralPattern" -> new Pattern.LiteralPattern(literal(element(node, 2, at), pointer(at, 2)));
            case "UnitPattern" -> new Pattern.UnitPattern();
            default -> throw unknownTag(at, "pattern", tag);
        };
    }

    private List<Pattern> patterns(JsonNode node, String at) {
        requireArray(node, at);
        List<Pattern> patterns = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            patterns.add(pattern(node.get(i), pointer(at, i)));
        }
        return patterns;
    }

    Literal literal(JsonNode node, String at) {
        String tag = tag(node, at);
        JsonNode value = element(node, 1, at);
        String valueAt = pointer(at, 1);
        return switch (tag) {
            case "BoolLiteral" -> {
                if (!value.isBoolean()) {
                    throw new IrParseException(valueAt, "expected a boolean but found " + describe(value));
                }
                yield new Literal.BoolLiteral(value.asBoolean());
            }
            case "CharLiteral" -> new Literal.CharLiteral(text(value, valueAt));
            case "StringLiteral" -> new Literal.StringLiteral(text(value, valueAt));
            case "WholeNumberLiteral" -> {
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
            default -> throw unknownTag(at, "literal", tag);
        };
    }

    // ==================== Tags ====================

    private static String tag(JsonNode node, String at) {
        return ClassicTags.normalize(text(element(node, 0, at), pointer(at, 0)));
    }

    private static IrParseException unknownTag(String at, String what, String tag) {
        return new IrParseException(at, "unknown " + what + " tag '" + tag + "'");
    }
}
