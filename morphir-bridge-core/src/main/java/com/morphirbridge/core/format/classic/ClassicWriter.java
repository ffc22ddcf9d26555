package com.morphirbridge.core.format.classic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morphirbridge.core.error.MigrationUnsupportedException;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.IrWriter;
import com.morphirbridge.core.model.Access;
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
import com.morphirbridge.core.naming.Path;

import java.util.List;
import java.util.Map;

/**
 * Writes a distribution in the classic V3 shape, the only classic shape this library emits.
 *
 * <p>Attribute slots are written as empty objects. V4-only constructs (holes, native, external
 * and incomplete bodies, incomplete type definitions) have no classic encoding and fail with
 * {@link MigrationUnsupportedException} naming the definition that holds them.
 */
public class ClassicWriter implements IrWriter {

    @Override
    public IrVersion version() {
        return IrVersion.CLASSIC_V3;
    }

    @Override
    public JsonNode write(Distribution distribution) {
        return new Emitter(distribution.packageName()).distribution(distribution);
    }

    /**
     * Per-call state: the definition being written, for error messages.
     */
    private static final class Emitter {

        private final Path packageName;
        private FQName current;

        Emitter(Path packageName) {
            this.packageName = packageName;
        }

        JsonNode distribution(Distribution distribution) {
            ArrayNode dependencies = IrJson.array();
            distribution.dependencies().forEach((path, spec) ->
                dependencies.add(IrJson.array().add(path(path)).add(packageSpecification(spec))));

            ArrayNode modules = IrJson.array();
            distribution.modules().forEach((path, module) -> modules.add(IrJson.array()
                .add(path(path))
                .add(accessControlled(module.access(), moduleDefinition(path, module.value())))));

            ObjectNode packageDef = IrJson.object();
            packageDef.set("modules", modules);

            ObjectNode root = IrJson.object();
            root.put("formatVersion", IrVersion.CLASSIC_V3.formatVersion());
            root.set("distribution", IrJson.array()
                .add("Library")
                .add(path(distribution.packageName()))
                .add(dependencies)
                .add(packageDef));
            return root;
        }

        // ==================== Names ====================

        private static ArrayNode name(Name name) {
            ArrayNode words = IrJson.array();
            name.words().forEach(words::add);
            return words;
        }

        private static ArrayNode path(Path path) {
            ArrayNode names = IrJson.array();
            path.names().forEach(n -> names.add(name(n)));
            return names;
        }

        private static ArrayNode fqName(FQName fqName) {
            return IrJson.array()
                .add(path(fqName.packagePath()))
                .add(path(fqName.modulePath()))
                .add(name(fqName.localName()));
        }

        private static ArrayNode names(List<Name> names) {
            ArrayNode array = IrJson.array();
            names.forEach(n -> array.add(name(n)));
            return array;
        }

        private static ObjectNode accessControlled(Access access, JsonNode value) {
            ObjectNode node = IrJson.object();
            node.put("access", access == Access.PUBLIC ? "Public" : "Private");
            node.set("value", value);
            return node;
        }

        private static ObjectNode documented(String doc, JsonNode value) {
            ObjectNode node = IrJson.object();
            node.put("doc", doc);
            node.set("value", value);
            return node;
        }

        private static ArrayNode tagged(String tag) {
            return IrJson.array().add(tag).add(IrJson.object());
        }

        private static void putDoc(ObjectNode node, String doc) {
            if (doc == null) {
                node.putNull("doc");
            } else {
                node.put("doc", doc);
            }
        }

        // ==================== Modules ====================

        private JsonNode moduleDefinition(Path modulePath, ModuleDefinition module) {
            ArrayNode types = IrJson.array();
            for (Map.Entry<Name, AccessControlled<Documented<TypeDefinition>>> entry : module.types().entrySet()) {
                current = new FQName(packageName, modulePath, entry.getKey());
                Documented<TypeDefinition> documented = entry.getValue().value();
                types.add(IrJson.array().add(name(entry.getKey())).add(accessControlled(entry.getValue().access(),
                    documented(documented.doc(), typeDefinition(documented.value())))));
            }
            ArrayNode values = IrJson.array();
            for (Map.Entry<Name, AccessControlled<Documented<ValueDefinition>>> entry : module.values().entrySet()) {
                current = new FQName(packageName, modulePath, entry.getKey());
                Documented<ValueDefinition> documented = entry.getValue().value();
                values.add(IrJson.array().add(name(entry.getKey())).add(accessControlled(entry.getValue().access(),
                    documented(documented.doc(), valueDefinition(documented.value())))));
            }
            ObjectNode node = IrJson.object();
            node.set("types", types);
            node.set("values", values);
            putDoc(node, module.doc());
            return node;
        }

        private JsonNode packageSpecification(PackageSpecification spec) {
            ArrayNode modules = IrJson.array();
            spec.modules().forEach((path, module) -> modules.add(IrJson.array().add(path(path)).add(moduleSpecification(module))));
            ObjectNode node = IrJson.object();
            node.set("modules", modules);
            return node;
        }

        private JsonNode moduleSpecification(ModuleSpecification module) {
            ArrayNode types = IrJson.array();
            module.types().forEach((name, documented) -> types.add(IrJson.array().add(name(name))
                .add(documented(documented.doc(), typeSpecification(documented.value())))));
            ArrayNode values = IrJson.array();
            module.values().forEach((name, documented) -> values.add(IrJson.array().add(name(name))
                .add(documented(documented.doc(), valueSpecification(documented.value())))));
            ObjectNode node = IrJson.object();
            node.set("types", types);
            node.set("values", values);
            putDoc(node, module.doc());
            return node;
        }

        private JsonNode typeSpecification(TypeSpecification spec) {
            if (spec instanceof TypeSpecification.TypeAliasSpecification alias) {
                return IrJson.array().add("TypeAliasSpecification").add(names(alias.typeParams())).add(type(alias.body()));
            } else if (spec instanceof TypeSpecification.OpaqueTypeSpecification opaque) {
                return IrJson.array().add("OpaqueTypeSpecification").add(names(opaque.typeParams()));
            } else if (spec instanceof TypeSpecification.CustomTypeSpecification custom) {
                return IrJson.array().add("CustomTypeSpecification").add(names(custom.typeParams()))
                    .add(constructors(custom.constructors()));
            }
            throw new IllegalStateException("unhandled type specification " + spec);
        }

        private JsonNode valueSpecification(ValueSpecification spec) {
            ObjectNode node = IrJson.object();
            node.set("inputs", fields(spec.inputs()));
            node.set("output", type(spec.output()));
            return node;
        }

        // ==================== Types ====================

        private JsonNode typeDefinition(TypeDefinition definition) {
            if (definition instanceof TypeDefinition.TypeAlias alias) {
                return IrJson.array().add("TypeAliasDefinition").add(names(alias.typeParams())).add(type(alias.body()));
            } else if (definition instanceof TypeDefinition.CustomType custom) {
                return IrJson.array().add("CustomTypeDefinition").add(names(custom.typeParams()))
                    .add(accessControlled(custom.constructors().access(), constructors(custom.constructors().value())));
            }
            throw unsupported("incomplete type definition");
        }

        private ArrayNode constructors(List<Constructor> constructors) {
            ArrayNode array = IrJson.array();
            for (Constructor constructor : constructors) {
                array.add(IrJson.array().add(name(constructor.name())).add(fields(constructor.args())));
            }
            return array;
        }

        private ArrayNode fields(List<Parameter> parameters) {
            ArrayNode array = IrJson.array();
            for (Parameter parameter : parameters) {
                array.add(IrJson.array().add(name(parameter.name())).add(type(parameter.type())));
            }
            return array;
        }

        private ArrayNode fieldTypes(Map<Name, TypeExpr> fields) {
            ArrayNode array = IrJson.array();
            fields.forEach((name, type) -> array.add(IrJson.array().add(name(name)).add(type(type))));
            return array;
        }

        private JsonNode type(TypeExpr type) {
            if (type == null) {
                throw unsupported("missing type annotation");
            }
            if (type instanceof TypeExpr.Variable variable) {
                return tagged("Variable").add(name(variable.name()));
            } else if (type instanceof TypeExpr.Reference reference) {
                ArrayNode args = IrJson.array();
                reference.args().forEach(arg -> args.add(type(arg)));
                return tagged("Reference").add(fqName(reference.fqName())).add(args);
            } else if (type instanceof TypeExpr.Tuple tuple) {
                ArrayNode elements = IrJson.array();
                tuple.elements().forEach(element -> elements.add(type(element)));
                return tagged("Tuple").add(elements);
            } else if (type instanceof TypeExpr.Record record) {
                return tagged("Record").add(fieldTypes(record.fields()));
            } else if (type instanceof TypeExpr.ExtensibleRecord record) {
                return tagged("ExtensibleRecord").add(name(record.variable())).add(fieldTypes(record.fields()));
            } else if (type instanceof TypeExpr.Function function) {
                return tagged("Function").add(type(function.argument())).add(type(function.result()));
            } else if (type instanceof TypeExpr.Unit) {
                return tagged("Unit");
            }
            throw new IllegalStateException("unhandled type " + type);
        }

        // ==================== Values ====================

        private JsonNode valueDefinition(ValueDefinition definition) {
            ArrayNode inputs = IrJson.array();
            for (Parameter input : definition.inputs()) {
                inputs.add(IrJson.array().add(name(input.name())).add(IrJson.object()).add(type(input.type())));
            }
            ObjectNode node = IrJson.object();
            node.set("inputTypes", inputs);
            node.set("outputType", type(definition.outputType()));
            node.set("body", body(definition.body()));
            return node;
        }

        private JsonNode body(ValueBody body) {
            if (body instanceof ValueBody.Expression expression) {
                return value(expression.body());
            } else if (body == null) {
                throw unsupported("missing body");
            } else if (body instanceof ValueBody.Native) {
                throw unsupported("native body");
            } else if (body instanceof ValueBody.External) {
                throw unsupported("external body");
            }
            throw unsupported("incomplete body");
        }

        private ArrayNode valueFields(Map<Name, ValueExpr> fields) {
            ArrayNode array = IrJson.array();
            fields.forEach((name, value) -> array.add(IrJson.array().add(name(name)).add(value(value))));
            return array;
        }

        private ArrayNode values(List<ValueExpr> values) {
            ArrayNode array = IrJson.array();
            values.forEach(value -> array.add(value(value)));
            return array;
        }

        private JsonNode value(ValueExpr value) {
            if (value instanceof ValueExpr.LiteralValue literal) {
                return tagged("Literal").add(literal(literal.literal()));
            } else if (value instanceof ValueExpr.Constructor constructor) {
                return tagged("Constructor").add(fqName(constructor.fqName()));
            } else if (value instanceof ValueExpr.Tuple tuple) {
                return tagged("Tuple").add(values(tuple.elements()));
            } else if (value instanceof ValueExpr.ListOf list) {
                return tagged("List").add(values(list.items()));
            } else if (value instanceof ValueExpr.Record record) {
                return tagged("Record").add(valueFields(record.fields()));
            } else if (value instanceof ValueExpr.Variable variable) {
                return tagged("Variable").add(name(variable.name()));
            } else if (value instanceof ValueExpr.Reference reference) {
                return tagged("Reference").add(fqName(reference.fqName()));
            } else if (value instanceof ValueExpr.Field field) {
                return tagged("Field").add(value(field.subject())).add(name(field.name()));
            } else if (value instanceof ValueExpr.FieldFunction field) {
                return tagged("FieldFunction").add(name(field.name()));
            } else if (value instanceof ValueExpr.Apply apply) {
                return tagged("Apply").add(value(apply.function())).add(value(apply.argument()));
            } else if (value instanceof ValueExpr.Lambda lambda) {
                return tagged("Lambda").add(pattern(lambda.pattern())).add(value(lambda.body()));
            } else if (value instanceof ValueExpr.LetDefinition let) {
                return tagged("LetDefinition").add(name(let.name())).add(valueDefinition(let.definition())).add(value(let.in()));
            } else if (value instanceof ValueExpr.LetRecursion let) {
                ArrayNode bindings = IrJson.array();
                let.bindings().forEach((name, definition) ->
                    bindings.add(IrJson.array().add(name(name)).add(valueDefinition(definition))));
                return tagged("LetRecursion").add(bindings).add(value(let.in()));
            } else if (value instanceof ValueExpr.Destructure destructure) {
                return tagged("Destructure").add(pattern(destructure.pattern()))
                    .add(value(destructure.value())).add(value(destructure.in()));
            } else if (value instanceof ValueExpr.IfThenElse ifThenElse) {
                return tagged("IfThenElse").add(value(ifThenElse.condition()))
                    .add(value(ifThenElse.thenBranch())).add(value(ifThenElse.elseBranch()));
            } else if (value instanceof ValueExpr.PatternMatch match) {
                ArrayNode cases = IrJson.array();
                match.cases().forEach(c -> cases.add(IrJson.array().add(pattern(c.pattern())).add(value(c.body()))));
                return tagged("PatternMatch").add(value(match.subject())).add(cases);
            } else if (value instanceof ValueExpr.UpdateRecord update) {
                return tagged("UpdateRecord").add(value(update.target())).add(valueFields(update.updates()));
            } else if (value instanceof ValueExpr.Unit) {
                return tagged("Unit");
            }
            throw unsupported("hole");
        }

        private JsonNode pattern(Pattern pattern) {
            if (pattern instanceof Pattern.WildcardPattern) {
                return tagged("WildcardPattern");
            } else if (pattern instanceof Pattern.VariablePattern variable) {
                return tagged("AsPattern").add(tagged("WildcardPattern")).add(name(variable.name()));
            } else if (pattern instanceof Pattern.AsPattern as) {
                return tagged("AsPattern").add(pattern(as.pattern())).add(name(as.name()));
            } else if (pattern instanceof Pattern.TuplePattern tuple) {
                ArrayNode elements = IrJson.array();
                tuple.elements().forEach(p -> elements.add(pattern(p)));
                return tagged("TuplePattern").add(elements);
            } else if (pattern instanceof Pattern.ConstructorPattern constructor) {
                ArrayNode args = IrJson.array();
                constructor.args().forEach(p -> args.add(pattern(p)));
                return tagged("ConstructorPattern").add(fqName(constructor.constructor())).add(args);
            } else if (pattern instanceof Pattern.EmptyListPattern) {
                return tagged("EmptyListPattern");
            } else if (pattern instanceof Pattern.HeadTailPattern headTail) {
                return tagged("HeadTailPattern").add(pattern(headTail.head())).add(pattern(headTail.tail()));
            } else if (pattern instanceof Pattern.LiteralPattern literal) {
                return tagged("LiteralPattern").add(literal(literal.literal()));
            }
            return tagged("UnitPattern");
        }

        private static JsonNode literal(Literal literal) {
            if (literal instanceof Literal.BoolLiteral bool) {
                return IrJson.array().add("BoolLiteral").add(bool.value());
            } else if (literal instanceof Literal.CharLiteral character) {
                return IrJson.array().add("CharLiteral").add(character.value());
            } else if (literal instanceof Literal.StringLiteral string) {
                return IrJson.array().add("StringLiteral").add(string.value());
            } else if (literal instanceof Literal.WholeNumberLiteral number) {
                return IrJson.array().add("WholeNumberLiteral").add(number.value());
            } else if (literal instanceof Literal.FloatLiteral number) {
                return IrJson.array().add("FloatLiteral").add(number.value());
            }
            return IrJson.array().add("DecimalLiteral").add(((Literal.DecimalLiteral) literal).value().toString());
        }

        private MigrationUnsupportedException unsupported(String construct) {
            String where = current == null ? "" : " in '" + current.toCanonicalString() + "'";
            return new MigrationUnsupportedException(construct + " has no classic encoding" + where);
        }
    }
}
