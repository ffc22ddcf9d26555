package com.morphirbridge.core.format.classic;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.error.IrParseException;
import com.morphirbridge.core.format.CosmeticLoss;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.model.Access;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Documented;
import com.morphirbridge.core.model.Literal;
import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.model.Pattern;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.model.ValueBody;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.model.ValueExpr;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.naming.PackageAliases;
import com.morphirbridge.core.naming.Path;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the classic parsers and {@link ClassicReader}.
 */
class ClassicParserTest {

    private static final Path BUSINESS_TERMS = Path.parse("business-terms");
    private static final Path LEDGER = Path.parse("ledger");

    @Test
    void parse_v3_readsPackageAndModules() {
        Distribution distribution = new ClassicV3Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V3)).distribution();

        assertThat(distribution.packageName()).isEqualTo(Path.parse("acme/finance"));
        assertThat(distribution.dependencies()).isEmpty();
        assertThat(distribution.modules().keySet()).containsExactly(BUSINESS_TERMS, LEDGER);
        assertThat(distribution.typeCount()).isEqualTo(3);
        assertThat(distribution.valueCount()).isEqualTo(10);
        assertThat(module(distribution, BUSINESS_TERMS).doc()).isEqualTo("Business vocabulary");
        assertThat(module(distribution, LEDGER).doc()).isNull();
    }

    @Test
    void parse_v3_keepsDocumentation() {
        Distribution distribution = new ClassicV3Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V3)).distribution();

        assertThat(module(distribution, BUSINESS_TERMS).types().get(Name.of("account", "id")).value().doc())
            .isEqualTo("Identifies an account");
        assertThat(module(distribution, BUSINESS_TERMS).values().get(Name.of("is", "credit")).value().doc())
            .isEqualTo("True for credits");
    }

    @Test
    void parse_v1AndV2_readSameDistribution() {
        ParsedDistribution v1 = new ClassicV1Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V1));
        ParsedDistribution v2 = new ClassicV2Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V2));

        assertThat(v1.distribution()).isEqualTo(v2.distribution());
        assertThat(v1.cosmeticLosses()).isEmpty();
        assertThat(v2.cosmeticLosses()).isEmpty();
    }

    @Test
    void parse_v2_hasNoDocumentation() {
        Distribution distribution = new ClassicV2Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V2)).distribution();

        assertThat(module(distribution, BUSINESS_TERMS).values().values())
            .extracting(entry -> entry.value().doc())
            .containsOnly("");
    }

    @Test
    void parse_sdkPackage_keepsClassicSpelling() {
        Distribution distribution = new ClassicV3Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V3)).distribution();

        TypeDefinition accountId = module(distribution, BUSINESS_TERMS).types().get(Name.of("account", "id")).value().value();

        assertThat(accountId).isInstanceOf(TypeDefinition.TypeAlias.class);
        TypeExpr.Reference string = (TypeExpr.Reference) ((TypeDefinition.TypeAlias) accountId).body();
        assertThat(string.fqName().packagePath()).isEqualTo(PackageAliases.CLASSIC_SDK);
        assertThat(string.fqName().localName()).isEqualTo(Name.of("string"));
    }

    @Test
    void parse_customType_readsConstructorsInOrder() {
        Distribution distribution = new ClassicV3Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V3)).distribution();

        TypeDefinition balance = module(distribution, BUSINESS_TERMS).types().get(Name.of("balance")).value().value();

        assertThat(balance).isInstanceOf(TypeDefinition.CustomType.class);
        TypeDefinition.CustomType custom = (TypeDefinition.CustomType) balance;
        assertThat(custom.typeParams()).containsExactly(Name.of("a"));
        assertThat(custom.constructors().access()).isEqualTo(Access.PUBLIC);
        assertThat(custom.constructors().value())
            .extracting(c -> c.name().toKebabCase())
            .containsExactly("credit", "debit", "empty");
        assertThat(custom.constructors().value().get(0).args().get(0).type()).isEqualTo(new TypeExpr.Variable(Name.of("a")));
    }

    @Test
    void parse_wildcardAsPattern_becomesVariablePattern() {
        Distribution distribution = new ClassicV3Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V3)).distribution();

        ValueDefinition total = value(distribution, BUSINESS_TERMS, "total");
        ValueExpr body = ((ValueBody.Expression) total.body()).body();
        ValueExpr.Apply outer = (ValueExpr.Apply) body;
        ValueExpr.Apply middle = (ValueExpr.Apply) outer.function();
        ValueExpr.Apply inner = (ValueExpr.Apply) middle.function();
        ValueExpr.Lambda lambda = (ValueExpr.Lambda) inner.argument();

        assertThat(lambda.pattern()).isEqualTo(new Pattern.VariablePattern(Name.of("x")));
        assertThat(((ValueExpr.Reference) inner.function()).fqName())
            .isEqualTo(new FQName(PackageAliases.CLASSIC_SDK, Path.parse("list"), Name.of("foldl")));
    }

    @Test
    void parse_decimalLiteral_keepsScale() {
        Distribution distribution = new ClassicV3Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V3)).distribution();

        ValueExpr rate = ((ValueBody.Expression) value(distribution, LEDGER, "rate").body()).body();

        assertThat(rate).isEqualTo(new ValueExpr.LiteralValue(new Literal.DecimalLiteral(new BigDecimal("0.0350"))));
    }

    @Test
    void parse_letRecursion_readsBindings() {
        Distribution distribution = new ClassicV3Parser().parse(IrFixtures.json(IrFixtures.CLASSIC_V3)).distribution();

        ValueExpr countdown = ((ValueBody.Expression) value(distribution, LEDGER, "countdown").body()).body();

        assertThat(countdown).isInstanceOf(ValueExpr.LetRecursion.class);
        assertThat(((ValueExpr.LetRecursion) countdown).bindings()).containsOnlyKeys(Name.of("go"));
    }

    @Test
    void parse_typeAttributes_recordsLoss() {
        JsonNode root = IrJson.read("""
            {"formatVersion": 3, "distribution": ["Library", [["acme"]], [], {"modules": [
              [[["m"]], {"access": "Public", "value": {"types": [
                [["t"], {"access": "Public", "value": {"doc": "", "value":
                  ["TypeAliasDefinition", [], ["Unit", {"source": "x"}]]}}]
              ], "values": [], "doc": null}}]
            ]}]}
            """, "attrs.json");

        ParsedDistribution parsed = new ClassicV3Parser().parse(root);

        assertThat(parsed.cosmeticLosses()).containsExactly(CosmeticLoss.TYPE_ATTRIBUTES);
    }

    @Test
    void parse_inputAttributes_recordsValueAttributeLoss() {
        JsonNode root = IrJson.read("""
            {"formatVersion": 3, "distribution": ["Library", [["acme"]], [], {"modules": [
              [[["m"]], {"access": "Public", "value": {"types": [], "values": [
                [["f"], {"access": "Public", "value": {"doc": "", "value": {
                  "inputTypes": [[["x"], {"source": "x"}, ["Unit", {}]]],
                  "outputType": ["Unit", {}],
                  "body": ["Variable", {}, ["x"]]}}}]
              ], "doc": null}}]
            ]}]}
            """, "input-attrs.json");

        ParsedDistribution parsed = new ClassicV3Parser().parse(root);

        assertThat(parsed.cosmeticLosses()).containsExactly(CosmeticLoss.VALUE_ATTRIBUTES);
    }

    @Test
    void parse_unknownTag_throwsWithPointer() {
        JsonNode root = IrJson.read("""
            {"formatVersion": 3, "distribution": ["Library", [["acme"]], [], {"modules": [
              [[["m"]], {"access": "Public", "value": {"types": [
                [["t"], {"access": "Public", "value": {"doc": "", "value":
                  ["TypeAliasDefinition", [], ["Mystery", {}]]}}]
              ], "values": [], "doc": null}}]
            ]}]}
            """, "bad.json");

        assertThatThrownBy(() -> new ClassicV3Parser().parse(root))
            .isInstanceOf(IrParseException.class)
            .hasMessageContaining("Mystery")
            .satisfies(e -> assertThat(((IrParseException) e).pointer()).startsWith("/distribution/3/modules/0"));
    }

    @Test
    void parse_duplicateModule_throws() {
        JsonNode root = IrJson.read("""
            {"distribution": ["Library", [["acme"]], [], {"modules": [
              [[["m"]], {"access": "Public", "value": {"types": [], "values": []}}],
              [[["m"]], {"access": "Public", "value": {"types": [], "values": []}}]
            ]}]}
            """, "dup.json");

        assertThatThrownBy(() -> new ClassicV3Parser().parse(root))
            .isInstanceOf(IrParseException.class)
            .hasMessageContaining("duplicate module");
    }

    private static ModuleDefinition module(Distribution distribution, Path path) {
        AccessControlled<ModuleDefinition> module = distribution.modules().get(path);
        assertThat(module).as("module %s", path).isNotNull();
        return module.value();
    }

    private static ValueDefinition value(Distribution distribution, Path module, String name) {
        AccessControlled<Documented<ValueDefinition>> entry = module(distribution, module).values().get(Name.fromString(name));
        assertThat(entry).as("value %s", name).isNotNull();
        return entry.value().value();
    }
}
