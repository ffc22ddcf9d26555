package com.morphirbridge.core.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.TestDistributions;
import com.morphirbridge.core.error.ErrorKind;
import com.morphirbridge.core.error.IncompleteDefinitionException;
import com.morphirbridge.core.error.MigrationUnsupportedException;
import com.morphirbridge.core.format.CosmeticLoss;
import com.morphirbridge.core.format.FormatDetector;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.model.ValueExpr;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.naming.PackageAliases;
import com.morphirbridge.core.naming.Path;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link IrMigrator}.
 */
class IrMigratorTest {

    private final IrMigrator migrator = new IrMigrator();
    private final FormatDetector detector = new FormatDetector();

    @Test
    void migrate_classicToV4AndBack_preservesDistribution() {
        ParsedDistribution classic = detector.parse(IrFixtures.json(IrFixtures.CLASSIC_V3));

        MigrationResult v4 = migrator.migrate(classic, IrVersion.V4);
        ParsedDistribution reparsed = detector.parse(v4.document());
        MigrationResult back = migrator.migrate(reparsed, IrVersion.CLASSIC_V3);

        assertThat(reparsed.version()).isEqualTo(IrVersion.V4);
        assertThat(detector.parse(back.document()).distribution()).isEqualTo(classic.distribution());
        assertThat(back.distribution()).isEqualTo(classic.distribution());
    }

    @Test
    void migrate_v4ToClassicAndBack_preservesDistribution() {
        ParsedDistribution v4 = detector.parse(IrFixtures.json(IrFixtures.V4_BUNDLED));

        MigrationResult classic = migrator.migrate(v4, IrVersion.CLASSIC_V3);
        ParsedDistribution reparsed = detector.parse(classic.document());
        MigrationResult back = migrator.migrate(reparsed, IrVersion.V4);

        assertThat(reparsed.version()).isEqualTo(IrVersion.CLASSIC_V3);
        assertThat(detector.parse(back.document()).distribution()).isEqualTo(v4.distribution());
    }

    @Test
    void migrate_classicToV4AndBack_keepsEmptyModuleDoc() {
        Distribution single = TestDistributions.types("my-org/my-pkg", "invoices",
            Map.of(Name.of("amount"), new TypeDefinition.TypeAlias(List.of(), new TypeExpr.Unit())));
        Distribution withEmptyDoc = new Distribution(single.packageName(), Map.of(),
            Map.of(Path.parse("invoices"), AccessControlled.publicly(
                new ModuleDefinition(single.modules().values().iterator().next().value().types(), Map.of(), ""))));
        ParsedDistribution classic = new ParsedDistribution(IrVersion.CLASSIC_V3, withEmptyDoc, Set.of());

        MigrationResult v4 = migrator.migrate(classic, IrVersion.V4);
        MigrationResult back = migrator.migrate(detector.parse(v4.document()), IrVersion.CLASSIC_V3);

        Distribution reparsed = detector.parse(back.document()).distribution();
        assertThat(reparsed.modules().get(Path.parse("invoices")).value().doc()).isEqualTo("");
        assertThat(reparsed).isEqualTo(withEmptyDoc);
    }

    @Test
    void migrate_classicToV4_rendersCanonicalNames() {
        MigrationResult result = migrator.migrate(detector.parse(IrFixtures.json(IrFixtures.CLASSIC_V3)), IrVersion.V4);
        JsonNode modules = result.document().at("/distribution/Library/def/modules");

        assertThat(result.document().at("/distribution/Library/packageName").asText()).isEqualTo("acme/finance");
        assertThat(modules.fieldNames()).toIterable().containsExactly("business-terms", "ledger");
        assertThat(modules.at("/ledger/value/types/entry/value/TypeAliasDefinition/typeExp/Record/fields/account/Reference/fqname")
            .asText()).isEqualTo("acme/finance:business-terms#account-id");
        assertThat(modules.at("/business-terms/value/types/account-id/value/TypeAliasDefinition/typeExp/Reference/fqname")
            .asText()).isEqualTo("morphir/sdk:string#string");
    }

    @Test
    void migrate_v4ToClassic_usesClassicSdkSpelling() {
        MigrationResult result = migrator.migrate(detector.parse(IrFixtures.json(IrFixtures.V4_BUNDLED)), IrVersion.CLASSIC_V3);

        JsonNode idType = result.document().at("/distribution/3/modules/0/1/value/types/0/1/value/value/2/2/0");
        assertThat(idType.toString()).isEqualTo("[[\"morphir\"],[\"s\",\"d\",\"k\"]]");
        assertThat(result.target()).isEqualTo(IrVersion.CLASSIC_V3);
    }

    @Test
    void migrate_carriesSourceLosses() {
        MigrationResult result = migrator.migrate(detector.parse(IrFixtures.json(IrFixtures.V4_BUNDLED)), IrVersion.CLASSIC_V3);

        assertThat(result.cosmeticLosses()).containsExactly(CosmeticLoss.TYPE_ATTRIBUTES);
    }

    @Test
    void migrate_v4OnlyConstructsToClassic_isUnsupported() {
        ParsedDistribution incomplete = detector.parse(IrFixtures.json(IrFixtures.V4_INCOMPLETE));

        assertThatThrownBy(() -> migrator.migrate(incomplete, IrVersion.CLASSIC_V3))
            .isInstanceOf(MigrationUnsupportedException.class)
            .hasMessageStartingWith("migrating 'acme/drafts' to classic-v3: ")
            .hasMessageContaining("has no classic encoding");
    }

    @Test
    void migrate_v4OnlyConstructsToV4_succeeds() {
        ParsedDistribution incomplete = detector.parse(IrFixtures.json(IrFixtures.V4_INCOMPLETE));

        MigrationResult result = migrator.migrate(incomplete, IrVersion.V4);

        assertThat(detector.parse(result.document()).distribution()).isEqualTo(incomplete.distribution());
    }

    @Test
    void migrate_missingBody_failsBeforeWriting() {
        Distribution distribution = TestDistributions.values("acme", "m",
            Map.of(Name.of("f"), new ValueDefinition(List.of(), TestDistributions.INT, null)));

        assertThatThrownBy(() -> migrator.migrate(distribution, IrVersion.V4))
            .isInstanceOf(IncompleteDefinitionException.class)
            .hasMessage("migrating 'acme' to v4: incomplete definition 'acme:m#f': missing body")
            .satisfies(e -> {
                IncompleteDefinitionException incomplete = (IncompleteDefinitionException) e;
                assertThat(incomplete.kind()).isEqualTo(ErrorKind.INCOMPLETE_DEFINITION);
                assertThat(incomplete.definition()).isEqualTo(FQName.parse("acme:m#f"));
            });
    }

    @Test
    void migrate_unresolvedReference_isUnsupported() {
        Distribution distribution = TestDistributions.values("acme", "m", Map.of(Name.of("f"),
            ValueDefinition.expression(List.of(), TestDistributions.INT, new ValueExpr.Unit())));
        Distribution dangling = TestDistributions.values("acme", "m", Map.of(Name.of("f"),
            ValueDefinition.expression(List.of(),
                TypeExpr.Reference.to(FQName.parse("acme:gone#thing")),
                new ValueExpr.Unit())));

        assertThat(migrator.migrate(distribution, IrVersion.V4).distribution()).isEqualTo(distribution);
        assertThatThrownBy(() -> migrator.migrate(dangling, IrVersion.V4))
            .isInstanceOf(MigrationUnsupportedException.class)
            .hasMessageContaining("unresolved type reference 'acme:gone#thing' in 'acme:m#f'");
    }

    @Test
    void migrate_classicV1Target_hasNoWriter() {
        ParsedDistribution classic = detector.parse(IrFixtures.json(IrFixtures.CLASSIC_V1));

        assertThatThrownBy(() -> migrator.migrate(classic, IrVersion.CLASSIC_V1))
            .isInstanceOf(MigrationUnsupportedException.class)
            .hasMessageContaining("no writer for target 'classic-v1'");
    }

    @Test
    void migrate_resultDistribution_hasTargetSdkSpelling() {
        MigrationResult result = migrator.migrate(detector.parse(IrFixtures.json(IrFixtures.CLASSIC_V2)), IrVersion.V4);

        TypeDefinition accountId = result.distribution().modules().get(Path.parse("business-terms"))
            .value().types().get(Name.of("account", "id")).value().value();

        assertThat(((TypeExpr.Reference) ((TypeDefinition.TypeAlias) accountId).body()).fqName().packagePath())
            .isEqualTo(PackageAliases.V4_SDK);
        assertThat(result.document().toString()).doesNotContain("morphir/s-d-k");
    }
}
