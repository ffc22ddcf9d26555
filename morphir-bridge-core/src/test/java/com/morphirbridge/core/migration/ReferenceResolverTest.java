package com.morphirbridge.core.migration;

import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.TestDistributions;
import com.morphirbridge.core.error.MigrationUnsupportedException;
import com.morphirbridge.core.format.FormatDetector;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Constructor;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Parameter;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.TypeExpr;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReferenceResolver}.
 */
class ReferenceResolverTest {

    private static final TypeDefinition BOX = new TypeDefinition.CustomType(List.of(Name.of("a")),
        AccessControlled.publicly(List.of(new Constructor(Name.of("box"),
            List.of(new Parameter(Name.of("content"), new TypeExpr.Variable(Name.of("a"))))))));

    private final ReferenceResolver resolver = new ReferenceResolver();

    @Test
    void resolve_fixtures_succeed() {
        FormatDetector detector = new FormatDetector();

        assertThatCode(() -> resolver.resolve(detector.parse(IrFixtures.json(IrFixtures.CLASSIC_V3)).distribution()))
            .doesNotThrowAnyException();
        assertThatCode(() -> resolver.resolve(detector.parse(IrFixtures.json(IrFixtures.V4_BUNDLED)).distribution()))
            .doesNotThrowAnyException();
    }

    @Test
    void resolve_correctArity_succeeds() {
        Distribution distribution = TestDistributions.types("acme", "m", withAlias(
            new TypeExpr.Reference(FQName.parse("acme:m#box"), List.of(TestDistributions.INT))));

        assertThatCode(() -> resolver.resolve(distribution)).doesNotThrowAnyException();
    }

    @Test
    void resolve_arityMismatch_throws() {
        Distribution distribution = TestDistributions.types("acme", "m", withAlias(
            TypeExpr.Reference.to(FQName.parse("acme:m#box"))));

        assertThatThrownBy(() -> resolver.resolve(distribution))
            .isInstanceOf(MigrationUnsupportedException.class)
            .hasMessage("type 'acme:m#box' takes 1 type argument(s) but 'acme:m#boxed' passes 0");
    }

    @Test
    void resolve_unknownType_throws() {
        Distribution distribution = TestDistributions.types("acme", "m", withAlias(
            TypeExpr.Reference.to(FQName.parse("acme:m#crate"))));

        assertThatThrownBy(() -> resolver.resolve(distribution))
            .isInstanceOf(MigrationUnsupportedException.class)
            .hasMessage("unresolved type reference 'acme:m#crate' in 'acme:m#boxed'");
    }

    @Test
    void resolve_sdkReferences_areTrusted() {
        Distribution distribution = TestDistributions.types("acme", "m", Map.of(Name.of("anything"),
            new TypeDefinition.TypeAlias(List.of(), TypeExpr.Reference.to(FQName.parse("morphir/sdk:dict#dict")))));

        assertThatCode(() -> resolver.resolve(distribution)).doesNotThrowAnyException();
    }

    @Test
    void declaredTypes_includeDependencySpecifications() {
        Distribution distribution = new FormatDetector().parse(IrFixtures.json(IrFixtures.V4_BUNDLED)).distribution();

        assertThat(ReferenceResolver.declaredTypes(distribution))
            .containsEntry(FQName.parse("acme/common:money#amount"), 0)
            .containsEntry(FQName.parse("acme/payments:invoicing#status"), 0)
            .hasSize(4);
    }

    private static Map<Name, TypeDefinition> withAlias(TypeExpr body) {
        Map<Name, TypeDefinition> types = new LinkedHashMap<>();
        types.put(Name.of("box"), BOX);
        types.put(Name.of("boxed"), new TypeDefinition.TypeAlias(List.of(), body));
        return types;
    }
}
