package com.morphirbridge.core.migration;

import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.TestDistributions;
import com.morphirbridge.core.error.IncompleteDefinitionException;
import com.morphirbridge.core.format.FormatDetector;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Constructor;
import com.morphirbridge.core.model.Parameter;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.model.ValueExpr;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CompletenessChecker}.
 */
class CompletenessCheckerTest {

    private final CompletenessChecker checker = new CompletenessChecker();

    @Test
    void check_fixtures_areComplete() {
        FormatDetector detector = new FormatDetector();

        assertThatCode(() -> checker.check(detector.parse(IrFixtures.json(IrFixtures.CLASSIC_V1)).distribution()))
            .doesNotThrowAnyException();
        assertThatCode(() -> checker.check(detector.parse(IrFixtures.json(IrFixtures.V4_INCOMPLETE)).distribution()))
            .doesNotThrowAnyException();
    }

    @Test
    void check_missingOutputType_throws() {
        ValueDefinition untyped = ValueDefinition.expression(List.of(), null, new ValueExpr.Unit());

        assertThatThrownBy(() -> checker.check(TestDistributions.values("acme", "m", Map.of(Name.of("f"), untyped))))
            .isInstanceOf(IncompleteDefinitionException.class)
            .hasMessage("incomplete definition 'acme:m#f': missing output type");
    }

    @Test
    void check_untypedInput_throws() {
        ValueDefinition untypedInput = ValueDefinition.expression(
            List.of(new Parameter(Name.of("x"), null)), TestDistributions.INT, new ValueExpr.Variable(Name.of("x")));

        assertThatThrownBy(() -> checker.check(TestDistributions.values("acme", "m", Map.of(Name.of("f"), untypedInput))))
            .isInstanceOf(IncompleteDefinitionException.class)
            .hasMessageContaining("input 'x' has no type");
    }

    @Test
    void check_untypedConstructorArgument_throws() {
        TypeDefinition custom = new TypeDefinition.CustomType(List.of(), AccessControlled.publicly(
            List.of(new Constructor(Name.of("wrap"), List.of(new Parameter(Name.of("content"), null))))));

        assertThatThrownBy(() -> checker.check(TestDistributions.types("acme", "m", Map.of(Name.of("wrapper"), custom))))
            .isInstanceOf(IncompleteDefinitionException.class)
            .hasMessageContaining("constructor 'wrap' argument 'content' has no type")
            .satisfies(e -> assertThat(((IncompleteDefinitionException) e).definition())
                .isEqualTo(FQName.parse("acme:m#wrapper")));
    }

    @Test
    void check_letBoundDefinition_namesEnclosingValue() {
        ValueExpr let = new ValueExpr.LetDefinition(Name.of("inner"),
            new ValueDefinition(List.of(), TestDistributions.INT, null), new ValueExpr.Unit());
        ValueDefinition outer = ValueDefinition.expression(List.of(), TestDistributions.INT, let);

        assertThatThrownBy(() -> checker.check(TestDistributions.values("acme", "m", Map.of(Name.of("outer"), outer))))
            .isInstanceOf(IncompleteDefinitionException.class)
            .hasMessage("incomplete definition 'acme:m#outer': missing body");
    }
}
