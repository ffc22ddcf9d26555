package com.morphirbridge.core.visitor.impl;

import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.format.FormatDetector;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.visitor.IrWalker;
import com.morphirbridge.core.visitor.Reducer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TypeReferenceCollector}.
 */
class TypeReferenceCollectorTest {

    private static List<TypeReferenceSite> collect(String fixture) {
        Distribution distribution = new FormatDetector().parse(IrFixtures.json(fixture)).distribution();
        return new IrWalker<>(new TypeReferenceCollector(), Reducer.<TypeReferenceSite>concat())
            .walk(distribution)
            .value();
    }

    @Test
    void collect_recordsSitesInTraversalOrder() {
        List<TypeReferenceSite> sites = collect(IrFixtures.V4_BUNDLED);

        assertThat(sites).startsWith(
            new TypeReferenceSite(FQName.parse("morphir/sdk:string#string"), 0,
                FQName.parse("acme/payments:invoicing#invoice-id")),
            new TypeReferenceSite(FQName.parse("morphir/sdk:basics#int"), 0,
                FQName.parse("acme/payments:invoicing#status")));
    }

    @Test
    void collect_includesRecordFieldsAndConstructorArguments() {
        List<TypeReferenceSite> sites = collect(IrFixtures.V4_BUNDLED);

        assertThat(sites)
            .contains(new TypeReferenceSite(FQName.parse("acme/common:money#amount"), 0,
                FQName.parse("acme/payments:invoicing#invoice")))
            .contains(new TypeReferenceSite(FQName.parse("acme/payments:invoicing#invoice"), 0,
                FQName.parse("acme/payments:invoicing#is-overdue")));
    }

    @Test
    void collect_includesHoleAnnotations() {
        List<TypeReferenceSite> sites = collect(IrFixtures.V4_INCOMPLETE);

        FQName basePrice = FQName.parse("acme/drafts:pricing#base-price");
        assertThat(sites)
            .filteredOn(site -> site.enclosing().equals(basePrice))
            .extracting(TypeReferenceSite::target)
            .containsExactly(FQName.parse("morphir/sdk:basics#float"), FQName.parse("morphir/sdk:basics#float"));
    }

    @Test
    void collect_ignoresDependencySpecifications() {
        List<TypeReferenceSite> sites = collect(IrFixtures.V4_BUNDLED);

        assertThat(sites).extracting(TypeReferenceSite::enclosing)
            .allMatch(fqName -> fqName.packagePath().toCanonicalString().equals("acme/payments"));
    }
}
