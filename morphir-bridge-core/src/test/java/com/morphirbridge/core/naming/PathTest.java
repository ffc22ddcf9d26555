package com.morphirbridge.core.naming;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Path}.
 */
class PathTest {

    @Test
    void parse_slashAndDotSeparators_giveSamePath() {
        assertThat(Path.parse("Morphir.SDK")).isEqualTo(Path.parse("morphir/s-d-k"));
    }

    @Test
    void parse_emptyText_givesEmptyPath() {
        assertThat(Path.parse("").isEmpty()).isTrue();
        assertThat(Path.parse("//").isEmpty()).isTrue();
    }

    @Test
    void renderings_canonicalAndDisplay() {
        Path path = Path.parse("Acme.BusinessTerms");

        assertThat(path.toCanonicalString()).isEqualTo("acme/business-terms");
        assertThat(path.toDisplayString()).isEqualTo("Acme.BusinessTerms");
    }

    @Test
    void isPrefixOf_comparesWholeNames() {
        Path acme = Path.parse("acme");

        assertThat(acme.isPrefixOf(Path.parse("acme/finance"))).isTrue();
        assertThat(acme.isPrefixOf(acme)).isTrue();
        assertThat(Path.parse("acme/finance").isPrefixOf(acme)).isFalse();
        assertThat(Path.parse("acm").isPrefixOf(acme)).isFalse();
    }

    @Test
    void append_leavesOriginalUnchanged() {
        Path base = Path.parse("acme");
        Path extended = base.append(Name.of("finance"));

        assertThat(extended.toCanonicalString()).isEqualTo("acme/finance");
        assertThat(base.toCanonicalString()).isEqualTo("acme");
    }
}
