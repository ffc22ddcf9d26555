package com.morphirbridge.core.naming;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NameCanonicalizer}.
 */
class NameCanonicalizerTest {

    @ParameterizedTest
    @ValueSource(strings = {"BusinessTerms", "business_terms", "businessTerms", "business-terms", "Business Terms"})
    void canonicalize_anySpelling_givesKebab(String spelling) {
        assertThat(NameCanonicalizer.canonicalize(spelling)).isEqualTo("business-terms");
    }

    @ParameterizedTest
    @ValueSource(strings = {"ValueInUSD", "value2x", "a", "SDK", "already-kebab-case"})
    void canonicalize_isIdempotent(String spelling) {
        String once = NameCanonicalizer.canonicalize(spelling);

        assertThat(NameCanonicalizer.canonicalize(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Acme.Finance:BusinessTerms#AccountId", "morphir/s-d-k:list#foldl"})
    void render_fqName_survivesReparsing(String text) {
        String rendered = NameCanonicalizer.render(FQName.parse(text));

        assertThat(NameCanonicalizer.render(FQName.parse(rendered))).isEqualTo(rendered);
    }
}
