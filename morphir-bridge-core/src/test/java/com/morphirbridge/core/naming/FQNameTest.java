package com.morphirbridge.core.naming;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FQName} and {@link PackageAliases}.
 */
class FQNameTest {

    @Test
    void parse_canonicalForm_splitsIntoParts() {
        FQName fqName = FQName.parse("morphir/sdk:basics#int");

        assertThat(fqName.packagePath()).isEqualTo(Path.parse("morphir/sdk"));
        assertThat(fqName.modulePath()).isEqualTo(Path.parse("basics"));
        assertThat(fqName.localName()).isEqualTo(Name.of("int"));
    }

    @Test
    void toCanonicalString_rendersKebab() {
        FQName fqName = FQName.of("Acme.Finance", "BusinessTerms", "AccountId");

        assertThat(fqName.toCanonicalString()).isEqualTo("acme/finance:business-terms#account-id");
        assertThat(FQName.parse(fqName.toCanonicalString())).isEqualTo(fqName);
    }

    @Test
    void parse_missingSeparator_throws() {
        assertThatThrownBy(() -> FQName.parse("acme/finance#total"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("package:module#name");
        assertThatThrownBy(() -> FQName.parse("acme:finance"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void packageAliases_convertSdkOnly() {
        FQName v4 = FQName.parse("morphir/sdk:basics#int");
        FQName classic = PackageAliases.toClassic(v4);

        assertThat(classic.packagePath()).isEqualTo(PackageAliases.CLASSIC_SDK);
        assertThat(PackageAliases.toV4(classic)).isEqualTo(v4);
        assertThat(PackageAliases.isSdk(classic.packagePath())).isTrue();

        FQName own = FQName.parse("acme/finance:ledger#entry");
        assertThat(PackageAliases.toClassic(own)).isEqualTo(own);
        assertThat(PackageAliases.isSdk(own.packagePath())).isFalse();
    }
}
