package com.morphirbridge.core.format.v4;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.format.FormatDetector;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.model.Distribution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link V4Writer}.
 */
class V4WriterTest {

    private final V4Writer writer = new V4Writer();

    @ParameterizedTest
    @ValueSource(strings = {IrFixtures.V4_BUNDLED, IrFixtures.V4_INCOMPLETE})
    void write_readsBackEqual(String fixture) {
        Distribution original = new V4Parser().parse(IrFixtures.json(fixture)).distribution();

        JsonNode written = writer.write(original);

        assertThat(new FormatDetector().detect(written)).isEqualTo(IrVersion.V4);
        assertThat(new V4Parser().parse(written).distribution()).isEqualTo(original);
    }

    @Test
    void write_usesCanonicalNamesEverywhere() {
        Distribution original = new V4Parser().parse(IrFixtures.json(IrFixtures.V4_BUNDLED)).distribution();

        JsonNode written = writer.write(original);

        assertThat(written.get("formatVersion").asText()).isEqualTo(V4Writer.FORMAT_VERSION);
        assertThat(written.at("/distribution/Library/packageName").asText()).isEqualTo("acme/payments");
        JsonNode types = written.at("/distribution/Library/def/modules/invoicing/value/types");
        assertThat(types.fieldNames()).toIterable().containsExactly("invoice-id", "status", "invoice");
        assertThat(types.at("/invoice/value/TypeAliasDefinition/typeExp/Record/fields/id/Reference/fqname").asText())
            .isEqualTo("acme/payments:invoicing#invoice-id");
        assertThat(types.at("/status/value/CustomTypeDefinition/constructors/value/1/args/0/name").asText())
            .isEqualTo("days-outstanding");
    }

    @Test
    void write_emptyDocumentation_isOmitted() {
        Distribution original = new V4Parser().parse(IrFixtures.json(IrFixtures.V4_BUNDLED)).distribution();

        JsonNode types = writer.write(original).at("/distribution/Library/def/modules/invoicing/value/types");

        assertThat(types.get("invoice-id").has("doc")).isFalse();
        assertThat(types.get("status").get("doc").asText()).isEqualTo("Where an invoice stands");
    }

    @Test
    void write_attributes_areNotEmitted() {
        Distribution original = new V4Parser().parse(IrFixtures.json(IrFixtures.V4_BUNDLED)).distribution();

        JsonNode written = writer.write(original);

        assertThat(written.toString()).doesNotContain("attrs");
    }
}
