package io.condoinsight.warehouse.contract;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.exception.ContractException;
import io.condoinsight.warehouse.exception.ErrorCategory;
import io.condoinsight.warehouse.exception.PipelineStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SchemaContractLoader Unit Tests")
class SchemaContractLoaderTest {

    private final PipelineProperties properties = new PipelineProperties();
    private final SchemaContractLoader loader = new SchemaContractLoader(new DefaultResourceLoader(), properties);

    @Test
    @DisplayName("Should load the bundled transaction contract")
    void shouldLoadBundledContract() {
        // When
        SchemaContract contract = loader.load();

        // Then
        assertThat(contract.getSchemaVersion()).isEqualTo("2.1.0");
        assertThat(contract.getContractHash()).hasSize(16);
        assertThat(contract.getRequiredColumns())
                .containsExactly("project_name", "sale_date", "price", "area_sqft");
        assertThat(contract.getOptionalColumns())
                .contains("unit_psf", "postal_district", "market_segment", "floor_range", "tenure");
        assertThat(contract.getNaturalKeyFields())
                .containsExactly("project_name", "transaction_month", "price", "area_sqft", "floor_range");
        assertThat(contract.resolve("Price ($)")).contains("price");
        assertThat(contract.resolve("  AREA SQFT ")).contains("area_sqft");
        assertThat(contract.resolve("Colour")).isEmpty();
        assertThat(contract.column("price").getType()).isEqualTo(ColumnType.DECIMAL);
    }

    @Test
    @DisplayName("Should hash the raw contract bytes")
    void shouldHashRawBytes() {
        // Given
        String json = "{\"version\":\"1\",\"columns\":[{\"name\":\"a\",\"required\":true}],\"natural_key_fields\":[\"a\"]}";

        // When
        SchemaContract first = SchemaContractLoader.parse(json.getBytes(StandardCharsets.UTF_8), "a.json");
        SchemaContract padded = SchemaContractLoader.parse((json + "\n").getBytes(StandardCharsets.UTF_8), "a.json");

        // Then
        assertThat(first.getSchemaVersion()).isEqualTo("1");
        assertThat(first.getContractHash()).isNotEqualTo(padded.getContractHash());
    }

    @Test
    @DisplayName("Should fail at the contract stage when the file is missing")
    void shouldFailWhenContractMissing() {
        // Given
        properties.setContractLocation("classpath:contracts/does-not-exist.json");

        // When / Then
        assertThatThrownBy(loader::load)
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("Contract file missing")
                .satisfies(e -> {
                    ContractException ce = (ContractException) e;
                    assertThat(ce.getStage()).isEqualTo(PipelineStage.CONTRACT);
                    assertThat(ce.getCategory()).isEqualTo(ErrorCategory.SYSTEM);
                });
    }

    @Test
    @DisplayName("Should reject malformed and incomplete contracts")
    void shouldRejectInvalidContracts() {
        assertThatThrownBy(() -> SchemaContractLoader.parse("{not json".getBytes(StandardCharsets.UTF_8), "bad.json"))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("not valid JSON");

        assertThatThrownBy(() -> SchemaContractLoader.parse(
                "{\"columns\":[{\"name\":\"a\",\"required\":false}],\"natural_key_fields\":[\"a\"]}"
                        .getBytes(StandardCharsets.UTF_8), "opt.json"))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("no required columns");

        assertThatThrownBy(() -> SchemaContractLoader.parse(
                "{\"columns\":[{\"name\":\"a\",\"required\":true}]}".getBytes(StandardCharsets.UTF_8), "nokey.json"))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("natural_key_fields is empty");
    }

    @Test
    @DisplayName("Should reject an alias claimed by two columns")
    void shouldRejectAmbiguousAlias() {
        String json = "{\"columns\":["
                + "{\"name\":\"price\",\"required\":true,\"aliases\":[\"Amount\"]},"
                + "{\"name\":\"nett_price\",\"required\":false,\"aliases\":[\"amount\"]}"
                + "],\"natural_key_fields\":[\"price\"]}";

        assertThatThrownBy(() -> SchemaContractLoader.parse(json.getBytes(StandardCharsets.UTF_8), "dup.json"))
                .isInstanceOf(ContractException.class)
                .hasMessageContaining("maps to both price and nett_price");
    }
}
