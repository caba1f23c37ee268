package io.condoinsight.warehouse.contract;

import io.condoinsight.warehouse.config.PipelineProperties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CompatibilityChecker Unit Tests")
class CompatibilityCheckerTest {

    private static SchemaContract contract;

    private final CompatibilityChecker checker = new CompatibilityChecker();

    @BeforeAll
    static void loadContract() {
        contract = new SchemaContractLoader(new DefaultResourceLoader(), new PipelineProperties()).load();
    }

    @Test
    @DisplayName("Should report exact matches and missing optional columns")
    void shouldReportExactMatches() {
        // Given
        List<String> headers = List.of("Project Name", "Sale Date", "Transacted Price ($)", "Area (SQFT)");

        // When
        ContractReport report = checker.check("exact.csv", headers, contract);

        // Then
        assertThat(report.isValid()).isTrue();
        assertThat(report.getColumns()).containsEntry("price", ColumnMatch.EXACT);
        assertThat(report.getColumns()).containsEntry("tenure", ColumnMatch.MISSING_OPTIONAL);
        assertThat(report.getMissingOptional()).contains("unit_psf", "tenure");
        assertThat(report.getAliasesUsed()).isEmpty();
        assertThat(report.getUnknownHeaders()).isEmpty();
    }

    @Test
    @DisplayName("Should resolve aliased headers case-insensitively")
    void shouldResolveAliases() {
        // Given
        List<String> headers = List.of("project name", " Contract Date ", "Price ($)", "Area Sqft", "Unit Price (PSF)");

        // When
        ContractReport report = checker.check("aliased.csv", headers, contract);

        // Then
        assertThat(report.isValid()).isTrue();
        assertThat(report.getColumns())
                .containsEntry("project_name", ColumnMatch.EXACT)
                .containsEntry("sale_date", ColumnMatch.ALIASED)
                .containsEntry("price", ColumnMatch.ALIASED)
                .containsEntry("area_sqft", ColumnMatch.ALIASED);
        assertThat(report.getAliasesUsed())
                .containsEntry("Contract Date", "sale_date")
                .containsEntry("Price ($)", "price");
        assertThat(report.getResolvedMapping()).containsEntry("Unit Price (PSF)", "unit_psf");
    }

    @Test
    @DisplayName("Should fail the report when a required column is missing")
    void shouldFailOnMissingRequired() {
        // Given
        List<String> headers = List.of("Project Name", "Sale Date", "Transacted Price ($)", "Postal District");

        // When
        ContractReport report = checker.check("noarea.csv", headers, contract);

        // Then
        assertThat(report.isValid()).isFalse();
        assertThat(report.getMissingRequired()).containsExactly("area_sqft");
        assertThat(report.getColumns()).containsEntry("area_sqft", ColumnMatch.MISSING_REQUIRED);
    }

    @Test
    @DisplayName("Should send unknown and duplicate headers to raw extras")
    void shouldCollectUnknownHeaders() {
        // Given
        List<String> headers = List.of("Project Name", "Project", "Sale Date", "Price", "Area", "Completion Date");

        // When
        ContractReport report = checker.check("extra.csv", headers, contract);

        // Then
        assertThat(report.isValid()).isTrue();
        assertThat(report.getUnknownHeaders()).containsExactly("Project", "Completion Date");
        assertThat(report.getResolvedMapping()).doesNotContainKey("Project");
    }

    @Test
    @DisplayName("Should fingerprint headers independent of column order")
    void shouldFingerprintHeaders() {
        ContractReport a = checker.check("a.csv", List.of("Project Name", "Sale Date", "Price", "Area"), contract);
        ContractReport b = checker.check("b.csv", List.of("Area", "Price", "Sale Date", "Project Name"), contract);
        ContractReport c = checker.check("c.csv", List.of("Project Name", "Sale Date", "Price ($)", "Area"), contract);

        assertThat(a.getHeaderFingerprint()).isEqualTo(b.getHeaderFingerprint());
        assertThat(a.getHeaderFingerprint()).isNotEqualTo(c.getHeaderFingerprint());
    }
}
