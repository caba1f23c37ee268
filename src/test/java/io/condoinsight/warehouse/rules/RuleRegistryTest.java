package io.condoinsight.warehouse.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RuleRegistry Unit Tests")
class RuleRegistryTest {

    private final RuleRegistry rules = RuleRegistry.standard();

    @Test
    @DisplayName("Should register every derivation rule")
    void shouldRegisterEveryRule() {
        assertThat(rules.listRules()).containsExactly(
                "transaction_month", "district", "bedroom", "floor_level", "region",
                "market_segment", "tenure", "lease_start_year", "remaining_lease");
    }

    @Test
    @DisplayName("Should compute the same rules version for identical registries")
    void shouldComputeStableRulesVersion() {
        // When
        String first = RuleRegistry.standard().getRulesVersion();
        String second = RuleRegistry.standard().getRulesVersion();

        // Then
        assertThat(first).hasSize(12).matches("[0-9a-f]{12}");
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should change the rules version when a rule's parameters change")
    void shouldChangeVersionWhenSignatureChanges() {
        // Given
        DerivationRule<BigDecimal, Integer> original = DerivationRule.<BigDecimal, Integer>builder()
                .key(RuleRegistry.BEDROOM).version(1).signature("bands<580").function(a -> 1).build();
        DerivationRule<BigDecimal, Integer> retuned = DerivationRule.<BigDecimal, Integer>builder()
                .key(RuleRegistry.BEDROOM).version(1).signature("bands<600").function(a -> 1).build();

        // When
        RuleRegistry a = new RuleRegistry(List.of(original));
        RuleRegistry b = new RuleRegistry(List.of(retuned));

        // Then
        assertThat(a.getRulesVersion()).isNotEqualTo(b.getRulesVersion());
    }

    @Test
    @DisplayName("Should reject duplicate rule names")
    void shouldRejectDuplicateRules() {
        DerivationRule<BigDecimal, Integer> rule = DerivationRule.<BigDecimal, Integer>builder()
                .key(RuleRegistry.BEDROOM).version(1).signature("x").function(a -> 1).build();

        assertThatThrownBy(() -> new RuleRegistry(List.of(rule, rule)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate rule: bedroom");
    }

    @ParameterizedTest(name = "{0} sqft -> {1} bedroom(s)")
    @CsvSource({"450, 1", "579.99, 1", "580, 2", "799, 2", "800, 3", "1199, 3", "1200, 4", "1499, 4", "1500, 5", "3000, 5"})
    @DisplayName("Should classify bedrooms by area band")
    void shouldClassifyBedrooms(String area, int expected) {
        assertThat(rules.apply(RuleRegistry.BEDROOM, new BigDecimal(area))).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "01 to 05, Low (1-5)",
            "06 to 10, Mid-Low (6-10)",
            "16 to 20, Mid (11-20)",
            "26 to 30, Mid-High (21-30)",
            "46 to 50, High (31+)",
            "B1 to B5, Unknown",
            "-, Unknown"
    })
    @DisplayName("Should classify floor levels")
    void shouldClassifyFloorLevels(String floorRange, String expected) {
        assertThat(rules.apply(RuleRegistry.FLOOR_LEVEL, floorRange)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "Dec-20, 2020-12-01",
            "Oct 2023, 2023-10-01",
            "October 2023, 2023-10-01",
            "15 Jan 2024, 2024-01-01",
            "2023-10-17, 2023-10-01",
            "2023/10/01, 2023-10-01",
            "10/2023, 2023-10-01",
            "Mar-99, 1999-03-01"
    })
    @DisplayName("Should bucket sale dates to the first of the month")
    void shouldBucketSaleDates(String raw, LocalDate expected) {
        assertThat(rules.apply(RuleRegistry.TRANSACTION_MONTH, raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should reject unparseable sale dates")
    void shouldRejectUnparseableSaleDate() {
        assertThatThrownBy(() -> rules.apply(RuleRegistry.TRANSACTION_MONTH, "sometime"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sometime");
    }

    @Test
    @DisplayName("Should normalise districts and derive their region")
    void shouldDeriveRegions() {
        assertThat(rules.apply(RuleRegistry.DISTRICT, "9")).isEqualTo("D09");
        assertThat(rules.apply(RuleRegistry.DISTRICT, "District 15")).isEqualTo("D15");
        assertThat(rules.apply(RuleRegistry.REGION, "D09")).isEqualTo("CCR");
        assertThat(rules.apply(RuleRegistry.REGION, "D15")).isEqualTo("RCR");
        assertThat(rules.apply(RuleRegistry.REGION, "D19")).isEqualTo("OCR");
        assertThat(rules.apply(RuleRegistry.MARKET_SEGMENT, "Core Central Region")).isEqualTo("CCR");
    }

    @Test
    @DisplayName("Should derive tenure type and remaining lease")
    void shouldDeriveTenure() {
        String tenure = "99 yrs lease commencing from 2015";

        assertThat(rules.apply(RuleRegistry.TENURE, tenure)).isEqualTo("99-year");
        assertThat(rules.apply(RuleRegistry.LEASE_START_YEAR, tenure)).isEqualTo(2015);
        assertThat(rules.apply(RuleRegistry.REMAINING_LEASE, LeaseTerm.of(tenure, 2023))).isEqualTo(91);
        assertThat(rules.apply(RuleRegistry.REMAINING_LEASE, LeaseTerm.of("Freehold", 2023))).isEqualTo(999);
        assertThat(rules.apply(RuleRegistry.TENURE, "Freehold")).isEqualTo("Freehold");
    }

    @Test
    @DisplayName("Should fall back to the default when a rule rejects its input")
    void shouldApplySafeWithDefault() {
        assertThat(rules.applySafe(RuleRegistry.DISTRICT, "District 99", null)).isNull();
        assertThat(rules.applySafe(RuleRegistry.BEDROOM, BigDecimal.ZERO, -1)).isEqualTo(-1);
    }

    @Test
    @DisplayName("Should fail loudly for an unknown rule")
    void shouldFailForUnknownRule() {
        RuleKey<String, String> missing = RuleKey.of("view_quality", String.class, String.class);

        assertThatThrownBy(() -> rules.apply(missing, "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown rule: view_quality");
        assertThatThrownBy(() -> rules.describe("view_quality"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should refuse a key whose types differ from the registered rule")
    void shouldRejectMistypedKey() {
        RuleKey<String, Integer> mistyped = RuleKey.of("bedroom", String.class, Integer.class);

        assertThatThrownBy(() -> rules.apply(mistyped, "850"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Rule bedroom is registered as");
        assertThatThrownBy(() -> rules.applySafe(mistyped, "850", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
