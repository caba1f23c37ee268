package io.condoinsight.warehouse.rules;

import io.condoinsight.warehouse.fingerprint.Fingerprints;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the derivation rules applied while staging rows.
 *
 * <p>Built once per process and handed to the pipeline. {@link #getRulesVersion()}
 * is a content hash over every rule's name, version and parameter signature; it is
 * computed at construction and never recomputed, so every batch records exactly
 * the rule set that derived its rows.
 *
 * <pre>
 *   RuleRegistry rules = RuleRegistry.standard();
 *   Integer bedrooms = rules.apply(RuleRegistry.BEDROOM, new BigDecimal("850"));
 * </pre>
 */
@Slf4j
public final class RuleRegistry {

    public static final RuleKey<String, LocalDate> TRANSACTION_MONTH =
            RuleKey.of("transaction_month", String.class, LocalDate.class);
    public static final RuleKey<String, String> DISTRICT = RuleKey.of("district", String.class, String.class);
    public static final RuleKey<BigDecimal, Integer> BEDROOM = RuleKey.of("bedroom", BigDecimal.class, Integer.class);
    public static final RuleKey<String, String> FLOOR_LEVEL = RuleKey.of("floor_level", String.class, String.class);
    public static final RuleKey<String, String> REGION = RuleKey.of("region", String.class, String.class);
    public static final RuleKey<String, String> MARKET_SEGMENT = RuleKey.of("market_segment", String.class, String.class);
    public static final RuleKey<String, String> TENURE = RuleKey.of("tenure", String.class, String.class);
    public static final RuleKey<String, Integer> LEASE_START_YEAR =
            RuleKey.of("lease_start_year", String.class, Integer.class);
    public static final RuleKey<LeaseTerm, Integer> REMAINING_LEASE =
            RuleKey.of("remaining_lease", LeaseTerm.class, Integer.class);

    private final Map<String, DerivationRule<?, ?>> rules;
    private final String rulesVersion;

    RuleRegistry(List<DerivationRule<?, ?>> ruleList) {
        Map<String, DerivationRule<?, ?>> byName = new LinkedHashMap<>();
        for (DerivationRule<?, ?> rule : ruleList) {
            if (byName.putIfAbsent(rule.getName(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule: " + rule.getName());
            }
        }
        this.rules = Collections.unmodifiableMap(byName);
        this.rulesVersion = computeVersion(byName.values());
        log.info("[RULES] registered {} rules, rulesVersion={}", rules.size(), rulesVersion);
    }

    public static RuleRegistry standard() {
        List<DerivationRule<?, ?>> list = new ArrayList<>();
        list.add(DerivationRule.<String, LocalDate>builder()
                .key(TRANSACTION_MONTH).version(1)
                .description("Bucket the raw sale date to the first day of its month")
                .input("sale_date")
                .signature(SaleDateParser.SIGNATURE)
                .function(SaleDateParser::toTransactionMonth)
                .build());
        list.add(DerivationRule.<String, String>builder()
                .key(DISTRICT).version(1)
                .description("Normalise postal district to Dnn")
                .input("postal_district")
                .signature(RegionClassifier.DISTRICT_SIGNATURE)
                .function(RegionClassifier::normaliseDistrict)
                .build());
        list.add(DerivationRule.<BigDecimal, Integer>builder()
                .key(BEDROOM).version(1)
                .description("Bedroom count from unit area")
                .input("area_sqft")
                .signature(BedroomClassifier.SIGNATURE)
                .function(BedroomClassifier::classify)
                .build());
        list.add(DerivationRule.<String, String>builder()
                .key(FLOOR_LEVEL).version(1)
                .description("Floor tier (Low, Mid-Low, Mid, Mid-High, High)")
                .input("floor_range")
                .signature(FloorLevelClassifier.SIGNATURE)
                .function(FloorLevelClassifier::classify)
                .build());
        list.add(DerivationRule.<String, String>builder()
                .key(REGION).version(1)
                .description("Market region (CCR/RCR/OCR) implied by the district")
                .input("district")
                .signature(RegionClassifier.REGION_SIGNATURE)
                .function(RegionClassifier::regionForDistrict)
                .build());
        list.add(DerivationRule.<String, String>builder()
                .key(MARKET_SEGMENT).version(1)
                .description("Region code of the declared market segment label")
                .input("market_segment")
                .signature(RegionClassifier.SEGMENT_SIGNATURE)
                .function(RegionClassifier::normaliseSegment)
                .build());
        list.add(DerivationRule.<String, String>builder()
                .key(TENURE).version(1)
                .description("Tenure type (Freehold, 99-year, 999-year)")
                .input("tenure")
                .signature(TenureClassifier.SIGNATURE)
                .function(TenureClassifier::classify)
                .build());
        list.add(DerivationRule.<String, Integer>builder()
                .key(LEASE_START_YEAR).version(1)
                .description("Lease commencement year from tenure text")
                .input("tenure")
                .signature(TenureClassifier.SIGNATURE)
                .function(TenureClassifier::leaseStartYear)
                .build());
        list.add(DerivationRule.<LeaseTerm, Integer>builder()
                .key(REMAINING_LEASE).version(1)
                .description("Remaining lease years at the transaction year")
                .input("tenure").input("transaction_month")
                .signature(TenureClassifier.SIGNATURE)
                .function(TenureClassifier::remainingLease)
                .build());
        return new RuleRegistry(list);
    }

    /**
     * Applies a rule.
     *
     * @throws IllegalArgumentException when the rule is not registered or rejects the input
     */
    public <I, O> O apply(RuleKey<I, O> key, I input) {
        DerivationRule<?, ?> rule = lookup(key);
        try {
            return key.getOutputType().cast(rule.applyErased(input));
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Rule '" + key.getName() + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Applies a rule, falling back to {@code defaultValue} when the input is rejected.
     * An unregistered rule still throws.
     */
    public <I, O> O applySafe(RuleKey<I, O> key, I input, O defaultValue) {
        DerivationRule<?, ?> rule = lookup(key);
        try {
            O result = key.getOutputType().cast(rule.applyErased(input));
            return result == null ? defaultValue : result;
        } catch (RuntimeException e) {
            return defaultValue;
        }
    }

    public String getRulesVersion() {
        return rulesVersion;
    }

    public List<String> listRules() {
        return List.copyOf(rules.keySet());
    }

    public DerivationRule<?, ?> describe(String name) {
        DerivationRule<?, ?> rule = rules.get(name);
        if (rule == null) {
            throw new IllegalArgumentException("Unknown rule: " + name + ". Available: " + rules.keySet());
        }
        return rule;
    }

    private DerivationRule<?, ?> lookup(RuleKey<?, ?> key) {
        DerivationRule<?, ?> rule = describe(key.getName());
        if (!rule.getKey().equals(key)) {
            throw new IllegalArgumentException("Rule " + key.getName() + " is registered as " + rule.getKey()
                    + ", requested as " + key);
        }
        return rule;
    }

    private static String computeVersion(Iterable<DerivationRule<?, ?>> rules) {
        StringBuilder source = new StringBuilder();
        for (DerivationRule<?, ?> rule : rules) {
            source.append(rule.fingerprintSource()).append('\n');
        }
        return Fingerprints.sha256Hex(source.toString()).substring(0, 12);
    }
}
