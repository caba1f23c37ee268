package io.condoinsight.warehouse.staging;

import io.condoinsight.warehouse.contract.SchemaContract;
import io.condoinsight.warehouse.entity.StagingTransaction;
import io.condoinsight.warehouse.fingerprint.Fingerprints;
import io.condoinsight.warehouse.rules.FloorLevelClassifier;
import io.condoinsight.warehouse.rules.LeaseTerm;
import io.condoinsight.warehouse.rules.RuleRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns one canonicalised record into a typed staging row.
 *
 * <p>Derivations run in a fixed order: transaction month, PSF reconciliation,
 * bedroom count, floor level, region, then the district and tenure extras.
 * A required field that is missing, unparseable or not positive does not stop
 * the row from being staged; it is staged invalid with the reason attached.
 */
@Component
@RequiredArgsConstructor
public class TransactionRowMapper {

    static final String PROJECT_NAME = "project_name";
    static final String SALE_DATE = "sale_date";
    static final String TRANSACTION_MONTH = "transaction_month";
    static final String PRICE = "price";
    static final String AREA_SQFT = "area_sqft";
    static final String UNIT_PSF = "unit_psf";
    static final String POSTAL_DISTRICT = "postal_district";
    static final String MARKET_SEGMENT = "market_segment";
    static final String FLOOR_RANGE = "floor_range";
    static final String TENURE = "tenure";
    static final String TYPE_OF_SALE = "type_of_sale";
    static final String PROPERTY_TYPE = "property_type";
    static final String STREET_NAME = "street_name";
    static final String NUM_UNITS = "num_units";
    static final String NETT_PRICE = "nett_price";
    static final String TYPE_OF_AREA = "type_of_area";

    private final RuleRegistry rules;
    private final PsfReconciler psfReconciler;

    /**
     * @param values canonical column to raw cell text
     * @param extras cells under headers the contract does not know
     */
    public StagingTransaction map(Map<String, String> values, Map<String, String> extras, SchemaContract contract) {
        List<String> problems = new ArrayList<>();

        List<String> oversized = new ArrayList<>();
        String projectName = FieldParsers.text(values.get(PROJECT_NAME));
        if (projectName == null) {
            problems.add("project_name is empty");
        } else if (projectName.length() > StagingTransaction.PROJECT_NAME_LENGTH) {
            problems.add("project_name longer than " + StagingTransaction.PROJECT_NAME_LENGTH + " characters");
            extras.put(PROJECT_NAME, projectName);
            projectName = null;
        }

        LocalDate month = null;
        try {
            month = rules.apply(RuleRegistry.TRANSACTION_MONTH, values.get(SALE_DATE));
        } catch (IllegalArgumentException e) {
            problems.add("sale_date: " + FieldParsers.abbreviate(e.getMessage()));
        }

        BigDecimal price = requiredPositive(values, PRICE, problems);
        BigDecimal area = requiredPositive(values, AREA_SQFT, problems);
        BigDecimal psfSource = optionalDecimal(values, UNIT_PSF, extras);

        StagingTransaction.StagingTransactionBuilder row = StagingTransaction.builder()
                .projectName(projectName)
                .transactionMonth(month)
                .price(price)
                .areaSqft(area)
                .psfSource(psfSource);

        if (price != null && area != null && price.signum() > 0 && area.signum() > 0) {
            PsfReconciler.Result psf = psfReconciler.reconcile(price, area, psfSource);
            row.psfCalc(psf.getCalculated()).psf(psf.getChosen()).psfReconciled(psf.isReconciled());
        }
        if (area != null && area.signum() > 0) {
            row.bedroomCount(rules.applySafe(RuleRegistry.BEDROOM, area, null));
        }

        String floorRange = boundedText(values, FLOOR_RANGE, StagingTransaction.FLOOR_RANGE_LENGTH, extras, oversized);
        row.floorRange(floorRange)
                .floorLevel(rules.applySafe(RuleRegistry.FLOOR_LEVEL, floorRange, FloorLevelClassifier.UNKNOWN));

        String districtRaw = FieldParsers.text(values.get(POSTAL_DISTRICT));
        String district = districtRaw == null ? null : rules.applySafe(RuleRegistry.DISTRICT, districtRaw, null);
        String segmentRaw = boundedText(values, MARKET_SEGMENT, StagingTransaction.MARKET_SEGMENT_RAW_LENGTH, extras, oversized);
        String segment = segmentRaw == null ? null : rules.applySafe(RuleRegistry.MARKET_SEGMENT, segmentRaw, null);
        String region = district != null ? rules.applySafe(RuleRegistry.REGION, district, null) : segment;
        row.district(district).region(region).marketSegment(segment).marketSegmentRaw(segmentRaw);
        if (districtRaw != null && district == null) {
            extras.put(POSTAL_DISTRICT, districtRaw);
        }

        String tenure = boundedText(values, TENURE, StagingTransaction.TENURE_LENGTH, extras, oversized);
        row.tenure(tenure)
                .tenureType(rules.applySafe(RuleRegistry.TENURE, tenure, null))
                .leaseStartYear(rules.applySafe(RuleRegistry.LEASE_START_YEAR, tenure, null));
        if (month != null) {
            row.remainingLease(rules.applySafe(RuleRegistry.REMAINING_LEASE, LeaseTerm.of(tenure, month.getYear()), null));
        }

        row.saleType(boundedText(values, TYPE_OF_SALE, StagingTransaction.SALE_TYPE_LENGTH, extras, oversized))
                .propertyType(boundedText(values, PROPERTY_TYPE, StagingTransaction.PROPERTY_TYPE_LENGTH, extras, oversized))
                .streetName(boundedText(values, STREET_NAME, StagingTransaction.STREET_NAME_LENGTH, extras, oversized))
                .numUnits(optionalInteger(values, NUM_UNITS, extras))
                .nettPrice(optionalDecimal(values, NETT_PRICE, extras))
                .typeOfArea(boundedText(values, TYPE_OF_AREA, StagingTransaction.TYPE_OF_AREA_LENGTH, extras, oversized))
                .rawExtras(extras)
                .oversizedColumns(oversized);

        StagingTransaction staged = row.build();
        staged.setRowHash(rowHash(staged, values, contract));
        problems.forEach(staged::reject);
        return staged;
    }

    /**
     * Natural-key hash, or null while any of project, month, price and area is unknown.
     */
    String rowHash(StagingTransaction row, Map<String, String> values, SchemaContract contract) {
        if (row.getProjectName() == null || row.getTransactionMonth() == null
                || row.getPrice() == null || row.getAreaSqft() == null) {
            return null;
        }
        List<Object> key = new ArrayList<>();
        for (String field : contract.getNaturalKeyFields()) {
            key.add(keyValue(field, row, values));
        }
        return Fingerprints.rowHash(key);
    }

    private static Object keyValue(String field, StagingTransaction row, Map<String, String> values) {
        switch (field) {
            case PROJECT_NAME:
                return row.getProjectName();
            case TRANSACTION_MONTH:
            case SALE_DATE:
                return row.getTransactionMonth();
            case PRICE:
                return row.getPrice();
            case AREA_SQFT:
                return row.getAreaSqft();
            case FLOOR_RANGE:
                return row.getFloorRange();
            case POSTAL_DISTRICT:
                return row.getDistrict();
            default:
                return values.get(field);
        }
    }

    private static BigDecimal requiredPositive(Map<String, String> values, String column, List<String> problems) {
        try {
            BigDecimal value = FieldParsers.decimal(values.get(column));
            if (value == null) {
                problems.add(column + " is empty");
            } else if (value.signum() <= 0) {
                problems.add(column + " must be positive: " + value.toPlainString());
            }
            return value;
        } catch (IllegalArgumentException e) {
            problems.add(column + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Trimmed text of an optional column. A value wider than the column is kept
     * verbatim in {@code extras} and the typed field stays null.
     */
    private static String boundedText(Map<String, String> values, String column, int maxLength,
                                      Map<String, String> extras, List<String> oversized) {
        String text = FieldParsers.text(values.get(column));
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        extras.put(column, text);
        oversized.add(column);
        return null;
    }

    private static BigDecimal optionalDecimal(Map<String, String> values, String column, Map<String, String> extras) {
        try {
            return FieldParsers.decimal(values.get(column));
        } catch (IllegalArgumentException e) {
            extras.put(column, values.get(column));
            return null;
        }
    }

    private static Integer optionalInteger(Map<String, String> values, String column, Map<String, String> extras) {
        try {
            return FieldParsers.integer(values.get(column));
        } catch (IllegalArgumentException e) {
            extras.put(column, values.get(column));
            return null;
        }
    }
}
