package io.condoinsight.warehouse.contract;

import io.condoinsight.warehouse.fingerprint.Fingerprints;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Diffs a file's header row against the contract before any row is parsed.
 * A missing required column is the only outcome that makes the report invalid.
 */
@Slf4j
@Component
public class CompatibilityChecker {

    public ContractReport check(String fileName, List<String> headers, SchemaContract contract) {
        Map<String, String> resolved = new LinkedHashMap<>();
        Map<String, String> aliasesUsed = new LinkedHashMap<>();
        Map<String, ColumnMatch> matches = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();

        for (String raw : headers) {
            String header = raw == null ? "" : raw.trim();
            Optional<String> canonical = contract.resolve(header);
            if (canonical.isEmpty() || matches.containsKey(canonical.get())) {
                // unrecognised, or a second header for a column already claimed
                unknown.add(header);
                continue;
            }
            resolved.put(header, canonical.get());
            if (contract.isExactName(header)) {
                matches.put(canonical.get(), ColumnMatch.EXACT);
            } else {
                matches.put(canonical.get(), ColumnMatch.ALIASED);
                aliasesUsed.put(header, canonical.get());
            }
        }

        List<String> missingRequired = new ArrayList<>();
        List<String> missingOptional = new ArrayList<>();
        Map<String, ColumnMatch> ordered = new LinkedHashMap<>();
        for (ColumnDefinition column : contract.getColumns()) {
            ColumnMatch match = matches.get(column.getName());
            if (match == null) {
                match = column.isRequired() ? ColumnMatch.MISSING_REQUIRED : ColumnMatch.MISSING_OPTIONAL;
                (column.isRequired() ? missingRequired : missingOptional).add(column.getName());
            }
            ordered.put(column.getName(), match);
        }

        ContractReport report = ContractReport.builder()
                .fileName(fileName)
                .headerFingerprint(Fingerprints.headerFingerprint(headers))
                .headers(new ArrayList<>(headers))
                .columns(ordered)
                .missingRequired(missingRequired)
                .missingOptional(missingOptional)
                .unknownHeaders(unknown)
                .aliasesUsed(aliasesUsed)
                .resolvedMapping(resolved)
                .valid(missingRequired.isEmpty())
                .build();

        log.info("[COMPAT] {} fingerprint={} valid={} aliased={} missingOptional={} unknown={}",
                fileName, report.getHeaderFingerprint(), report.isValid(),
                aliasesUsed.keySet(), missingOptional, unknown);
        if (!report.isValid()) {
            log.error("[COMPAT] {} is missing required column(s) {}", fileName, missingRequired);
        }
        return report;
    }
}
