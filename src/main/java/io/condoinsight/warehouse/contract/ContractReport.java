package io.condoinsight.warehouse.contract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of diffing one file's header row against the contract. Serialised into
 * {@code etl_batches.contract_report}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractReport {

    private String fileName;

    private String headerFingerprint;

    @Builder.Default
    private List<String> headers = new ArrayList<>();

    /** Canonical column to how it was found. */
    @Builder.Default
    private Map<String, ColumnMatch> columns = new LinkedHashMap<>();

    @Builder.Default
    private List<String> missingRequired = new ArrayList<>();

    @Builder.Default
    private List<String> missingOptional = new ArrayList<>();

    /** Headers that are not in the contract; their values go to raw extras. */
    @Builder.Default
    private List<String> unknownHeaders = new ArrayList<>();

    /** Header to canonical, only where an alias was needed. */
    @Builder.Default
    private Map<String, String> aliasesUsed = new LinkedHashMap<>();

    /** Header to canonical for every recognised header. */
    @Builder.Default
    private Map<String, String> resolvedMapping = new LinkedHashMap<>();

    private boolean valid;
}
