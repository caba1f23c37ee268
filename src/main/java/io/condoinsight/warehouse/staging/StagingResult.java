package io.condoinsight.warehouse.staging;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts produced by one staging pass over all files of a batch.
 */
@Data
@Builder
public class StagingResult {

    /** Rows written to staging, valid or not. */
    private long rowsLoaded;

    /** Staged rows marked invalid while parsing. */
    private long rowsRejected;

    /** Blank lines. */
    private long rowsSkipped;

    /** Rows that carried a source PSF. */
    private long psfCompared;

    private long psfReconciled;

    @Builder.Default
    private Map<String, Long> rowsPerFile = new LinkedHashMap<>();

    /** Per column, values too wide for the typed column and kept as raw extras. */
    @Builder.Default
    private Map<String, Long> oversizedValues = new LinkedHashMap<>();

    public long getSourceRowCount() {
        return rowsLoaded + rowsSkipped;
    }
}
