package io.condoinsight.warehouse.contract;

/**
 * How an expected column was found in a file header.
 */
public enum ColumnMatch {
    /** Canonical name or the usual source header. */
    EXACT,
    /** A registered alias, i.e. the column was renamed upstream. */
    ALIASED,
    MISSING_REQUIRED,
    MISSING_OPTIONAL
}
