package io.condoinsight.warehouse.staging;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * One physical record of an input file as handed over by the reader.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CsvRecord {

    /** 1-based line in the source file; the header is line 1. */
    long lineNumber;
    String rawLine;
    List<String> values;
    boolean blank;
    /** Set when the line could not be tokenised. */
    String error;

    static CsvRecord of(long lineNumber, String rawLine, List<String> values) {
        return new CsvRecord(lineNumber, rawLine, values, false, null);
    }

    static CsvRecord blank(long lineNumber) {
        return new CsvRecord(lineNumber, "", List.of(), true, null);
    }

    static CsvRecord malformed(long lineNumber, String rawLine, String error) {
        return new CsvRecord(lineNumber, rawLine, List.of(), false, error);
    }

    public boolean isMalformed() {
        return error != null;
    }
}
