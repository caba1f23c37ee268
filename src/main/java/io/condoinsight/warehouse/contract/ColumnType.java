package io.condoinsight.warehouse.contract;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ColumnType {
    STRING, DECIMAL, INTEGER, DATE;

    @JsonCreator
    public static ColumnType fromJson(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
