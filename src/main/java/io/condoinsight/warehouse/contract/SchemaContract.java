package io.condoinsight.warehouse.contract;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of the versioned input contract. Loaded once at the start of a
 * run and never mutated.
 */
@Value
public class SchemaContract {

    String name;
    String schemaVersion;
    String contractHash;
    List<ColumnDefinition> columns;
    Set<String> requiredColumns;
    Set<String> optionalColumns;

    /** Lower-cased alias (including canonical names and usual headers) to canonical name. */
    Map<String, String> columnAliases;

    /** Lower-cased canonical name or usual header to canonical name. */
    Map<String, String> exactNames;

    List<String> naturalKeyFields;

    public static SchemaContract of(String name, String schemaVersion, String contractHash,
                                    List<ColumnDefinition> columns, List<String> naturalKeyFields) {
        Set<String> required = new LinkedHashSet<>();
        Set<String> optional = new LinkedHashSet<>();
        Map<String, String> exact = new LinkedHashMap<>();
        Map<String, String> aliases = new LinkedHashMap<>();

        for (ColumnDefinition column : columns) {
            (column.isRequired() ? required : optional).add(column.getName());
            register(exact, column.getName(), column.getName());
            if (column.getHeader() != null) {
                register(exact, column.getHeader(), column.getName());
            }
        }
        aliases.putAll(exact);
        for (ColumnDefinition column : columns) {
            for (String alias : column.getAliases()) {
                register(aliases, alias, column.getName());
            }
        }
        return new SchemaContract(name, schemaVersion, contractHash,
                List.copyOf(columns),
                Collections.unmodifiableSet(required),
                Collections.unmodifiableSet(optional),
                Collections.unmodifiableMap(aliases),
                Collections.unmodifiableMap(exact),
                List.copyOf(naturalKeyFields));
    }

    /**
     * Canonical column for a raw header, by exact name or alias.
     */
    public Optional<String> resolve(String header) {
        return Optional.ofNullable(columnAliases.get(key(header)));
    }

    public boolean isExactName(String header) {
        return exactNames.containsKey(key(header));
    }

    public ColumnDefinition column(String canonical) {
        return columns.stream()
                .filter(c -> c.getName().equals(canonical))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Column not in contract: " + canonical));
    }

    static String key(String header) {
        return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
    }

    private static void register(Map<String, String> target, String header, String canonical) {
        String previous = target.putIfAbsent(key(header), canonical);
        if (previous != null && !previous.equals(canonical)) {
            throw new IllegalArgumentException(
                    "Header '" + header + "' maps to both " + previous + " and " + canonical);
        }
    }
}
