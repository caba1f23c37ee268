package io.condoinsight.warehouse.contract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One expected input column: its canonical name, the header the source normally
 * uses, and the other headers it has been published under.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDefinition {

    private String name;

    private String header;

    private boolean required;

    @Builder.Default
    private ColumnType type = ColumnType.STRING;

    @Builder.Default
    private List<String> aliases = new ArrayList<>();
}
