package io.condoinsight.warehouse.rules;

import lombok.Value;

/**
 * Tenure text paired with the year the remaining lease is measured from.
 */
@Value(staticConstructor = "of")
public class LeaseTerm {
    String tenure;
    int referenceYear;
}
