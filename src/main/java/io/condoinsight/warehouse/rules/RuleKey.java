package io.condoinsight.warehouse.rules;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Typed handle on a registered rule. The type parameters tie each call site to
 * the rule's input and output types so derived fields are checked at compile time;
 * the class tokens check them again when a rule is applied.
 *
 * @param <I> rule input
 * @param <O> rule output
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RuleKey<I, O> {

    private final String name;
    private final Class<I> inputType;
    private final Class<O> outputType;

    private RuleKey(String name, Class<I> inputType, Class<O> outputType) {
        this.name = name;
        this.inputType = inputType;
        this.outputType = outputType;
    }

    public static <I, O> RuleKey<I, O> of(String name, Class<I> inputType, Class<O> outputType) {
        return new RuleKey<>(name, inputType, outputType);
    }
}
