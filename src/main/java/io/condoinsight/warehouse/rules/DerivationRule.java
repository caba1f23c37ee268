package io.condoinsight.warehouse.rules;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.function.Function;

/**
 * A named, versioned pure function used to derive a computed staging field.
 *
 * <p>{@code signature} describes the parameters baked into the function (band
 * edges, lookup tables). It feeds the registry's content hash, so editing a
 * threshold changes {@code rulesVersion} even when the version number is not bumped.
 */
@Getter
@Builder
@ToString(exclude = "function")
public class DerivationRule<I, O> {

    @NonNull
    private final RuleKey<I, O> key;

    private final int version;

    private final String description;

    @Singular
    private final List<String> inputs;

    @NonNull
    private final String signature;

    @NonNull
    private final Function<I, O> function;

    public String getName() {
        return key.getName();
    }

    public O apply(I input) {
        return function.apply(input);
    }

    /** Applies the rule to an input whose type is checked against the key. */
    Object applyErased(Object input) {
        return function.apply(key.getInputType().cast(input));
    }

        String fingerprintSource() {
        return getName() + ":v" + version + ":" + signature;
    }
}
