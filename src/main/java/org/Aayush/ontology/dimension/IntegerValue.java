package org.Aayush.ontology.dimension;

/**
 * Whole number such as "42" or "three hundred".
 *
 * @param value numeric value.
 * @param grain power of ten of the last spoken multiplier ("three hundred" has grain 2), or {@code null}.
 * @param group whether digits were written with group separators.
 */
public record IntegerValue(long value, Integer grain, boolean group) implements NumberValue {

    public static IntegerValue of(long value) {
        return new IntegerValue(value, null, false);
    }
}
