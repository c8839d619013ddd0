package org.Aayush.ontology.dimension;

/**
 * Minute offset relative to an hour, such as "quarter" in "quarter past five".
 */
public record RelativeMinuteValue(int value) implements Dimension {

    @Override
    public DimensionKind kind() {
        return DimensionKind.RELATIVE_MINUTE;
    }
}
