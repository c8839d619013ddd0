package org.Aayush.ontology.dimension;

/**
 * Percentage such as "12.5%".
 */
public record PercentageValue(double value) implements Dimension {

    @Override
    public DimensionKind kind() {
        return DimensionKind.PERCENTAGE;
    }
}
