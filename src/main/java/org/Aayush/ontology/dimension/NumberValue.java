package org.Aayush.ontology.dimension;

/**
 * Numeric value: either {@link IntegerValue} or {@link FloatValue}.
 */
public interface NumberValue extends Dimension {

    @Override
    default DimensionKind kind() {
        return DimensionKind.NUMBER;
    }
}
