package org.Aayush.ontology.dimension;

/**
 * Ordinal such as "third".
 *
 * @param value ordinal position.
 * @param prefixed whether the ordinal was introduced by a prefix ("the 3rd").
 */
public record OrdinalValue(long value, boolean prefixed) implements Dimension {

    @Override
    public DimensionKind kind() {
        return DimensionKind.ORDINAL;
    }
}
