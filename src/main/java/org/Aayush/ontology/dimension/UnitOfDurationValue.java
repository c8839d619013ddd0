package org.Aayush.ontology.dimension;

import org.Aayush.core.time.Grain;

/**
 * Bare duration unit such as "hours", before an amount is attached.
 */
public record UnitOfDurationValue(Grain grain) implements Dimension {

    @Override
    public DimensionKind kind() {
        return DimensionKind.UNIT_OF_DURATION;
    }
}
