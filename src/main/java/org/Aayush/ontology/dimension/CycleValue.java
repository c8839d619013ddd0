package org.Aayush.ontology.dimension;

import org.Aayush.core.time.Grain;

/**
 * Bare calendar cycle such as "week", before it is anchored ("next week").
 */
public record CycleValue(Grain grain) implements Dimension {

    @Override
    public DimensionKind kind() {
        return DimensionKind.CYCLE;
    }
}
