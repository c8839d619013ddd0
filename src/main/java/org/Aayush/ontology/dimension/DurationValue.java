package org.Aayush.ontology.dimension;

import org.Aayush.core.time.Period;

import java.util.Objects;

/**
 * Duration such as "two days and three hours".
 *
 * @param period amount per grain.
 * @param precision declared precision.
 * @param prefixed whether a prefix such as "for" introduced the duration.
 * @param suffixed whether a suffix such as "long" closed the duration.
 */
public record DurationValue(Period period, Precision precision, boolean prefixed, boolean suffixed) implements Dimension {

    public DurationValue {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(precision, "precision");
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.DURATION;
    }
}
