package org.Aayush.ontology.dimension;

/**
 * Shape of a temporal expression as declared by the grammar rule that built it.
 */
public enum DatetimeKind {
    DATE,
    TIME,
    DATE_TIME,
    DATE_PERIOD,
    TIME_PERIOD,
    DATE_TIME_COMPLEMENT,
    EMPTY;

    /**
     * Returns {@code true} for kinds that denote a single date or time rather than a span.
     */
    public boolean isPointLike() {
        return this == DATE || this == TIME;
    }
}
