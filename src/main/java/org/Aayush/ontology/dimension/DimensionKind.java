package org.Aayush.ontology.dimension;

/**
 * Closed set of abstract value kinds produced by the grammar layer.
 */
public enum DimensionKind {
    NUMBER,
    ORDINAL,
    AMOUNT_OF_MONEY,
    TEMPERATURE,
    DURATION,
    PERCENTAGE,
    DATETIME,
    // Intermediate kinds used while combining rules; they have no resolved output.
    MONEY_UNIT,
    CYCLE,
    UNIT_OF_DURATION,
    RELATIVE_MINUTE
}
