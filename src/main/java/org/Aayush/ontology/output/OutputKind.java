package org.Aayush.ontology.output;

/**
 * Closed set of concrete output kinds.
 */
public enum OutputKind {
    INTEGER,
    FLOAT,
    ORDINAL,
    DATETIME,
    DATETIME_INTERVAL,
    AMOUNT_OF_MONEY,
    TEMPERATURE,
    DURATION,
    PERCENTAGE
}
