package org.Aayush.ontology.dimension;

/**
 * Decimal number such as "3.5".
 */
public record FloatValue(double value) implements NumberValue {
}
