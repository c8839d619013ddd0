package org.Aayush.ontology.dimension;

/**
 * Bare currency mention such as "euros", before an amount is attached.
 */
public record MoneyUnitValue(String unit) implements Dimension {

    @Override
    public DimensionKind kind() {
        return DimensionKind.MONEY_UNIT;
    }
}
