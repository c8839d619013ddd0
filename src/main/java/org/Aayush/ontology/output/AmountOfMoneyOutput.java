package org.Aayush.ontology.output;

import org.Aayush.ontology.dimension.Precision;

/**
 * Resolved amount of money.
 *
 * @param value numeric amount.
 * @param precision declared precision.
 * @param unit currency code, or {@code null} when not stated.
 */
public record AmountOfMoneyOutput(double value, Precision precision, String unit) implements Output {

    @Override
    public OutputKind kind() {
        return OutputKind.AMOUNT_OF_MONEY;
    }
}
