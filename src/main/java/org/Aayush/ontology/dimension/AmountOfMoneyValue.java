package org.Aayush.ontology.dimension;

import java.util.Objects;

/**
 * Amount of money such as "about 42.5 dollars".
 *
 * @param value numeric amount.
 * @param precision declared precision.
 * @param unit currency code, or {@code null} when the currency is not stated.
 * @param latent whether the amount was inferred rather than explicit.
 */
public record AmountOfMoneyValue(double value, Precision precision, String unit, boolean latent) implements Dimension {

    public AmountOfMoneyValue {
        Objects.requireNonNull(precision, "precision");
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.AMOUNT_OF_MONEY;
    }
}
