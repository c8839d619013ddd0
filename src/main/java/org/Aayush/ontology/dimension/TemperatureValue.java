package org.Aayush.ontology.dimension;

/**
 * Temperature such as "21 degrees celsius".
 *
 * @param value numeric temperature.
 * @param unit unit name, or {@code null} when not stated.
 * @param latent whether the temperature was inferred rather than explicit.
 */
public record TemperatureValue(double value, String unit, boolean latent) implements Dimension {

    @Override
    public DimensionKind kind() {
        return DimensionKind.TEMPERATURE;
    }
}
