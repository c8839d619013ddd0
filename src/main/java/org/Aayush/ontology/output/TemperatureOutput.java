package org.Aayush.ontology.output;

/**
 * Resolved temperature.
 *
 * @param value numeric temperature.
 * @param unit unit name, or {@code null} when not stated.
 * @param latent whether the temperature was inferred.
 */
public record TemperatureOutput(double value, String unit, boolean latent) implements Output {

    @Override
    public OutputKind kind() {
        return OutputKind.TEMPERATURE;
    }
}
