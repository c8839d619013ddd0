package org.Aayush.ontology.output;

public record PercentageOutput(double value) implements Output {

    @Override
    public OutputKind kind() {
        return OutputKind.PERCENTAGE;
    }
}
