package org.Aayush.ontology.output;

public record FloatOutput(double value) implements Output {

    @Override
    public OutputKind kind() {
        return OutputKind.FLOAT;
    }
}
