package org.Aayush.ontology.output;

public record IntegerOutput(long value) implements Output {

    @Override
    public OutputKind kind() {
        return OutputKind.INTEGER;
    }
}
