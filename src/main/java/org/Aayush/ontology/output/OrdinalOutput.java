package org.Aayush.ontology.output;

public record OrdinalOutput(long value) implements Output {

    @Override
    public OutputKind kind() {
        return OutputKind.ORDINAL;
    }
}
