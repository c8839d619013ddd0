package org.Aayush.ontology.output;

import org.Aayush.core.time.Period;
import org.Aayush.ontology.dimension.Precision;

public record DurationOutput(Period period, Precision precision) implements Output {

    @Override
    public OutputKind kind() {
        return OutputKind.DURATION;
    }
}
