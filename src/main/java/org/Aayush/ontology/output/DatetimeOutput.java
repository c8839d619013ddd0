package org.Aayush.ontology.output;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Moment;
import org.Aayush.ontology.dimension.DatetimeKind;
import org.Aayush.ontology.dimension.Precision;

import java.util.Objects;

/**
 * Resolved point in time at a grain, such as "Monday 1970-01-05" at day grain.
 *
 * @param moment start of the resolved period.
 * @param grain granularity of the resolved period.
 * @param precision declared precision.
 * @param latent whether the value was inferred.
 * @param datetimeKind declared shape.
 */
public record DatetimeOutput(
        Moment moment,
        Grain grain,
        Precision precision,
        boolean latent,
        DatetimeKind datetimeKind
) implements Output {

    public DatetimeOutput {
        Objects.requireNonNull(moment, "moment");
        Objects.requireNonNull(grain, "grain");
        Objects.requireNonNull(precision, "precision");
        Objects.requireNonNull(datetimeKind, "datetimeKind");
    }

    @Override
    public OutputKind kind() {
        return OutputKind.DATETIME;
    }
}
