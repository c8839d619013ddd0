package org.Aayush.ontology.output;

import org.Aayush.ontology.dimension.DatetimeKind;

import java.util.Objects;

/**
 * Resolved temporal range.
 *
 * @param intervalKind span or open-ended range.
 * @param datetimeKind declared shape.
 */
public record DatetimeIntervalOutput(DatetimeIntervalKind intervalKind, DatetimeKind datetimeKind) implements Output {

    public DatetimeIntervalOutput {
        Objects.requireNonNull(intervalKind, "intervalKind");
        Objects.requireNonNull(datetimeKind, "datetimeKind");
    }

    @Override
    public OutputKind kind() {
        return OutputKind.DATETIME_INTERVAL;
    }
}
