package org.Aayush.ontology.dimension;

import lombok.Builder;
import lombok.Value;
import org.Aayush.ontology.constraint.TimeConstraint;

import java.util.Objects;

/**
 * Temporal value: a constraint plus the flags that shape its resolved output.
 */
@Value
public class DatetimeValue implements Dimension {

    /**
     * Constraint producing candidate intervals.
     */
    TimeConstraint constraint;

    /**
     * Form flags; {@link Form#empty()} when not specified.
     */
    Form form;

    /**
     * Open-ended range marker, or {@code null} for point-in-time and explicit-span values.
     */
    BoundedDirection direction;

    /**
     * Declared precision, forwarded to the output.
     */
    Precision precision;

    /**
     * Whether the value was inferred rather than explicit, forwarded to the output.
     */
    boolean latent;

    /**
     * Declared shape, forwarded to the output.
     */
    DatetimeKind datetimeKind;

    @Builder(toBuilder = true)
    private DatetimeValue(
            TimeConstraint constraint,
            Form form,
            BoundedDirection direction,
            Precision precision,
            boolean latent,
            DatetimeKind datetimeKind
    ) {
        this.constraint = Objects.requireNonNull(constraint, "constraint");
        this.form = form == null ? Form.empty() : form;
        this.direction = direction;
        this.precision = precision == null ? Precision.EXACT : precision;
        this.latent = latent;
        this.datetimeKind = datetimeKind == null ? DatetimeKind.DATE_TIME : datetimeKind;
    }

    /**
     * Creates an exact, explicit date-time value with no form or direction.
     */
    public static DatetimeValue of(TimeConstraint constraint) {
        return DatetimeValue.builder().constraint(constraint).build();
    }

    @Override
    public DimensionKind kind() {
        return DimensionKind.DATETIME;
    }
}
