package org.Aayush.ontology.output;

import org.Aayush.core.time.Moment;
import org.Aayush.ontology.dimension.Precision;

import java.util.Objects;

/**
 * Shape of a resolved temporal range: an explicit span, or a range open on one side.
 */
public interface DatetimeIntervalKind {

    /**
     * Explicit span {@code [start, end)}.
     */
    record Between(Moment start, Moment end, Precision precision, boolean latent) implements DatetimeIntervalKind {
        public Between {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
            Objects.requireNonNull(precision, "precision");
        }
    }

    /**
     * Everything before the anchor.
     */
    record Before(DatetimeOutput anchor) implements DatetimeIntervalKind {
        public Before {
            Objects.requireNonNull(anchor, "anchor");
        }
    }

    /**
     * Everything after the anchor.
     */
    record After(DatetimeOutput anchor) implements DatetimeIntervalKind {
        public After {
            Objects.requireNonNull(anchor, "anchor");
        }
    }
}
