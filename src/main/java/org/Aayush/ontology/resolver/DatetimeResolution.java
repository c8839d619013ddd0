package org.Aayush.ontology.resolver;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.Moment;
import org.Aayush.core.time.MomentContext;
import org.Aayush.ontology.constraint.Walker;
import org.Aayush.ontology.dimension.Bound;
import org.Aayush.ontology.dimension.BoundedDirection;
import org.Aayush.ontology.dimension.DatetimeValue;
import org.Aayush.ontology.output.DatetimeIntervalKind;
import org.Aayush.ontology.output.DatetimeIntervalOutput;
import org.Aayush.ontology.output.DatetimeOutput;
import org.Aayush.ontology.output.Output;

import java.util.Iterator;
import java.util.Optional;

/**
 * Candidate selection and output mapping for temporal values.
 *
 * <p>Pulls at most two forward candidates and one backward candidate per value.</p>
 */
@Slf4j
final class DatetimeResolution {

    private DatetimeResolution() {
    }

    /**
     * Resolves one temporal value against {@code context}.
     *
     * @return resolved output, or empty when the constraint has no candidate in either direction.
     */
    static Optional<Output> resolve(DatetimeValue value, MomentContext context) {
        Walker walker = value.getConstraint().toWalker(context.reference(), context);
        Interval candidate = selectForward(walker.forward(), value, context.reference());
        if (candidate == null && walker.backward().hasNext()) {
            candidate = walker.backward().next();
        }
        if (candidate == null) {
            log.debug("No candidate interval for {} around {}", value.getConstraint(), context.reference());
            return Optional.empty();
        }
        return Optional.of(toOutput(value, candidate));
    }

    /**
     * Returns the first forward candidate, skipping it once when the value must not be immediate
     * and the candidate overlaps the reference.
     */
    private static Interval selectForward(Iterator<Interval> forward, DatetimeValue value, Interval reference) {
        if (!forward.hasNext()) {
            return null;
        }
        Interval head = forward.next();
        boolean notImmediate = value.getForm().notImmediateFlag().orElse(false);
        if (notImmediate && head.intersect(reference).isPresent()) {
            return forward.hasNext() ? forward.next() : null;
        }
        return head;
    }

    private static Output toOutput(DatetimeValue value, Interval interval) {
        BoundedDirection direction = value.getDirection();
        if (direction != null) {
            DatetimeOutput anchor = pointOutput(value, anchorMoment(direction.bound(), interval), interval);
            DatetimeIntervalKind intervalKind = switch (direction.direction()) {
                case AFTER -> new DatetimeIntervalKind.After(anchor);
                case BEFORE -> new DatetimeIntervalKind.Before(anchor);
            };
            // The range takes its kind from the anchor payload.
            return new DatetimeIntervalOutput(intervalKind, anchor.datetimeKind());
        }
        if (interval.hasEnd()) {
            if (value.getDatetimeKind().isPointLike()) {
                log.warn("{} kind with an interval - {}", value.getDatetimeKind(), interval);
            }
            Moment end = interval.end().orElseThrow();
            return new DatetimeIntervalOutput(
                    new DatetimeIntervalKind.Between(interval.start(), end, value.getPrecision(), value.isLatent()),
                    value.getDatetimeKind()
            );
        }
        return pointOutput(value, interval.start(), interval);
    }

    private static Moment anchorMoment(Bound bound, Interval interval) {
        if (bound.isStart()) {
            return interval.start();
        }
        if (bound.onlyInterval()) {
            return interval.end().orElse(interval.start());
        }
        return interval.endMoment();
    }

    private static DatetimeOutput pointOutput(DatetimeValue value, Moment moment, Interval interval) {
        return new DatetimeOutput(
                moment,
                interval.grain(),
                value.getPrecision(),
                value.isLatent(),
                value.getDatetimeKind()
        );
    }
}
