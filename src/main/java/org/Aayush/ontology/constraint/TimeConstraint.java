package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.MomentContext;

/**
 * Abstract, not-yet-anchored temporal expression.
 *
 * <p>Implementations must be immutable and side-effect free: every call to
 * {@link #toWalker(Interval, MomentContext)} returns a fresh walker whose sequences depend only
 * on the arguments.</p>
 */
public interface TimeConstraint {

    /**
     * Returns the grain of the candidates this constraint produces.
     */
    Grain grain();

    /**
     * Creates the candidate walker anchored at {@code reference}.
     *
     * @param reference anchor the forward and backward sequences are split around.
     * @param context window the sequences must stay within.
     * @return fresh walker owned by the caller.
     */
    Walker toWalker(Interval reference, MomentContext context);

    /**
     * Returns the constraint matching both this one and {@code other}.
     */
    default TimeConstraint intersect(TimeConstraint other) {
        return new IntersectConstraint(this, other);
    }

    /**
     * Returns the span from each candidate of this constraint to the next candidate of {@code to}.
     *
     * @param to closing constraint.
     * @param inclusive whether the closing candidate itself is part of the span.
     */
    default TimeConstraint spanTo(TimeConstraint to, boolean inclusive) {
        return new SpanConstraint(this, to, inclusive);
    }

    /**
     * Returns this constraint with every candidate moved by {@code amount} grains.
     */
    default TimeConstraint shiftBy(long amount, Grain shiftGrain) {
        return new ShiftByConstraint(this, amount, shiftGrain);
    }

    /**
     * Returns the single {@code n}-th candidate: forward from 0 when {@code n >= 0},
     * backward from -1 otherwise.
     */
    default TimeConstraint takeNth(int n) {
        return new TakeNthConstraint(this, n);
    }
}
