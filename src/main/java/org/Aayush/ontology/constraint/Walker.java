package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Interval;

import java.util.Iterator;
import java.util.Objects;

/**
 * Pair of lazy candidate sequences produced by a {@link TimeConstraint}.
 *
 * <p>{@link #forward()} yields candidates at or after the reference in increasing start order;
 * {@link #backward()} yields candidates before the reference in decreasing start order.
 * Both sequences are stateful, non-restartable and must not be shared across threads.</p>
 */
public final class Walker {
    private static final Walker EMPTY = new Walker(Candidates.empty(), Candidates.empty());

    private final Iterator<Interval> forward;
    private final Iterator<Interval> backward;

    private Walker(Iterator<Interval> forward, Iterator<Interval> backward) {
        this.forward = Objects.requireNonNull(forward, "forward");
        this.backward = Objects.requireNonNull(backward, "backward");
    }

    public static Walker of(Iterator<Interval> forward, Iterator<Interval> backward) {
        return new Walker(forward, backward);
    }

    public static Walker forwardOnly(Iterator<Interval> forward) {
        return new Walker(forward, Candidates.empty());
    }

    public static Walker backwardOnly(Iterator<Interval> backward) {
        return new Walker(Candidates.empty(), backward);
    }

    /**
     * Returns a walker with no candidates in either direction.
     */
    public static Walker empty() {
        return EMPTY;
    }

    /**
     * Returns the forward sequence; every call returns the same stateful iterator.
     */
    public Iterator<Interval> forward() {
        return forward;
    }

    /**
     * Returns the backward sequence; every call returns the same stateful iterator.
     */
    public Iterator<Interval> backward() {
        return backward;
    }
}
