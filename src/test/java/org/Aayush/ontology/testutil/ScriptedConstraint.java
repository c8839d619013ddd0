package org.Aayush.ontology.testutil;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.MomentContext;
import org.Aayush.ontology.constraint.TimeConstraint;
import org.Aayush.ontology.constraint.Walker;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Constraint replaying fixed candidate lists and counting how many candidates were pulled.
 */
public final class ScriptedConstraint implements TimeConstraint {
    private final Grain grain;
    private final List<Interval> forward;
    private final List<Interval> backward;
    private int forwardPulls;
    private int backwardPulls;
    private int walkersCreated;

    public ScriptedConstraint(Grain grain, List<Interval> forward, List<Interval> backward) {
        this.grain = grain;
        this.forward = List.copyOf(forward);
        this.backward = List.copyOf(backward);
    }

    public static ScriptedConstraint forward(Interval... candidates) {
        return new ScriptedConstraint(Grain.DAY, List.of(candidates), List.of());
    }

    @Override
    public Grain grain() {
        return grain;
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        walkersCreated++;
        return Walker.of(new Counting(forward.iterator(), true), new Counting(backward.iterator(), false));
    }

    public int forwardPulls() {
        return forwardPulls;
    }

    public int backwardPulls() {
        return backwardPulls;
    }

    public int walkersCreated() {
        return walkersCreated;
    }

    private final class Counting implements Iterator<Interval> {
        private final Iterator<Interval> delegate;
        private final boolean isForward;

        private Counting(Iterator<Interval> delegate, boolean isForward) {
            this.delegate = delegate;
            this.isForward = isForward;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public Interval next() {
            if (!delegate.hasNext()) {
                throw new NoSuchElementException();
            }
            if (isForward) {
                forwardPulls++;
            } else {
                backwardPulls++;
            }
            return delegate.next();
        }
    }
}
