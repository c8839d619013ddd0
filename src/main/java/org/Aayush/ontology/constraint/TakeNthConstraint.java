package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.Moment;
import org.Aayush.core.time.MomentContext;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Exactly one candidate of {@code inner}: index {@code n} of the forward sequence when
 * {@code n >= 0}, index {@code -n - 1} of the backward sequence otherwise.
 */
record TakeNthConstraint(TimeConstraint inner, int n) implements TimeConstraint {

    TakeNthConstraint {
        Objects.requireNonNull(inner, "inner");
    }

    @Override
    public Grain grain() {
        return inner.grain();
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        Moment origin = reference.start();
        Supplier<Interval> chosen = new Memo(() -> pick(inner.toWalker(reference, context)));
        return Walker.of(
                Candidates.single(() -> {
                    Interval candidate = chosen.get();
                    return candidate != null && candidate.endMoment().isAfter(origin) ? candidate : null;
                }),
                Candidates.single(() -> {
                    Interval candidate = chosen.get();
                    return candidate != null && !candidate.endMoment().isAfter(origin) ? candidate : null;
                })
        );
    }

    private Interval pick(Walker walker) {
        Iterator<Interval> source = n >= 0 ? walker.forward() : walker.backward();
        int index = n >= 0 ? n : -n - 1;
        for (int i = 0; i < index && source.hasNext(); i++) {
            source.next();
        }
        return source.hasNext() ? source.next() : null;
    }

    private static final class Memo implements Supplier<Interval> {
        private final Supplier<Interval> delegate;
        private boolean computed;
        private Interval value;

        private Memo(Supplier<Interval> delegate) {
            this.delegate = delegate;
        }

        @Override
        public Interval get() {
            if (!computed) {
                value = delegate.get();
                computed = true;
            }
            return value;
        }
    }
}
