package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.Moment;
import org.Aayush.core.time.MomentContext;

import java.util.Iterator;
import java.util.Objects;

/**
 * Explicit spans such as "from Monday to Wednesday" or "9am to 5pm".
 *
 * <p>Each candidate of {@code from} is closed by the first candidate of {@code to} starting at or
 * after it. Inclusive spans end where the closing candidate ends; exclusive spans end where it starts.</p>
 */
record SpanConstraint(TimeConstraint from, TimeConstraint to, boolean inclusive) implements TimeConstraint {

    SpanConstraint {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    @Override
    public Grain grain() {
        return Grain.finer(from.grain(), to.grain());
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        Walker opening = from.toWalker(reference, context);
        return Walker.of(
                Candidates.map(opening.forward(), candidate -> close(candidate, context)),
                Candidates.map(opening.backward(), candidate -> close(candidate, context))
        );
    }

    private Interval close(Interval opening, MomentContext context) {
        Moment start = opening.start();
        Iterator<Interval> closing = to.toWalker(Interval.startingAt(start, to.grain()), context).forward();
        while (closing.hasNext()) {
            Interval candidate = closing.next();
            if (candidate.start().isBefore(start)) {
                continue;
            }
            Moment end = inclusive ? candidate.endMoment() : candidate.start();
            return end.isAfter(start) ? Interval.of(start, end, grain()) : null;
        }
        return null;
    }
}
