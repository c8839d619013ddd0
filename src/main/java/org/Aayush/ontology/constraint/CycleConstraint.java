package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.MomentContext;

import java.util.Objects;

/**
 * Every {@code grain}-aligned interval, for example "a day" or "weeks".
 *
 * <p>The forward sequence starts with the interval containing the reference.</p>
 */
record CycleConstraint(Grain grain) implements TimeConstraint {

    CycleConstraint {
        Objects.requireNonNull(grain, "grain");
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        Interval head = reference.roundTo(grain);
        return Walker.of(
                Candidates.iterate(head, interval -> interval.step(1), context::admitsForward),
                Candidates.iterate(head.step(-1), interval -> interval.step(-1), context::admitsBackward)
        );
    }
}
