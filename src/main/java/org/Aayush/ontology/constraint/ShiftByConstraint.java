package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.MomentContext;

import java.util.Objects;

/**
 * Candidates of {@code inner} moved by a fixed amount, for example "in 3 days" or "2 hours ago".
 *
 * <p>Shifted candidates keep their grain and stay in the sequence they came from.</p>
 */
record ShiftByConstraint(TimeConstraint inner, long amount, Grain shiftGrain) implements TimeConstraint {

    ShiftByConstraint {
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(shiftGrain, "shiftGrain");
    }

    @Override
    public Grain grain() {
        return inner.grain();
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        Walker source = inner.toWalker(reference, context);
        return Walker.of(
                Candidates.map(source.forward(), candidate -> candidate.shift(amount, shiftGrain)),
                Candidates.map(source.backward(), candidate -> candidate.shift(amount, shiftGrain))
        );
    }
}
