package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.MomentContext;

import java.util.Objects;

/**
 * The single interval {@code n} grains away from the one containing the reference:
 * "this week" is {@code (WEEK, 0)}, "next month" is {@code (MONTH, 1)}, "last year" is {@code (YEAR, -1)}.
 */
record CycleNthConstraint(Grain grain, int n) implements TimeConstraint {

    CycleNthConstraint {
        Objects.requireNonNull(grain, "grain");
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        if (n >= 0) {
            return Walker.forwardOnly(Candidates.single(() -> {
                Interval target = reference.roundTo(grain).step(n);
                return context.admitsForward(target) ? target : null;
            }));
        }
        return Walker.backwardOnly(Candidates.single(() -> {
            Interval target = reference.roundTo(grain).step(n);
            return context.admitsBackward(target) ? target : null;
        }));
    }
}
