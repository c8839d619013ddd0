package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.Moment;
import org.Aayush.core.time.MomentContext;

import java.time.Year;
import java.time.ZonedDateTime;

/**
 * One explicit calendar year, placed forward when it ends after the reference and backward otherwise.
 */
record YearConstraint(int year) implements TimeConstraint {

    YearConstraint {
        if (year < Year.MIN_VALUE || year > Year.MAX_VALUE) {
            throw new IllegalArgumentException("year out of range: " + year);
        }
    }

    @Override
    public Grain grain() {
        return Grain.YEAR;
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        ZonedDateTime start = ZonedDateTime.of(year, 1, 1, 0, 0, 0, 0, reference.start().dateTime().getZone());
        Interval candidate = Interval.startingAt(new Moment(start), Grain.YEAR);
        // Ends after the reference start.
        if (year >= reference.start().dateTime().getYear()) {
            return context.admitsForward(candidate)
                    ? Walker.forwardOnly(Candidates.single(() -> candidate))
                    : Walker.empty();
        }
        return context.admitsBackward(candidate)
                ? Walker.backwardOnly(Candidates.single(() -> candidate))
                : Walker.empty();
    }
}
