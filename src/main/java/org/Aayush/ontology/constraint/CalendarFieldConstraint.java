package org.Aayush.ontology.constraint;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.MomentContext;

import java.time.temporal.ChronoField;
import java.util.Objects;

/**
 * Intervals of {@code grain} whose calendar {@code field} takes one of the allowed values,
 * for example Mondays, March, the 13th, or 5pm.
 *
 * <p>Allowed values are held in a primitive sorted set so the per-step membership test in the
 * walker does not box.</p>
 */
record CalendarFieldConstraint(ChronoField field, IntSortedSet allowedValues, Grain grain) implements TimeConstraint {

    CalendarFieldConstraint {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(allowedValues, "allowedValues");
        Objects.requireNonNull(grain, "grain");
        if (allowedValues.isEmpty()) {
            throw new IllegalArgumentException(field + " constraint needs at least one value");
        }
        for (int value : allowedValues) {
            if (!field.range().isValidIntValue(value)) {
                throw new IllegalArgumentException(field + " value out of range: " + value);
            }
        }
        allowedValues = IntSortedSets.unmodifiable(new IntRBTreeSet(allowedValues));
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        Interval head = reference.roundTo(grain);
        return Walker.of(
                Candidates.filter(
                        Candidates.iterate(head, interval -> interval.step(1), context::admitsForward),
                        this::matches
                ),
                Candidates.filter(
                        Candidates.iterate(head.step(-1), interval -> interval.step(-1), context::admitsBackward),
                        this::matches
                )
        );
    }

    private boolean matches(Interval candidate) {
        return allowedValues.contains(candidate.start().dateTime().get(field));
    }
}
