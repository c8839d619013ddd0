package org.Aayush.core.time;

import java.time.DateTimeException;
import java.util.Objects;

/**
 * Immutable reference instant plus the admissible window walkers stay within.
 *
 * <p>The canonical constructor enforces {@code min.start <= reference.start <= max.start} and
 * requires {@value #EDGE_HEADROOM_YEARS} years of representable time beyond each edge, since
 * walkers step past the window before stopping.</p>
 *
 * @param reference "now" anchor.
 * @param min earliest admissible interval.
 * @param max latest admissible interval.
 */
public record MomentContext(Interval reference, Interval min, Interval max) {
    public static final int DEFAULT_WINDOW_YEARS = 20;
    public static final int EDGE_HEADROOM_YEARS = 2;

    public MomentContext {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.start().isAfter(reference.start())) {
            throw new IllegalArgumentException("min " + min.start() + " is after reference " + reference.start());
        }
        if (reference.start().isAfter(max.start())) {
            throw new IllegalArgumentException("max " + max.start() + " is before reference " + reference.start());
        }
        requireHeadroom(min.start(), -EDGE_HEADROOM_YEARS);
        requireHeadroom(max.start(), EDGE_HEADROOM_YEARS);
    }

    /**
     * Creates a context whose window spans {@link #DEFAULT_WINDOW_YEARS} years around {@code now}.
     */
    public static MomentContext forReference(Interval now) {
        return forReference(now, DEFAULT_WINDOW_YEARS);
    }

    /**
     * Creates a context whose window spans {@code windowYears} years on both sides of {@code now}.
     *
     * @param now reference interval.
     * @param windowYears positive number of years.
     * @return context anchored at {@code now}.
     * @throws IllegalArgumentException when {@code windowYears} is not positive or the window
     *                                  leaves the representable range.
     */
    public static MomentContext forReference(Interval now, int windowYears) {
        Objects.requireNonNull(now, "now");
        if (windowYears <= 0) {
            throw new IllegalArgumentException("windowYears must be positive, got " + windowYears);
        }
        Interval min = Interval.startingAt(shiftYears(now.start(), -windowYears), Grain.SECOND);
        Interval max = Interval.startingAt(shiftYears(now.start(), windowYears), Grain.SECOND);
        return new MomentContext(now, min, max);
    }

    private static Moment shiftYears(Moment moment, int years) {
        try {
            return moment.plus(years, Grain.YEAR);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException(
                    "window of " + Math.abs(years) + " years around " + moment + " leaves the representable range",
                    ex
            );
        }
    }

    private static void requireHeadroom(Moment edge, int years) {
        try {
            edge.plus(years, Grain.YEAR);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException(
                    "window edge " + edge + " needs " + Math.abs(years) + " representable years beyond it",
                    ex
            );
        }
    }

    /**
     * Returns whether a forward-walking candidate is still inside the window.
     */
    public boolean admitsForward(Interval candidate) {
        return candidate.start().isBefore(max.endMoment());
    }

    /**
     * Returns whether a backward-walking candidate is still inside the window.
     */
    public boolean admitsBackward(Interval candidate) {
        return candidate.endMoment().isAfter(min.start());
    }
}
