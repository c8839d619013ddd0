package org.Aayush.core.time;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.time.temporal.ChronoUnit;

/**
 * Calendar granularity of an {@link Interval}, declared coarse to fine.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum Grain {
    YEAR(ChronoUnit.YEARS, 1),
    QUARTER(ChronoUnit.MONTHS, 3),
    MONTH(ChronoUnit.MONTHS, 1),
    WEEK(ChronoUnit.WEEKS, 1),
    DAY(ChronoUnit.DAYS, 1),
    HOUR(ChronoUnit.HOURS, 1),
    MINUTE(ChronoUnit.MINUTES, 1),
    SECOND(ChronoUnit.SECONDS, 1);

    /** Underlying {@code java.time} unit. */
    private final ChronoUnit unit;
    /** Number of {@link #unit} steps in one grain. */
    private final int multiplier;

    /**
     * Returns {@code true} when this grain is strictly coarser than {@code other}.
     */
    public boolean isCoarserThan(Grain other) {
        return ordinal() < other.ordinal();
    }

    /**
     * Returns the finer of the two grains.
     */
    public static Grain finer(Grain a, Grain b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
