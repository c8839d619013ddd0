package org.Aayush.ontology.constraint;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import lombok.experimental.UtilityClass;
import org.Aayush.core.time.Grain;

import java.time.DayOfWeek;
import java.time.temporal.ChronoField;
import java.util.Objects;

/**
 * Factory for the built-in {@link TimeConstraint} implementations.
 *
 * <p>Combine the results with {@link TimeConstraint#intersect}, {@link TimeConstraint#spanTo},
 * {@link TimeConstraint#shiftBy} and {@link TimeConstraint#takeNth}.</p>
 */
@UtilityClass
public final class TimeConstraints {

    /**
     * Every {@code grain}-aligned interval.
     */
    public static TimeConstraint cycle(Grain grain) {
        return new CycleConstraint(grain);
    }

    /**
     * The interval {@code n} grains from the one containing the reference.
     */
    public static TimeConstraint cycleNth(Grain grain, int n) {
        return new CycleNthConstraint(grain, n);
    }

    /**
     * Days falling on any of the given days of week.
     */
    public static TimeConstraint dayOfWeek(DayOfWeek first, DayOfWeek... rest) {
        IntSortedSet values = new IntRBTreeSet();
        values.add(Objects.requireNonNull(first, "first").getValue());
        for (DayOfWeek day : rest) {
            values.add(Objects.requireNonNull(day, "day").getValue());
        }
        return new CalendarFieldConstraint(ChronoField.DAY_OF_WEEK, values, Grain.DAY);
    }

    /**
     * Months with any of the given month numbers (1 = January).
     */
    public static TimeConstraint month(int... months) {
        return new CalendarFieldConstraint(ChronoField.MONTH_OF_YEAR, valuesOf(months), Grain.MONTH);
    }

    /**
     * Days with any of the given day-of-month numbers; months lacking the day are skipped.
     */
    public static TimeConstraint dayOfMonth(int... days) {
        return new CalendarFieldConstraint(ChronoField.DAY_OF_MONTH, valuesOf(days), Grain.DAY);
    }

    /**
     * Hours of day; on a twelve-hour clock {@code 5} matches both 05:00 and 17:00.
     *
     * @param hour hour in {@code [0, 23]}.
     * @param twelveHourClock whether {@code hour} is ambiguous between am and pm.
     */
    public static TimeConstraint hour(int hour, boolean twelveHourClock) {
        IntSortedSet values = new IntRBTreeSet();
        if (twelveHourClock && hour >= 1 && hour <= 12) {
            values.add(hour % 12);
            values.add(hour % 12 + 12);
        } else {
            values.add(hour);
        }
        return new CalendarFieldConstraint(ChronoField.HOUR_OF_DAY, values, Grain.HOUR);
    }

    /**
     * Minutes of hour.
     */
    public static TimeConstraint minute(int... minutes) {
        return new CalendarFieldConstraint(ChronoField.MINUTE_OF_HOUR, valuesOf(minutes), Grain.MINUTE);
    }

    /**
     * One explicit calendar year.
     */
    public static TimeConstraint year(int year) {
        return new YearConstraint(year);
    }

    private static IntSortedSet valuesOf(int... values) {
        Objects.requireNonNull(values, "values");
        return new IntRBTreeSet(values);
    }
}
