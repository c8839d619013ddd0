package org.Aayush.core.time;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable calendar duration expressed as one amount per {@link Grain}.
 */
public final class Period {
    private static final Grain[] GRAINS = Grain.values();
    private static final Period EMPTY = new Period(new long[GRAINS.length]);

    // Indexed by Grain.ordinal().
    private final long[] amounts;

    private Period(long[] amounts) {
        this.amounts = amounts;
    }

    public static Period empty() {
        return EMPTY;
    }

    /**
     * Creates a period holding {@code amount} units of one grain.
     */
    public static Period of(Grain grain, long amount) {
        Objects.requireNonNull(grain, "grain");
        long[] values = new long[GRAINS.length];
        values[grain.ordinal()] = amount;
        return new Period(values);
    }

    /**
     * Returns the component-wise sum of this period and {@code other}.
     */
    public Period plus(Period other) {
        Objects.requireNonNull(other, "other");
        long[] values = amounts.clone();
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.addExact(values[i], other.amounts[i]);
        }
        return new Period(values);
    }

    public long get(Grain grain) {
        return amounts[grain.ordinal()];
    }

    public boolean isEmpty() {
        for (long amount : amounts) {
            if (amount != 0L) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Period)) {
            return false;
        }
        return Arrays.equals(amounts, ((Period) o).amounts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(amounts);
    }

    /**
     * Formats the period as ISO-8601 style text, for example {@code P1W2DT3H}.
     */
    @Override
    public String toString() {
        StringBuilder date = new StringBuilder("P");
        StringBuilder time = new StringBuilder();
        appendComponent(date, Grain.YEAR, "Y");
        appendComponent(date, Grain.QUARTER, "Q");
        appendComponent(date, Grain.MONTH, "M");
        appendComponent(date, Grain.WEEK, "W");
        appendComponent(date, Grain.DAY, "D");
        appendComponent(time, Grain.HOUR, "H");
        appendComponent(time, Grain.MINUTE, "M");
        appendComponent(time, Grain.SECOND, "S");
        if (time.length() > 0) {
            date.append('T').append(time);
        } else if (isEmpty()) {
            date.append("0D");
        }
        return date.toString();
    }

    private void appendComponent(StringBuilder builder, Grain grain, String suffix) {
        long amount = get(grain);
        if (amount != 0L) {
            builder.append(amount).append(suffix);
        }
    }
}
