package org.Aayush.core.time;

import lombok.EqualsAndHashCode;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable span {@code [start, end)} tagged with a {@link Grain}.
 *
 * <p>When no explicit end is present the interval covers exactly one grain from its start;
 * see {@link #endMoment()}.</p>
 */
@EqualsAndHashCode
public final class Interval {
    private final Moment start;
    private final Moment end;
    private final Grain grain;

    private Interval(Moment start, Moment end, Grain grain) {
        this.start = Objects.requireNonNull(start, "start");
        this.grain = Objects.requireNonNull(grain, "grain");
        if (end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("interval end " + end + " precedes start " + start);
        }
        this.end = end;
    }

    /**
     * Creates an interval without explicit end.
     */
    public static Interval startingAt(Moment start, Grain grain) {
        return new Interval(start, null, grain);
    }

    /**
     * Creates an interval with an explicit end.
     */
    public static Interval of(Moment start, Moment end, Grain grain) {
        return new Interval(start, Objects.requireNonNull(end, "end"), grain);
    }

    public Moment start() {
        return start;
    }

    /**
     * Returns the explicit end, or empty for single-grain intervals.
     */
    public Optional<Moment> end() {
        return Optional.ofNullable(end);
    }

    public Grain grain() {
        return grain;
    }

    public boolean hasEnd() {
        return end != null;
    }

    /**
     * Returns the explicit end, or {@code start + 1 grain} when absent.
     */
    public Moment endMoment() {
        return end != null ? end : start.plus(1, grain);
    }

    /**
     * Intersects this interval with {@code other}.
     *
     * <p>When the later-starting interval is fully covered by the earlier one it is returned
     * unchanged; otherwise the overlap is returned with an explicit end and the finer grain.</p>
     *
     * @param other interval to intersect with.
     * @return overlap, or empty when the spans are disjoint.
     */
    public Optional<Interval> intersect(Interval other) {
        Objects.requireNonNull(other, "other");
        Interval earlier = this;
        Interval later = other;
        if (other.start.isBefore(start)) {
            earlier = other;
            later = this;
        }
        Moment earlierEnd = earlier.endMoment();
        if (!earlierEnd.isAfter(later.start)) {
            return Optional.empty();
        }
        if (!later.endMoment().isAfter(earlierEnd)) {
            return Optional.of(later);
        }
        return Optional.of(new Interval(later.start, earlierEnd, Grain.finer(earlier.grain, later.grain)));
    }

    /**
     * Returns the single-grain interval of {@code newGrain} containing this interval's start.
     */
    public Interval roundTo(Grain newGrain) {
        return startingAt(start.roundTo(newGrain), newGrain);
    }

    /**
     * Returns this interval moved by {@code amount} units of {@code shiftGrain}, keeping its grain.
     */
    public Interval shift(long amount, Grain shiftGrain) {
        Moment shiftedEnd = end == null ? null : end.plus(amount, shiftGrain);
        return new Interval(start.plus(amount, shiftGrain), shiftedEnd, grain);
    }

    /**
     * Returns the single-grain interval {@code steps} grains after this one (before it when negative).
     *
     * <p>The result is re-aligned to its grain, so a start pushed off midnight by a daylight-saving
     * gap does not carry over to later steps.</p>
     */
    public Interval step(long steps) {
        return startingAt(start.plus(steps, grain).roundTo(grain), grain);
    }

    @Override
    public String toString() {
        return "Interval[" + start + (end == null ? "" : " .. " + end) + ", " + grain + "]";
    }
}
