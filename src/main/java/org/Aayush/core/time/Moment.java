package org.Aayush.core.time;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Immutable point in time bound to a zone.
 *
 * <p>Ordering follows the instant on the time line; equality also compares the zone.</p>
 */
public record Moment(ZonedDateTime dateTime) implements Comparable<Moment> {

    public Moment {
        Objects.requireNonNull(dateTime, "dateTime");
    }

    /**
     * Creates a moment from epoch seconds in the given zone.
     *
     * @param epochSeconds Unix timestamp in seconds.
     * @param zoneId zone the moment is expressed in.
     * @return moment at {@code epochSeconds}.
     */
    public static Moment ofEpochSeconds(long epochSeconds, ZoneId zoneId) {
        Objects.requireNonNull(zoneId, "zoneId");
        TimeUtils.requireRepresentableEpochSecond(epochSeconds);
        return new Moment(ZonedDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), zoneId));
    }

    /**
     * Returns this moment shifted by {@code amount} grains (negative shifts go back in time).
     */
    public Moment plus(long amount, Grain grain) {
        return new Moment(dateTime.plus(Math.multiplyExact(amount, (long) grain.multiplier()), grain.unit()));
    }

    /**
     * Returns the start of the {@code grain} period containing this moment.
     *
     * <p>Weeks start on Monday; quarters start in January, April, July and October.</p>
     */
    public Moment roundTo(Grain grain) {
        ZonedDateTime rounded = switch (grain) {
            case SECOND -> dateTime.truncatedTo(ChronoUnit.SECONDS);
            case MINUTE -> dateTime.truncatedTo(ChronoUnit.MINUTES);
            case HOUR -> dateTime.truncatedTo(ChronoUnit.HOURS);
            case DAY -> dateTime.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> dateTime.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> dateTime.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
            case QUARTER -> dateTime.truncatedTo(ChronoUnit.DAYS)
                    .withDayOfMonth(1)
                    .withMonth(((dateTime.getMonthValue() - 1) / 3) * 3 + 1);
            case YEAR -> dateTime.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
        };
        return new Moment(rounded);
    }

    public long toEpochSecond() {
        return dateTime.toEpochSecond();
    }

    public boolean isBefore(Moment other) {
        return dateTime.toInstant().isBefore(other.dateTime.toInstant());
    }

    public boolean isAfter(Moment other) {
        return dateTime.toInstant().isAfter(other.dateTime.toInstant());
    }

    @Override
    public int compareTo(Moment other) {
        return dateTime.toInstant().compareTo(other.dateTime.toInstant());
    }

    @Override
    public String toString() {
        return dateTime.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
