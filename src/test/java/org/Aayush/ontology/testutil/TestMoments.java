package org.Aayush.ontology.testutil;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.Moment;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * UTC moment and interval builders shared by resolver and constraint tests.
 */
public final class TestMoments {

    private TestMoments() {
    }

    public static Moment utc(int year, int month, int day) {
        return utc(year, month, day, 0, 0, 0);
    }

    public static Moment utc(int year, int month, int day, int hour, int minute, int second) {
        return new Moment(ZonedDateTime.of(year, month, day, hour, minute, second, 0, ZoneOffset.UTC));
    }

    public static Interval day(int year, int month, int day) {
        return Interval.startingAt(utc(year, month, day), Grain.DAY);
    }

    public static Interval hour(int year, int month, int day, int hour) {
        return Interval.startingAt(utc(year, month, day, hour, 0, 0), Grain.HOUR);
    }

    public static Interval second(int year, int month, int day, int hour, int minute, int second) {
        return Interval.startingAt(utc(year, month, day, hour, minute, second), Grain.SECOND);
    }
}
