package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.Moment;
import org.Aayush.core.time.MomentContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.Aayush.ontology.constraint.ConstraintFixtures.take;
import static org.Aayush.ontology.constraint.ConstraintFixtures.walk;
import static org.Aayush.ontology.testutil.TestMoments.day;
import static org.Aayush.ontology.testutil.TestMoments.hour;
import static org.Aayush.ontology.testutil.TestMoments.utc;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Calendar Field Constraint Tests")
class CalendarFieldConstraintTest {

    @Test
    @DisplayName("Day of week walks matching days in both directions")
    void testDayOfWeek() {
        Walker walker = walk(TimeConstraints.dayOfWeek(DayOfWeek.MONDAY));

        assertEquals(List.of(day(1970, 1, 5), day(1970, 1, 12)), take(walker.forward(), 2));
        assertEquals(List.of(day(1969, 12, 29), day(1969, 12, 22)), take(walker.backward(), 2));
    }

    @Test
    @DisplayName("Several days of week are merged in time order")
    void testWeekend() {
        Walker walker = walk(TimeConstraints.dayOfWeek(DayOfWeek.SUNDAY, DayOfWeek.SATURDAY));

        assertEquals(List.of(day(1970, 1, 3), day(1970, 1, 4), day(1970, 1, 10)), take(walker.forward(), 3));
    }

    @Test
    @DisplayName("Forward includes the interval containing the reference")
    void testForwardHeadContainsReference() {
        assertEquals(day(1970, 1, 1), walk(TimeConstraints.dayOfWeek(DayOfWeek.THURSDAY)).forward().next());
        assertEquals(hour(1970, 1, 1, 10), walk(TimeConstraints.hour(10, false)).forward().next());
    }

    @Test
    @DisplayName("Twelve-hour clock matches both am and pm")
    void testTwelveHourClock() {
        Walker walker = walk(TimeConstraints.hour(5, true));

        assertEquals(List.of(hour(1970, 1, 1, 17), hour(1970, 1, 2, 5)), take(walker.forward(), 2));
        assertEquals(hour(1970, 1, 1, 5), walker.backward().next());
    }

    @Test
    @DisplayName("Twelve o'clock on a twelve-hour clock is midnight or noon")
    void testTwelveOClock() {
        Walker walker = walk(TimeConstraints.hour(12, true));

        assertEquals(hour(1970, 1, 1, 12), walker.forward().next());
        assertEquals(hour(1970, 1, 1, 0), walker.backward().next());
    }

    @Test
    @DisplayName("Day of month skips months lacking the day")
    void testDayOfMonthSkipsShortMonths() {
        Walker walker = walk(TimeConstraints.dayOfMonth(31));

        assertEquals(List.of(day(1970, 1, 31), day(1970, 3, 31)), take(walker.forward(), 2));
    }

    @Test
    @DisplayName("Month and minute use their own grains")
    void testMonthAndMinute() {
        assertEquals(
                Interval.startingAt(utc(1970, 2, 1), Grain.MONTH),
                walk(TimeConstraints.month(2)).forward().next()
        );
        assertEquals(
                Interval.startingAt(utc(1970, 1, 1, 10, 30, 0), Grain.MINUTE),
                walk(TimeConstraints.minute(30)).forward().next()
        );
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 13})
    @DisplayName("Out-of-range months are rejected")
    void testInvalidMonthRejected(int month) {
        assertThrows(IllegalArgumentException.class, () -> TimeConstraints.month(month));
    }

    @Test
    @DisplayName("Empty and out-of-range value sets are rejected")
    void testInvalidValueSetsRejected() {
        assertThrows(IllegalArgumentException.class, TimeConstraints::month);
        assertThrows(IllegalArgumentException.class, () -> TimeConstraints.minute(60));
        assertThrows(IllegalArgumentException.class, () -> TimeConstraints.hour(24, false));
    }

    @Test
    @DisplayName("Candidates after a midnight daylight-saving gap start at midnight")
    void testCandidatesAfterMidnightGap() {
        ZoneId saoPaulo = ZoneId.of("America/Sao_Paulo");
        Interval reference = Interval.startingAt(
                new Moment(ZonedDateTime.of(2018, 11, 1, 12, 0, 0, 0, saoPaulo)), Grain.SECOND);
        MomentContext context = MomentContext.forReference(reference);

        Interval monday = TimeConstraints.dayOfWeek(DayOfWeek.MONDAY).toWalker(reference, context).forward().next();
        Interval the13th = TimeConstraints.dayOfMonth(13).toWalker(reference, context).forward().next();
        Interval december = TimeConstraints.month(12).toWalker(reference, context).forward().next();

        assertEquals(new Moment(ZonedDateTime.of(2018, 11, 5, 0, 0, 0, 0, saoPaulo)), monday.start());
        assertEquals(new Moment(ZonedDateTime.of(2018, 11, 13, 0, 0, 0, 0, saoPaulo)), the13th.start());
        assertEquals(new Moment(ZonedDateTime.of(2018, 12, 1, 0, 0, 0, 0, saoPaulo)), december.start());
    }
}
