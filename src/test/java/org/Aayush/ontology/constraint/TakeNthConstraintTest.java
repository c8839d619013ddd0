package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static org.Aayush.ontology.constraint.ConstraintFixtures.count;
import static org.Aayush.ontology.constraint.ConstraintFixtures.walk;
import static org.Aayush.ontology.testutil.TestMoments.day;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@DisplayName("TakeNth Constraint Tests")
class TakeNthConstraintTest {

    @Test
    @DisplayName("Non-negative index counts forward from the current interval")
    void testForwardIndex() {
        Walker walker = walk(TimeConstraints.cycle(Grain.DAY).takeNth(2));

        assertEquals(day(1970, 1, 3), walker.forward().next());
        assertFalse(walker.forward().hasNext());
        assertFalse(walker.backward().hasNext());
    }

    @Test
    @DisplayName("Negative index counts backward from minus one")
    void testBackwardIndex() {
        Walker walker = walk(TimeConstraints.cycle(Grain.DAY).takeNth(-1));

        assertFalse(walker.forward().hasNext());
        assertEquals(day(1969, 12, 31), walker.backward().next());
    }

    @Test
    @DisplayName("Second Monday from the reference")
    void testSecondMonday() {
        assertEquals(day(1970, 1, 12), walk(TimeConstraints.dayOfWeek(DayOfWeek.MONDAY).takeNth(1)).forward().next());
    }

    @Test
    @DisplayName("Index past the end of the inner sequence yields nothing")
    void testIndexPastEnd() {
        Walker walker = walk(TimeConstraints.year(1975).takeNth(1));

        assertEquals(0, count(walker.forward()));
        assertEquals(0, count(walker.backward()));
    }
}
