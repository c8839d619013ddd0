package org.Aayush.ontology.dimension;

import org.Aayush.core.time.Grain;
import org.Aayush.ontology.constraint.TimeConstraint;
import org.Aayush.ontology.constraint.TimeConstraints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Datetime Value Tests")
class DatetimeValueTest {

    @Test
    @DisplayName("Unset fields take their defaults")
    void testDefaults() {
        TimeConstraint today = TimeConstraints.cycleNth(Grain.DAY, 0);
        DatetimeValue value = DatetimeValue.of(today);

        assertSame(today, value.getConstraint());
        assertEquals(Form.empty(), value.getForm());
        assertNull(value.getDirection());
        assertEquals(Precision.EXACT, value.getPrecision());
        assertFalse(value.isLatent());
        assertEquals(DatetimeKind.DATE_TIME, value.getDatetimeKind());
        assertEquals(DimensionKind.DATETIME, value.kind());
    }

    @Test
    @DisplayName("Builder copies keep untouched fields")
    void testToBuilder() {
        DatetimeValue approximate = DatetimeValue.builder()
                .constraint(TimeConstraints.hour(17, false))
                .precision(Precision.APPROXIMATE)
                .latent(true)
                .datetimeKind(DatetimeKind.TIME)
                .build();
        DatetimeValue afterFive = approximate.toBuilder()
                .direction(BoundedDirection.after(Bound.start()))
                .build();

        assertEquals(Precision.APPROXIMATE, afterFive.getPrecision());
        assertTrue(afterFive.isLatent());
        assertEquals(DatetimeKind.TIME, afterFive.getDatetimeKind());
        assertEquals(Direction.AFTER, afterFive.getDirection().direction());
    }

    @Test
    @DisplayName("Constraint is required")
    void testConstraintRequired() {
        assertThrows(NullPointerException.class, () -> DatetimeValue.builder().build());
    }

    @Test
    @DisplayName("Only the end bound may restrict itself to explicit ends")
    void testBoundValidation() {
        assertTrue(Bound.start().isStart());
        assertFalse(Bound.end(true).isStart());
        assertTrue(Bound.end(true).onlyInterval());
        assertThrows(IllegalArgumentException.class, () -> new Bound(false, true));
    }

    @Test
    @DisplayName("Only date and time kinds are point-like")
    void testPointLikeKinds() {
        for (DatetimeKind kind : DatetimeKind.values()) {
            assertEquals(kind == DatetimeKind.DATE || kind == DatetimeKind.TIME, kind.isPointLike(), kind.name());
        }
    }
}
