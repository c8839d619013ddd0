package org.Aayush.ontology.resolver;

import org.Aayush.ontology.dimension.Dimension;
import org.Aayush.ontology.dimension.IntegerValue;
import org.Aayush.ontology.dimension.MoneyUnitValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("IdentityContext Tests")
class IdentityContextTest {

    @Test
    @DisplayName("Values come back unchanged, including kinds without output")
    void testIdentity() {
        ParsingContext<Dimension, Dimension> context = new IdentityContext<>();
        Dimension unit = new MoneyUnitValue("EUR");

        assertSame(unit, context.resolve(unit).orElseThrow());
        assertEquals(Optional.of(IntegerValue.of(3L)), context.resolve(IntegerValue.of(3L)));
    }

    @Test
    @DisplayName("Null values are rejected")
    void testNullRejected() {
        assertThrows(NullPointerException.class, () -> new IdentityContext<Dimension>().resolve(null));
    }
}
