package org.Aayush.ontology.dimension;

import java.util.Objects;

/**
 * Marks a temporal value as an open-ended range such as "after 5pm" or "before the end of May".
 */
public record BoundedDirection(Bound bound, Direction direction) {

    public BoundedDirection {
        Objects.requireNonNull(bound, "bound");
        Objects.requireNonNull(direction, "direction");
    }

    public static BoundedDirection after(Bound bound) {
        return new BoundedDirection(bound, Direction.AFTER);
    }

    public static BoundedDirection before(Bound bound) {
        return new BoundedDirection(bound, Direction.BEFORE);
    }
}
