package org.Aayush.ontology.dimension;

/**
 * Edge of the resolved interval that anchors an open-ended range.
 *
 * @param end {@code false} for the start edge, {@code true} for the end edge.
 * @param onlyInterval for the end edge: use the interval's explicit end only, falling back to its
 *                     start rather than to the implied one-grain end.
 */
public record Bound(boolean end, boolean onlyInterval) {
    private static final Bound START = new Bound(false, false);

    public Bound {
        if (!end && onlyInterval) {
            throw new IllegalArgumentException("onlyInterval applies to the end bound only");
        }
    }

    public static Bound start() {
        return START;
    }

    public static Bound end(boolean onlyInterval) {
        return new Bound(true, onlyInterval);
    }

    public boolean isStart() {
        return !end;
    }
}
