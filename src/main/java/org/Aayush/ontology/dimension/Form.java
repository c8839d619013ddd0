package org.Aayush.ontology.dimension;

import java.util.Objects;
import java.util.Optional;

/**
 * Form flags carried by a temporal value.
 *
 * @param kind grammatical shape.
 * @param notImmediate whether the candidate containing "now" must be skipped; {@code null} for
 *                     forms that do not carry the flag.
 */
public record Form(FormKind kind, Boolean notImmediate) {
    private static final Form EMPTY = new Form(FormKind.EMPTY, null);

    public Form {
        Objects.requireNonNull(kind, "kind");
        if (notImmediate != null && !kind.immediacyAware()) {
            throw new IllegalArgumentException(kind + " form does not carry a notImmediate flag");
        }
    }

    public static Form empty() {
        return EMPTY;
    }

    /**
     * Creates a form without immediacy flag.
     */
    public static Form of(FormKind kind) {
        return new Form(kind, null);
    }

    /**
     * Creates a day-of-week form; {@code notImmediate} is set for "next Tuesday" style expressions.
     */
    public static Form dayOfWeek(boolean notImmediate) {
        return new Form(FormKind.DAY_OF_WEEK, notImmediate);
    }

    /**
     * Creates a part-of-day form ("this evening", "tonight").
     */
    public static Form partOfDay(boolean notImmediate) {
        return new Form(FormKind.PART_OF_DAY, notImmediate);
    }

    /**
     * Returns the immediacy flag, or empty when this form does not carry one.
     */
    public Optional<Boolean> notImmediateFlag() {
        return Optional.ofNullable(notImmediate);
    }
}
