package org.Aayush.ontology.dimension;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Grammatical shape of a temporal expression, used by rules that combine expressions.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum FormKind {
    EMPTY(false),
    MONTH(false),
    YEAR(false),
    CYCLE(false),
    TIME_OF_DAY(false),
    DAY_OF_WEEK(true),
    PART_OF_DAY(true),
    MEAL(false),
    CELEBRATION(false);

    /** Whether expressions of this form may demand a strictly future occurrence ("next Tuesday"). */
    private final boolean immediacyAware;
}
