package org.Aayush.ontology.resolver;

import java.util.Optional;

/**
 * Turns values recognized by the grammar layer into caller-facing results.
 *
 * @param <V> recognized value type.
 * @param <O> result type.
 */
public interface ParsingContext<V, O> {

    /**
     * Resolves one value.
     *
     * @param value recognized value.
     * @return result, or empty when this context cannot resolve {@code value}.
     */
    Optional<O> resolve(V value);
}
