package org.Aayush.ontology.resolver;

import java.util.Objects;
import java.util.Optional;

/**
 * Context returning recognized values unchanged, for callers that want raw values.
 */
public final class IdentityContext<V> implements ParsingContext<V, V> {

    @Override
    public Optional<V> resolve(V value) {
        return Optional.of(Objects.requireNonNull(value, "value"));
    }
}
