package org.Aayush.ontology.dimension;

/**
 * Abstract semantic value recognized upstream and awaiting resolution.
 *
 * <p>Implementations are immutable. {@link #kind()} identifies the variant; resolvers dispatch on it
 * and cast to the matching implementation.</p>
 */
public interface Dimension {

    /**
     * Returns the variant of this value.
     */
    DimensionKind kind();
}
