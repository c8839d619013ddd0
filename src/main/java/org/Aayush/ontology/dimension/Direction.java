package org.Aayush.ontology.dimension;

/**
 * Side on which an open-ended temporal range extends from its anchor.
 */
public enum Direction {
    AFTER,
    BEFORE
}
