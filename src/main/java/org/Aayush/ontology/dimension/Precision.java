package org.Aayush.ontology.dimension;

/**
 * How exact a resolved value is claimed to be ("about 5 dollars" is approximate).
 */
public enum Precision {
    APPROXIMATE,
    EXACT
}
