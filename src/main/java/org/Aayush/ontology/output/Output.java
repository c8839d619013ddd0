package org.Aayush.ontology.output;

/**
 * Concrete, directly consumable resolved value.
 *
 * <p>Implementations are immutable records with value equality.</p>
 */
public interface Output {

    /**
     * Returns the variant of this output.
     */
    OutputKind kind();
}
