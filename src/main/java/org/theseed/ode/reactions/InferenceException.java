/**
 *
 */
package org.theseed.ode.reactions;

import org.theseed.ode.ConversionException;

/**
 * This exception is thrown when the terms of a model cannot be grouped into a unique set of
 * reactions.  It is not fatal to a conversion:  the converter falls back to rate rules.
 */
public class InferenceException extends ConversionException {

    // FIELDS
    /** serialization ID */
    private static final long serialVersionUID = -6203841127794631578L;
    /** type of failure */
    private final Kind kind;

    /**
     * Types of inference failure.
     */
    public static enum Kind {
        /** two different groupings are equally good */
        AMBIGUOUS_GROUPING,
        /** too many terms share a monomial for an exhaustive search */
        SEARCH_LIMIT,
        /** a term divides by a parameter whose value is zero */
        SINGULAR_RATE;
    }

    /**
     * Construct an inference exception.
     *
     * @param kind		type of failure
     * @param detail	description of the problem
     */
    public InferenceException(Kind kind, String detail) {
        super(Stage.INFERENCE, kind.name(), detail, 0, null);
        this.kind = kind;
    }

    @Override
    public Stage getStage() {
        return Stage.INFERENCE;
    }

    @Override
    public String getKindName() {
        return this.kind.name();
    }

    /**
     * @return the type of failure
     */
    public Kind getKind() {
        return this.kind;
    }

}
