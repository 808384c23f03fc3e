package org.theseed.ode.model;

import org.theseed.ode.ConversionException;

/**
 * This exception is thrown when a derivative cannot be put into the canonical sum-of-terms
 * form needed by the model.
 */
public class ModelBuildException extends ConversionException {

    // FIELDS
    /** serialization ID */
    private static final long serialVersionUID = 4410582736109941075L;
    /** type of failure */
    private final Kind kind;

    /**
     * Types of model-building failure.
     */
    public static enum Kind {
        /** a term contains an operation that cannot be expanded into a product */
        NON_POLYNOMIAL_TERM,
        /** a derivative uses a name that is not a species, a parameter, or time */
        UNDEFINED_SYMBOL;
    }

    /**
     * Construct a model-building exception.
     *
     * @param kind			type of failure
     * @param detail		description of the problem
     * @param line			line number of the offending source, or 0 if unknown
     * @param sourceLine	text of the offending source line
     */
    public ModelBuildException(Kind kind, String detail, int line, String sourceLine) {
        super(Stage.BUILD, kind.name(), detail, line, sourceLine);
        this.kind = kind;
    }

    @Override
    public Stage getStage() {
        return Stage.BUILD;
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
