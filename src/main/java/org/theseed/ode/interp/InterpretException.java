package org.theseed.ode.interp;

import org.theseed.ode.ConversionException;

/**
 * This exception is thrown when a parsed script cannot be reduced to a system of ODEs.
 */
public class InterpretException extends ConversionException {

    // FIELDS
    /** serialization ID */
    private static final long serialVersionUID = -6129740360512316442L;
    /** type of failure */
    private final Kind kind;

    /**
     * Types of interpretation failure.
     */
    public static enum Kind {
        /** a name has no definition, or its definition is circular */
        UNRESOLVED_SYMBOL,
        /** the solver call does not refer to a usable ODE function */
        SOLVER_FUNCTION_MISMATCH,
        /** a condition cannot be decided at translation time */
        UNSUPPORTED_CONDITIONAL,
        /** there is no solver call */
        MISSING_SOLVER_CALL,
        /** there is more than one solver call */
        MULTIPLE_SOLVER_CALLS,
        /** vector or matrix sizes do not agree */
        DIMENSION_MISMATCH,
        /** a value is used in a way that cannot be translated */
        UNSUPPORTED_CONSTRUCT;
    }

    /**
     * Construct an interpretation exception.
     *
     * @param kind			type of failure
     * @param detail		description of the problem
     * @param line			line number of the offending source, or 0 if unknown
     * @param sourceLine	text of the offending source line
     */
    public InterpretException(Kind kind, String detail, int line, String sourceLine) {
        super(Stage.INTERPRET, kind.name(), detail, line, sourceLine);
        this.kind = kind;
    }

    @Override
    public Stage getStage() {
        return Stage.INTERPRET;
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
