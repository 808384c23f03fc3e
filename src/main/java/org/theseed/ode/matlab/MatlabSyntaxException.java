package org.theseed.ode.matlab;

import org.theseed.ode.ConversionException;

/**
 * This exception is thrown when MATLAB source is malformed or uses a construct the
 * converter does not support.  It always carries a line and column.
 */
public class MatlabSyntaxException extends ConversionException {

    // FIELDS
    /** serialization ID */
    private static final long serialVersionUID = 4637285094621127651L;
    /** type of syntax problem */
    private final Kind kind;
    /** column number (1-based) */
    private final int column;

    /**
     * Types of syntax error.
     */
    public static enum Kind {
        /** the text is not valid MATLAB */
        SYNTAX,
        /** the text is valid MATLAB, but uses a construct we cannot convert */
        UNSUPPORTED_CONSTRUCT;
    }

    /**
     * Construct a syntax exception.
     *
     * @param kind			type of error
     * @param detail		description of the problem
     * @param line			original source line number
     * @param column		column in the line
     * @param sourceLine	text of the source line
     */
    public MatlabSyntaxException(Kind kind, String detail, int line, int column, String sourceLine) {
        super(Stage.PARSE, kind.name(), detail + " (column " + column + ")", line, sourceLine);
        this.kind = kind;
        this.column = column;
    }

    @Override
    public Stage getStage() {
        return Stage.PARSE;
    }

    @Override
    public String getKindName() {
        return this.kind.name();
    }

    /**
     * @return the type of syntax problem
     */
    public Kind getKind() {
        return this.kind;
    }

    /**
     * @return the column of the offending text
     */
    public int getColumn() {
        return this.column;
    }

}
