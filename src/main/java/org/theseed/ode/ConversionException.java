/**
 *
 */
package org.theseed.ode;

import org.apache.commons.lang3.StringUtils;

/**
 * This is the base class for all the errors that can stop a conversion.  Each error
 * knows the pipeline stage that raised it, a kind code specific to that stage, and
 * (if known) the line of MATLAB source responsible.  The message quotes the source line
 * so that a modeler can find the problem without knowing anything about the converter.
 */
public abstract class ConversionException extends Exception {

    // FIELDS
    /** serialization ID */
    private static final long serialVersionUID = -2383410519125773128L;
    /** line number of the offending source (1-based), or 0 if unknown */
    private final int line;
    /** text of the offending source line, or empty if unknown */
    private final String sourceLine;
    /** basic description of the problem */
    private final String detail;

    /**
     * This enumeration describes the pipeline stages.
     */
    public static enum Stage {
        PARSE, INTERPRET, BUILD, INFERENCE;
    }

    /**
     * Construct a conversion exception.
     *
     * @param stage			stage raising the error
     * @param kind			kind code of the error
     * @param detail		description of the problem
     * @param line			line number of the offending source, or 0 if unknown
     * @param sourceLine	text of the offending source line, or NULL if unknown
     */
    protected ConversionException(Stage stage, String kind, String detail, int line, String sourceLine) {
        super(formatMessage(stage, kind, detail, line, sourceLine));
        this.detail = detail;
        this.line = line;
        this.sourceLine = StringUtils.defaultString(sourceLine);
    }

    /**
     * @return the message text for an error
     *
     * @param stage			stage raising the error
     * @param kind			kind code of the error
     * @param detail		description of the problem
     * @param line			line number of the offending source, or 0 if unknown
     * @param sourceLine	text of the offending source line, or NULL if unknown
     */
    private static String formatMessage(Stage stage, String kind, String detail, int line, String sourceLine) {
        StringBuilder retVal = new StringBuilder(80);
        retVal.append(stage).append(" error (").append(kind).append(")");
        if (line > 0)
            retVal.append(" at line ").append(line);
        retVal.append(": ").append(detail);
        if (! StringUtils.isBlank(sourceLine))
            retVal.append(System.lineSeparator()).append("    > ").append(sourceLine.strip());
        return retVal.toString();
    }

    /**
     * @return the pipeline stage that raised this error
     */
    public abstract Stage getStage();

    /**
     * @return the kind code of this error, as a string
     */
    public abstract String getKindName();

    /**
     * @return the line number of the offending source, or 0 if it is unknown
     */
    public int getLine() {
        return this.line;
    }

    /**
     * @return the offending source line (empty if unknown)
     */
    public String getSourceLine() {
        return this.sourceLine;
    }

    /**
     * @return the description of the problem without the location information
     */
    public String getDetail() {
        return this.detail;
    }

}
