/**
 *
 */
package org.theseed.ode.cli;

/**
 * This exception is thrown when a command-line parameter is invalid.
 */
public class ParseFailureException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = 5837916004851612046L;

    /**
     * Construct a parse failure with a message.
     *
     * @param message	description of the invalid parameter
     */
    public ParseFailureException(String message) {
        super(message);
    }

}
