package org.theseed.ode.matlab;

/**
 * A token is a single lexical unit of MATLAB source.  The line number is the line in the
 * original file; the column is relative to the cleaned line.  Tokens also remember whether
 * white space preceded them, since inside matrix brackets this is significant.
 */
public class Token {

    // FIELDS
    /** token type */
    private final TokenType type;
    /** token text */
    private final String text;
    /** original line number */
    private final int line;
    /** column number */
    private final int column;
    /** TRUE if white space preceded the token */
    private final boolean spaceBefore;

    /**
     * Construct a new token.
     *
     * @param type			token type
     * @param text			token text
     * @param line			original line number
     * @param column		column number
     * @param spaceBefore	TRUE if white space preceded the token
     */
    public Token(TokenType type, String text, int line, int column, boolean spaceBefore) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.spaceBefore = spaceBefore;
    }

    /**
     * @return the token type
     */
    public TokenType getType() {
        return this.type;
    }

    /**
     * @return the token text
     */
    public String getText() {
        return this.text;
    }

    /**
     * @return the original line number
     */
    public int getLine() {
        return this.line;
    }

    /**
     * @return the column number
     */
    public int getColumn() {
        return this.column;
    }

    /**
     * @return TRUE if white space preceded this token
     */
    public boolean hasSpaceBefore() {
        return this.spaceBefore;
    }

    /**
     * @return TRUE if this token is of the specified type
     *
     * @param other		type to check
     */
    public boolean is(TokenType other) {
        return this.type == other;
    }

    @Override
    public String toString() {
        return this.type.name() + "(" + this.text + ")@" + this.line + ":" + this.column;
    }

}
