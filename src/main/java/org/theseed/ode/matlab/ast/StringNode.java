package org.theseed.ode.matlab.ast;

/**
 * A string literal.
 */
public class StringNode extends Expression {

    /** string value (delimiters removed) */
    private final String value;

    public StringNode(int line, int column, String value) {
        super(line, column);
        this.value = value;
    }

    /**
     * @return the string value
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitString(this);
    }

}
