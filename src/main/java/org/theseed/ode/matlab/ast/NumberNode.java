package org.theseed.ode.matlab.ast;

/**
 * A numeric literal.
 */
public class NumberNode extends Expression {

    // FIELDS
    /** numeric value */
    private final double value;
    /** literal text */
    private final String text;

    public NumberNode(int line, int column, String text) {
        super(line, column);
        this.text = text;
        this.value = Double.parseDouble(text.replace('d', 'e').replace('D', 'e'));
    }

    /**
     * @return the numeric value
     */
    public double getValue() {
        return this.value;
    }

    /**
     * @return the literal text
     */
    public String getText() {
        return this.text;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitNumber(this);
    }

}
