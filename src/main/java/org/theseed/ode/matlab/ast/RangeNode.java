package org.theseed.ode.matlab.ast;

/**
 * A colon range expression, "start:stop" or "start:step:stop".
 */
public class RangeNode extends Expression {

    // FIELDS
    /** first value */
    private final Expression start;
    /** increment, or NULL for the default of 1 */
    private final Expression step;
    /** limiting value */
    private final Expression stop;

    public RangeNode(int line, int column, Expression start, Expression step, Expression stop) {
        super(line, column);
        this.start = start;
        this.step = step;
        this.stop = stop;
    }

    /**
     * @return the first value
     */
    public Expression getStart() {
        return this.start;
    }

    /**
     * @return the increment, or NULL if none was specified
     */
    public Expression getStep() {
        return this.step;
    }

    /**
     * @return the limiting value
     */
    public Expression getStop() {
        return this.stop;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitRange(this);
    }

}
