package org.theseed.ode.matlab.ast;

/**
 * A binary operation.
 */
public class BinaryNode extends Expression {

    // FIELDS
    /** operator */
    private final BinaryOperator operator;
    /** left operand */
    private final Expression left;
    /** right operand */
    private final Expression right;

    public BinaryNode(int line, int column, BinaryOperator operator, Expression left, Expression right) {
        super(line, column);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    /**
     * @return the operator
     */
    public BinaryOperator getOperator() {
        return this.operator;
    }

    /**
     * @return the left operand
     */
    public Expression getLeft() {
        return this.left;
    }

    /**
     * @return the right operand
     */
    public Expression getRight() {
        return this.right;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitBinary(this);
    }

}
