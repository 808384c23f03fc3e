package org.theseed.ode.matlab.ast;

/**
 * A prefix or postfix unary operation.
 */
public class UnaryNode extends Expression {

    // FIELDS
    /** operator */
    private final UnaryOperator operator;
    /** operand */
    private final Expression operand;

    public UnaryNode(int line, int column, UnaryOperator operator, Expression operand) {
        super(line, column);
        this.operator = operator;
        this.operand = operand;
    }

    /**
     * @return the operator
     */
    public UnaryOperator getOperator() {
        return this.operator;
    }

    /**
     * @return the operand
     */
    public Expression getOperand() {
        return this.operand;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitUnary(this);
    }

}
