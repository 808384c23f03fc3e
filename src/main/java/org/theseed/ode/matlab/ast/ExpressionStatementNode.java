package org.theseed.ode.matlab.ast;

/**
 * A statement consisting of a bare expression, usually a function call.
 */
public class ExpressionStatementNode extends Statement {

    /** expression evaluated */
    private final Expression expression;

    public ExpressionStatementNode(int line, int column, Expression expression) {
        super(line, column);
        this.expression = expression;
    }

    /**
     * @return the expression evaluated
     */
    public Expression getExpression() {
        return this.expression;
    }

    @Override
    public <T, E extends Exception> T accept(StatementVisitor<T, E> visitor) throws E {
        return visitor.visitExpressionStatement(this);
    }

}
