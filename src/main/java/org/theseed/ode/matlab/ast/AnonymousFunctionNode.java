package org.theseed.ode.matlab.ast;

import java.util.List;

/**
 * An anonymous function, "@(p1, p2) expression".
 */
public class AnonymousFunctionNode extends Expression {

    // FIELDS
    /** parameter names */
    private final List<String> params;
    /** body expression */
    private final Expression body;

    public AnonymousFunctionNode(int line, int column, List<String> params, Expression body) {
        super(line, column);
        this.params = List.copyOf(params);
        this.body = body;
    }

    /**
     * @return the parameter names
     */
    public List<String> getParams() {
        return this.params;
    }

    /**
     * @return the body expression
     */
    public Expression getBody() {
        return this.body;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitAnonymousFunction(this);
    }

}
