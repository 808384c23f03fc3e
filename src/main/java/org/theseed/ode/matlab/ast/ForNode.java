package org.theseed.ode.matlab.ast;

import java.util.List;

/**
 * A for loop.
 */
public class ForNode extends Statement {

    // FIELDS
    /** loop variable name */
    private final String variable;
    /** expression producing the loop values */
    private final Expression range;
    /** loop body */
    private final List<Statement> body;

    public ForNode(int line, int column, String variable, Expression range, List<Statement> body) {
        super(line, column);
        this.variable = variable;
        this.range = range;
        this.body = List.copyOf(body);
    }

    /**
     * @return the loop variable name
     */
    public String getVariable() {
        return this.variable;
    }

    /**
     * @return the expression producing the loop values
     */
    public Expression getRange() {
        return this.range;
    }

    /**
     * @return the loop body
     */
    public List<Statement> getBody() {
        return this.body;
    }

    @Override
    public <T, E extends Exception> T accept(StatementVisitor<T, E> visitor) throws E {
        return visitor.visitFor(this);
    }

}
