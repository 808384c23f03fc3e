package org.theseed.ode.matlab.ast;

import java.util.List;

/**
 * A name followed by a parenthesized argument list.  MATLAB syntax does not distinguish
 * array indexing from function calls, so this node stands for both.  The interpreter
 * decides which one applies by looking the name up.
 */
public class CallNode extends Expression {

    // FIELDS
    /** name being called or indexed */
    private final String name;
    /** argument expressions */
    private final List<Expression> args;

    public CallNode(int line, int column, String name, List<Expression> args) {
        super(line, column);
        this.name = name;
        this.args = List.copyOf(args);
    }

    /**
     * @return the name being called or indexed
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the argument expressions
     */
    public List<Expression> getArgs() {
        return this.args;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitCall(this);
    }

}
