package org.theseed.ode.matlab.ast;

/**
 * A named function handle, "@name".
 */
public class FunctionHandleNode extends Expression {

    /** name of the function */
    private final String name;

    public FunctionHandleNode(int line, int column, String name) {
        super(line, column);
        this.name = name;
    }

    /**
     * @return the name of the function
     */
    public String getName() {
        return this.name;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitFunctionHandle(this);
    }

}
