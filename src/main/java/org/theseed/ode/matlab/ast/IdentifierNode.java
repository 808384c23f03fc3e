package org.theseed.ode.matlab.ast;

/**
 * A bare name.  This may refer to a variable or to a function called without arguments.
 */
public class IdentifierNode extends Expression {

    /** name referenced */
    private final String name;

    public IdentifierNode(int line, int column, String name) {
        super(line, column);
        this.name = name;
    }

    /**
     * @return the name referenced
     */
    public String getName() {
        return this.name;
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitIdentifier(this);
    }

}
