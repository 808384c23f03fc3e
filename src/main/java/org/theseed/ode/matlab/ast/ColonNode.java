package org.theseed.ode.matlab.ast;

/**
 * A bare colon used as an index, meaning "all elements".
 */
public class ColonNode extends Expression {

    public ColonNode(int line, int column) {
        super(line, column);
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitColon(this);
    }

}
