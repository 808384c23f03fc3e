package org.theseed.ode.matlab.ast;

/**
 * This is the base class for statement nodes.
 */
public abstract class Statement extends ParseNode {

    protected Statement(int line, int column) {
        super(line, column);
    }

    /**
     * Dispatch this node to the appropriate visitor method.
     *
     * @param visitor	visitor to process this node
     *
     * @return the visitor's result
     */
    public abstract <T, E extends Exception> T accept(StatementVisitor<T, E> visitor) throws E;

}
