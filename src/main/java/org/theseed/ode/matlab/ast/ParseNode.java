package org.theseed.ode.matlab.ast;

/**
 * This is the base class for all nodes of a MATLAB parse tree.  Each node knows the
 * original source line and column where it begins.  Nodes are immutable, and a node
 * belongs to exactly one parent.
 */
public abstract class ParseNode {

    // FIELDS
    /** original line number (1-based) */
    private final int line;
    /** column number (1-based) */
    private final int column;

    /**
     * Construct a parse node.
     *
     * @param line		original line number
     * @param column	column number
     */
    protected ParseNode(int line, int column) {
        this.line = line;
        this.column = column;
    }

    /**
     * @return the original source line number
     */
    public int getLine() {
        return this.line;
    }

    /**
     * @return the column number
     */
    public int getColumn() {
        return this.column;
    }

}
