package org.theseed.ode.matlab.ast;

/**
 * Binary operators of the MATLAB subset.
 */
public enum BinaryOperator {
    ADD("+"), SUBTRACT("-"), TIMES("*"), DIVIDE("/"), LEFT_DIVIDE("\\"), POWER("^"),
    ELEM_TIMES(".*"), ELEM_DIVIDE("./"), ELEM_LEFT_DIVIDE(".\\"), ELEM_POWER(".^"),
    EQUAL("=="), NOT_EQUAL("~="), LESS("<"), LESS_EQUAL("<="), GREATER(">"), GREATER_EQUAL(">="),
    AND("&"), OR("|"), SHORT_AND("&&"), SHORT_OR("||");

    /** operator symbol */
    private final String symbol;

    private BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the MATLAB symbol for this operator
     */
    public String getSymbol() {
        return this.symbol;
    }

    /**
     * @return TRUE if this is a comparison operator
     */
    public boolean isRelational() {
        return (this == EQUAL || this == NOT_EQUAL || this == LESS || this == LESS_EQUAL
                || this == GREATER || this == GREATER_EQUAL);
    }

    /**
     * @return TRUE if this is a logical connective
     */
    public boolean isLogical() {
        return (this == AND || this == OR || this == SHORT_AND || this == SHORT_OR);
    }

}
