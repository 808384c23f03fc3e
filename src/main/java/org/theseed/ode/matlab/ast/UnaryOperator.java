package org.theseed.ode.matlab.ast;

/**
 * Unary operators of the MATLAB subset.  The transposes are postfix; the rest are prefix.
 */
public enum UnaryOperator {
    NEGATE("-"), PLUS("+"), NOT("~"), TRANSPOSE("'"), DOT_TRANSPOSE(".'");

    /** operator symbol */
    private final String symbol;

    private UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the MATLAB symbol for this operator
     */
    public String getSymbol() {
        return this.symbol;
    }

}
