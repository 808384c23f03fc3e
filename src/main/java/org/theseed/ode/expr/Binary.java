package org.theseed.ode.expr;

import java.util.Set;

/**
 * A binary operation.
 */
public class Binary extends Expr {

    // FIELDS
    /** operator */
    private final Op op;
    /** left operand */
    private final Expr left;
    /** right operand */
    private final Expr right;

    /**
     * Binary operators.  Each has a display symbol and a precedence level for formatting.
     */
    public static enum Op {
        ADD("+", 4), SUB("-", 4), MUL("*", 5), DIV("/", 5), POW("^", 7),
        EQ("==", 3), NE("~=", 3), LT("<", 3), LE("<=", 3), GT(">", 3), GE(">=", 3),
        AND("&&", 2), OR("||", 1);

        /** display symbol */
        private final String symbol;
        /** precedence level */
        private final int precedence;

        private Op(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        /**
         * @return the display symbol
         */
        public String getSymbol() {
            return this.symbol;
        }

        /**
         * @return the precedence level (higher binds tighter)
         */
        public int getPrecedence() {
            return this.precedence;
        }

        /**
         * @return TRUE if this is a comparison operator
         */
        public boolean isRelational() {
            return this.precedence == 3;
        }

        /**
         * @return TRUE if this is a logical connective
         */
        public boolean isLogical() {
            return this == AND || this == OR;
        }

    }

    public Binary(Op op, Expr left, Expr right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    /**
     * @return the operator
     */
    public Op getOp() {
        return this.op;
    }

    /**
     * @return the left operand
     */
    public Expr getLeft() {
        return this.left;
    }

    /**
     * @return the right operand
     */
    public Expr getRight() {
        return this.right;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    protected void addSymbols(Set<String> symbols) {
        this.left.addSymbols(symbols);
        this.right.addSymbols(symbols);
    }

    @Override
    public boolean dependsOnTime() {
        return this.left.dependsOnTime() || this.right.dependsOnTime();
    }

    @Override
    public int hashCode() {
        return (this.op.hashCode() * 31 + this.left.hashCode()) * 31 + this.right.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Binary))
            return false;
        Binary other = (Binary) obj;
        return this.op == other.op && this.left.equals(other.left) && this.right.equals(other.right);
    }

}
