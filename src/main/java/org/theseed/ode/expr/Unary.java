package org.theseed.ode.expr;

import java.util.Set;

/**
 * A unary operation:  arithmetic negation or logical not.
 */
public class Unary extends Expr {

    // FIELDS
    /** operator */
    private final Op op;
    /** operand */
    private final Expr operand;

    /**
     * Unary operators.
     */
    public static enum Op {
        NEG, NOT;
    }

    public Unary(Op op, Expr operand) {
        this.op = op;
        this.operand = operand;
    }

    /**
     * @return the operator
     */
    public Op getOp() {
        return this.op;
    }

    /**
     * @return the operand
     */
    public Expr getOperand() {
        return this.operand;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    protected void addSymbols(Set<String> symbols) {
        this.operand.addSymbols(symbols);
    }

    @Override
    public boolean dependsOnTime() {
        return this.operand.dependsOnTime();
    }

    @Override
    public int hashCode() {
        return this.op.hashCode() * 31 + this.operand.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Unary))
            return false;
        Unary other = (Unary) obj;
        return this.op == other.op && this.operand.equals(other.operand);
    }

}
