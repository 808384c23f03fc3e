package org.theseed.ode.expr;

import java.util.Set;

/**
 * A numeric constant.
 */
public class Constant extends Expr {

    /** value of the constant */
    private final double value;

    public Constant(double value) {
        this.value = value;
    }

    /**
     * @return the value of the constant
     */
    public double getValue() {
        return this.value;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    protected void addSymbols(Set<String> symbols) {
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public boolean dependsOnTime() {
        return false;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(this.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Constant))
            return false;
        Constant other = (Constant) obj;
        return Double.compare(this.value, other.value) == 0;
    }

}
