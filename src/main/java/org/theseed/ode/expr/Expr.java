/**
 *
 */
package org.theseed.ode.expr;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * This is the base class for symbolic expressions.  The derivative of every state
 * variable is one of these, as is every rate law.  Expressions are immutable and
 * compare structurally.  They should be built through the factory methods in
 * {@link Exprs}, which fold constants and drop trivial operations.
 */
public abstract class Expr {

    /**
     * Dispatch this expression to the appropriate visitor method.
     *
     * @param visitor	visitor to process this expression
     *
     * @return the visitor's result
     */
    public abstract <T> T accept(ExprVisitor<T> visitor);

    /**
     * @return the names of the symbols used in this expression, in order of first occurrence
     *
     * The time symbol is not included.
     */
    public Set<String> getSymbols() {
        Set<String> retVal = new LinkedHashSet<String>();
        this.addSymbols(retVal);
        return retVal;
    }

    /**
     * Add the names of the symbols in this expression to a set.
     *
     * @param symbols	set to receive the names
     */
    protected abstract void addSymbols(Set<String> symbols);

    /**
     * @return TRUE if this expression is a numeric constant
     */
    public boolean isConstant() {
        return false;
    }

    /**
     * @return TRUE if this expression contains the time symbol
     */
    public abstract boolean dependsOnTime();

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }

}
