/**
 *
 */
package org.theseed.ode.model;

import java.util.Collections;
import java.util.List;

import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;

/**
 * This object represents one state variable of the ODE system:  its position in the state
 * vector, its species name, its initial condition, and its derivative both as the intact
 * expression and as a list of canonical terms.
 */
public class OdeVariable {

    // FIELDS
    /** 1-based position in the state vector */
    private final int index;
    /** species name */
    private final String name;
    /** initial condition */
    private final Expr initial;
    /** derivative expression */
    private final Expr derivative;
    /** canonical terms of the derivative */
    private final List<Term> terms;

    /**
     * Create a state variable.
     *
     * @param index			1-based position in the state vector
     * @param name			species name
     * @param initial		initial condition
     * @param derivative	derivative expression
     * @param terms			canonical terms of the derivative
     */
    public OdeVariable(int index, String name, Expr initial, Expr derivative, List<Term> terms) {
        this.index = index;
        this.name = name;
        this.initial = initial;
        this.derivative = derivative;
        this.terms = terms;
    }

    /**
     * @return the 1-based position in the state vector
     */
    public int getIndex() {
        return this.index;
    }

    /**
     * @return the species name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the numeric initial value, or NULL if the initial condition is an expression
     */
    public Double getInitialValue() {
        return Exprs.valueOf(this.initial);
    }

    /**
     * @return the initial condition expression
     */
    public Expr getInitialExpression() {
        return this.initial;
    }

    /**
     * @return the derivative expression
     */
    public Expr getDerivative() {
        return this.derivative;
    }

    /**
     * @return the canonical terms of the derivative
     */
    public List<Term> getTerms() {
        return Collections.unmodifiableList(this.terms);
    }

    /**
     * @return the derivative rebuilt from its canonical terms
     */
    public Expr getTermSum() {
        Expr retVal = Exprs.ZERO;
        for (Term term : this.terms)
            retVal = Exprs.add(retVal, term.toExpr());
        return retVal;
    }

    @Override
    public String toString() {
        return "d" + this.name + "/dt = " + this.derivative;
    }

}
