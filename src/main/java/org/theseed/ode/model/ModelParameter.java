/**
 *
 */
package org.theseed.ode.model;

import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;

/**
 * A model parameter is a named constant referenced by the rates or initial conditions.  It
 * has a numeric value, or an expression when the value cannot be computed at translation
 * time.
 */
public class ModelParameter {

    // FIELDS
    /** parameter name */
    private final String name;
    /** defining expression */
    private final Expr expression;

    /**
     * Create a model parameter.
     *
     * @param name			parameter name
     * @param expression	defining expression
     */
    public ModelParameter(String name, Expr expression) {
        this.name = name;
        this.expression = expression;
    }

    /**
     * @return the parameter name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the numeric value, or NULL if the value is an expression
     */
    public Double getValue() {
        return Exprs.valueOf(this.expression);
    }

    /**
     * @return TRUE if the parameter has a numeric value
     */
    public boolean hasValue() {
        return this.getValue() != null;
    }

    /**
     * @return the defining expression
     */
    public Expr getExpression() {
        return this.expression;
    }

    @Override
    public String toString() {
        return this.name + " = " + this.expression;
    }

}
