/**
 *
 */
package org.theseed.ode.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;

/**
 * A term is a signed numeric coefficient times a product of factors.  The factors are
 * kept in canonical order with at most one factor per base, so two terms have the same
 * monomial exactly when their monomial keys are equal.
 */
public class Term {

    // FIELDS
    /** numeric coefficient */
    private final double coefficient;
    /** factors, in canonical order */
    private final List<Factor> factors;
    /** monomial key */
    private final String key;

    /**
     * Create a term.  Factors with the same base are combined and factors with a zero
     * exponent are dropped.
     *
     * @param coefficient	numeric coefficient
     * @param factors		factors of the product
     */
    public Term(double coefficient, Collection<Factor> factors) {
        this.coefficient = coefficient;
        List<Factor> combined = new ArrayList<Factor>(factors.size());
        for (Factor factor : factors) {
            boolean found = false;
            for (int i = 0; ! found && i < combined.size(); i++) {
                Factor old = combined.get(i);
                if (old.sameBase(factor)) {
                    combined.set(i, old.withExponent(old.getExponent() + factor.getExponent()));
                    found = true;
                }
            }
            if (! found)
                combined.add(factor);
        }
        combined.removeIf(x -> x.getExponent() == 0.0);
        Collections.sort(combined);
        this.factors = combined;
        this.key = (combined.isEmpty() ? "1" : combined.stream().map(Factor::getKey).collect(Collectors.joining("*")));
    }

    /**
     * @return a term with no factors
     *
     * @param value		value of the term
     */
    public static Term constant(double value) {
        return new Term(value, Collections.emptyList());
    }

    /**
     * @return a term consisting of a single factor
     *
     * @param factor	factor forming the term
     */
    public static Term of(Factor factor) {
        return new Term(1.0, List.of(factor));
    }

    /**
     * @return the numeric coefficient
     */
    public double getCoefficient() {
        return this.coefficient;
    }

    /**
     * @return the factors, in canonical order
     */
    public List<Factor> getFactors() {
        return Collections.unmodifiableList(this.factors);
    }

    /**
     * @return the monomial key (the canonical product text, without the coefficient)
     */
    public String getKey() {
        return this.key;
    }

    /**
     * @return a term with the same monomial and a different coefficient
     *
     * @param newCoefficient	coefficient of the new term
     */
    public Term withCoefficient(double newCoefficient) {
        return new Term(newCoefficient, this.factors);
    }

    /**
     * @return the negation of this term
     */
    public Term negate() {
        return this.withCoefficient(-this.coefficient);
    }

    /**
     * @return the product of this term and another
     *
     * @param other		term to multiply by
     */
    public Term times(Term other) {
        List<Factor> all = new ArrayList<Factor>(this.factors);
        all.addAll(other.factors);
        return new Term(this.coefficient * other.coefficient, all);
    }

    /**
     * @return this term raised to a power
     *
     * @param exponent	power to raise it to
     */
    public Term power(double exponent) {
        List<Factor> raised = new ArrayList<Factor>(this.factors.size());
        for (Factor factor : this.factors)
            raised.add(factor.withExponent(factor.getExponent() * exponent));
        return new Term(Math.pow(this.coefficient, exponent), raised);
    }

    /**
     * @return TRUE if this term contains a species factor with the specified name
     *
     * @param species	name of the species
     */
    public boolean dependsOn(String species) {
        return this.factors.stream().anyMatch(x -> x.isSpecies() && x.getName().equals(species));
    }

    /**
     * @return the names of the species in this term, in canonical order
     */
    public List<String> getSpecies() {
        return this.factors.stream().filter(x -> x.isSpecies()).map(x -> x.getName()).collect(Collectors.toList());
    }

    /**
     * @return the product of the factors as an expression, without the coefficient
     *
     * Factors with negative exponents form a denominator.
     */
    public Expr getMonomial() {
        Expr num = Exprs.ONE;
        Expr den = Exprs.ONE;
        for (Factor factor : this.factors) {
            double e = factor.getExponent();
            if (e > 0)
                num = Exprs.mul(num, factor.toExpr());
            else
                den = Exprs.mul(den, factor.withExponent(-e).toExpr());
        }
        return Exprs.div(num, den);
    }

    /**
     * @return this term as an expression
     */
    public Expr toExpr() {
        return Exprs.mul(Exprs.constant(this.coefficient), this.getMonomial());
    }

    @Override
    public String toString() {
        return this.toExpr().toString();
    }

}
