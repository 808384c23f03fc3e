/**
 *
 */
package org.theseed.ode.model;

import org.theseed.ode.expr.CanonicalFormatter;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.expr.Symbol;

/**
 * A factor is one element of a term's product:  a base quantity raised to a numeric
 * exponent.  The base is a parameter, a species, the time, or an opaque sub-expression
 * that cannot be broken down further (such as "exp(-k * x_1)" or a sum in a denominator).
 *
 * Factors sort parameters first, then species in state-vector order, then time, then
 * opaque factors, so that rate laws read naturally ("k * x_1 * x_2").
 */
public class Factor implements Comparable<Factor> {

    // FIELDS
    /** type of base */
    private final Type type;
    /** base expression */
    private final Expr base;
    /** text identifying the base */
    private final String name;
    /** 1-based index of a species base, else 0 */
    private final int speciesIndex;
    /** exponent */
    private final double exponent;

    /**
     * Types of factor bases.
     */
    public static enum Type {
        PARAMETER, SPECIES, TIME, OPAQUE;
    }

    private Factor(Type type, Expr base, String name, int speciesIndex, double exponent) {
        this.type = type;
        this.base = base;
        this.name = name;
        this.speciesIndex = speciesIndex;
        this.exponent = exponent;
    }

    /**
     * @return a parameter factor
     *
     * @param name		name of the parameter
     */
    public static Factor parameter(String name) {
        return new Factor(Type.PARAMETER, new Symbol(name), name, 0, 1.0);
    }

    /**
     * @return a species factor
     *
     * @param name		name of the species
     * @param index		1-based index of the species
     */
    public static Factor species(String name, int index) {
        return new Factor(Type.SPECIES, new Symbol(name), name, index, 1.0);
    }

    /**
     * @return the time factor
     */
    public static Factor time() {
        return new Factor(Type.TIME, Symbol.TIME, "time", 0, 1.0);
    }

    /**
     * @return an opaque factor
     *
     * @param base		expression forming the factor
     */
    public static Factor opaque(Expr base) {
        return new Factor(Type.OPAQUE, base, CanonicalFormatter.format(base), 0, 1.0);
    }

    /**
     * @return a factor with the same base and a different exponent
     *
     * @param newExponent	exponent for the new factor
     */
    public Factor withExponent(double newExponent) {
        return new Factor(this.type, this.base, this.name, this.speciesIndex, newExponent);
    }

    /**
     * @return TRUE if the other factor has the same base as this one
     *
     * @param other		factor to compare
     */
    public boolean sameBase(Factor other) {
        return this.type == other.type && this.name.equals(other.name);
    }

    /**
     * @return the type of base
     */
    public Type getType() {
        return this.type;
    }

    /**
     * @return the base expression
     */
    public Expr getBase() {
        return this.base;
    }

    /**
     * @return the text identifying the base (the name of a species or parameter)
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the 1-based species index, or 0 if this is not a species factor
     */
    public int getSpeciesIndex() {
        return this.speciesIndex;
    }

    /**
     * @return the exponent
     */
    public double getExponent() {
        return this.exponent;
    }

    /**
     * @return TRUE if this is a species factor
     */
    public boolean isSpecies() {
        return this.type == Type.SPECIES;
    }

    /**
     * @return the canonical text for this factor, used to build monomial keys
     */
    public String getKey() {
        String retVal = (this.type == Type.OPAQUE ? "(" + this.name + ")" : this.name);
        if (this.exponent != 1.0)
            retVal += "^" + Exprs.formatNumber(this.exponent);
        return retVal;
    }

    /**
     * @return this factor as an expression
     */
    public Expr toExpr() {
        return Exprs.pow(this.base, Exprs.constant(this.exponent));
    }

    @Override
    public int compareTo(Factor o) {
        int retVal = this.type.compareTo(o.type);
        if (retVal == 0) {
            retVal = this.speciesIndex - o.speciesIndex;
            if (retVal == 0) {
                retVal = this.name.compareTo(o.name);
                if (retVal == 0)
                    retVal = Double.compare(this.exponent, o.exponent);
            }
        }
        return retVal;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.type.hashCode();
        result = prime * result + this.name.hashCode();
        result = prime * result + Double.hashCode(this.exponent);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Factor))
            return false;
        Factor other = (Factor) obj;
        return this.type == other.type && this.name.equals(other.name) && this.exponent == other.exponent;
    }

    @Override
    public String toString() {
        return this.getKey();
    }

}
