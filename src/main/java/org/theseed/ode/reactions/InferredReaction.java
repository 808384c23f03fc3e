/**
 *
 */
package org.theseed.ode.reactions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.theseed.ode.expr.Expr;
import org.theseed.ode.model.Term;

/**
 * This object represents a reaction inferred from the terms of an ODE model.  It has a list
 * of stoichiometric entries (negative for reactants, positive for products), a list of
 * modifiers (species in the rate law that are not consumed), and a rate law consisting of
 * a single term.
 */
public class InferredReaction implements Comparable<InferredReaction> {

    // FIELDS
    /** reaction ID */
    private final String id;
    /** stoichiometric entries, reactants before products */
    private final List<Stoich> stoichs;
    /** modifier species */
    private final List<String> modifiers;
    /** rate law, as a term whose coefficient is the common unit */
    private final Term rate;
    /** source position of the first term explained by this reaction */
    private final int firstTerm;

    /**
     * Reaction types.
     */
    public static enum Kind {
        /** reactants become products */
        CONVERSION,
        /** products are created from nothing */
        SYNTHESIS,
        /** reactants are destroyed */
        DEGRADATION;
    }

    /**
     * This class represents a species participating in the reaction, along with its
     * stoichiometric coefficient.
     */
    public static class Stoich implements Comparable<Stoich> {

        /** stoichiometric coefficient (negative for a reactant) */
        private final int coefficient;
        /** species name */
        private final String species;
        /** 1-based index of the species in the state vector */
        private final int index;

        /**
         * Construct a new stoichiometric entry.
         *
         * @param coeff		coefficient (negative for a reactant)
         * @param species	species name
         * @param index		state-vector index of the species
         */
        public Stoich(int coeff, String species, int index) {
            this.coefficient = coeff;
            this.species = species;
            this.index = index;
        }

        @Override
        public int compareTo(Stoich o) {
            int retVal = Boolean.compare(this.isProduct(), o.isProduct());
            if (retVal == 0)
                retVal = this.index - o.index;
            return retVal;
        }

        /**
         * @return the coefficient (always positive)
         */
        public int getCoeff() {
            return (this.coefficient < 0 ? -this.coefficient : this.coefficient);
        }

        /**
         * @return the signed coefficient (negative for a reactant)
         */
        public int getNetCoeff() {
            return this.coefficient;
        }

        /**
         * @return TRUE for a product, FALSE for a reactant
         */
        public boolean isProduct() {
            return (this.coefficient > 0);
        }

        /**
         * @return the species name
         */
        public String getSpecies() {
            return this.species;
        }

        /**
         * @return the state-vector index of the species
         */
        public int getIndex() {
            return this.index;
        }

        @Override
        public String toString() {
            int coeff = this.getCoeff();
            String retVal;
            if (coeff == 1)
                retVal = this.species;
            else
                retVal = String.format("%d*%s", coeff, this.species);
            return retVal;
        }

    }

    /**
     * Construct an inferred reaction.
     *
     * @param id			reaction ID
     * @param stoichs		stoichiometric entries
     * @param rate			rate law term
     * @param firstTerm		source position of the first term explained
     */
    public InferredReaction(String id, List<Stoich> stoichs, Term rate, int firstTerm) {
        this.id = id;
        this.stoichs = new ArrayList<Stoich>(stoichs);
        Collections.sort(this.stoichs);
        this.rate = rate;
        this.firstTerm = firstTerm;
        this.modifiers = new ArrayList<String>();
        for (String species : rate.getSpecies()) {
            if (this.stoichs.stream().noneMatch(x -> ! x.isProduct() && x.getSpecies().equals(species)))
                this.modifiers.add(species);
        }
    }

    /**
     * @return a copy of this reaction with a different ID
     *
     * @param newId		new reaction ID
     */
    public InferredReaction withId(String newId) {
        return new InferredReaction(newId, this.stoichs, this.rate, this.firstTerm);
    }

    /**
     * @return the reaction ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the reactants
     */
    public List<Stoich> getReactants() {
        return this.stoichs.stream().filter(x -> ! x.isProduct()).collect(Collectors.toList());
    }

    /**
     * @return the products
     */
    public List<Stoich> getProducts() {
        return this.stoichs.stream().filter(x -> x.isProduct()).collect(Collectors.toList());
    }

    /**
     * @return all the stoichiometric entries, reactants first
     */
    public List<Stoich> getStoichs() {
        return Collections.unmodifiableList(this.stoichs);
    }

    /**
     * @return the net stoichiometric coefficient of a species (0 if it does not participate)
     *
     * @param species	name of the species
     */
    public int getNetCoeff(String species) {
        int retVal = 0;
        for (Stoich stoich : this.stoichs) {
            if (stoich.getSpecies().equals(species))
                retVal += stoich.getNetCoeff();
        }
        return retVal;
    }

    /**
     * @return the modifier species
     */
    public List<String> getModifiers() {
        return Collections.unmodifiableList(this.modifiers);
    }

    /**
     * @return the rate law as a term
     */
    public Term getRateTerm() {
        return this.rate;
    }

    /**
     * @return the rate law as an expression
     */
    public Expr getRate() {
        return this.rate.toExpr();
    }

    /**
     * @return the source position of the first term explained by this reaction
     */
    public int getFirstTerm() {
        return this.firstTerm;
    }

    /**
     * @return the type of this reaction
     */
    public Kind getKind() {
        boolean reactants = this.stoichs.stream().anyMatch(x -> ! x.isProduct());
        boolean products = this.stoichs.stream().anyMatch(x -> x.isProduct());
        Kind retVal;
        if (reactants && products)
            retVal = Kind.CONVERSION;
        else if (products)
            retVal = Kind.SYNTHESIS;
        else
            retVal = Kind.DEGRADATION;
        return retVal;
    }

    /**
     * @return the reaction formula, in the form "reactants -> products"
     */
    public String getFormula() {
        String left = this.getReactants().stream().map(Stoich::toString).collect(Collectors.joining(" + "));
        String right = this.getProducts().stream().map(Stoich::toString).collect(Collectors.joining(" + "));
        return (left.isEmpty() ? "0" : left) + " -> " + (right.isEmpty() ? "0" : right);
    }

    @Override
    public int compareTo(InferredReaction o) {
        return this.firstTerm - o.firstTerm;
    }

    @Override
    public String toString() {
        return this.id + ": " + this.getFormula() + "; " + this.getRate();
    }

}
