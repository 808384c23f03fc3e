/**
 *
 */
package org.theseed.ode.reactions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.model.Term;
import org.theseed.ode.model.TermExpander;

/**
 * This object contains the reactions inferred for an ODE model, in source order of the
 * first term each one explains.
 */
public class ReactionNetwork {

    // FIELDS
    /** species names, in state-vector order */
    private final List<String> species;
    /** reactions */
    private final List<InferredReaction> reactions;

    /**
     * Create a reaction network.
     *
     * @param species		species names, in state-vector order
     * @param reactions		reactions, in source order
     */
    public ReactionNetwork(List<String> species, List<InferredReaction> reactions) {
        this.species = species;
        this.reactions = reactions;
    }

    /**
     * @return the species names, in state-vector order
     */
    public List<String> getSpecies() {
        return Collections.unmodifiableList(this.species);
    }

    /**
     * @return the reactions
     */
    public List<InferredReaction> getReactions() {
        return Collections.unmodifiableList(this.reactions);
    }

    /**
     * @return the number of reactions
     */
    public int size() {
        return this.reactions.size();
    }

    /**
     * @return the merged terms of a species' derivative, computed from the reactions
     *
     * @param speciesName	name of the species
     */
    public List<Term> rederiveTerms(String speciesName) {
        List<Term> terms = new ArrayList<Term>();
        for (InferredReaction reaction : this.reactions) {
            int net = reaction.getNetCoeff(speciesName);
            if (net != 0) {
                Term rate = reaction.getRateTerm();
                terms.add(rate.withCoefficient(net * rate.getCoefficient()));
            }
        }
        return TermExpander.merge(terms);
    }

    /**
     * @return the right side of a species' differential equation, computed from the reactions
     *
     * @param speciesName	name of the species
     */
    public Expr rederive(String speciesName) {
        Expr retVal = Exprs.ZERO;
        for (Term term : this.rederiveTerms(speciesName))
            retVal = Exprs.add(retVal, term.toExpr());
        return retVal;
    }

}
