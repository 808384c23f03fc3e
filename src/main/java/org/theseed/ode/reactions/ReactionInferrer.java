/**
 *
 */
package org.theseed.ode.reactions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.model.Factor;
import org.theseed.ode.model.ModelParameter;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeVariable;
import org.theseed.ode.model.Term;

/**
 * This object infers a reaction network from the canonical terms of an ODE model.  The terms
 * of all the derivatives are grouped by monomial, and each group is split into the fewest
 * reactions that satisfy the stoichiometry limits.  The negative terms of a reaction are its
 * reactants and the positive terms its products.
 *
 * A term's sign includes the signs of the parameters with known values, so "k * x_1" with
 * a negative k counts as a negative term.  A term containing a parameter whose value is zero
 * contributes nothing and is skipped.
 */
public class ReactionInferrer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionInferrer.class);
    /** maximum total reactant stoichiometry */
    private final int maxReactants;
    /** maximum total product stoichiometry */
    private final int maxProducts;
    /** maximum stoichiometry of a single species */
    private final int maxStoich;

    /** default maximum total reactant stoichiometry */
    public static final int DEFAULT_MAX_REACTANTS = 2;
    /** default maximum total product stoichiometry */
    public static final int DEFAULT_MAX_PRODUCTS = 3;
    /** default maximum stoichiometry of a single species */
    public static final int DEFAULT_MAX_STOICH = 4;

    /**
     * Create a reaction inferrer with the default limits.
     */
    public ReactionInferrer() {
        this(DEFAULT_MAX_REACTANTS, DEFAULT_MAX_PRODUCTS, DEFAULT_MAX_STOICH);
    }

    /**
     * Create a reaction inferrer.
     *
     * @param maxReactants	maximum total reactant stoichiometry
     * @param maxProducts	maximum total product stoichiometry
     * @param maxStoich		maximum stoichiometry of a single species
     */
    public ReactionInferrer(int maxReactants, int maxProducts, int maxStoich) {
        if (maxReactants < 1 || maxProducts < 1 || maxStoich < 1)
            throw new IllegalArgumentException("Stoichiometry limits must be positive.");
        this.maxReactants = maxReactants;
        this.maxProducts = maxProducts;
        this.maxStoich = maxStoich;
    }

    /**
     * @return the reaction network for a model
     *
     * @param model		ODE model whose terms are to be explained
     *
     * @throws InferenceException
     */
    public ReactionNetwork infer(OdeModel model) throws InferenceException {
        // Group the terms by monomial, in order of first appearance.
        Map<String, List<ReactionGrouping.Entry>> groups = new LinkedHashMap<String, List<ReactionGrouping.Entry>>();
        Map<String, Double> values = new HashMap<String, Double>();
        for (ModelParameter parm : model.getParameters()) {
            if (parm.hasValue())
                values.put(parm.getName(), parm.getValue());
        }
        int order = 0;
        List<String> species = new ArrayList<String>(model.size());
        for (OdeVariable variable : model.getVariables()) {
            species.add(variable.getName());
            for (Term term : variable.getTerms()) {
                int sign = parameterSign(term, values);
                if (sign == 0)
                    log.warn("Term {} of d{}/dt has a zero parameter and is skipped.", term, variable.getName());
                else {
                    var entry = new ReactionGrouping.Entry(variable.getName(), variable.getIndex(), term, order, sign);
                    groups.computeIfAbsent(term.getKey(), x -> new ArrayList<ReactionGrouping.Entry>()).add(entry);
                }
                order++;
            }
        }
        log.info("{} terms found with {} distinct monomials.", order, groups.size());
        // Split each group into reactions.
        List<InferredReaction> reactions = new ArrayList<InferredReaction>();
        for (Map.Entry<String, List<ReactionGrouping.Entry>> group : groups.entrySet()) {
            var grouping = new ReactionGrouping(group.getKey(), group.getValue(), this.maxReactants,
                    this.maxProducts, this.maxStoich);
            reactions.addAll(grouping.solve());
        }
        // Sort into source order and assign the IDs.
        Collections.sort(reactions);
        List<InferredReaction> named = new ArrayList<InferredReaction>(reactions.size());
        for (int i = 0; i < reactions.size(); i++)
            named.add(reactions.get(i).withId("r" + (i + 1)));
        log.info("{} reactions inferred.", named.size());
        return new ReactionNetwork(species, named);
    }

    /**
     * @return the sign of the product of a term's parameter factors, or 0 if one of them is zero
     *
     * Parameters without a known value are treated as positive.
     *
     * @param term		term to check
     * @param values	map of parameter names to known values
     *
     * @throws InferenceException
     */
    private static int parameterSign(Term term, Map<String, Double> values) throws InferenceException {
        int retVal = 1;
        for (Factor factor : term.getFactors()) {
            if (factor.getType() == Factor.Type.PARAMETER) {
                Double value = values.get(factor.getName());
                if (value != null) {
                    double exponent = factor.getExponent();
                    if (value == 0.0) {
                        if (exponent < 0)
                            throw new InferenceException(InferenceException.Kind.SINGULAR_RATE,
                                    "Term " + term + " divides by " + factor.getName() + ", which is zero.");
                        retVal = 0;
                    } else if (value < 0 && exponent == Math.rint(exponent) && Math.abs(exponent) % 2 == 1)
                        retVal = -retVal;
                }
            }
        }
        return retVal;
    }

    /**
     * @return the maximum total reactant stoichiometry
     */
    public int getMaxReactants() {
        return this.maxReactants;
    }

    /**
     * @return the maximum total product stoichiometry
     */
    public int getMaxProducts() {
        return this.maxProducts;
    }

    /**
     * @return the maximum stoichiometry of a single species
     */
    public int getMaxStoich() {
        return this.maxStoich;
    }

}
