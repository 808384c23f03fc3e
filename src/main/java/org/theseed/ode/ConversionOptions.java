/**
 *
 */
package org.theseed.ode;

import org.theseed.ode.reactions.ReactionInferrer;
import org.theseed.ode.sbml.SbmlModelBuilder;

/**
 * This object holds the settings for a conversion.  The setters return the object itself so
 * that options can be chained.
 */
public class ConversionOptions implements SbmlModelBuilder.IParms {

    // FIELDS
    /** way of expressing the dynamics */
    private SbmlModelBuilder.Type mode;
    /** TRUE to use rate rules when reaction inference fails */
    private boolean fallback;
    /** TRUE to make the state variables parameters instead of species */
    private boolean speciesAsParameters;
    /** TRUE to name the species after the second output of the solver call */
    private boolean useOutputNames;
    /** maximum total reactant stoichiometry */
    private int maxReactants;
    /** maximum total product stoichiometry */
    private int maxProducts;
    /** maximum stoichiometry of a single species */
    private int maxStoich;
    /** model ID, or NULL to use the source name */
    private String modelId;
    /** TRUE to describe the converted elements in notes or comments */
    private boolean addComments;

    /**
     * Create a default set of options.
     */
    public ConversionOptions() {
        this.mode = SbmlModelBuilder.Type.REACTIONS;
        this.fallback = true;
        this.speciesAsParameters = false;
        this.useOutputNames = false;
        this.maxReactants = ReactionInferrer.DEFAULT_MAX_REACTANTS;
        this.maxProducts = ReactionInferrer.DEFAULT_MAX_PRODUCTS;
        this.maxStoich = ReactionInferrer.DEFAULT_MAX_STOICH;
        this.modelId = null;
        this.addComments = false;
    }

    /**
     * @return the way of expressing the dynamics
     */
    public SbmlModelBuilder.Type getMode() {
        return this.mode;
    }

    /**
     * Specify the way of expressing the dynamics.
     *
     * @param mode 	the mode to set
     */
    public ConversionOptions setMode(SbmlModelBuilder.Type mode) {
        this.mode = mode;
        return this;
    }

    /**
     * @return TRUE if rate rules are used when reaction inference fails
     */
    public boolean isFallback() {
        return this.fallback;
    }

    /**
     * Specify whether rate rules should be used when reaction inference fails.
     *
     * @param fallback 	TRUE to fall back to rate rules, FALSE to fail
     */
    public ConversionOptions setFallback(boolean fallback) {
        this.fallback = fallback;
        return this;
    }

    @Override
    public boolean isSpeciesAsParameters() {
        return this.speciesAsParameters;
    }

    /**
     * Specify whether the state variables should be parameters instead of species.
     *
     * @param speciesAsParameters 	TRUE to use parameters
     */
    public ConversionOptions setSpeciesAsParameters(boolean speciesAsParameters) {
        this.speciesAsParameters = speciesAsParameters;
        return this;
    }

    /**
     * @return TRUE if the species are named after the second output of the solver call
     */
    public boolean isUseOutputNames() {
        return this.useOutputNames;
    }

    /**
     * Specify whether to name the species after the second output of the solver call.
     *
     * @param useOutputNames 	TRUE to use the output name, FALSE to use the state parameter
     */
    public ConversionOptions setUseOutputNames(boolean useOutputNames) {
        this.useOutputNames = useOutputNames;
        return this;
    }

    /**
     * @return the maximum total reactant stoichiometry
     */
    public int getMaxReactants() {
        return this.maxReactants;
    }

    /**
     * @param maxReactants 	the maximum total reactant stoichiometry
     */
    public ConversionOptions setMaxReactants(int maxReactants) {
        this.maxReactants = maxReactants;
        return this;
    }

    /**
     * @return the maximum total product stoichiometry
     */
    public int getMaxProducts() {
        return this.maxProducts;
    }

    /**
     * @param maxProducts 	the maximum total product stoichiometry
     */
    public ConversionOptions setMaxProducts(int maxProducts) {
        this.maxProducts = maxProducts;
        return this;
    }

    /**
     * @return the maximum stoichiometry of a single species
     */
    public int getMaxStoich() {
        return this.maxStoich;
    }

    /**
     * @param maxStoich 	the maximum stoichiometry of a single species
     */
    public ConversionOptions setMaxStoich(int maxStoich) {
        this.maxStoich = maxStoich;
        return this;
    }

    @Override
    public String getModelId() {
        return this.modelId;
    }

    /**
     * @param modelId 	the model ID to use, or NULL to use the source name
     */
    public ConversionOptions setModelId(String modelId) {
        this.modelId = modelId;
        return this;
    }

    @Override
    public boolean isAddComments() {
        return this.addComments;
    }

    /**
     * Specify whether the converted elements should be described in notes or comments.
     *
     * @param addComments	TRUE to add descriptive notes
     */
    public ConversionOptions setAddComments(boolean addComments) {
        this.addComments = addComments;
        return this;
    }

}
