/**
 *
 */
package org.theseed.ode.sbml;

import org.sbml.jsbml.KineticLaw;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.Reaction;
import org.sbml.jsbml.Species;
import org.sbml.jsbml.SpeciesReference;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.reactions.InferredReaction;
import org.theseed.ode.reactions.ReactionNetwork;

/**
 * This builder expresses the dynamics as a network of irreversible reactions, each with
 * its reactants, products, modifiers and a kinetic law.
 */
public class ReactionSbmlBuilder extends SbmlModelBuilder {

    /**
     * Construct a reaction model builder.
     *
     * @param processor		controlling parameters
     */
    public ReactionSbmlBuilder(IParms processor) {
        super(processor);
        if (processor.isSpeciesAsParameters())
            throw new IllegalArgumentException("Reactions require the state variables to be species.");
    }

    @Override
    protected void addDynamics(Model sbmlModel, OdeModel model, ReactionNetwork network) {
        if (network == null)
            throw new IllegalArgumentException("No reaction network available for model " + model.getName() + ".");
        for (InferredReaction reaction : network.getReactions()) {
            Reaction sbmlReaction = sbmlModel.createReaction(reaction.getId());
            sbmlReaction.setReversible(false);
            sbmlReaction.setFast(false);
            for (InferredReaction.Stoich stoich : reaction.getStoichs()) {
                Species species = sbmlModel.getSpecies(stoich.getSpecies());
                SpeciesReference ref = (stoich.isProduct() ? sbmlReaction.createProduct(species)
                        : sbmlReaction.createReactant(species));
                ref.setStoichiometry(stoich.getCoeff());
                ref.setConstant(true);
            }
            for (String modifier : reaction.getModifiers())
                sbmlReaction.createModifier(sbmlModel.getSpecies(modifier));
            KineticLaw law = sbmlReaction.createKineticLaw();
            law.setMath(MathConverter.convert(reaction.getRate()));
            if (this.isAddComments())
                addNotes(sbmlReaction, reaction.getFormula() + "; rate " + reaction.getRate());
            log.debug("Reaction {} created: {}.", reaction.getId(), reaction.getFormula());
        }
        log.info("{} reactions created.", network.size());
    }

}
