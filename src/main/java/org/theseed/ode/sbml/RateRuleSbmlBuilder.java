/**
 *
 */
package org.theseed.ode.sbml;

import org.sbml.jsbml.Model;
import org.sbml.jsbml.RateRule;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeVariable;
import org.theseed.ode.reactions.ReactionNetwork;

/**
 * This builder expresses the dynamics as one rate rule per state variable, using the
 * derivative expression exactly as the script computes it.
 */
public class RateRuleSbmlBuilder extends SbmlModelBuilder {

    /**
     * Construct a rate-rule model builder.
     *
     * @param processor		controlling parameters
     */
    public RateRuleSbmlBuilder(IParms processor) {
        super(processor);
    }

    @Override
    protected void addDynamics(Model sbmlModel, OdeModel model, ReactionNetwork network) {
        for (OdeVariable variable : model.getVariables()) {
            RateRule rule = sbmlModel.createRateRule();
            rule.setVariable(variable.getName());
            rule.setMath(MathConverter.convert(variable.getDerivative()));
            if (this.isAddComments())
                addNotes(rule, "d" + variable.getName() + "/dt = " + variable.getDerivative());
        }
        log.info("{} rate rules created.", model.size());
    }

}
