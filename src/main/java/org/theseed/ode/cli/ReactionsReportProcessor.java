/**
 *
 */
package org.theseed.ode.cli;

import java.io.IOException;
import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.reactions.InferredReaction;
import org.theseed.ode.reactions.ReactionNetwork;

/**
 * This command infers a reaction network from the ODE system in a MATLAB file and lists the
 * reactions.  For each reaction, we show its type, the formula, the modifiers and the rate law.
 *
 * The positional parameter is the name of the MATLAB file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --output-names	name the species after the second output of the solver call
 * --maxReactants	maximum total reactant stoichiometry for an inferred reaction
 * --maxProducts	maximum total product stoichiometry for an inferred reaction
 * --maxStoich		maximum stoichiometry of a single species in an inferred reaction
 */
public class ReactionsReportProcessor extends BaseSourceReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionsReportProcessor.class);

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        OdeModel model = this.buildModel();
        ReactionNetwork network = this.getInferrer().infer(model);
        writer.println("reaction_id\tkind\tformula\tmodifiers\trate");
        for (InferredReaction reaction : network.getReactions()) {
            writer.println(reaction.getId() + "\t" + reaction.getKind() + "\t" + reaction.getFormula() + "\t"
                    + String.join(", ", reaction.getModifiers()) + "\t" + reaction.getRate());
        }
    }

}
