/**
 *
 */
package org.theseed.ode.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.model.ModelParameter;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeVariable;
import org.theseed.ode.model.Term;

/**
 * This command extracts the ODE system from a MATLAB file and lists the state variables
 * followed by the parameters.  For each state variable, we show the species name, the
 * initial condition, the derivative and its canonical terms.
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
 */
public class OdeReportProcessor extends BaseSourceReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(OdeReportProcessor.class);

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        OdeModel model = this.buildModel();
        log.info("{} state variables found in {}.", model.size(), model.getName());
        writer.println("index\tspecies\tinitial\tderivative\tterms");
        for (OdeVariable variable : model.getVariables()) {
            String terms = variable.getTerms().stream().map(Term::toString).collect(Collectors.joining(" ; "));
            writer.println(variable.getIndex() + "\t" + variable.getName() + "\t" + variable.getInitialExpression()
                    + "\t" + variable.getDerivative() + "\t" + terms);
        }
        writer.println();
        writer.println("parameter\tvalue");
        for (ModelParameter parm : model.getParameters())
            writer.println(parm.getName() + "\t" + parm.getExpression());
    }

}
