/**
 *
 */
package org.theseed.ode.xpp;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.expr.NumericEvaluator;
import org.theseed.ode.model.ModelParameter;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeVariable;

/**
 * This object writes an ODE model as an XPPAUT ".ode" file.  Each parameter with a known
 * value becomes a "par" line and each parameter defined by a formula becomes a derived
 * parameter.  Each state variable gets an "init" line and a differential equation.  XPP
 * requires numeric initial conditions, so a symbolic initial value is evaluated using the
 * parameter values.
 *
 * If comments are requested, each parameter and state variable is preceded by a comment
 * describing it, and the file ends with a comment for each state variable defined by a rule.
 */
public class XppWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(XppWriter.class);
    /** TRUE to describe the model elements in comments */
    private final boolean comments;

    /**
     * Create an XPP writer.
     *
     * @param comments		TRUE to describe the model elements in comments
     */
    public XppWriter(boolean comments) {
        this.comments = comments;
    }

    /**
     * @return the text of the XPP file for a model
     *
     * @param model		ODE model to write
     */
    public String write(OdeModel model) {
        StringBuilder retVal = new StringBuilder(1000);
        retVal.append("#\n# Converted from MATLAB script ").append(model.getName()).append("\n#\n\n");
        // Track the parameter values for computing the initial conditions.
        Map<String, Double> values = new HashMap<String, Double>();
        for (ModelParameter parm : model.getParameters()) {
            String name = parm.getName();
            if (this.comments)
                retVal.append("# Parameter id = ").append(name).append(", constant\n");
            if (parm.hasValue()) {
                values.put(name, parm.getValue());
                retVal.append("par ").append(name).append('=').append(Exprs.formatNumber(parm.getValue())).append('\n');
            } else {
                retVal.append('!').append(name).append('=').append(XppFormatter.format(parm.getExpression())).append('\n');
                try {
                    values.put(name, NumericEvaluator.evaluate(parm.getExpression(), values, 0.0));
                } catch (IllegalArgumentException e) {
                    log.debug("Parameter {} has no numeric value: {}", name, e.getMessage());
                }
            }
            if (this.comments)
                retVal.append('\n');
        }
        if (! this.comments && ! model.getParameters().isEmpty())
            retVal.append('\n');
        // Write the state variables.
        for (OdeVariable variable : model.getVariables()) {
            String name = variable.getName();
            if (this.comments)
                retVal.append("# rateRule : variable = ").append(name).append('\n');
            retVal.append("init ").append(name).append('=').append(Exprs.formatNumber(this.initialValue(variable, values)))
                    .append('\n');
            retVal.append('d').append(name).append("/dt=").append(XppFormatter.format(variable.getDerivative()))
                    .append("\n\n");
        }
        if (this.comments) {
            for (OdeVariable variable : model.getVariables())
                retVal.append("# Species:   id = ").append(variable.getName()).append(", defined by rule\n");
            retVal.append('\n');
        }
        retVal.append("done\n");
        log.info("XPP file generated for {} with {} variables and {} parameters.", model.getName(), model.size(),
                model.getParameters().size());
        return retVal.toString();
    }

    /**
     * @return the numeric initial value of a state variable
     *
     * If the value cannot be computed, it is set to 0 with a warning.
     *
     * @param variable		state variable of interest
     * @param values		known parameter values
     */
    private double initialValue(OdeVariable variable, Map<String, Double> values) {
        double retVal = 0.0;
        if (variable.getInitialValue() != null)
            retVal = variable.getInitialValue();
        else {
            try {
                retVal = NumericEvaluator.evaluate(variable.getInitialExpression(), values, 0.0);
            } catch (IllegalArgumentException e) {
                log.warn("Initial value of {} cannot be computed and is set to 0: {}", variable.getName(), e.getMessage());
            }
        }
        return retVal;
    }

}
