/**
 *
 */
package org.theseed.ode.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.interp.InterpretedScript;
import org.theseed.ode.interp.OdeFunction;
import org.theseed.ode.matlab.SourceText;

/**
 * This object converts an interpreted script into an ODE model.  Each derivative is expanded
 * into canonical terms, and the parameters are the named constants that the derivatives and
 * initial conditions use, directly or through other constants.
 */
public class OdeModelBuilder {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(OdeModelBuilder.class);
    /** source text, for error messages */
    private final SourceText source;

    /**
     * Create a model builder.
     *
     * @param source	source text of the script, for error messages
     */
    public OdeModelBuilder(SourceText source) {
        this.source = source;
    }

    /**
     * @return the ODE model for an interpreted script
     *
     * @param script	interpreted script to convert
     *
     * @throws ModelBuildException
     */
    public OdeModel build(InterpretedScript script) throws ModelBuildException {
        OdeFunction function = script.getFunction();
        int line = (function.isSynthetic() ? script.getSolverCall().getLine() : function.getDefinition().getLine());
        String sourceLine = this.source.quote(line);
        List<String> speciesNames = script.getSpeciesNames();
        Map<String, Integer> speciesIndex = new HashMap<String, Integer>(speciesNames.size() * 4 / 3 + 1);
        for (int i = 0; i < speciesNames.size(); i++)
            speciesIndex.put(speciesNames.get(i), i + 1);
        Map<String, Expr> constants = script.getConstants();
        // Collect the parameters used by the derivatives and initial conditions.
        List<Expr> derivatives = script.getDerivatives();
        List<Expr> initials = script.getInitialValues();
        Set<String> used = new LinkedHashSet<String>();
        Deque<String> queue = new ArrayDeque<String>();
        List<Expr> roots = new ArrayList<Expr>(derivatives);
        roots.addAll(initials);
        for (Expr root : roots)
            queue.addAll(root.getSymbols());
        while (! queue.isEmpty()) {
            String name = queue.pop();
            Expr value = constants.get(name);
            if (value != null && used.add(name))
                queue.addAll(value.getSymbols());
        }
        List<ModelParameter> parameters = new ArrayList<ModelParameter>(used.size());
        for (Map.Entry<String, Expr> constant : constants.entrySet()) {
            if (used.contains(constant.getKey()))
                parameters.add(new ModelParameter(constant.getKey(), constant.getValue()));
        }
        log.info("{} parameters used by the model.", parameters.size());
        // Expand the derivatives.
        TermExpander expander = new TermExpander(speciesIndex, used, line, sourceLine);
        List<OdeVariable> variables = new ArrayList<OdeVariable>(speciesNames.size());
        for (int i = 0; i < speciesNames.size(); i++) {
            Expr derivative = derivatives.get(i);
            List<Term> terms = expander.expand(derivative);
            for (String name : initials.get(i).getSymbols()) {
                if (! used.contains(name))
                    throw new ModelBuildException(ModelBuildException.Kind.UNDEFINED_SYMBOL,
                            "Initial condition of " + speciesNames.get(i) + " uses unknown name \"" + name + "\".",
                            line, sourceLine);
            }
            variables.add(new OdeVariable(i + 1, speciesNames.get(i), initials.get(i), derivative, terms));
            log.debug("d{}/dt = {} ({} terms).", speciesNames.get(i), derivative, terms.size());
        }
        return new OdeModel(script.getName(), variables, parameters);
    }

}
