/**
 *
 */
package org.theseed.ode.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * This object describes a system of ordinary differential equations in canonical form.  It
 * contains the state variables in state-vector order and the parameters in the order they
 * were first defined.
 */
public class OdeModel {

    // FIELDS
    /** model name */
    private final String name;
    /** state variables in state-vector order */
    private final List<OdeVariable> variables;
    /** parameters in definition order */
    private final List<ModelParameter> parameters;
    /** map of species names to state variables */
    private final Map<String, OdeVariable> variableMap;

    /**
     * Create an ODE model.
     *
     * @param name			model name
     * @param variables		state variables, in state-vector order
     * @param parameters	parameters, in definition order
     */
    public OdeModel(String name, List<OdeVariable> variables, List<ModelParameter> parameters) {
        this.name = name;
        this.variables = variables;
        this.parameters = parameters;
        this.variableMap = new LinkedHashMap<String, OdeVariable>(variables.size() * 4 / 3 + 1);
        for (OdeVariable variable : variables)
            this.variableMap.put(variable.getName(), variable);
    }

    /**
     * @return the model name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the state variables, in state-vector order
     */
    public List<OdeVariable> getVariables() {
        return Collections.unmodifiableList(this.variables);
    }

    /**
     * @return the state variable with the specified species name, or NULL if there is none
     *
     * @param speciesName	name of the desired species
     */
    public OdeVariable getVariable(String speciesName) {
        return this.variableMap.get(speciesName);
    }

    /**
     * @return the parameters, in definition order
     */
    public List<ModelParameter> getParameters() {
        return Collections.unmodifiableList(this.parameters);
    }

    /**
     * @return the number of state variables
     */
    public int size() {
        return this.variables.size();
    }

}
