/**
 *
 */
package org.theseed.ode.interp;

import java.util.List;

import org.theseed.ode.expr.Expr;
import org.theseed.ode.matlab.ast.FunctionDefinitionNode;

/**
 * This object describes the ODE right-hand-side function and the derivative expressions
 * produced by evaluating it.  For an anonymous function whose body is the derivative
 * vector itself, there is no function definition and the name is "anonymous".
 */
public class OdeFunction {

    // FIELDS
    /** function name */
    private final String name;
    /** function definition, or NULL for a synthetic function */
    private final FunctionDefinitionNode definition;
    /** name of the time parameter */
    private final String timeParam;
    /** name of the state-vector parameter */
    private final String stateParam;
    /** derivative expressions, one per state variable */
    private final List<Expr> derivatives;

    /**
     * Describe an evaluated ODE function.
     *
     * @param name			function name
     * @param definition	function definition, or NULL for a synthetic function
     * @param timeParam		name of the time parameter
     * @param stateParam	name of the state-vector parameter
     * @param derivatives	derivative expressions
     */
    public OdeFunction(String name, FunctionDefinitionNode definition, String timeParam, String stateParam,
            List<Expr> derivatives) {
        this.name = name;
        this.definition = definition;
        this.timeParam = timeParam;
        this.stateParam = stateParam;
        this.derivatives = derivatives;
    }

    /**
     * @return the function name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the function definition, or NULL for a synthetic function
     */
    public FunctionDefinitionNode getDefinition() {
        return this.definition;
    }

    /**
     * @return TRUE if this function was built from an anonymous function body
     */
    public boolean isSynthetic() {
        return this.definition == null;
    }

    /**
     * @return the name of the time parameter
     */
    public String getTimeParam() {
        return this.timeParam;
    }

    /**
     * @return the name of the state-vector parameter
     */
    public String getStateParam() {
        return this.stateParam;
    }

    /**
     * @return the derivative expressions, in state-vector order
     */
    public List<Expr> getDerivatives() {
        return this.derivatives;
    }

}
