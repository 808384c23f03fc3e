/**
 *
 */
package org.theseed.ode.interp;

import java.util.List;

import org.theseed.ode.matlab.ast.AssignmentNode;
import org.theseed.ode.matlab.ast.CallNode;
import org.theseed.ode.matlab.ast.Expression;

/**
 * This object describes the call to the ODE solver.  The time span and the options
 * argument are read and dropped, since SBML has nowhere to put them.
 */
public class SolverCall {

    // FIELDS
    /** the call node */
    private final CallNode call;
    /** the assignment receiving the solver outputs, or NULL */
    private final AssignmentNode assignment;
    /** position of the call in the working scope */
    private final int order;

    /** names of the recognized solver functions */
    public static final List<String> SOLVER_NAMES = List.of("ode45", "ode23", "ode113", "ode15s",
            "ode23s", "ode23t", "ode23tb", "ode15i");

    /**
     * Describe a solver call.
     *
     * @param call			solver call node
     * @param assignment	assignment receiving the outputs, or NULL
     * @param order			position of the call in the working scope
     */
    public SolverCall(CallNode call, AssignmentNode assignment, int order) {
        this.call = call;
        this.assignment = assignment;
        this.order = order;
    }

    /**
     * @return TRUE if the specified name is a solver function
     *
     * @param name		name to check
     */
    public static boolean isSolver(String name) {
        return SOLVER_NAMES.contains(name);
    }

    /**
     * @return TRUE if the expression is a call to a solver function
     *
     * @param expr		expression to check
     */
    public static boolean isSolverCall(Expression expr) {
        return (expr instanceof CallNode && isSolver(((CallNode) expr).getName()));
    }

    /**
     * @return the name of the solver
     */
    public String getSolverName() {
        return this.call.getName();
    }

    /**
     * @return the call node
     */
    public CallNode getCall() {
        return this.call;
    }

    /**
     * @return the argument list
     */
    public List<Expression> getArgs() {
        return this.call.getArgs();
    }

    /**
     * @return the position of the call in the working scope
     */
    public int getOrder() {
        return this.order;
    }

    /**
     * @return the source line of the call
     */
    public int getLine() {
        return this.call.getLine();
    }

    /**
     * @return the name of the specified output variable, or NULL if there is none
     *
     * @param idx	0-based output index
     */
    public String getOutputName(int idx) {
        String retVal = null;
        if (this.assignment != null) {
            List<AssignmentNode.Target> targets = this.assignment.getTargets();
            if (idx < targets.size() && ! targets.get(idx).isIgnored())
                retVal = targets.get(idx).getName();
        }
        return retVal;
    }

}
