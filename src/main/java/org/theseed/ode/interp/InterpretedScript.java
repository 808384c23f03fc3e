/**
 *
 */
package org.theseed.ode.interp;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.theseed.ode.expr.Expr;
import org.theseed.ode.matlab.ast.ScriptNode;

/**
 * This object contains the result of interpreting a script:  the symbol table of the
 * working scope, the solver call, the evaluated ODE function, the species names, the
 * initial values, and the named constants registered during evaluation.
 */
public class InterpretedScript {

    // FIELDS
    /** parse tree */
    private final ScriptNode script;
    /** symbol table of the working scope */
    private final SymbolTable symbols;
    /** solver call */
    private final SolverCall solverCall;
    /** evaluated ODE function */
    private final OdeFunction function;
    /** species names, in state-vector order */
    private final List<String> speciesNames;
    /** initial values, in state-vector order */
    private final List<Expr> initialValues;
    /** named constants, in registration order */
    private final Map<String, Expr> constants;
    /** separator used to build indexed names */
    private final String separator;

    /**
     * Assemble an interpreted script.
     *
     * @param script			parse tree
     * @param symbols			symbol table of the working scope
     * @param solverCall		solver call
     * @param function			evaluated ODE function
     * @param speciesNames		species names
     * @param initialValues		initial values
     * @param constants			named constants
     * @param separator			separator for indexed names
     */
    public InterpretedScript(ScriptNode script, SymbolTable symbols, SolverCall solverCall, OdeFunction function,
            List<String> speciesNames, List<Expr> initialValues, Map<String, Expr> constants, String separator) {
        this.script = script;
        this.symbols = symbols;
        this.solverCall = solverCall;
        this.function = function;
        this.speciesNames = speciesNames;
        this.initialValues = initialValues;
        this.constants = constants;
        this.separator = separator;
    }

    /**
     * @return the parse tree
     */
    public ScriptNode getScript() {
        return this.script;
    }

    /**
     * @return the name of the source script
     */
    public String getName() {
        return this.script.getName();
    }

    /**
     * @return the symbol table of the working scope
     */
    public SymbolTable getSymbols() {
        return this.symbols;
    }

    /**
     * @return the solver call
     */
    public SolverCall getSolverCall() {
        return this.solverCall;
    }

    /**
     * @return the evaluated ODE function
     */
    public OdeFunction getFunction() {
        return this.function;
    }

    /**
     * @return the species names, in state-vector order
     */
    public List<String> getSpeciesNames() {
        return Collections.unmodifiableList(this.speciesNames);
    }

    /**
     * @return the initial values, in state-vector order
     */
    public List<Expr> getInitialValues() {
        return Collections.unmodifiableList(this.initialValues);
    }

    /**
     * @return the derivative expressions, in state-vector order
     */
    public List<Expr> getDerivatives() {
        return this.function.getDerivatives();
    }

    /**
     * @return the named constants, in registration order
     */
    public Map<String, Expr> getConstants() {
        return Collections.unmodifiableMap(this.constants);
    }

    /**
     * @return the separator used to build indexed names
     */
    public String getSeparator() {
        return this.separator;
    }

}
