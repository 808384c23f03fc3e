/**
 *
 */
package org.theseed.ode.interp;

import java.util.HashMap;
import java.util.Map;

/**
 * This is the variable workspace of a function body or anonymous function during
 * inline evaluation.  An anonymous-function scope has a parent, which is the scope
 * that invoked it; a function scope does not.
 */
public class LocalScope {

    // FIELDS
    /** variable values */
    private final Map<String, Value> variables;
    /** enclosing scope, or NULL */
    private final LocalScope parent;
    /** name of the function owning the scope, for diagnostics */
    private final String owner;

    /**
     * Create a new scope.
     *
     * @param owner		name of the function owning the scope
     * @param parent	enclosing scope, or NULL
     */
    public LocalScope(String owner, LocalScope parent) {
        this.variables = new HashMap<String, Value>();
        this.parent = parent;
        this.owner = owner;
    }

    /**
     * @return the value of a variable, or NULL if it is not defined here or in an enclosing scope
     *
     * @param name		name of the variable
     */
    public Value get(String name) {
        Value retVal = this.variables.get(name);
        if (retVal == null && this.parent != null)
            retVal = this.parent.get(name);
        return retVal;
    }

    /**
     * @return TRUE if the variable is defined here or in an enclosing scope
     *
     * @param name		name of the variable
     */
    public boolean contains(String name) {
        return this.get(name) != null;
    }

    /**
     * Store a variable value in this scope.
     *
     * @param name		name of the variable
     * @param value		new value
     */
    public void put(String name, Value value) {
        this.variables.put(name, value);
    }

    /**
     * @return the name of the function owning this scope
     */
    public String getOwner() {
        return this.owner;
    }

}
