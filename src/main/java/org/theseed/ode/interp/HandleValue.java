package org.theseed.ode.interp;

import org.theseed.ode.matlab.ast.AnonymousFunctionNode;

/**
 * A function handle.  This either names a function ("@f") or holds an anonymous function.
 */
public class HandleValue extends Value {

    // FIELDS
    /** name of the function, or NULL for an anonymous function */
    private final String name;
    /** anonymous function, or NULL for a named handle */
    private final AnonymousFunctionNode lambda;

    /**
     * Create a handle for a named function.
     *
     * @param name		name of the function
     */
    public HandleValue(String name) {
        this.name = name;
        this.lambda = null;
    }

    /**
     * Create a handle for an anonymous function.
     *
     * @param lambda	anonymous function node
     */
    public HandleValue(AnonymousFunctionNode lambda) {
        this.name = null;
        this.lambda = lambda;
    }

    /**
     * @return the function name, or NULL for an anonymous function
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the anonymous function, or NULL for a named handle
     */
    public AnonymousFunctionNode getLambda() {
        return this.lambda;
    }

    /**
     * @return TRUE if this is an anonymous function
     */
    public boolean isAnonymous() {
        return this.lambda != null;
    }

    @Override
    public String describe() {
        return (this.name != null ? "function handle @" + this.name : "anonymous function");
    }

}
