package org.theseed.ode.interp;

/**
 * This is the base class for the values a MATLAB expression can produce during
 * interpretation:  numeric or symbolic matrices, strings, and function handles.
 */
public abstract class Value {

    /**
     * @return a short description of the value for error messages
     */
    public abstract String describe();

    @Override
    public String toString() {
        return this.describe();
    }

}
