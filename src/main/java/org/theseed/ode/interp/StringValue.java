package org.theseed.ode.interp;

/**
 * A character string.  Strings only matter as option names and function names.
 */
public class StringValue extends Value {

    /** string content */
    private final String value;

    public StringValue(String value) {
        this.value = value;
    }

    /**
     * @return the string content
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public String describe() {
        return "string '" + this.value + "'";
    }

}
