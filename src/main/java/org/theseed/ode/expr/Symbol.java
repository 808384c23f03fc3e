package org.theseed.ode.expr;

import java.util.Set;

/**
 * A named quantity:  a species, a parameter, or the simulation time.  Time is a
 * distinguished singleton so that a user name like "time" can never be mistaken for it.
 */
public class Symbol extends Expr {

    // FIELDS
    /** name of the symbol */
    private final String name;
    /** TRUE for the simulation time */
    private final boolean time;
    /** the simulation time symbol */
    public static final Symbol TIME = new Symbol("time", true);

    /**
     * Create a named symbol.
     *
     * @param name		name of the symbol
     */
    public Symbol(String name) {
        this(name, false);
    }

    private Symbol(String name, boolean time) {
        this.name = name;
        this.time = time;
    }

    /**
     * @return the symbol name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return TRUE if this is the simulation time
     */
    public boolean isTime() {
        return this.time;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    protected void addSymbols(Set<String> symbols) {
        if (! this.time)
            symbols.add(this.name);
    }

    @Override
    public boolean dependsOnTime() {
        return this.time;
    }

    @Override
    public int hashCode() {
        return this.name.hashCode() + (this.time ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Symbol))
            return false;
        Symbol other = (Symbol) obj;
        return this.time == other.time && this.name.equals(other.name);
    }

}
