package org.theseed.ode.expr;

import java.util.List;
import java.util.Set;

/**
 * A call to an elementary function that is kept symbolically, such as "exp(x_1)".
 */
public class FunctionCall extends Expr {

    // FIELDS
    /** function name */
    private final String name;
    /** arguments */
    private final List<Expr> args;

    public FunctionCall(String name, List<Expr> args) {
        this.name = name;
        this.args = List.copyOf(args);
    }

    /**
     * @return the function name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the arguments
     */
    public List<Expr> getArgs() {
        return this.args;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    protected void addSymbols(Set<String> symbols) {
        for (Expr arg : this.args)
            arg.addSymbols(symbols);
    }

    @Override
    public boolean dependsOnTime() {
        return this.args.stream().anyMatch(x -> x.dependsOnTime());
    }

    @Override
    public int hashCode() {
        return this.name.hashCode() * 31 + this.args.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof FunctionCall))
            return false;
        FunctionCall other = (FunctionCall) obj;
        return this.name.equals(other.name) && this.args.equals(other.args);
    }

}
