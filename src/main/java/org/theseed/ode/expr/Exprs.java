/**
 *
 */
package org.theseed.ode.expr;

import java.util.List;

/**
 * This class contains factory methods for symbolic expressions.  Every method folds
 * constant operands and removes trivial operations (adding zero, multiplying by one),
 * so that an expression built entirely from numbers is always a single {@link Constant}.
 */
public final class Exprs {

    /** the constant zero */
    public static final Constant ZERO = new Constant(0.0);
    /** the constant one */
    public static final Constant ONE = new Constant(1.0);

    private Exprs() { }

    /**
     * @return a numeric constant
     *
     * @param value		value of the constant
     */
    public static Expr constant(double value) {
        Expr retVal;
        if (value == 0.0)
            retVal = ZERO;
        else if (value == 1.0)
            retVal = ONE;
        else
            retVal = new Constant(value);
        return retVal;
    }

    /**
     * @return a named symbol
     *
     * @param name		name of the symbol
     */
    public static Expr symbol(String name) {
        return new Symbol(name);
    }

    /**
     * @return the numeric value of an expression, or NULL if it is not a constant
     *
     * @param expr		expression to check
     */
    public static Double valueOf(Expr expr) {
        Double retVal = null;
        if (expr instanceof Constant)
            retVal = ((Constant) expr).getValue();
        return retVal;
    }

    /**
     * @return TRUE if the expression is the constant zero
     *
     * @param expr		expression to check
     */
    public static boolean isZero(Expr expr) {
        return (expr instanceof Constant && ((Constant) expr).getValue() == 0.0);
    }

    /**
     * @return TRUE if the expression is the constant one
     *
     * @param expr		expression to check
     */
    public static boolean isOne(Expr expr) {
        return (expr instanceof Constant && ((Constant) expr).getValue() == 1.0);
    }

    /**
     * @return TRUE if the expression is a negative constant
     *
     * @param expr		expression to check
     */
    private static boolean isNegativeConstant(Expr expr) {
        return (expr instanceof Constant && ((Constant) expr).getValue() < 0.0);
    }

    public static Expr add(Expr a, Expr b) {
        Expr retVal;
        if (a.isConstant() && b.isConstant())
            retVal = constant(valueOf(a) + valueOf(b));
        else if (isZero(a))
            retVal = b;
        else if (isZero(b))
            retVal = a;
        else if (b instanceof Unary && ((Unary) b).getOp() == Unary.Op.NEG)
            retVal = sub(a, ((Unary) b).getOperand());
        else if (isNegativeConstant(b))
            retVal = new Binary(Binary.Op.SUB, a, constant(-valueOf(b)));
        else
            retVal = new Binary(Binary.Op.ADD, a, b);
        return retVal;
    }

    public static Expr sub(Expr a, Expr b) {
        Expr retVal;
        if (a.isConstant() && b.isConstant())
            retVal = constant(valueOf(a) - valueOf(b));
        else if (isZero(b))
            retVal = a;
        else if (isZero(a))
            retVal = neg(b);
        else if (b instanceof Unary && ((Unary) b).getOp() == Unary.Op.NEG)
            retVal = add(a, ((Unary) b).getOperand());
        else if (isNegativeConstant(b))
            retVal = new Binary(Binary.Op.ADD, a, constant(-valueOf(b)));
        else
            retVal = new Binary(Binary.Op.SUB, a, b);
        return retVal;
    }

    public static Expr mul(Expr a, Expr b) {
        Expr retVal;
        if (a.isConstant() && b.isConstant())
            retVal = constant(valueOf(a) * valueOf(b));
        else if (isZero(a) || isZero(b))
            retVal = ZERO;
        else if (isOne(a))
            retVal = b;
        else if (isOne(b))
            retVal = a;
        else if (a.isConstant() && valueOf(a) == -1.0)
            retVal = neg(b);
        else if (b.isConstant() && valueOf(b) == -1.0)
            retVal = neg(a);
        else
            retVal = new Binary(Binary.Op.MUL, a, b);
        return retVal;
    }

    public static Expr div(Expr a, Expr b) {
        Expr retVal;
        if (a.isConstant() && b.isConstant() && valueOf(b) != 0.0)
            retVal = constant(valueOf(a) / valueOf(b));
        else if (isZero(a) && b.isConstant() && valueOf(b) != 0.0)
            retVal = ZERO;
        else if (isOne(b))
            retVal = a;
        else
            retVal = new Binary(Binary.Op.DIV, a, b);
        return retVal;
    }

    public static Expr pow(Expr a, Expr b) {
        Expr retVal;
        if (a.isConstant() && b.isConstant())
            retVal = constant(Math.pow(valueOf(a), valueOf(b)));
        else if (isZero(b) || isOne(a))
            retVal = ONE;
        else if (isOne(b))
            retVal = a;
        else
            retVal = new Binary(Binary.Op.POW, a, b);
        return retVal;
    }

    public static Expr neg(Expr a) {
        Expr retVal;
        if (a.isConstant())
            retVal = constant(-valueOf(a));
        else if (a instanceof Unary && ((Unary) a).getOp() == Unary.Op.NEG)
            retVal = ((Unary) a).getOperand();
        else
            retVal = new Unary(Unary.Op.NEG, a);
        return retVal;
    }

    public static Expr not(Expr a) {
        Expr retVal;
        if (a.isConstant())
            retVal = truth(valueOf(a) == 0.0);
        else
            retVal = new Unary(Unary.Op.NOT, a);
        return retVal;
    }

    /**
     * @return a comparison expression
     *
     * @param op	relational operator
     * @param a		left operand
     * @param b		right operand
     */
    public static Expr compare(Binary.Op op, Expr a, Expr b) {
        Expr retVal;
        if (a.isConstant() && b.isConstant())
            retVal = constant(NumericEvaluator.applyBinary(op, valueOf(a), valueOf(b)));
        else
            retVal = new Binary(op, a, b);
        return retVal;
    }

    public static Expr and(Expr a, Expr b) {
        Expr retVal;
        if (isZero(a) || isZero(b))
            retVal = ZERO;
        else if (a.isConstant() && b.isConstant())
            retVal = ONE;
        else if (a.isConstant())
            retVal = truthValue(b);
        else if (b.isConstant())
            retVal = truthValue(a);
        else
            retVal = new Binary(Binary.Op.AND, a, b);
        return retVal;
    }

    public static Expr or(Expr a, Expr b) {
        Expr retVal;
        if ((a.isConstant() && ! isZero(a)) || (b.isConstant() && ! isZero(b)))
            retVal = ONE;
        else if (a.isConstant() && b.isConstant())
            retVal = ZERO;
        else if (a.isConstant())
            retVal = truthValue(b);
        else if (b.isConstant())
            retVal = truthValue(a);
        else
            retVal = new Binary(Binary.Op.OR, a, b);
        return retVal;
    }

    /**
     * @return an expression whose value is 1 when the operand is nonzero and 0 otherwise
     *
     * Relational and logical expressions already have this property.
     *
     * @param a		operand to convert
     */
    private static Expr truthValue(Expr a) {
        Expr retVal = a;
        boolean logical = (a instanceof Binary && (((Binary) a).getOp().isRelational() || ((Binary) a).getOp().isLogical()))
                || (a instanceof Unary && ((Unary) a).getOp() == Unary.Op.NOT);
        if (! logical)
            retVal = new Binary(Binary.Op.NE, a, ZERO);
        return retVal;
    }

    /**
     * @return the constant 1 if a flag is TRUE, else 0
     *
     * @param flag		flag to convert
     */
    public static Expr truth(boolean flag) {
        return (flag ? ONE : ZERO);
    }

    /**
     * @return a call to an elementary function, folded if all the arguments are constant
     *
     * @param name		function name
     * @param args		argument expressions
     */
    public static Expr call(String name, List<Expr> args) {
        Expr retVal;
        boolean allConstant = args.stream().allMatch(x -> x.isConstant());
        if (allConstant && NumericEvaluator.isKnownFunction(name, args.size())) {
            double[] values = args.stream().mapToDouble(x -> valueOf(x)).toArray();
            retVal = constant(NumericEvaluator.applyFunction(name, values));
        } else
            retVal = new FunctionCall(name, args);
        return retVal;
    }

    /**
     * @return the sum of a list of expressions (zero if the list is empty)
     *
     * @param terms		expressions to add
     */
    public static Expr sum(List<Expr> terms) {
        Expr retVal = ZERO;
        for (Expr term : terms)
            retVal = add(retVal, term);
        return retVal;
    }

    /**
     * @return a display string for a number, without a trailing ".0" on integers
     *
     * @param value		number to format
     */
    public static String formatNumber(double value) {
        String retVal;
        if (value == 0.0)
            retVal = "0";
        else if (Double.isNaN(value))
            retVal = "NaN";
        else if (Double.isInfinite(value))
            retVal = (value > 0 ? "Inf" : "-Inf");
        else if (value == Math.rint(value) && Math.abs(value) < 1e15)
            retVal = Long.toString((long) value);
        else
            retVal = Double.toString(value).replace('E', 'e');
        return retVal;
    }

}
