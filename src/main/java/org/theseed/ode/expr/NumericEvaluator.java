package org.theseed.ode.expr;

import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * This class computes the numeric value of an expression given values for its symbols.
 * Relational and logical operations produce 1 for true and 0 for false.
 */
public class NumericEvaluator implements ExprVisitor<Double> {

    // FIELDS
    /** values of the named symbols */
    private final Map<String, Double> values;
    /** value of the time symbol */
    private final double time;
    /** elementary functions of one argument */
    private static final Map<String, DoubleUnaryOperator> FUNCTIONS = Map.of(
            "exp", Math::exp, "log", Math::log, "log10", Math::log10, "abs", Math::abs,
            "sin", Math::sin, "cos", Math::cos, "tan", Math::tan, "floor", Math::floor,
            "ceil", Math::ceil);

    /**
     * Create an evaluator.
     *
     * @param values	map of symbol names to values
     * @param time		value to use for the time symbol
     */
    public NumericEvaluator(Map<String, Double> values, double time) {
        this.values = values;
        this.time = time;
    }

    /**
     * @return the value of an expression
     *
     * @param expr		expression to evaluate
     * @param values	map of symbol names to values
     * @param time		value to use for the time symbol
     *
     * @throws IllegalArgumentException if a symbol has no value
     */
    public static double evaluate(Expr expr, Map<String, Double> values, double time) {
        return expr.accept(new NumericEvaluator(values, time));
    }

    /**
     * @return TRUE if the named function is an elementary function we can evaluate
     *
     * @param name		name of the function
     * @param arity		number of arguments
     */
    public static boolean isKnownFunction(String name, int arity) {
        return (arity == 1 && FUNCTIONS.containsKey(name));
    }

    /**
     * @return the value of an elementary function
     *
     * @param name		name of the function
     * @param args		argument values
     */
    public static double applyFunction(String name, double[] args) {
        DoubleUnaryOperator f = FUNCTIONS.get(name);
        if (f == null || args.length != 1)
            throw new IllegalArgumentException("Cannot evaluate function " + name + " with "
                    + args.length + " arguments.");
        return f.applyAsDouble(args[0]);
    }

    /**
     * @return the result of a binary operation on two numbers
     *
     * @param op	operator to apply
     * @param a		left operand
     * @param b		right operand
     */
    public static double applyBinary(Binary.Op op, double a, double b) {
        double retVal;
        switch (op) {
        case ADD :
            retVal = a + b;
            break;
        case SUB :
            retVal = a - b;
            break;
        case MUL :
            retVal = a * b;
            break;
        case DIV :
            retVal = a / b;
            break;
        case POW :
            retVal = Math.pow(a, b);
            break;
        case EQ :
            retVal = (a == b ? 1.0 : 0.0);
            break;
        case NE :
            retVal = (a != b ? 1.0 : 0.0);
            break;
        case LT :
            retVal = (a < b ? 1.0 : 0.0);
            break;
        case LE :
            retVal = (a <= b ? 1.0 : 0.0);
            break;
        case GT :
            retVal = (a > b ? 1.0 : 0.0);
            break;
        case GE :
            retVal = (a >= b ? 1.0 : 0.0);
            break;
        case AND :
            retVal = (a != 0.0 && b != 0.0 ? 1.0 : 0.0);
            break;
        case OR :
            retVal = (a != 0.0 || b != 0.0 ? 1.0 : 0.0);
            break;
        default :
            throw new IllegalArgumentException("Unknown operator " + op + ".");
        }
        return retVal;
    }

    @Override
    public Double visitConstant(Constant expr) {
        return expr.getValue();
    }

    @Override
    public Double visitSymbol(Symbol expr) {
        double retVal;
        if (expr.isTime())
            retVal = this.time;
        else {
            Double value = this.values.get(expr.getName());
            if (value == null)
                throw new IllegalArgumentException("No value available for symbol " + expr.getName() + ".");
            retVal = value;
        }
        return retVal;
    }

    @Override
    public Double visitUnary(Unary expr) {
        double value = expr.getOperand().accept(this);
        return (expr.getOp() == Unary.Op.NEG ? -value : (value == 0.0 ? 1.0 : 0.0));
    }

    @Override
    public Double visitBinary(Binary expr) {
        double a = expr.getLeft().accept(this);
        double b = expr.getRight().accept(this);
        return applyBinary(expr.getOp(), a, b);
    }

    @Override
    public Double visitCall(FunctionCall expr) {
        double[] args = expr.getArgs().stream().mapToDouble(x -> x.accept(this)).toArray();
        return applyFunction(expr.getName(), args);
    }

}
