/**
 *
 */
package org.theseed.ode.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BinaryOperator;

import org.theseed.ode.expr.Binary;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.matlab.ast.ParseNode;

/**
 * This object implements the built-in functions and constants known to the interpreter.
 * Functions with an SBML meaning are replaced by their semantic equivalent ("sqrt(x)"
 * becomes "x^0.5", "gt(a, b)" becomes "a > b"), elementary functions are kept as
 * symbolic calls, and the array helpers are computed directly from the operand sizes.
 */
public class Builtins {

    // FIELDS
    /** controlling interpreter */
    private final OdeInterpreter interp;

    /** named constants */
    private static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "Inf", Double.POSITIVE_INFINITY,
            "inf", Double.POSITIVE_INFINITY, "NaN", Double.NaN, "nan", Double.NaN, "eps", Math.ulp(1.0),
            "true", 1.0, "false", 0.0);

    /** elementary functions kept symbolically */
    private static final Set<String> ELEMENTARY = Set.of("exp", "log", "log10", "abs", "sin", "cos", "tan",
            "floor", "ceil");

    /** binary comparison functions */
    private static final Map<String, Binary.Op> COMPARISONS = Map.of("gt", Binary.Op.GT, "lt", Binary.Op.LT,
            "ge", Binary.Op.GE, "geq", Binary.Op.GE, "le", Binary.Op.LE, "leq", Binary.Op.LE,
            "eq", Binary.Op.EQ, "ne", Binary.Op.NE, "neq", Binary.Op.NE);

    /** other functions */
    private static final Set<String> FUNCTIONS = Set.of("power", "pow", "sqr", "sqrt", "root", "piecewise",
            "and", "or", "xor", "not", "zeros", "ones", "numel", "length", "size", "sum");

    /**
     * Create the built-in function table for an interpreter.
     *
     * @param interp	controlling interpreter
     */
    public Builtins(OdeInterpreter interp) {
        this.interp = interp;
    }

    /**
     * @return TRUE if the name is a built-in constant
     *
     * @param name		name to check
     */
    public static boolean isConstant(String name) {
        return CONSTANTS.containsKey(name);
    }

    /**
     * @return the value of a built-in constant
     *
     * @param name		name of the constant
     */
    public static Value constant(String name) {
        return MatrixValue.scalar(CONSTANTS.get(name));
    }

    /**
     * @return TRUE if the name is a built-in function
     *
     * @param name		name to check
     */
    public static boolean isFunction(String name) {
        return ELEMENTARY.contains(name) || COMPARISONS.containsKey(name) || FUNCTIONS.contains(name);
    }

    /**
     * Call a built-in function.
     *
     * @param name		name of the function
     * @param args		argument values
     * @param nargout	number of outputs requested
     * @param node		calling node, for error messages
     *
     * @return the list of output values
     *
     * @throws InterpretException
     */
    public List<Value> call(String name, List<Value> args, int nargout, ParseNode node) throws InterpretException {
        List<Value> retVal;
        if (name.equals("size"))
            retVal = this.size(args, nargout, node);
        else {
            if (nargout > 1)
                throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                        "Function " + name + " returns only one value.");
            retVal = Collections.singletonList(this.callSingle(name, args, node));
        }
        return retVal;
    }

    /**
     * @return the value of a single-output built-in function
     *
     * @param name		name of the function
     * @param args		argument values
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    private Value callSingle(String name, List<Value> args, ParseNode node) throws InterpretException {
        Value retVal;
        Binary.Op comparison = COMPARISONS.get(name);
        if (ELEMENTARY.contains(name)) {
            this.checkArgs(name, args, 1, 1, node);
            retVal = this.matrix(args.get(0), node).map(x -> Exprs.call(name, List.of(x)));
        } else if (comparison != null) {
            this.checkArgs(name, args, 2, 2, node);
            retVal = this.elementwise(args, (a, b) -> Exprs.compare(comparison, a, b), node);
        } else {
            switch (name) {
            case "power" :
            case "pow" :
                this.checkArgs(name, args, 2, 2, node);
                retVal = this.elementwise(args, Exprs::pow, node);
                break;
            case "sqr" :
                this.checkArgs(name, args, 1, 1, node);
                retVal = this.matrix(args.get(0), node).map(x -> Exprs.pow(x, Exprs.constant(2.0)));
                break;
            case "sqrt" :
                this.checkArgs(name, args, 1, 1, node);
                retVal = this.matrix(args.get(0), node).map(x -> Exprs.pow(x, Exprs.constant(0.5)));
                break;
            case "root" :
                // root(n, x) is the n-th root of x
                this.checkArgs(name, args, 2, 2, node);
                retVal = this.elementwise(args, (n, x) -> Exprs.pow(x, Exprs.div(Exprs.ONE, n)), node);
                break;
            case "and" :
                this.checkArgs(name, args, 2, 2, node);
                retVal = this.elementwise(args, Exprs::and, node);
                break;
            case "or" :
                this.checkArgs(name, args, 2, 2, node);
                retVal = this.elementwise(args, Exprs::or, node);
                break;
            case "xor" :
                this.checkArgs(name, args, 2, 2, node);
                retVal = this.elementwise(args, (a, b) -> Exprs.and(Exprs.or(a, b), Exprs.not(Exprs.and(a, b))),
                        node);
                break;
            case "not" :
                this.checkArgs(name, args, 1, 1, node);
                retVal = this.matrix(args.get(0), node).map(Exprs::not);
                break;
            case "piecewise" :
                retVal = this.piecewise(args, node);
                break;
            case "zeros" :
                retVal = this.filled(name, args, Exprs.ZERO, node);
                break;
            case "ones" :
                retVal = this.filled(name, args, Exprs.ONE, node);
                break;
            case "numel" :
                this.checkArgs(name, args, 1, 1, node);
                retVal = MatrixValue.scalar(this.matrix(args.get(0), node).size());
                break;
            case "length" :
                this.checkArgs(name, args, 1, 1, node);
                MatrixValue m = this.matrix(args.get(0), node);
                retVal = MatrixValue.scalar(m.isEmpty() ? 0 : Math.max(m.getRows(), m.getCols()));
                break;
            case "sum" :
                this.checkArgs(name, args, 1, 1, node);
                retVal = this.sum(this.matrix(args.get(0), node));
                break;
            default :
                throw this.interp.error(InterpretException.Kind.UNRESOLVED_SYMBOL, node.getLine(),
                        "Unknown function \"" + name + "\".");
            }
        }
        return retVal;
    }

    /**
     * Verify the number of arguments to a function.
     *
     * @param name		name of the function
     * @param args		argument list
     * @param min		minimum permissible count
     * @param max		maximum permissible count
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    private void checkArgs(String name, List<Value> args, int min, int max, ParseNode node) throws InterpretException {
        int n = args.size();
        if (n < min || n > max) {
            String expected = (min == max ? Integer.toString(min) : min + " to " + max);
            throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                    "Function " + name + " expects " + expected + " arguments but was given " + n + ".");
        }
    }

    /**
     * @return a value as a matrix
     *
     * @param value		value to convert
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    private MatrixValue matrix(Value value, ParseNode node) throws InterpretException {
        if (! (value instanceof MatrixValue))
            throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                    "A " + value.describe() + " cannot be used as a number.");
        return (MatrixValue) value;
    }

    /**
     * @return the result of an element-wise operation on a pair of arguments
     *
     * @param args		argument list (must have two elements)
     * @param f			element operation
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    private MatrixValue elementwise(List<Value> args, BinaryOperator<Expr> f, ParseNode node) throws InterpretException {
        MatrixValue a = this.matrix(args.get(0), node);
        MatrixValue b = this.matrix(args.get(1), node);
        try {
            return MatrixValue.elementwise(a, b, f);
        } catch (IllegalArgumentException e) {
            throw this.interp.error(InterpretException.Kind.DIMENSION_MISMATCH, node.getLine(), e.getMessage());
        }
    }

    /**
     * @return the value of a constant scalar argument
     *
     * @param value		argument value
     * @param node		calling node, for error messages
     * @param kind		type of error to throw if the argument does not fold to a number
     * @param what		description of the argument
     *
     * @throws InterpretException
     */
    private double number(Value value, ParseNode node, InterpretException.Kind kind, String what)
            throws InterpretException {
        MatrixValue m = this.matrix(value, node);
        Double retVal = null;
        if (m.isScalar())
            retVal = this.interp.fold(m.getScalar());
        if (retVal == null)
            throw this.interp.error(kind, node.getLine(), "The " + what + " cannot be computed at translation time.");
        return retVal;
    }

    /**
     * @return the value of a constant non-negative integer argument
     *
     * @param value		argument value
     * @param node		calling node, for error messages
     * @param what		description of the argument
     *
     * @throws InterpretException
     */
    private int count(Value value, ParseNode node, String what) throws InterpretException {
        double v = this.number(value, node, InterpretException.Kind.UNSUPPORTED_CONSTRUCT, what);
        if (v < 0 || v != Math.rint(v))
            throw this.interp.error(InterpretException.Kind.DIMENSION_MISMATCH, node.getLine(),
                    "The " + what + " must be a non-negative integer, not " + Exprs.formatNumber(v) + ".");
        return (int) v;
    }

    /**
     * @return the value selected by a piecewise function:  piecewise(v1, c1, v2, c2, ..., [otherwise])
     *
     * Every condition examined must fold to a constant.
     *
     * @param args		argument values
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    private Value piecewise(List<Value> args, ParseNode node) throws InterpretException {
        if (args.isEmpty())
            throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                    "Function piecewise needs at least one argument.");
        Value retVal = null;
        final int n = args.size();
        for (int i = 0; retVal == null && i + 1 < n; i += 2) {
            double flag = this.number(args.get(i + 1), node, InterpretException.Kind.UNSUPPORTED_CONDITIONAL,
                    "piecewise condition " + (i / 2 + 1));
            if (flag != 0.0)
                retVal = this.matrix(args.get(i), node);
        }
        if (retVal == null) {
            if (n % 2 == 1)
                retVal = this.matrix(args.get(n - 1), node);
            else
                throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONDITIONAL, node.getLine(),
                        "No branch of the piecewise function applies.");
        }
        return retVal;
    }

    /**
     * @return a matrix filled with a single value, sized by the arguments
     *
     * @param name		name of the function
     * @param args		argument values
     * @param fill		fill value
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    private Value filled(String name, List<Value> args, Expr fill, ParseNode node) throws InterpretException {
        this.checkArgs(name, args, 0, 2, node);
        int rows;
        int cols;
        if (args.isEmpty()) {
            rows = 1;
            cols = 1;
        } else if (args.size() == 2) {
            rows = this.count(args.get(0), node, "row count");
            cols = this.count(args.get(1), node, "column count");
        } else {
            MatrixValue dims = this.matrix(args.get(0), node);
            if (dims.size() == 2) {
                rows = this.count(MatrixValue.scalar(dims.get(0)), node, "row count");
                cols = this.count(MatrixValue.scalar(dims.get(1)), node, "column count");
            } else {
                rows = this.count(dims, node, "matrix size");
                cols = rows;
            }
        }
        return MatrixValue.filled(rows, cols, fill);
    }

    /**
     * @return the sum of a vector, or the column sums of a matrix
     *
     * @param m		matrix to sum
     */
    private Value sum(MatrixValue m) {
        Value retVal;
        if (m.isEmpty())
            retVal = MatrixValue.scalar(Exprs.ZERO);
        else if (m.isVector())
            retVal = MatrixValue.scalar(Exprs.sum(m.elements()));
        else {
            List<Expr> sums = new ArrayList<Expr>(m.getCols());
            for (int c = 0; c < m.getCols(); c++) {
                Expr total = Exprs.ZERO;
                for (int r = 0; r < m.getRows(); r++)
                    total = Exprs.add(total, m.get(r, c));
                sums.add(total);
            }
            retVal = MatrixValue.row(sums);
        }
        return retVal;
    }

    /**
     * @return the outputs of the size function
     *
     * @param args		argument values
     * @param nargout	number of outputs requested
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    private List<Value> size(List<Value> args, int nargout, ParseNode node) throws InterpretException {
        this.checkArgs("size", args, 1, 2, node);
        MatrixValue m = this.matrix(args.get(0), node);
        List<Value> retVal = new ArrayList<Value>(2);
        if (args.size() == 2) {
            int dim = this.count(args.get(1), node, "dimension");
            retVal.add(MatrixValue.scalar(dim == 1 ? m.getRows() : (dim == 2 ? m.getCols() : 1)));
        } else if (nargout <= 1)
            retVal.add(MatrixValue.row(List.of(Exprs.constant(m.getRows()), Exprs.constant(m.getCols()))));
        else if (nargout == 2) {
            retVal.add(MatrixValue.scalar(m.getRows()));
            retVal.add(MatrixValue.scalar(m.getCols()));
        } else
            throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                    "Function size returns at most two values.");
        return retVal;
    }

}
