/**
 *
 */
package org.theseed.ode.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BinaryOperator;

import org.theseed.ode.expr.Binary;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.matlab.ast.AnonymousFunctionNode;
import org.theseed.ode.matlab.ast.BinaryNode;
import org.theseed.ode.matlab.ast.CallNode;
import org.theseed.ode.matlab.ast.ColonNode;
import org.theseed.ode.matlab.ast.Expression;
import org.theseed.ode.matlab.ast.ExpressionVisitor;
import org.theseed.ode.matlab.ast.FunctionHandleNode;
import org.theseed.ode.matlab.ast.IdentifierNode;
import org.theseed.ode.matlab.ast.MatrixNode;
import org.theseed.ode.matlab.ast.NumberNode;
import org.theseed.ode.matlab.ast.ParseNode;
import org.theseed.ode.matlab.ast.RangeNode;
import org.theseed.ode.matlab.ast.StringNode;
import org.theseed.ode.matlab.ast.UnaryNode;

/**
 * This visitor computes the value of a MATLAB expression.  Values are matrices of
 * symbolic expressions, strings, or function handles.
 *
 * The evaluator runs either at the top level of the working scope or inside a function
 * scope.  Names not found in the function scope are looked up in the working scope as
 * of a fixed point in the file.  In reference mode, numeric working-scope values are
 * replaced by named constants ("a", or "k_1" for an element of a vector), which is how
 * the parameters of the model are kept symbolic in the derivative expressions.
 */
public class ExpressionEvaluator implements ExpressionVisitor<Value, InterpretException> {

    // FIELDS
    /** controlling interpreter */
    private final OdeInterpreter interp;
    /** function scope, or NULL at the top level */
    private final LocalScope scope;
    /** position in the working scope used for name lookup */
    private final int order;
    /** TRUE to replace working-scope numbers by named constants */
    private final boolean reference;

    /** maximum number of elements in a range */
    private static final int MAX_RANGE = 100000;

    /**
     * Create an expression evaluator.
     *
     * @param interp		controlling interpreter
     * @param scope			function scope, or NULL at the top level
     * @param order			position in the working scope used for name lookup
     * @param reference		TRUE to replace working-scope numbers by named constants
     */
    public ExpressionEvaluator(OdeInterpreter interp, LocalScope scope, int order, boolean reference) {
        this.interp = interp;
        this.scope = scope;
        this.order = order;
        this.reference = reference;
    }

    /**
     * @return an evaluator with the same lookup mode working in a different function scope
     *
     * @param newScope		function scope for the new evaluator
     */
    public ExpressionEvaluator withScope(LocalScope newScope) {
        return new ExpressionEvaluator(this.interp, newScope, this.order, this.reference);
    }

    /**
     * @return the function scope, or NULL at the top level
     */
    public LocalScope getScope() {
        return this.scope;
    }

    /**
     * @return the value of an expression
     *
     * @param expr		expression to evaluate
     *
     * @throws InterpretException
     */
    public Value evaluate(Expression expr) throws InterpretException {
        return expr.accept(this);
    }

    /**
     * @return the value of an expression, which must be numeric or symbolic
     *
     * @param expr		expression to evaluate
     *
     * @throws InterpretException
     */
    public MatrixValue evaluateMatrix(Expression expr) throws InterpretException {
        return this.matrix(this.evaluate(expr), expr);
    }

    /**
     * @return the output values of an expression that may produce several of them
     *
     * @param expr		expression to evaluate
     * @param nargout	number of outputs required
     *
     * @throws InterpretException
     */
    public List<Value> evaluateMulti(Expression expr, int nargout) throws InterpretException {
        List<Value> retVal;
        if (expr instanceof CallNode)
            retVal = this.call((CallNode) expr, nargout);
        else if (nargout <= 1)
            retVal = Collections.singletonList(this.evaluate(expr));
        else
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, expr,
                    "This expression cannot produce " + nargout + " values.");
        if (retVal.size() < nargout)
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, expr,
                    nargout + " values requested but only " + retVal.size() + " available.");
        return retVal;
    }

    /**
     * @return a located interpretation exception
     *
     * @param kind		type of failure
     * @param node		offending node
     * @param detail	description of the failure
     */
    protected InterpretException error(InterpretException.Kind kind, ParseNode node, String detail) {
        return this.interp.error(kind, node.getLine(), detail);
    }

    /**
     * @return a value as a matrix
     *
     * @param value		value to convert
     * @param node		node that produced the value, for error messages
     *
     * @throws InterpretException
     */
    public MatrixValue matrix(Value value, ParseNode node) throws InterpretException {
        if (! (value instanceof MatrixValue))
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                    "A " + value.describe() + " cannot be used as a number.");
        return (MatrixValue) value;
    }

    /**
     * @return the truth value of a condition, which must fold to a constant
     *
     * @param value		value of the condition
     * @param node		condition node, for error messages
     *
     * @throws InterpretException
     */
    public boolean truth(Value value, ParseNode node) throws InterpretException {
        MatrixValue m = this.matrix(value, node);
        boolean retVal = ! m.isEmpty();
        for (Expr element : m.elements()) {
            Double v = this.interp.fold(element);
            if (v == null)
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONDITIONAL, node,
                        "The condition \"" + element + "\" cannot be decided at translation time.");
            if (v == 0.0)
                retVal = false;
        }
        return retVal;
    }

    /**
     * @return the value of an expression that must fold to a number
     *
     * @param expr		expression to evaluate
     * @param what		description of the expression, for error messages
     *
     * @throws InterpretException
     */
    private double number(Expression expr, String what) throws InterpretException {
        MatrixValue m = this.evaluateMatrix(expr);
        Double retVal = null;
        if (m.isScalar())
            retVal = this.interp.fold(m.getScalar());
        if (retVal == null)
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, expr,
                    "The " + what + " must be a number known at translation time.");
        return retVal;
    }

    @Override
    public Value visitNumber(NumberNode node) throws InterpretException {
        return MatrixValue.scalar(node.getValue());
    }

    @Override
    public Value visitString(StringNode node) throws InterpretException {
        return new StringValue(node.getValue());
    }

    @Override
    public Value visitIdentifier(IdentifierNode node) throws InterpretException {
        String name = node.getName();
        Value retVal = this.variable(name, node);
        if (retVal == null) {
            if (this.interp.isFunction(name))
                retVal = this.interp.callFunction(name, Collections.emptyList(), 1, this, node).get(0);
            else if (Builtins.isConstant(name))
                retVal = Builtins.constant(name);
            else if (Builtins.isFunction(name))
                retVal = this.interp.getBuiltins().call(name, Collections.emptyList(), 1, node).get(0);
            else if (SolverCall.isSolver(name))
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                        "The solver " + name + " can only be called as a statement.");
            else
                throw this.error(InterpretException.Kind.UNRESOLVED_SYMBOL, node,
                        "Undefined name \"" + name + "\".");
        }
        return retVal;
    }

    /**
     * @return the value of a variable, or NULL if the name is not a variable
     *
     * @param name		variable name
     * @param node		referencing node
     *
     * @throws InterpretException
     */
    private Value variable(String name, ParseNode node) throws InterpretException {
        Value retVal = null;
        if (this.scope != null)
            retVal = this.scope.get(name);
        if (retVal == null)
            retVal = this.interp.lookupTop(name, this.order, node.getLine(), this.reference);
        return retVal;
    }

    @Override
    public Value visitCall(CallNode node) throws InterpretException {
        return this.call(node, 1).get(0);
    }

    /**
     * @return the output values of a call or array reference
     *
     * @param node		call node
     * @param nargout	number of outputs requested
     *
     * @throws InterpretException
     */
    private List<Value> call(CallNode node, int nargout) throws InterpretException {
        List<Value> retVal;
        String name = node.getName();
        Value var = this.variable(name, node);
        if (var instanceof HandleValue)
            retVal = this.invoke((HandleValue) var, this.arguments(node), nargout, node);
        else if (var != null) {
            if (nargout > 1)
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                        "An array reference produces only one value.");
            retVal = Collections.singletonList(this.index(this.matrix(var, node), node.getArgs(), name, node));
        } else if (this.interp.isFunction(name))
            retVal = this.interp.callFunction(name, this.arguments(node), nargout, this, node);
        else if (Builtins.isFunction(name))
            retVal = this.interp.getBuiltins().call(name, this.arguments(node), nargout, node);
        else if (SolverCall.isSolver(name))
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                    "The solver " + name + " can only be called as a statement.");
        else
            throw this.error(InterpretException.Kind.UNRESOLVED_SYMBOL, node,
                    "Undefined function or variable \"" + name + "\".");
        return retVal;
    }

    /**
     * @return the values of the arguments of a function call
     *
     * @param node		call node
     *
     * @throws InterpretException
     */
    private List<Value> arguments(CallNode node) throws InterpretException {
        List<Value> retVal = new ArrayList<Value>(node.getArgs().size());
        for (Expression arg : node.getArgs())
            retVal.add(this.evaluate(arg));
        return retVal;
    }

    /**
     * @return the outputs of a function handle invocation
     *
     * @param handle	function handle to invoke
     * @param args		argument values
     * @param nargout	number of outputs requested
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    public List<Value> invoke(HandleValue handle, List<Value> args, int nargout, ParseNode node)
            throws InterpretException {
        List<Value> retVal;
        if (! handle.isAnonymous()) {
            String name = handle.getName();
            if (this.interp.isFunction(name))
                retVal = this.interp.callFunction(name, args, nargout, this, node);
            else if (Builtins.isFunction(name))
                retVal = this.interp.getBuiltins().call(name, args, nargout, node);
            else
                throw this.error(InterpretException.Kind.UNRESOLVED_SYMBOL, node,
                        "Function handle refers to undefined function \"" + name + "\".");
        } else {
            AnonymousFunctionNode lambda = handle.getLambda();
            List<String> params = lambda.getParams();
            if (args.size() > params.size())
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                        "Anonymous function takes " + params.size() + " arguments but was given " + args.size() + ".");
            LocalScope lambdaScope = new LocalScope("anonymous function", this.scope);
            for (int i = 0; i < args.size(); i++) {
                if (! params.get(i).equals("~"))
                    lambdaScope.put(params.get(i), args.get(i));
            }
            retVal = this.withScope(lambdaScope).evaluateMulti(lambda.getBody(), nargout);
        }
        return retVal;
    }

    /**
     * @return the 0-based positions selected by an index expression
     *
     * @param idx		index expression
     * @param extent	number of positions available
     * @param name		name of the array, for error messages
     *
     * @throws InterpretException
     */
    private List<Integer> positions(Expression idx, int extent, String name) throws InterpretException {
        List<Integer> retVal;
        if (idx instanceof ColonNode) {
            retVal = new ArrayList<Integer>(extent);
            for (int i = 0; i < extent; i++)
                retVal.add(i);
        } else {
            MatrixValue m = this.evaluateMatrix(idx);
            retVal = new ArrayList<Integer>(m.size());
            for (Expr element : m.elements()) {
                Double v = this.interp.fold(element);
                if (v == null)
                    throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, idx,
                            "Index into \"" + name + "\" cannot be computed at translation time.");
                if (v < 1 || v != Math.rint(v))
                    throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, idx,
                            "Index " + Exprs.formatNumber(v) + " into \"" + name + "\" is not a positive integer.");
                retVal.add(v.intValue() - 1);
            }
        }
        return retVal;
    }

    /**
     * Verify that index positions are within an array.
     *
     * @param positions		0-based positions
     * @param extent		number of positions available
     * @param name			name of the array
     * @param node			indexing node, for error messages
     *
     * @throws InterpretException
     */
    private void checkRange(List<Integer> positions, int extent, String name, ParseNode node)
            throws InterpretException {
        for (int pos : positions) {
            if (pos >= extent)
                throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, node,
                        "Index " + (pos + 1) + " exceeds the " + extent + " elements of \"" + name + "\".");
        }
    }

    /**
     * @return the result of indexing a matrix
     *
     * @param m			matrix to index
     * @param indices	index expressions
     * @param name		name of the matrix, for error messages
     * @param node		indexing node, for error messages
     *
     * @throws InterpretException
     */
    public MatrixValue index(MatrixValue m, List<Expression> indices, String name, ParseNode node)
            throws InterpretException {
        MatrixValue retVal;
        switch (indices.size()) {
        case 0 :
            retVal = m;
            break;
        case 1 : {
            Expression idx = indices.get(0);
            List<Integer> pos = this.positions(idx, m.size(), name);
            this.checkRange(pos, m.size(), name, node);
            List<Expr> elements = new ArrayList<Expr>(pos.size());
            for (int p : pos)
                elements.add(m.get(p));
            if (elements.size() == 1)
                retVal = MatrixValue.scalar(elements.get(0));
            else if (m.getRows() == 1 && ! (idx instanceof ColonNode))
                retVal = MatrixValue.row(elements);
            else
                retVal = MatrixValue.column(elements);
            break;
        }
        case 2 : {
            List<Integer> rows = this.positions(indices.get(0), m.getRows(), name);
            List<Integer> cols = this.positions(indices.get(1), m.getCols(), name);
            this.checkRange(rows, m.getRows(), name, node);
            this.checkRange(cols, m.getCols(), name, node);
            Expr[] data = new Expr[rows.size() * cols.size()];
            int i = 0;
            for (int c : cols) {
                for (int r : rows)
                    data[i++] = m.get(r, c);
            }
            retVal = new MatrixValue(rows.size(), cols.size(), data);
            break;
        }
        default :
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                    "Arrays with more than two dimensions are not supported.");
        }
        return retVal;
    }

    /**
     * @return the result of assigning to indexed elements of a matrix, growing it if needed
     *
     * @param base		original matrix
     * @param indices	index expressions
     * @param rhs		value being assigned
     * @param name		name of the matrix, for error messages
     * @param node		assignment node, for error messages
     *
     * @throws InterpretException
     */
    public MatrixValue assignIndexed(MatrixValue base, List<Expression> indices, Value rhs, String name,
            ParseNode node) throws InterpretException {
        MatrixValue value = this.matrix(rhs, node);
        MatrixValue retVal = base;
        try {
            if (indices.size() == 1) {
                List<Integer> pos = this.positions(indices.get(0), base.size(), name);
                this.checkCount(value, pos.size(), name, node);
                for (int i = 0; i < pos.size(); i++)
                    retVal = retVal.with(pos.get(i), value.isScalar() ? value.getScalar() : value.get(i));
            } else if (indices.size() == 2) {
                List<Integer> rows = this.positions(indices.get(0), base.getRows(), name);
                List<Integer> cols = this.positions(indices.get(1), base.getCols(), name);
                this.checkCount(value, rows.size() * cols.size(), name, node);
                int i = 0;
                for (int c : cols) {
                    for (int r : rows) {
                        retVal = retVal.with(r, c, value.isScalar() ? value.getScalar() : value.get(i));
                        i++;
                    }
                }
            } else
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                        "Arrays with more than two dimensions are not supported.");
        } catch (IllegalArgumentException e) {
            throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, node, e.getMessage());
        }
        return retVal;
    }

    /**
     * Verify that an assigned value has the right number of elements.
     *
     * @param value		value being assigned
     * @param count		number of positions receiving it
     * @param name		name of the matrix
     * @param node		assignment node
     *
     * @throws InterpretException
     */
    private void checkCount(MatrixValue value, int count, String name, ParseNode node) throws InterpretException {
        if (! value.isScalar() && value.size() != count)
            throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, node,
                    "Cannot assign " + value.size() + " elements to " + count + " positions of \"" + name + "\".");
    }

    @Override
    public Value visitUnary(UnaryNode node) throws InterpretException {
        MatrixValue operand = this.evaluateMatrix(node.getOperand());
        MatrixValue retVal;
        switch (node.getOperator()) {
        case NEGATE :
            retVal = operand.map(Exprs::neg);
            break;
        case NOT :
            retVal = operand.map(Exprs::not);
            break;
        case TRANSPOSE :
        case DOT_TRANSPOSE :
            retVal = operand.transpose();
            break;
        default :
            retVal = operand;
        }
        return retVal;
    }

    @Override
    public Value visitBinary(BinaryNode node) throws InterpretException {
        Value retVal;
        switch (node.getOperator()) {
        case SHORT_AND :
            retVal = this.shortCircuit(node, false);
            break;
        case SHORT_OR :
            retVal = this.shortCircuit(node, true);
            break;
        default :
            MatrixValue a = this.evaluateMatrix(node.getLeft());
            MatrixValue b = this.evaluateMatrix(node.getRight());
            try {
                retVal = this.arithmetic(node, a, b);
            } catch (IllegalArgumentException e) {
                throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, node, e.getMessage());
            }
        }
        return retVal;
    }

    /**
     * @return the result of a non-short-circuit binary operation
     *
     * @param node		binary operation node
     * @param a			left operand
     * @param b			right operand
     *
     * @throws InterpretException
     */
    private MatrixValue arithmetic(BinaryNode node, MatrixValue a, MatrixValue b) throws InterpretException {
        MatrixValue retVal;
        switch (node.getOperator()) {
        case ADD :
            retVal = MatrixValue.elementwise(a, b, Exprs::add);
            break;
        case SUBTRACT :
            retVal = MatrixValue.elementwise(a, b, Exprs::sub);
            break;
        case TIMES :
            retVal = MatrixValue.multiply(a, b);
            break;
        case ELEM_TIMES :
            retVal = MatrixValue.elementwise(a, b, Exprs::mul);
            break;
        case DIVIDE :
            if (! b.isScalar())
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                        "Matrix right division is not supported.");
            retVal = MatrixValue.elementwise(a, b, Exprs::div);
            break;
        case ELEM_DIVIDE :
            retVal = MatrixValue.elementwise(a, b, Exprs::div);
            break;
        case LEFT_DIVIDE :
            if (! a.isScalar())
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                        "Matrix left division is not supported.");
            retVal = MatrixValue.elementwise(a, b, (x, y) -> Exprs.div(y, x));
            break;
        case ELEM_LEFT_DIVIDE :
            retVal = MatrixValue.elementwise(a, b, (x, y) -> Exprs.div(y, x));
            break;
        case POWER :
            if (! a.isScalar() || ! b.isScalar())
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                        "Matrix powers are not supported.");
            retVal = MatrixValue.elementwise(a, b, Exprs::pow);
            break;
        case ELEM_POWER :
            retVal = MatrixValue.elementwise(a, b, Exprs::pow);
            break;
        case EQUAL :
            retVal = MatrixValue.elementwise(a, b, comparison(Binary.Op.EQ));
            break;
        case NOT_EQUAL :
            retVal = MatrixValue.elementwise(a, b, comparison(Binary.Op.NE));
            break;
        case LESS :
            retVal = MatrixValue.elementwise(a, b, comparison(Binary.Op.LT));
            break;
        case LESS_EQUAL :
            retVal = MatrixValue.elementwise(a, b, comparison(Binary.Op.LE));
            break;
        case GREATER :
            retVal = MatrixValue.elementwise(a, b, comparison(Binary.Op.GT));
            break;
        case GREATER_EQUAL :
            retVal = MatrixValue.elementwise(a, b, comparison(Binary.Op.GE));
            break;
        case AND :
            retVal = MatrixValue.elementwise(a, b, Exprs::and);
            break;
        case OR :
            retVal = MatrixValue.elementwise(a, b, Exprs::or);
            break;
        default :
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                    "Unsupported operator " + node.getOperator().getSymbol() + ".");
        }
        return retVal;
    }

    /**
     * @return an element operation for a comparison operator
     *
     * @param op	comparison operator
     */
    private static BinaryOperator<Expr> comparison(Binary.Op op) {
        return (x, y) -> Exprs.compare(op, x, y);
    }

    /**
     * @return the result of a short-circuit logical operation on scalars
     *
     * @param node		operation node
     * @param isOr		TRUE for "||", FALSE for "&&"
     *
     * @throws InterpretException
     */
    private Value shortCircuit(BinaryNode node, boolean isOr) throws InterpretException {
        Expr left = this.scalar(node.getLeft());
        Double leftValue = this.interp.fold(left);
        Expr retVal;
        if (leftValue != null && (leftValue != 0.0) == isOr)
            retVal = Exprs.truth(isOr);
        else {
            Expr right = this.scalar(node.getRight());
            retVal = (isOr ? Exprs.or(left, right) : Exprs.and(left, right));
        }
        return MatrixValue.scalar(retVal);
    }

    /**
     * @return the value of an expression that must be a scalar
     *
     * @param expr		expression to evaluate
     *
     * @throws InterpretException
     */
    private Expr scalar(Expression expr) throws InterpretException {
        MatrixValue m = this.evaluateMatrix(expr);
        if (! m.isScalar())
            throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, expr,
                    "Expected a scalar but found a " + m.describe() + ".");
        return m.getScalar();
    }

    @Override
    public Value visitMatrix(MatrixNode node) throws InterpretException {
        Value retVal;
        List<List<Expression>> rows = node.getRows();
        if (rows.size() == 1 && rows.get(0).size() == 1 && rows.get(0).get(0) instanceof StringNode)
            retVal = this.evaluate(rows.get(0).get(0));
        else {
            List<MatrixValue> rowValues = new ArrayList<MatrixValue>(rows.size());
            try {
                for (List<Expression> row : rows) {
                    List<MatrixValue> parts = new ArrayList<MatrixValue>(row.size());
                    for (Expression element : row)
                        parts.add(this.evaluateMatrix(element));
                    rowValues.add(MatrixValue.horzcat(parts));
                }
                retVal = MatrixValue.vertcat(rowValues);
            } catch (IllegalArgumentException e) {
                throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, node, e.getMessage());
            }
        }
        return retVal;
    }

    @Override
    public Value visitRange(RangeNode node) throws InterpretException {
        double start = this.number(node.getStart(), "range start");
        double step = (node.getStep() == null ? 1.0 : this.number(node.getStep(), "range step"));
        double stop = this.number(node.getStop(), "range end");
        List<Expr> elements = new ArrayList<Expr>();
        if (step != 0.0 && (stop - start) / step >= 0) {
            long n = (long) Math.floor((stop - start) / step + 1e-10) + 1;
            if (n > MAX_RANGE)
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                        "Range has more than " + MAX_RANGE + " elements.");
            for (long i = 0; i < n; i++)
                elements.add(Exprs.constant(start + i * step));
        }
        return MatrixValue.row(elements);
    }

    @Override
    public Value visitColon(ColonNode node) throws InterpretException {
        throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node,
                "A bare colon is only allowed as an index.");
    }

    @Override
    public Value visitFunctionHandle(FunctionHandleNode node) throws InterpretException {
        return new HandleValue(node.getName());
    }

    @Override
    public Value visitAnonymousFunction(AnonymousFunctionNode node) throws InterpretException {
        return new HandleValue(node);
    }

}
