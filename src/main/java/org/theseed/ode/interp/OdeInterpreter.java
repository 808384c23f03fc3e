/**
 *
 */
package org.theseed.ode.interp;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.expr.NumericEvaluator;
import org.theseed.ode.expr.Symbol;
import org.theseed.ode.matlab.SourceText;
import org.theseed.ode.matlab.ast.AnonymousFunctionNode;
import org.theseed.ode.matlab.ast.AssignmentNode;
import org.theseed.ode.matlab.ast.CallNode;
import org.theseed.ode.matlab.ast.CommandNode;
import org.theseed.ode.matlab.ast.Expression;
import org.theseed.ode.matlab.ast.ExpressionStatementNode;
import org.theseed.ode.matlab.ast.ForNode;
import org.theseed.ode.matlab.ast.FunctionDefinitionNode;
import org.theseed.ode.matlab.ast.FunctionHandleNode;
import org.theseed.ode.matlab.ast.IdentifierNode;
import org.theseed.ode.matlab.ast.IfNode;
import org.theseed.ode.matlab.ast.ParseNode;
import org.theseed.ode.matlab.ast.ScriptNode;
import org.theseed.ode.matlab.ast.Statement;
import org.theseed.ode.matlab.ast.StatementVisitor;

/**
 * This object reduces a parsed MATLAB script to a system of ODEs.
 *
 * The working scope is the top level of the script, or, if the solver call is inside a
 * function, the body of the first function containing it.  Its assignments are collected
 * into a symbol table (with "if" statements turned into guards and "for" loops unrolled)
 * and resolved on demand.  The single active solver call then names the ODE function and
 * the initial conditions.  The ODE function is evaluated symbolically with the time
 * parameter bound to the time symbol and the state parameter bound to a vector of species
 * symbols.  Numeric values from the working scope are referenced by name, so they survive
 * as model parameters.
 *
 * An interpreter is used for a single script.
 */
public class OdeInterpreter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(OdeInterpreter.class);
    /** source text, for error messages */
    private final SourceText source;
    /** TRUE to name the species after the solver's second output */
    private final boolean useOutputNames;
    /** function definitions in the script */
    private final Map<String, FunctionDefinitionNode> functions;
    /** symbol table of the working scope */
    private final SymbolTable symbols;
    /** built-in function table */
    private final Builtins builtins;
    /** named constants registered during evaluation */
    private final Map<String, Expr> constants;
    /** functions currently being inlined */
    private final Set<String> activeCalls;
    /** solver calls found in the working scope */
    private final List<Candidate> candidates;
    /** indexed-name builder */
    private NameAllocator names;
    /** next position number in the working scope */
    private int nextOrder;

    /** maximum number of unrolled loop iterations in the working scope */
    private static final int MAX_UNROLL = 10000;

    /**
     * A solver call together with the guards controlling it.
     */
    private static class Candidate {

        /** the solver call */
        private final SolverCall call;
        /** guards that must hold for the call to run */
        private final List<SymbolTable.Guard> guards;

        protected Candidate(SolverCall call, List<SymbolTable.Guard> guards) {
            this.call = call;
            this.guards = new ArrayList<SymbolTable.Guard>(guards);
        }

    }

    /**
     * Create an interpreter for a script.
     *
     * @param source			source text of the script
     * @param useOutputNames	TRUE to name the species after the solver's second output variable
     */
    public OdeInterpreter(SourceText source, boolean useOutputNames) {
        this.source = source;
        this.useOutputNames = useOutputNames;
        this.functions = new LinkedHashMap<String, FunctionDefinitionNode>();
        this.symbols = new SymbolTable(this);
        this.builtins = new Builtins(this);
        this.constants = new LinkedHashMap<String, Expr>();
        this.activeCalls = new HashSet<String>();
        this.candidates = new ArrayList<Candidate>();
        this.nextOrder = 0;
    }

    /**
     * Interpret a parsed script.
     *
     * @param script	parse tree of the script
     *
     * @return the interpreted script
     *
     * @throws InterpretException
     */
    public InterpretedScript interpret(ScriptNode script) throws InterpretException {
        for (FunctionDefinitionNode function : script.getFunctions()) {
            if (this.functions.containsKey(function.getName()))
                log.warn("Function {} is defined more than once; using the first definition.", function.getName());
            else
                this.functions.put(function.getName(), function);
        }
        this.names = new NameAllocator(script);
        // Find the working scope.
        List<Statement> working = script.getTopLevel();
        if (! containsSolverCall(working)) {
            working = null;
            for (FunctionDefinitionNode function : script.getFunctions()) {
                if (working == null && containsSolverCall(function.getBody())) {
                    log.info("Solver call found inside function {}; using its body as the working scope.",
                            function.getName());
                    working = function.getBody();
                    this.symbols.addPreset("nargin", 0, List.of(), MatrixValue.scalar(0.0), function.getLine());
                }
            }
            if (working == null)
                throw this.error(InterpretException.Kind.MISSING_SOLVER_CALL, 0,
                        "No call to a recognized ODE solver was found.");
        }
        // Collect the assignments and solver calls.
        new Collector(List.of()).collect(working);
        log.debug("{} definitions collected from the working scope.", this.symbols.size());
        SolverCall solverCall = this.selectSolverCall();
        log.info("Using {} call at line {}.", solverCall.getSolverName(), solverCall.getLine());
        return this.processSolverCall(script, solverCall);
    }

    /**
     * @return the single active solver call
     *
     * @throws InterpretException
     */
    private SolverCall selectSolverCall() throws InterpretException {
        List<SolverCall> active = new ArrayList<SolverCall>();
        for (Candidate candidate : this.candidates) {
            if (this.symbols.allHold(candidate.guards))
                active.add(candidate.call);
        }
        if (active.isEmpty())
            throw this.error(InterpretException.Kind.MISSING_SOLVER_CALL, 0,
                    "No solver call is reached when the script runs.");
        if (active.size() > 1)
            throw this.error(InterpretException.Kind.MULTIPLE_SOLVER_CALLS, active.get(1).getLine(),
                    "Found " + active.size() + " solver calls; only one is supported (first at line "
                    + active.get(0).getLine() + ").");
        return active.get(0);
    }

    /**
     * @return TRUE if a list of statements contains a solver call, at any depth
     *
     * @param body		statements to search
     */
    private static boolean containsSolverCall(List<Statement> body) {
        boolean retVal = false;
        for (Statement stmt : body) {
            if (stmt instanceof AssignmentNode)
                retVal = SolverCall.isSolverCall(((AssignmentNode) stmt).getValue());
            else if (stmt instanceof ExpressionStatementNode)
                retVal = SolverCall.isSolverCall(((ExpressionStatementNode) stmt).getExpression());
            else if (stmt instanceof IfNode) {
                IfNode ifNode = (IfNode) stmt;
                for (IfNode.Branch branch : ifNode.getBranches())
                    retVal = retVal || containsSolverCall(branch.getBody());
                retVal = retVal || containsSolverCall(ifNode.getElseBody());
            } else if (stmt instanceof ForNode)
                retVal = containsSolverCall(((ForNode) stmt).getBody());
            if (retVal)
                break;
        }
        return retVal;
    }

    /**
     * This visitor collects the definitions and solver calls of the working scope.  Each
     * instance carries the guards in effect for the statements it visits.
     */
    private class Collector implements StatementVisitor<Void, InterpretException> {

        /** guards in effect */
        private final List<SymbolTable.Guard> guards;

        protected Collector(List<SymbolTable.Guard> guards) {
            this.guards = guards;
        }

        /**
         * Collect a list of statements.
         *
         * @param body		statements to collect
         *
         * @throws InterpretException
         */
        protected void collect(List<Statement> body) throws InterpretException {
            for (Statement stmt : body)
                stmt.accept(this);
        }

        @Override
        public Void visitAssignment(AssignmentNode node) throws InterpretException {
            int order = ++OdeInterpreter.this.nextOrder;
            boolean solver = SolverCall.isSolverCall(node.getValue());
            OdeInterpreter.this.symbols.addAssignment(node, order, this.guards, solver);
            if (solver)
                OdeInterpreter.this.candidates.add(new Candidate(new SolverCall((CallNode) node.getValue(), node, order),
                        this.guards));
            return null;
        }

        @Override
        public Void visitExpressionStatement(ExpressionStatementNode node) throws InterpretException {
            int order = ++OdeInterpreter.this.nextOrder;
            if (SolverCall.isSolverCall(node.getExpression()))
                OdeInterpreter.this.candidates.add(new Candidate(new SolverCall((CallNode) node.getExpression(),
                        null, order), this.guards));
            return null;
        }

        @Override
        public Void visitCommand(CommandNode node) throws InterpretException {
            ++OdeInterpreter.this.nextOrder;
            return null;
        }

        @Override
        public Void visitIf(IfNode node) throws InterpretException {
            int order = ++OdeInterpreter.this.nextOrder;
            List<SymbolTable.Guard> prior = new ArrayList<SymbolTable.Guard>(this.guards);
            for (IfNode.Branch branch : node.getBranches()) {
                SymbolTable.Guard guard = new SymbolTable.Guard(branch.getCondition(), order, true);
                List<SymbolTable.Guard> branchGuards = new ArrayList<SymbolTable.Guard>(prior);
                branchGuards.add(guard);
                new Collector(branchGuards).collect(branch.getBody());
                prior.add(guard.negate());
            }
            new Collector(prior).collect(node.getElseBody());
            return null;
        }

        @Override
        public Void visitFor(ForNode node) throws InterpretException {
            int order = ++OdeInterpreter.this.nextOrder;
            if (! OdeInterpreter.this.symbols.allHold(this.guards))
                log.debug("Skipping loop at line {} in an inactive branch.", node.getLine());
            else {
                ExpressionEvaluator evaluator = new ExpressionEvaluator(OdeInterpreter.this, null, order, false);
                MatrixValue range = evaluator.evaluateMatrix(node.getRange());
                List<MatrixValue> columns = range.columns();
                if (columns.size() > MAX_UNROLL)
                    throw OdeInterpreter.this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                            "Loop has more than " + MAX_UNROLL + " iterations.");
                log.debug("Unrolling {} iterations of loop over {} at line {}.", columns.size(), node.getVariable(),
                        node.getLine());
                for (MatrixValue column : columns) {
                    int varOrder = ++OdeInterpreter.this.nextOrder;
                    MatrixValue loopValue = OdeInterpreter.this.foldLoopValue(column, node);
                    OdeInterpreter.this.symbols.addPreset(node.getVariable(), varOrder, this.guards, loopValue,
                            node.getLine());
                    this.collect(node.getBody());
                }
            }
            return null;
        }

        @Override
        public Void visitFunctionDefinition(FunctionDefinitionNode node) throws InterpretException {
            return null;
        }

    }

    /**
     * @return the value of a working-scope definition
     *
     * @param entry		definition to compute
     *
     * @throws InterpretException
     */
    protected Value computeEntry(SymbolTable.Entry entry) throws InterpretException {
        AssignmentNode node = entry.getNode();
        List<AssignmentNode.Target> targets = node.getTargets();
        AssignmentNode.Target target = targets.get(entry.getTargetIndex());
        ExpressionEvaluator evaluator = new ExpressionEvaluator(this, null, entry.getOrder(), false);
        Value retVal;
        if (targets.size() > 1) {
            if (target.isIndexed())
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                        "Indexed targets in a multiple assignment are not supported.");
            retVal = evaluator.evaluateMulti(node.getValue(), targets.size()).get(entry.getTargetIndex());
        } else {
            retVal = evaluator.evaluate(node.getValue());
            if (target.isIndexed()) {
                Value old = this.symbols.lookupBefore(entry.getName(), entry.getOrder(), node.getLine());
                MatrixValue base = (old == null ? MatrixValue.empty() : evaluator.matrix(old, node));
                retVal = evaluator.assignIndexed(base, target.getIndices(), retVal, entry.getName(), node);
            }
        }
        return retVal;
    }

    /**
     * @return the truth value of a working-scope condition
     *
     * @param condition		condition expression
     * @param order			position of the condition in the working scope
     *
     * @throws InterpretException
     */
    protected boolean testCondition(Expression condition, int order) throws InterpretException {
        ExpressionEvaluator evaluator = new ExpressionEvaluator(this, null, order, false);
        return evaluator.truth(evaluator.evaluate(condition), condition);
    }

    /**
     * @return the folded value of a loop-variable value
     *
     * @param column	loop-variable value
     * @param node		loop node, for error messages
     *
     * @throws InterpretException
     */
    protected MatrixValue foldLoopValue(MatrixValue column, ParseNode node) throws InterpretException {
        List<Expr> folded = new ArrayList<Expr>(column.size());
        for (Expr element : column.elements()) {
            Double v = this.fold(element);
            if (v == null)
                throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                        "Loop range must be known at translation time.");
            folded.add(Exprs.constant(v));
        }
        return (folded.size() == 1 ? MatrixValue.scalar(folded.get(0)) : MatrixValue.column(folded));
    }

    /**
     * @return the numeric value of an expression, using the values of the registered named
     * 		   constants, or NULL if it depends on time, species, or unknown names
     *
     * @param expr		expression to fold
     */
    public Double fold(Expr expr) {
        Double retVal = Exprs.valueOf(expr);
        if (retVal == null && ! expr.dependsOnTime()) {
            Map<String, Double> values = new LinkedHashMap<String, Double>();
            boolean ok = true;
            for (String name : expr.getSymbols()) {
                Expr value = this.constants.get(name);
                Double v = (value == null ? null : Exprs.valueOf(value));
                if (v == null)
                    ok = false;
                else
                    values.put(name, v);
            }
            if (ok)
                retVal = NumericEvaluator.evaluate(expr, values, 0.0);
        }
        return retVal;
    }

    /**
     * Record a named constant.
     *
     * @param name		name of the constant
     * @param value		value of the constant
     */
    public void registerConstant(String name, Expr value) {
        Expr old = this.constants.put(name, value);
        if (old != null && ! old.equals(value))
            log.warn("Constant {} redefined from {} to {}.", name, old, value);
    }

    /**
     * @return the value of a working-scope name, or NULL if it has no active definition
     *
     * @param name			name to look up
     * @param order			position of the reference in the working scope
     * @param line			line of the reference, for error messages
     * @param reference		TRUE to convert numeric values to named constants
     *
     * @throws InterpretException
     */
    protected Value lookupTop(String name, int order, int line, boolean reference) throws InterpretException {
        Value retVal = this.symbols.lookup(name, order, line);
        if (retVal != null && reference)
            retVal = this.reference(name, retVal);
        return retVal;
    }

    /**
     * @return a working-scope value with its numbers replaced by named constants
     *
     * A scalar becomes a constant with the variable name; the elements of a vector or
     * matrix become constants with indexed names.
     *
     * @param name		variable name
     * @param value		value of the variable
     */
    private Value reference(String name, Value value) {
        Value retVal = value;
        if (value instanceof MatrixValue && ((MatrixValue) value).isNumeric()) {
            MatrixValue m = (MatrixValue) value;
            Expr[] data = new Expr[m.size()];
            for (int r = 0; r < m.getRows(); r++) {
                for (int c = 0; c < m.getCols(); c++) {
                    String constName;
                    if (m.isScalar())
                        constName = name;
                    else if (m.isVector())
                        constName = this.names.name(name, r + c + 1);
                    else
                        constName = this.names.name(name, r + 1, c + 1);
                    this.registerConstant(constName, m.get(r, c));
                    data[c * m.getRows() + r] = new Symbol(constName);
                }
            }
            retVal = new MatrixValue(m.getRows(), m.getCols(), data);
        }
        return retVal;
    }

    /**
     * @return TRUE if the named function is defined in the script
     *
     * @param name		name to check
     */
    public boolean isFunction(String name) {
        return this.functions.containsKey(name);
    }

    /**
     * @return the built-in function table
     */
    public Builtins getBuiltins() {
        return this.builtins;
    }

    /**
     * @return the outputs of a call to a function defined in the script, computed by
     * 		   running its body inline
     *
     * @param name		name of the function
     * @param args		argument values
     * @param nargout	number of outputs requested
     * @param caller	evaluator making the call
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    protected List<Value> callFunction(String name, List<Value> args, int nargout, ExpressionEvaluator caller,
            ParseNode node) throws InterpretException {
        FunctionDefinitionNode function = this.functions.get(name);
        List<String> params = function.getParams();
        List<String> outputs = function.getOutputs();
        if (args.size() > params.size())
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                    "Function " + name + " takes " + params.size() + " arguments but was given " + args.size() + ".");
        if (nargout > outputs.size() || outputs.isEmpty())
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                    "Function " + name + " does not return " + Math.max(nargout, 1) + " values.");
        LocalScope scope = this.bindArguments(function, args);
        this.runBody(function, new BodyExecutor(this, caller.withScope(scope)), node);
        int n = Math.max(nargout, 1);
        List<Value> retVal = new ArrayList<Value>(n);
        for (int i = 0; i < n; i++)
            retVal.add(this.output(function, scope, i));
        return retVal;
    }

    /**
     * @return a local scope with a function's parameters bound to argument values
     *
     * @param function	function being called
     * @param args		argument values
     */
    private LocalScope bindArguments(FunctionDefinitionNode function, List<Value> args) {
        LocalScope retVal = new LocalScope(function.getName(), null);
        List<String> params = function.getParams();
        for (int i = 0; i < args.size(); i++) {
            if (params.get(i) != null)
                retVal.put(params.get(i), args.get(i));
        }
        retVal.put("nargin", MatrixValue.scalar(args.size()));
        return retVal;
    }

    /**
     * Run a function body inline.
     *
     * @param function	function to run
     * @param executor	statement executor for the function scope
     * @param node		calling node, for error messages
     *
     * @throws InterpretException
     */
    private void runBody(FunctionDefinitionNode function, BodyExecutor executor, ParseNode node)
            throws InterpretException {
        String name = function.getName();
        if (! this.activeCalls.add(name))
            throw this.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                    "Recursive call to function " + name + " is not supported.");
        try {
            executor.run(function.getBody());
        } finally {
            this.activeCalls.remove(name);
        }
    }

    /**
     * @return the value of a function output after its body has run
     *
     * @param function	function that was run
     * @param scope		local scope of the function
     * @param idx		index of the output
     *
     * @throws InterpretException
     */
    private Value output(FunctionDefinitionNode function, LocalScope scope, int idx) throws InterpretException {
        String outName = function.getOutputs().get(idx);
        Value retVal = scope.get(outName);
        if (retVal == null)
            throw this.error(InterpretException.Kind.UNRESOLVED_SYMBOL, function.getLine(),
                    "Output \"" + outName + "\" of function " + function.getName() + " is never assigned.");
        return retVal;
    }

    /**
     * @return the interpreted script built from the solver call
     *
     * @param script		parse tree
     * @param solverCall	the active solver call
     *
     * @throws InterpretException
     */
    private InterpretedScript processSolverCall(ScriptNode script, SolverCall solverCall) throws InterpretException {
        List<Expression> args = solverCall.getArgs();
        int line = solverCall.getLine();
        if (args.size() < 3)
            throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, line,
                    "The solver call needs a function handle, a time span and initial conditions.");
        int order = solverCall.getOrder();
        ExpressionEvaluator topValues = new ExpressionEvaluator(this, null, order, false);
        ExpressionEvaluator topRefs = new ExpressionEvaluator(this, null, order, true);
        HandleValue handle = this.resolveHandle(args.get(0), topValues);
        // Compute the initial conditions.
        Expression icArg = args.get(2);
        MatrixValue ic = (icArg instanceof IdentifierNode ? topValues.evaluateMatrix(icArg)
                : topRefs.evaluateMatrix(icArg));
        final int n = ic.size();
        if (n == 0)
            throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, line, "The initial-condition vector is empty.");
        List<Expr> initialValues = new ArrayList<Expr>(ic.elements());
        // Compute the extra parameters.
        List<Value> extras = new ArrayList<Value>();
        for (int i = 4; i < args.size(); i++)
            extras.add(topRefs.evaluate(args.get(i)));
        // Find the ODE function and the parameter names.
        FunctionDefinitionNode function = null;
        AnonymousFunctionNode lambda = handle.getLambda();
        if (! handle.isAnonymous()) {
            function = this.odeFunction(handle.getName(), line);
        } else {
            if (lambda.getParams().size() < 2)
                throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, line,
                        "The anonymous solver function must take time and state arguments.");
            Expression body = lambda.getBody();
            if (body instanceof CallNode && this.isFunction(((CallNode) body).getName()))
                function = this.odeFunction(((CallNode) body).getName(), line);
        }
        String timeParam;
        String stateParam;
        if (function != null) {
            timeParam = function.getParams().get(0);
            stateParam = function.getParams().get(1);
        } else {
            timeParam = lambda.getParams().get(0);
            stateParam = lambda.getParams().get(1);
        }
        // Build the species names and the state vector.
        String base = stateParam;
        if (this.useOutputNames && solverCall.getOutputName(1) != null)
            base = solverCall.getOutputName(1);
        if (base == null || base.equals("~"))
            base = "x";
        List<String> speciesNames = new ArrayList<String>(n);
        List<Expr> state = new ArrayList<Expr>(n);
        for (int i = 1; i <= n; i++) {
            String speciesName = this.names.name(base, i);
            speciesNames.add(speciesName);
            state.add(new Symbol(speciesName));
        }
        log.info("{} state variables named from \"{}\".", n, base);
        MatrixValue stateVector = (ic.getRows() == 1 && n > 1 ? MatrixValue.row(state) : MatrixValue.column(state));
        // Evaluate the derivatives.
        Value derivative;
        String functionName;
        if (! handle.isAnonymous()) {
            List<Value> odeArgs = new ArrayList<Value>();
            odeArgs.add(MatrixValue.scalar(Symbol.TIME));
            odeArgs.add(stateVector);
            odeArgs.addAll(extras);
            derivative = this.evaluateOde(function, odeArgs, order, line);
            functionName = function.getName();
        } else {
            LocalScope lambdaScope = new LocalScope("anonymous function", null);
            List<String> lambdaParams = lambda.getParams();
            List<Value> lambdaArgs = new ArrayList<Value>();
            lambdaArgs.add(MatrixValue.scalar(Symbol.TIME));
            lambdaArgs.add(stateVector);
            lambdaArgs.addAll(extras);
            if (lambdaArgs.size() > lambdaParams.size())
                throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, line,
                        "The anonymous solver function takes " + lambdaParams.size() + " arguments but the solver passes "
                        + lambdaArgs.size() + ".");
            for (int i = 0; i < lambdaArgs.size(); i++) {
                if (! lambdaParams.get(i).equals("~"))
                    lambdaScope.put(lambdaParams.get(i), lambdaArgs.get(i));
            }
            ExpressionEvaluator lambdaEval = topRefs.withScope(lambdaScope);
            if (function != null) {
                CallNode call = (CallNode) lambda.getBody();
                List<Value> odeArgs = new ArrayList<Value>();
                for (Expression arg : call.getArgs())
                    odeArgs.add(lambdaEval.evaluate(arg));
                derivative = this.evaluateOde(function, odeArgs, order, line);
                functionName = function.getName();
            } else {
                log.info("Using the body of the anonymous function as the derivative vector.");
                derivative = lambdaEval.evaluate(lambda.getBody());
                functionName = "anonymous";
            }
        }
        // Validate the derivative vector.
        MatrixValue derivs = topRefs.matrix(derivative, solverCall.getCall());
        if (derivs.size() != n)
            throw this.error(InterpretException.Kind.DIMENSION_MISMATCH, line,
                    "The ODE function returns " + derivs.size() + " derivatives but there are " + n
                    + " initial conditions.");
        OdeFunction odeFunction = new OdeFunction(functionName, function, timeParam, stateParam,
                new ArrayList<Expr>(derivs.elements()));
        return new InterpretedScript(script, this.symbols, solverCall, odeFunction, speciesNames, initialValues,
                this.constants, this.names.getSeparator());
    }

    /**
     * @return the function handle passed to the solver
     *
     * @param arg			first solver argument
     * @param evaluator		evaluator for the working scope at the solver call
     *
     * @throws InterpretException
     */
    private HandleValue resolveHandle(Expression arg, ExpressionEvaluator evaluator) throws InterpretException {
        HandleValue retVal;
        if (arg instanceof FunctionHandleNode)
            retVal = new HandleValue(((FunctionHandleNode) arg).getName());
        else if (arg instanceof AnonymousFunctionNode)
            retVal = new HandleValue((AnonymousFunctionNode) arg);
        else {
            Value value = evaluator.evaluate(arg);
            if (value instanceof HandleValue)
                retVal = (HandleValue) value;
            else if (value instanceof StringValue)
                retVal = new HandleValue(((StringValue) value).getValue());
            else
                throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, arg.getLine(),
                        "The first solver argument must be a function handle, not a " + value.describe() + ".");
        }
        return retVal;
    }

    /**
     * @return the definition of the ODE function, after verifying that it has the right form
     *
     * @param name		name of the function
     * @param line		line of the solver call
     *
     * @throws InterpretException
     */
    private FunctionDefinitionNode odeFunction(String name, int line) throws InterpretException {
        FunctionDefinitionNode retVal = this.functions.get(name);
        if (retVal == null)
            throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, line,
                    "The solver function \"" + name + "\" is not defined in this file.");
        if (retVal.getParams().size() < 2)
            throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, line,
                    "The solver function \"" + name + "\" must take time and state arguments.");
        if (retVal.getOutputs().isEmpty())
            throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, line,
                    "The solver function \"" + name + "\" does not return a value.");
        String output = retVal.getOutputs().get(0);
        if (! assigns(retVal.getBody(), output))
            throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, line,
                    "The solver function \"" + name + "\" never assigns its output \"" + output + "\".");
        return retVal;
    }

    /**
     * @return TRUE if a list of statements assigns a name, at any depth
     *
     * @param body		statements to search
     * @param name		name to look for
     */
    private static boolean assigns(List<Statement> body, String name) {
        boolean retVal = false;
        for (int i = 0; ! retVal && i < body.size(); i++) {
            Statement stmt = body.get(i);
            if (stmt instanceof AssignmentNode) {
                for (AssignmentNode.Target target : ((AssignmentNode) stmt).getTargets())
                    retVal = retVal || name.equals(target.getName());
            } else if (stmt instanceof IfNode) {
                IfNode ifNode = (IfNode) stmt;
                for (IfNode.Branch branch : ifNode.getBranches())
                    retVal = retVal || assigns(branch.getBody(), name);
                retVal = retVal || assigns(ifNode.getElseBody(), name);
            } else if (stmt instanceof ForNode)
                retVal = assigns(((ForNode) stmt).getBody(), name);
        }
        return retVal;
    }

    /**
     * @return the derivative value computed by the ODE function
     *
     * @param function	ODE function definition
     * @param args		argument values
     * @param order		position of the solver call in the working scope
     * @param line		line of the solver call
     *
     * @throws InterpretException
     */
    private Value evaluateOde(FunctionDefinitionNode function, List<Value> args, int order, int line)
            throws InterpretException {
        if (args.size() > function.getParams().size())
            throw this.error(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH, line,
                    "The solver function \"" + function.getName() + "\" takes " + function.getParams().size()
                    + " arguments but is given " + args.size() + ".");
        LocalScope scope = this.bindArguments(function, args);
        Set<String> reserved = new HashSet<String>(function.getOutputs());
        for (String param : function.getParams()) {
            if (param != null)
                reserved.add(param);
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(this, scope, order, true);
        BodyExecutor executor = new BodyExecutor(this, evaluator, BodyExecutor.countAssignments(function.getBody()),
                reserved);
        this.runBody(function, executor, function);
        return this.output(function, scope, 0);
    }

    /**
     * @return an interpretation exception quoting the offending source line
     *
     * @param kind		type of failure
     * @param line		line number, or 0 if unknown
     * @param detail	description of the failure
     */
    public InterpretException error(InterpretException.Kind kind, int line, String detail) {
        return new InterpretException(kind, detail, line, (line > 0 ? this.source.quote(line) : ""));
    }

    /**
     * @return the symbol table of the working scope
     */
    public SymbolTable getSymbols() {
        return this.symbols;
    }

}
