/**
 *
 */
package org.theseed.ode.interp;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.expr.Symbol;
import org.theseed.ode.matlab.ast.AssignmentNode;
import org.theseed.ode.matlab.ast.CommandNode;
import org.theseed.ode.matlab.ast.ExpressionStatementNode;
import org.theseed.ode.matlab.ast.ForNode;
import org.theseed.ode.matlab.ast.FunctionDefinitionNode;
import org.theseed.ode.matlab.ast.IfNode;
import org.theseed.ode.matlab.ast.Statement;
import org.theseed.ode.matlab.ast.StatementVisitor;

/**
 * This visitor runs the statements of a function body in a local scope.  Conditionals
 * must be decidable at translation time and loops must have constant ranges, so execution
 * is straight-line.  Expression statements and commands have no effect on the model and
 * are skipped.
 *
 * When running the ODE function itself, a local variable assigned exactly once to a
 * number is kept as a named constant instead of being folded, so that it becomes a
 * model parameter.
 */
public class BodyExecutor implements StatementVisitor<Void, InterpretException> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BodyExecutor.class);
    /** controlling interpreter */
    private final OdeInterpreter interp;
    /** expression evaluator for the body */
    private final ExpressionEvaluator evaluator;
    /** local scope */
    private final LocalScope scope;
    /** assignment counts for ODE-function mode, or NULL */
    private final Map<String, Integer> assignCounts;
    /** names that are never converted to constants */
    private final Set<String> reserved;

    /** maximum number of loop iterations */
    private static final int MAX_ITERATIONS = 10000;

    /**
     * Create an executor for an ordinary function body.
     *
     * @param interp		controlling interpreter
     * @param evaluator		expression evaluator using the local scope
     */
    public BodyExecutor(OdeInterpreter interp, ExpressionEvaluator evaluator) {
        this(interp, evaluator, null, Set.of());
    }

    /**
     * Create an executor.
     *
     * @param interp		controlling interpreter
     * @param evaluator		expression evaluator using the local scope
     * @param assignCounts	number of assignments to each name in the body, or NULL to fold all locals
     * @param reserved		names (parameters and outputs) never converted to constants
     */
    public BodyExecutor(OdeInterpreter interp, ExpressionEvaluator evaluator, Map<String, Integer> assignCounts,
            Set<String> reserved) {
        this.interp = interp;
        this.evaluator = evaluator;
        this.scope = evaluator.getScope();
        this.assignCounts = assignCounts;
        this.reserved = reserved;
    }

    /**
     * Run a list of statements.
     *
     * @param body		statements to run
     *
     * @throws InterpretException
     */
    public void run(List<Statement> body) throws InterpretException {
        for (Statement stmt : body)
            stmt.accept(this);
    }

    /**
     * @return the number of times each name is assigned in a function body
     *
     * Assignments inside loops are counted twice, since they normally run more than once.
     *
     * @param body		statements to scan
     */
    public static Map<String, Integer> countAssignments(List<Statement> body) {
        Map<String, Integer> retVal = new HashMap<String, Integer>();
        countAssignments(body, 1, retVal);
        return retVal;
    }

    /**
     * Accumulate assignment counts for a list of statements.
     *
     * @param body		statements to scan
     * @param weight	count to add for each assignment
     * @param counts	map of counts to update
     */
    private static void countAssignments(List<Statement> body, int weight, Map<String, Integer> counts) {
        for (Statement stmt : body) {
            if (stmt instanceof AssignmentNode) {
                for (AssignmentNode.Target target : ((AssignmentNode) stmt).getTargets()) {
                    if (! target.isIgnored())
                        counts.merge(target.getName(), weight, Integer::sum);
                }
            } else if (stmt instanceof IfNode) {
                IfNode ifNode = (IfNode) stmt;
                for (IfNode.Branch branch : ifNode.getBranches())
                    countAssignments(branch.getBody(), weight, counts);
                countAssignments(ifNode.getElseBody(), weight, counts);
            } else if (stmt instanceof ForNode) {
                ForNode forNode = (ForNode) stmt;
                counts.merge(forNode.getVariable(), 2, Integer::sum);
                countAssignments(forNode.getBody(), 2, counts);
            }
        }
    }

    @Override
    public Void visitAssignment(AssignmentNode node) throws InterpretException {
        List<AssignmentNode.Target> targets = node.getTargets();
        if (targets.size() == 1) {
            AssignmentNode.Target target = node.getTarget();
            String name = target.getName();
            Value value = this.evaluator.evaluate(node.getValue());
            if (target.isIndexed()) {
                Value old = this.scope.get(name);
                MatrixValue base = (old == null ? MatrixValue.empty() : this.evaluator.matrix(old, node));
                value = this.evaluator.assignIndexed(base, target.getIndices(), value, name, node);
            } else if (this.isNamedConstant(name, value)) {
                this.interp.registerConstant(name, ((MatrixValue) value).getScalar());
                value = MatrixValue.scalar(new Symbol(name));
            }
            this.scope.put(name, value);
        } else {
            List<Value> values = this.evaluator.evaluateMulti(node.getValue(), targets.size());
            for (int i = 0; i < targets.size(); i++) {
                AssignmentNode.Target target = targets.get(i);
                if (target.isIndexed())
                    throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                            "Indexed targets in a multiple assignment are not supported.");
                if (! target.isIgnored())
                    this.scope.put(target.getName(), values.get(i));
            }
        }
        return null;
    }

    /**
     * @return TRUE if an assignment should produce a named constant rather than a folded value
     *
     * @param name		variable being assigned
     * @param value		value assigned
     */
    private boolean isNamedConstant(String name, Value value) {
        boolean retVal = false;
        if (this.assignCounts != null && ! this.reserved.contains(name)
                && this.assignCounts.getOrDefault(name, 0) == 1 && value instanceof MatrixValue) {
            MatrixValue m = (MatrixValue) value;
            retVal = m.isScalar() && m.isNumeric();
        }
        return retVal;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatementNode node) throws InterpretException {
        log.debug("Skipping expression statement at line {}.", node.getLine());
        return null;
    }

    @Override
    public Void visitCommand(CommandNode node) throws InterpretException {
        log.debug("Skipping command \"{}\" at line {}.", node.getName(), node.getLine());
        return null;
    }

    @Override
    public Void visitIf(IfNode node) throws InterpretException {
        boolean done = false;
        for (IfNode.Branch branch : node.getBranches()) {
            Value cond = this.evaluator.evaluate(branch.getCondition());
            if (this.evaluator.truth(cond, branch.getCondition())) {
                this.run(branch.getBody());
                done = true;
                break;
            }
        }
        if (! done)
            this.run(node.getElseBody());
        return null;
    }

    @Override
    public Void visitFor(ForNode node) throws InterpretException {
        MatrixValue range = this.evaluator.evaluateMatrix(node.getRange());
        List<MatrixValue> columns = range.columns();
        if (columns.size() > MAX_ITERATIONS)
            throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                    "Loop has more than " + MAX_ITERATIONS + " iterations.");
        for (MatrixValue column : columns) {
            this.scope.put(node.getVariable(), this.interp.foldLoopValue(column, node));
            this.run(node.getBody());
        }
        return null;
    }

    @Override
    public Void visitFunctionDefinition(FunctionDefinitionNode node) throws InterpretException {
        throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, node.getLine(),
                "Nested function definitions are not supported.");
    }

}
