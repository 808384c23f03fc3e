package org.theseed.ode.matlab.ast;

import java.util.List;

/**
 * An if statement.  The "if" and each "elseif" form a branch with a condition; the
 * "else" body is kept separately and is empty if there was no "else".
 */
public class IfNode extends Statement {

    // FIELDS
    /** conditional branches, in order */
    private final List<Branch> branches;
    /** else body */
    private final List<Statement> elseBody;

    /**
     * This class describes a single conditional branch.
     */
    public static class Branch {

        /** branch condition */
        private final Expression condition;
        /** branch body */
        private final List<Statement> body;

        public Branch(Expression condition, List<Statement> body) {
            this.condition = condition;
            this.body = List.copyOf(body);
        }

        /**
         * @return the branch condition
         */
        public Expression getCondition() {
            return this.condition;
        }

        /**
         * @return the branch body
         */
        public List<Statement> getBody() {
            return this.body;
        }

    }

    public IfNode(int line, int column, List<Branch> branches, List<Statement> elseBody) {
        super(line, column);
        this.branches = List.copyOf(branches);
        this.elseBody = List.copyOf(elseBody);
    }

    /**
     * @return the conditional branches
     */
    public List<Branch> getBranches() {
        return this.branches;
    }

    /**
     * @return the else body (empty if there is none)
     */
    public List<Statement> getElseBody() {
        return this.elseBody;
    }

    @Override
    public <T, E extends Exception> T accept(StatementVisitor<T, E> visitor) throws E {
        return visitor.visitIf(this);
    }

}
