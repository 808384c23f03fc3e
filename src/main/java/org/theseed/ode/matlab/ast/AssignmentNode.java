package org.theseed.ode.matlab.ast;

import java.util.List;

/**
 * An assignment statement.  There may be more than one target ("[t, y] = ode45(...)"),
 * and a target may be indexed ("dx(2) = ...") or ignored ("[~, y] = ...").
 */
public class AssignmentNode extends Statement {

    // FIELDS
    /** assignment targets */
    private final List<Target> targets;
    /** value expression */
    private final Expression value;

    /**
     * This class describes a single assignment target.
     */
    public static class Target {

        /** name assigned, or NULL for an ignored output */
        private final String name;
        /** index expressions (empty for a whole-variable assignment) */
        private final List<Expression> indices;

        /**
         * Create a new assignment target.
         *
         * @param name		name assigned, or NULL for an ignored output
         * @param indices	index expressions (empty for a whole-variable assignment)
         */
        public Target(String name, List<Expression> indices) {
            this.name = name;
            this.indices = List.copyOf(indices);
        }

        /**
         * @return the name assigned, or NULL for an ignored output
         */
        public String getName() {
            return this.name;
        }

        /**
         * @return the index expressions
         */
        public List<Expression> getIndices() {
            return this.indices;
        }

        /**
         * @return TRUE if this target is an ignored output
         */
        public boolean isIgnored() {
            return this.name == null;
        }

        /**
         * @return TRUE if this target is indexed
         */
        public boolean isIndexed() {
            return ! this.indices.isEmpty();
        }

    }

    public AssignmentNode(int line, int column, List<Target> targets, Expression value) {
        super(line, column);
        this.targets = List.copyOf(targets);
        this.value = value;
    }

    /**
     * @return the assignment targets
     */
    public List<Target> getTargets() {
        return this.targets;
    }

    /**
     * @return the first (and usually only) target
     */
    public Target getTarget() {
        return this.targets.get(0);
    }

    /**
     * @return the value expression
     */
    public Expression getValue() {
        return this.value;
    }

    @Override
    public <T, E extends Exception> T accept(StatementVisitor<T, E> visitor) throws E {
        return visitor.visitAssignment(this);
    }

}
