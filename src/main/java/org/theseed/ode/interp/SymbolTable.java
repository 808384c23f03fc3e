/**
 *
 */
package org.theseed.ode.interp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.matlab.ast.AssignmentNode;
import org.theseed.ode.matlab.ast.Expression;

/**
 * This object holds the assignments of the working scope.  The assignments are collected
 * first, in file order, and each is then resolved on demand.  A reference made at a
 * given point in the file binds to the latest earlier active definition of the name;
 * if there is none, it binds to the first later one (a forward reference).
 *
 * An assignment is active if every guard on it holds.  Guards come from the enclosing
 * "if" statements, and each guard condition must fold to a constant.
 */
public class SymbolTable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SymbolTable.class);
    /** controlling interpreter */
    private final OdeInterpreter interp;
    /** map of names to definitions, each list in file order */
    private final Map<String, List<Entry>> entryMap;
    /** all entries in file order */
    private final List<Entry> entries;

    /**
     * Resolution states for an entry.
     */
    public static enum Status {
        PENDING, RESOLVING, RESOLVED;
    }

    /**
     * A condition that must have a certain truth value for an assignment to be active.
     */
    public static class Guard {

        /** condition expression */
        private final Expression condition;
        /** position of the condition in the file */
        private final int order;
        /** required truth value */
        private final boolean expected;
        /** cached truth value, or NULL if not yet computed */
        private Boolean result;
        /** TRUE while the condition is being evaluated */
        private boolean evaluating;

        /**
         * Create a guard.
         *
         * @param condition		condition expression
         * @param order			position of the condition in the file
         * @param expected		required truth value
         */
        public Guard(Expression condition, int order, boolean expected) {
            this.condition = condition;
            this.order = order;
            this.expected = expected;
            this.result = null;
            this.evaluating = false;
        }

        /**
         * @return a guard for the same condition requiring the opposite truth value
         */
        public Guard negate() {
            return new Guard(this.condition, this.order, ! this.expected);
        }

        /**
         * @return the condition expression
         */
        public Expression getCondition() {
            return this.condition;
        }

    }

    /**
     * A single definition of a name.
     */
    public static class Entry {

        /** name being defined */
        private final String name;
        /** position of the defining statement in the file */
        private final int order;
        /** defining assignment, or NULL for a preset value */
        private final AssignmentNode node;
        /** index of the name among the assignment targets */
        private final int targetIndex;
        /** guards that must hold for the definition to be active */
        private final List<Guard> guards;
        /** TRUE if this is an output of the solver call */
        private final boolean solverOutput;
        /** source line number */
        private final int line;
        /** resolution state */
        private Status status;
        /** resolved value */
        private Value value;

        private Entry(String name, int order, AssignmentNode node, int targetIndex, List<Guard> guards,
                boolean solverOutput, int line) {
            this.name = name;
            this.order = order;
            this.node = node;
            this.targetIndex = targetIndex;
            this.guards = guards;
            this.solverOutput = solverOutput;
            this.line = line;
            this.status = Status.PENDING;
            this.value = null;
        }

        /**
         * @return the name being defined
         */
        public String getName() {
            return this.name;
        }

        /**
         * @return the position of the definition in the file
         */
        public int getOrder() {
            return this.order;
        }

        /**
         * @return the defining assignment, or NULL for a preset value
         */
        public AssignmentNode getNode() {
            return this.node;
        }

        /**
         * @return the index of the name among the assignment targets
         */
        public int getTargetIndex() {
            return this.targetIndex;
        }

        /**
         * @return TRUE if this definition is an output of the solver call
         */
        public boolean isSolverOutput() {
            return this.solverOutput;
        }

        /**
         * @return the source line number
         */
        public int getLine() {
            return this.line;
        }

        /**
         * @return the resolution state
         */
        public Status getStatus() {
            return this.status;
        }

        /**
         * @return the resolved value, or NULL if the entry has not been resolved
         */
        public Value getValue() {
            return this.value;
        }

    }

    /**
     * Create an empty symbol table.
     *
     * @param interp	controlling interpreter
     */
    public SymbolTable(OdeInterpreter interp) {
        this.interp = interp;
        this.entryMap = new LinkedHashMap<String, List<Entry>>();
        this.entries = new ArrayList<Entry>();
    }

    /**
     * Record the definitions made by an assignment statement.
     *
     * @param node			assignment statement
     * @param order			position of the statement in the file
     * @param guards		guards in effect for the statement
     * @param solverOutput	TRUE if the right side is the solver call
     */
    public void addAssignment(AssignmentNode node, int order, List<Guard> guards, boolean solverOutput) {
        List<AssignmentNode.Target> targets = node.getTargets();
        List<Guard> guardCopy = new ArrayList<Guard>(guards);
        for (int i = 0; i < targets.size(); i++) {
            AssignmentNode.Target target = targets.get(i);
            if (! target.isIgnored())
                this.add(new Entry(target.getName(), order, node, i, guardCopy, solverOutput, node.getLine()));
        }
    }

    /**
     * Record a definition whose value is already known, such as a loop variable.
     *
     * @param name		name being defined
     * @param order		position of the definition in the file
     * @param guards	guards in effect for the definition
     * @param value		value of the definition
     * @param line		source line number
     */
    public void addPreset(String name, int order, List<Guard> guards, Value value, int line) {
        Entry entry = new Entry(name, order, null, 0, new ArrayList<Guard>(guards), false, line);
        entry.value = value;
        entry.status = Status.RESOLVED;
        this.add(entry);
    }

    /**
     * Add an entry to the table.
     *
     * @param entry		entry to add
     */
    private void add(Entry entry) {
        this.entries.add(entry);
        this.entryMap.computeIfAbsent(entry.name, x -> new ArrayList<Entry>()).add(entry);
    }

    /**
     * @return the active definition visible at a point in the file, or NULL if there is none
     *
     * @param name		name to look up
     * @param order		position of the reference
     *
     * @throws InterpretException
     */
    public Entry find(String name, int order) throws InterpretException {
        Entry retVal = null;
        List<Entry> list = this.entryMap.get(name);
        if (list != null) {
            // Search backward for the latest earlier definition.
            for (int i = list.size() - 1; i >= 0 && retVal == null; i--) {
                Entry entry = list.get(i);
                if (entry.order < order && this.isActive(entry))
                    retVal = entry;
            }
            // Failing that, take the first later definition.
            for (int i = 0; i < list.size() && retVal == null; i++) {
                Entry entry = list.get(i);
                if (entry.order > order && this.isActive(entry)) {
                    log.debug("Forward reference to {} bound to line {}.", name, entry.line);
                    retVal = entry;
                }
            }
        }
        return retVal;
    }

    /**
     * @return the value of the latest active definition before a point in the file, or NULL
     * 		   if there is none (forward references are not considered)
     *
     * @param name		name to look up
     * @param order		position of the reference
     * @param line		line of the reference, for error messages
     *
     * @throws InterpretException
     */
    public Value lookupBefore(String name, int order, int line) throws InterpretException {
        Value retVal = null;
        List<Entry> list = this.entryMap.get(name);
        if (list != null) {
            for (int i = list.size() - 1; i >= 0 && retVal == null; i--) {
                Entry entry = list.get(i);
                if (entry.order < order && this.isActive(entry))
                    retVal = this.resolve(entry, line);
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if the specified name has any definition in the table
     *
     * @param name		name to check
     */
    public boolean isDefined(String name) {
        return this.entryMap.containsKey(name);
    }

    /**
     * @return the value visible at a point in the file, or NULL if the name is undefined
     *
     * @param name		name to look up
     * @param order		position of the reference
     * @param line		line of the reference, for error messages
     *
     * @throws InterpretException
     */
    public Value lookup(String name, int order, int line) throws InterpretException {
        Value retVal = null;
        Entry entry = this.find(name, order);
        if (entry != null)
            retVal = this.resolve(entry, line);
        return retVal;
    }

    /**
     * @return the value of an entry, computing it if necessary
     *
     * @param entry		entry to resolve
     * @param line		line of the reference, for error messages
     *
     * @throws InterpretException
     */
    public Value resolve(Entry entry, int line) throws InterpretException {
        switch (entry.status) {
        case RESOLVING :
            throw this.interp.error(InterpretException.Kind.UNRESOLVED_SYMBOL, line,
                    "Circular definition of \"" + entry.name + "\".");
        case PENDING :
            if (entry.solverOutput)
                throw this.interp.error(InterpretException.Kind.UNSUPPORTED_CONSTRUCT, line,
                        "\"" + entry.name + "\" is a solver output and has no value at translation time.");
            entry.status = Status.RESOLVING;
            entry.value = this.interp.computeEntry(entry);
            entry.status = Status.RESOLVED;
            log.debug("{} at line {} resolved to {}.", entry.name, entry.line, entry.value);
            break;
        default :
        }
        return entry.value;
    }

    /**
     * @return TRUE if all of an entry's guards hold
     *
     * @param entry		entry to check
     *
     * @throws InterpretException
     */
    public boolean isActive(Entry entry) throws InterpretException {
        boolean retVal = true;
        for (int i = 0; retVal && i < entry.guards.size(); i++)
            retVal = this.holds(entry.guards.get(i));
        return retVal;
    }

    /**
     * @return TRUE if all of a set of guards hold
     *
     * @param guards	guards to check
     *
     * @throws InterpretException
     */
    public boolean allHold(Collection<Guard> guards) throws InterpretException {
        boolean retVal = true;
        for (Guard guard : guards) {
            if (! this.holds(guard)) {
                retVal = false;
                break;
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if a guard holds
     *
     * @param guard		guard to check
     *
     * @throws InterpretException
     */
    private boolean holds(Guard guard) throws InterpretException {
        if (guard.result == null) {
            if (guard.evaluating)
                throw this.interp.error(InterpretException.Kind.UNRESOLVED_SYMBOL, guard.condition.getLine(),
                        "Condition depends on its own outcome.");
            guard.evaluating = true;
            guard.result = this.interp.testCondition(guard.condition, guard.order);
            guard.evaluating = false;
        }
        return guard.result == guard.expected;
    }

    /**
     * @return all the entries in file order
     */
    public List<Entry> getEntries() {
        return Collections.unmodifiableList(this.entries);
    }

    /**
     * @return the number of entries
     */
    public int size() {
        return this.entries.size();
    }

}
