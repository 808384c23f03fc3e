/**
 *
 */
package org.theseed.ode.interp;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.matlab.ast.AnonymousFunctionNode;
import org.theseed.ode.matlab.ast.AssignmentNode;
import org.theseed.ode.matlab.ast.BinaryNode;
import org.theseed.ode.matlab.ast.CallNode;
import org.theseed.ode.matlab.ast.ColonNode;
import org.theseed.ode.matlab.ast.CommandNode;
import org.theseed.ode.matlab.ast.Expression;
import org.theseed.ode.matlab.ast.ExpressionStatementNode;
import org.theseed.ode.matlab.ast.ForNode;
import org.theseed.ode.matlab.ast.FunctionDefinitionNode;
import org.theseed.ode.matlab.ast.FunctionHandleNode;
import org.theseed.ode.matlab.ast.IdentifierNode;
import org.theseed.ode.matlab.ast.IfNode;
import org.theseed.ode.matlab.ast.MatrixNode;
import org.theseed.ode.matlab.ast.NumberNode;
import org.theseed.ode.matlab.ast.ParseNodeVisitor;
import org.theseed.ode.matlab.ast.RangeNode;
import org.theseed.ode.matlab.ast.ScriptNode;
import org.theseed.ode.matlab.ast.Statement;
import org.theseed.ode.matlab.ast.StringNode;
import org.theseed.ode.matlab.ast.UnaryNode;

/**
 * This object builds the names of indexed quantities (species "x_1", vector constants
 * "k_2", matrix constants "A_1_2").  The separator is normally an underscore, but if the
 * script itself uses an identifier that looks like an indexed name built from another of
 * its identifiers, the separator is lengthened until no such collision is possible.
 */
public class NameAllocator {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NameAllocator.class);
    /** identifiers used in the script */
    private final Set<String> identifiers;
    /** separator between a base name and its indices */
    private final String separator;

    /**
     * Compute the separator for a script.
     *
     * @param script	parse tree of the script
     */
    public NameAllocator(ScriptNode script) {
        Collector collector = new Collector();
        script.accept(collector);
        this.identifiers = collector.names;
        String sep = "_";
        while (this.collides(sep))
            sep += "_";
        if (sep.length() > 1)
            log.info("Using separator \"{}\" for indexed names to avoid collisions.", sep);
        this.separator = sep;
    }

    /**
     * @return TRUE if an identifier in the script could be produced by indexing another
     * 		   identifier with the specified separator
     *
     * @param sep	separator to check
     */
    private boolean collides(String sep) {
        String q = Pattern.quote(sep);
        Pattern suffix = Pattern.compile(q + "\\d+(" + q + "\\d+)?");
        boolean retVal = false;
        for (String id : this.identifiers) {
            for (String base : this.identifiers) {
                if (id.length() > base.length() && id.startsWith(base)
                        && suffix.matcher(id.substring(base.length())).matches()) {
                    log.debug("Identifier {} collides with indexed names of {}.", id, base);
                    retVal = true;
                }
            }
        }
        return retVal;
    }

    /**
     * @return the separator between a base name and its indices
     */
    public String getSeparator() {
        return this.separator;
    }

    /**
     * @return the name of an element of a vector
     *
     * @param base		base name of the vector
     * @param idx		1-based index
     */
    public String name(String base, int idx) {
        return base + this.separator + idx;
    }

    /**
     * @return the name of an element of a matrix
     *
     * @param base		base name of the matrix
     * @param row		1-based row index
     * @param col		1-based column index
     */
    public String name(String base, int row, int col) {
        return base + this.separator + row + this.separator + col;
    }

    /**
     * @return TRUE if the identifier appears in the script
     *
     * @param name		identifier to check
     */
    public boolean isUsed(String name) {
        return this.identifiers.contains(name);
    }

    /**
     * This visitor collects every identifier named anywhere in a parse tree.
     */
    private static class Collector implements ParseNodeVisitor<Void, RuntimeException> {

        /** names found */
        private final Set<String> names = new TreeSet<String>();

        private void statements(Iterable<Statement> body) {
            for (Statement stmt : body)
                stmt.accept(this);
        }

        private void expressions(Iterable<Expression> exprs) {
            for (Expression expr : exprs)
                expr.accept(this);
        }

        @Override
        public Void visitScript(ScriptNode node) {
            this.statements(node.getStatements());
            return null;
        }

        @Override
        public Void visitAssignment(AssignmentNode node) {
            for (AssignmentNode.Target target : node.getTargets()) {
                if (! target.isIgnored()) {
                    this.names.add(target.getName());
                    this.expressions(target.getIndices());
                }
            }
            node.getValue().accept(this);
            return null;
        }

        @Override
        public Void visitExpressionStatement(ExpressionStatementNode node) {
            node.getExpression().accept(this);
            return null;
        }

        @Override
        public Void visitCommand(CommandNode node) {
            return null;
        }

        @Override
        public Void visitIf(IfNode node) {
            for (IfNode.Branch branch : node.getBranches()) {
                branch.getCondition().accept(this);
                this.statements(branch.getBody());
            }
            this.statements(node.getElseBody());
            return null;
        }

        @Override
        public Void visitFor(ForNode node) {
            this.names.add(node.getVariable());
            node.getRange().accept(this);
            this.statements(node.getBody());
            return null;
        }

        @Override
        public Void visitFunctionDefinition(FunctionDefinitionNode node) {
            this.names.add(node.getName());
            this.names.addAll(node.getOutputs());
            for (String param : node.getParams()) {
                if (param != null)
                    this.names.add(param);
            }
            this.statements(node.getBody());
            return null;
        }

        @Override
        public Void visitNumber(NumberNode node) {
            return null;
        }

        @Override
        public Void visitString(StringNode node) {
            return null;
        }

        @Override
        public Void visitIdentifier(IdentifierNode node) {
            this.names.add(node.getName());
            return null;
        }

        @Override
        public Void visitCall(CallNode node) {
            this.names.add(node.getName());
            this.expressions(node.getArgs());
            return null;
        }

        @Override
        public Void visitUnary(UnaryNode node) {
            node.getOperand().accept(this);
            return null;
        }

        @Override
        public Void visitBinary(BinaryNode node) {
            node.getLeft().accept(this);
            node.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitMatrix(MatrixNode node) {
            for (var row : node.getRows())
                this.expressions(row);
            return null;
        }

        @Override
        public Void visitRange(RangeNode node) {
            node.getStart().accept(this);
            if (node.getStep() != null)
                node.getStep().accept(this);
            node.getStop().accept(this);
            return null;
        }

        @Override
        public Void visitColon(ColonNode node) {
            return null;
        }

        @Override
        public Void visitFunctionHandle(FunctionHandleNode node) {
            this.names.add(node.getName());
            return null;
        }

        @Override
        public Void visitAnonymousFunction(AnonymousFunctionNode node) {
            for (String param : node.getParams()) {
                if (! param.equals("~"))
                    this.names.add(param);
            }
            node.getBody().accept(this);
            return null;
        }

    }

}
