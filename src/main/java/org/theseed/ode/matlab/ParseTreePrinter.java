/**
 *
 */
package org.theseed.ode.matlab;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
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
 * This class renders a parse tree as an indented listing, one node per line, with the
 * source line number of each statement.  Two structurally identical trees always
 * produce identical listings.
 */
public class ParseTreePrinter implements ParseNodeVisitor<Void, RuntimeException> {

    // FIELDS
    /** output buffer */
    private final StringBuilder buffer;
    /** current indentation level */
    private int depth;

    public ParseTreePrinter() {
        this.buffer = new StringBuilder(1000);
        this.depth = 0;
    }

    /**
     * @return the listing for a parse tree
     *
     * @param script	root of the tree to list
     */
    public static String print(ScriptNode script) {
        ParseTreePrinter printer = new ParseTreePrinter();
        script.accept(printer);
        return printer.buffer.toString();
    }

    /**
     * Write a line of output at the current indentation.
     *
     * @param text	text to write
     */
    private void line(String text) {
        this.buffer.append(StringUtils.repeat("  ", this.depth)).append(text).append('\n');
    }

    /**
     * List a sequence of statements one level deeper.
     *
     * @param label		label line for the sequence, or NULL if none
     * @param body		statements to list
     */
    private void block(String label, List<Statement> body) {
        if (label != null)
            this.line(label);
        this.depth++;
        for (Statement stmt : body)
            stmt.accept(this);
        this.depth--;
    }

    /**
     * List expressions one level deeper.
     *
     * @param children	expressions to list
     */
    private void children(Expression... children) {
        this.depth++;
        for (Expression child : children) {
            if (child != null)
                child.accept(this);
        }
        this.depth--;
    }

    @Override
    public Void visitScript(ScriptNode node) {
        this.block("script " + node.getName(), node.getStatements());
        return null;
    }

    @Override
    public Void visitAssignment(AssignmentNode node) {
        this.line("assign [line " + node.getLine() + "]");
        this.depth++;
        for (AssignmentNode.Target target : node.getTargets()) {
            if (target.isIgnored())
                this.line("target ~");
            else if (! target.isIndexed())
                this.line("target " + target.getName());
            else {
                this.line("target " + target.getName() + " indexed");
                this.children(target.getIndices().toArray(new Expression[0]));
            }
        }
        this.line("value");
        this.children(node.getValue());
        this.depth--;
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatementNode node) {
        this.line("expression [line " + node.getLine() + "]");
        this.children(node.getExpression());
        return null;
    }

    @Override
    public Void visitCommand(CommandNode node) {
        this.line("command " + node.getName() + " " + StringUtils.join(node.getWords(), ' ')
                + " [line " + node.getLine() + "]");
        return null;
    }

    @Override
    public Void visitIf(IfNode node) {
        this.line("if [line " + node.getLine() + "]");
        this.depth++;
        for (IfNode.Branch branch : node.getBranches()) {
            this.line("condition");
            this.children(branch.getCondition());
            this.block("then", branch.getBody());
        }
        if (! node.getElseBody().isEmpty())
            this.block("else", node.getElseBody());
        this.depth--;
        return null;
    }

    @Override
    public Void visitFor(ForNode node) {
        this.line("for " + node.getVariable() + " [line " + node.getLine() + "]");
        this.children(node.getRange());
        this.block(null, node.getBody());
        return null;
    }

    @Override
    public Void visitFunctionDefinition(FunctionDefinitionNode node) {
        List<String> params = node.getParams();
        String[] paramNames = new String[params.size()];
        for (int i = 0; i < paramNames.length; i++)
            paramNames[i] = StringUtils.defaultString(params.get(i), "~");
        this.line("function [" + StringUtils.join(node.getOutputs(), ", ") + "] = " + node.getName()
                + "(" + StringUtils.join(paramNames, ", ") + ") [line " + node.getLine() + "]");
        this.block(null, node.getBody());
        return null;
    }

    @Override
    public Void visitNumber(NumberNode node) {
        this.line("number " + node.getText());
        return null;
    }

    @Override
    public Void visitString(StringNode node) {
        this.line("string '" + node.getValue() + "'");
        return null;
    }

    @Override
    public Void visitIdentifier(IdentifierNode node) {
        this.line("name " + node.getName());
        return null;
    }

    @Override
    public Void visitCall(CallNode node) {
        this.line("call " + node.getName());
        this.children(node.getArgs().toArray(new Expression[0]));
        return null;
    }

    @Override
    public Void visitUnary(UnaryNode node) {
        this.line("unary " + node.getOperator().getSymbol());
        this.children(node.getOperand());
        return null;
    }

    @Override
    public Void visitBinary(BinaryNode node) {
        this.line("binary " + node.getOperator().getSymbol());
        this.children(node.getLeft(), node.getRight());
        return null;
    }

    @Override
    public Void visitMatrix(MatrixNode node) {
        this.line("matrix " + node.getRows().size() + " rows");
        this.depth++;
        for (List<Expression> row : node.getRows()) {
            this.line("row");
            this.children(row.toArray(new Expression[0]));
        }
        this.depth--;
        return null;
    }

    @Override
    public Void visitRange(RangeNode node) {
        this.line(node.getStep() == null ? "range" : "range with step");
        this.children(node.getStart(), node.getStep(), node.getStop());
        return null;
    }

    @Override
    public Void visitColon(ColonNode node) {
        this.line("colon");
        return null;
    }

    @Override
    public Void visitFunctionHandle(FunctionHandleNode node) {
        this.line("handle @" + node.getName());
        return null;
    }

    @Override
    public Void visitAnonymousFunction(AnonymousFunctionNode node) {
        this.line("lambda @(" + StringUtils.join(node.getParams(), ", ") + ")");
        this.children(node.getBody());
        return null;
    }

}
