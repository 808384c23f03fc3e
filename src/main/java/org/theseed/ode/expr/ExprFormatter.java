package org.theseed.ode.expr;

import java.util.stream.Collectors;

/**
 * This class renders a symbolic expression as infix text in MATLAB syntax, with the
 * minimum parentheses needed to preserve the tree structure.  Binary operators other
 * than power are surrounded by spaces ("a - b * x_1").
 */
public class ExprFormatter implements ExprVisitor<String> {

    /** precedence of atoms */
    private static final int ATOM = 8;
    /** precedence of prefix operators */
    private static final int PREFIX = 6;

    /**
     * @return the infix text for an expression
     *
     * @param expr		expression to format
     */
    public static String format(Expr expr) {
        return expr.accept(new ExprFormatter());
    }

    /**
     * @return the precedence level of an expression's top operator
     *
     * @param expr		expression to check
     */
    private static int precedence(Expr expr) {
        int retVal = ATOM;
        if (expr instanceof Binary)
            retVal = ((Binary) expr).getOp().getPrecedence();
        else if (expr instanceof Unary)
            retVal = PREFIX;
        else if (expr instanceof Constant && ((Constant) expr).getValue() < 0)
            retVal = PREFIX;
        return retVal;
    }

    /**
     * @return the formatted text of an operand, parenthesized if necessary
     *
     * @param expr		operand to format
     * @param paren		TRUE if parentheses are required
     */
    private String operand(Expr expr, boolean paren) {
        String retVal = expr.accept(this);
        if (paren)
            retVal = "(" + retVal + ")";
        return retVal;
    }

    @Override
    public String visitConstant(Constant expr) {
        return Exprs.formatNumber(expr.getValue());
    }

    @Override
    public String visitSymbol(Symbol expr) {
        return expr.getName();
    }

    @Override
    public String visitUnary(Unary expr) {
        String prefix = (expr.getOp() == Unary.Op.NEG ? "-" : "~");
        return prefix + this.operand(expr.getOperand(), precedence(expr.getOperand()) < PREFIX);
    }

    @Override
    public String visitBinary(Binary expr) {
        Binary.Op op = expr.getOp();
        int p = op.getPrecedence();
        int lp = precedence(expr.getLeft());
        int rp = precedence(expr.getRight());
        boolean leftParen = (lp < p || (op == Binary.Op.POW && lp <= p));
        boolean rightParen = (rp < p || (rp == p && (op == Binary.Op.SUB || op == Binary.Op.DIV
                || op.isRelational())));
        String left = this.operand(expr.getLeft(), leftParen);
        String right = this.operand(expr.getRight(), rightParen);
        String retVal;
        if (op == Binary.Op.POW)
            retVal = left + "^" + right;
        else
            retVal = left + " " + this.symbol(op) + " " + right;
        return retVal;
    }

    /**
     * @return the text for a binary operator
     *
     * @param op	operator to render
     */
    protected String symbol(Binary.Op op) {
        return op.getSymbol();
    }

    @Override
    public String visitCall(FunctionCall expr) {
        return expr.getName() + "(" + expr.getArgs().stream().map(x -> x.accept(this))
                .collect(Collectors.joining(", ")) + ")";
    }

}
