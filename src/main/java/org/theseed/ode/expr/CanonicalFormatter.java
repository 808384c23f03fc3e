/**
 *
 */
package org.theseed.ode.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * This class renders an expression as text that does not depend on the order of the
 * operands of sums and products.  Nested sums and products are flattened and their
 * operands sorted, so "K + x_1" and "x_1 + K" produce the same text, as do "exp(k * x_1)"
 * and "exp(x_1 * k)".  The text is used to compare opaque sub-expressions, not for display.
 */
public class CanonicalFormatter implements ExprVisitor<String> {

    /**
     * @return the canonical text for an expression
     *
     * @param expr		expression to format
     */
    public static String format(Expr expr) {
        return expr.accept(new CanonicalFormatter());
    }

    /**
     * @return TRUE if the expression is a sum, a difference, or a negation
     *
     * @param expr		expression to check
     */
    private static boolean isAdditive(Expr expr) {
        boolean retVal = false;
        if (expr instanceof Unary)
            retVal = ((Unary) expr).getOp() == Unary.Op.NEG;
        else if (expr instanceof Binary) {
            Binary.Op op = ((Binary) expr).getOp();
            retVal = (op == Binary.Op.ADD || op == Binary.Op.SUB);
        }
        return retVal;
    }

    /**
     * @return TRUE if the expression is a product
     *
     * @param expr		expression to check
     */
    private static boolean isProduct(Expr expr) {
        return (expr instanceof Binary && ((Binary) expr).getOp() == Binary.Op.MUL);
    }

    /**
     * @return TRUE if the expression is a power
     *
     * @param expr		expression to check
     */
    private static boolean isPower(Expr expr) {
        return (expr instanceof Binary && ((Binary) expr).getOp() == Binary.Op.POW);
    }

    /**
     * @return TRUE if the expression is an atom that never needs parentheses
     *
     * @param expr		expression to check
     */
    private static boolean isAtom(Expr expr) {
        return (expr instanceof Symbol || expr instanceof FunctionCall
                || (expr instanceof Constant && ((Constant) expr).getValue() >= 0));
    }

    /**
     * Collect the signed operands of a nest of sums, differences, and negations.
     *
     * @param expr		expression to flatten
     * @param negative	TRUE if the expression is being subtracted
     * @param addends	list to receive the signed operand texts
     */
    private void addends(Expr expr, boolean negative, List<String> addends) {
        if (expr instanceof Unary && ((Unary) expr).getOp() == Unary.Op.NEG)
            this.addends(((Unary) expr).getOperand(), ! negative, addends);
        else if (expr instanceof Binary && ((Binary) expr).getOp() == Binary.Op.ADD) {
            this.addends(((Binary) expr).getLeft(), negative, addends);
            this.addends(((Binary) expr).getRight(), negative, addends);
        } else if (expr instanceof Binary && ((Binary) expr).getOp() == Binary.Op.SUB) {
            this.addends(((Binary) expr).getLeft(), negative, addends);
            this.addends(((Binary) expr).getRight(), ! negative, addends);
        } else
            addends.add((negative ? "-" : "+") + expr.accept(this));
    }

    /**
     * Collect the operands of a nest of products.
     *
     * @param expr		expression to flatten
     * @param factors	list to receive the operand texts
     */
    private void factors(Expr expr, List<String> factors) {
        if (isProduct(expr)) {
            this.factors(((Binary) expr).getLeft(), factors);
            this.factors(((Binary) expr).getRight(), factors);
        } else
            factors.add(this.wrap(expr, ! isAtom(expr) && ! isPower(expr)));
    }

    /**
     * @return the canonical text of an operand, parenthesized if requested
     *
     * @param expr		operand to format
     * @param paren		TRUE to add parentheses
     */
    private String wrap(Expr expr, boolean paren) {
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
        String retVal;
        if (expr.getOp() == Unary.Op.NEG)
            retVal = this.sum(expr);
        else
            retVal = "~" + this.wrap(expr.getOperand(), ! isAtom(expr.getOperand()));
        return retVal;
    }

    /**
     * @return the canonical text of a sum
     *
     * @param expr		additive expression to format
     */
    private String sum(Expr expr) {
        List<String> addends = new ArrayList<String>();
        this.addends(expr, false, addends);
        // Sort on the operand text, ignoring the sign.
        Collections.sort(addends, (a, b) -> {
            int retVal = a.substring(1).compareTo(b.substring(1));
            if (retVal == 0)
                retVal = a.compareTo(b);
            return retVal;
        });
        StringBuilder retVal = new StringBuilder();
        for (String addend : addends) {
            char sign = addend.charAt(0);
            if (retVal.length() == 0) {
                if (sign == '-')
                    retVal.append('-');
            } else
                retVal.append(sign == '-' ? " - " : " + ");
            retVal.append(addend.substring(1));
        }
        return retVal.toString();
    }

    @Override
    public String visitBinary(Binary expr) {
        String retVal;
        Binary.Op op = expr.getOp();
        if (isAdditive(expr))
            retVal = this.sum(expr);
        else if (op == Binary.Op.MUL) {
            List<String> factors = new ArrayList<String>();
            this.factors(expr, factors);
            Collections.sort(factors);
            retVal = String.join(" * ", factors);
        } else if (op == Binary.Op.POW)
            retVal = this.wrap(expr.getLeft(), ! isAtom(expr.getLeft())) + "^"
                    + this.wrap(expr.getRight(), ! isAtom(expr.getRight()));
        else {
            boolean leftParen = ! isAtom(expr.getLeft());
            boolean rightParen = ! isAtom(expr.getRight());
            if (op == Binary.Op.DIV) {
                // A product or power on the left, or a power on the right, binds tighter than the division.
                leftParen = leftParen && ! isProduct(expr.getLeft()) && ! isPower(expr.getLeft());
                rightParen = rightParen && ! isPower(expr.getRight());
            }
            retVal = this.wrap(expr.getLeft(), leftParen) + " " + op.getSymbol() + " "
                    + this.wrap(expr.getRight(), rightParen);
        }
        return retVal;
    }

    @Override
    public String visitCall(FunctionCall expr) {
        return expr.getName() + "(" + expr.getArgs().stream().map(x -> x.accept(this))
                .collect(Collectors.joining(", ")) + ")";
    }

}
