/**
 *
 */
package org.theseed.ode.xpp;

import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.theseed.ode.expr.Binary;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.ExprFormatter;
import org.theseed.ode.expr.FunctionCall;
import org.theseed.ode.expr.Symbol;
import org.theseed.ode.expr.Unary;

/**
 * This class renders an expression in XPPAUT syntax.  The time variable is "t", the
 * logical operators use the XPP spellings, and the MATLAB functions whose XPP names differ
 * are renamed.  XPP does not allow white space inside a formula, so none is produced.
 */
public class XppFormatter extends ExprFormatter {

    /** MATLAB functions with a different name in XPP */
    private static final Map<String, String> FUNCTIONS = Map.of("log", "ln", "floor", "flr");

    /**
     * @return the XPP text for an expression
     *
     * @param expr		expression to format
     */
    public static String format(Expr expr) {
        return StringUtils.deleteWhitespace(expr.accept(new XppFormatter()));
    }

    @Override
    public String visitSymbol(Symbol expr) {
        String retVal = expr.getName();
        if (expr.isTime())
            retVal = "t";
        return retVal;
    }

    @Override
    public String visitUnary(Unary expr) {
        String retVal;
        if (expr.getOp() == Unary.Op.NOT)
            retVal = "not(" + expr.getOperand().accept(this) + ")";
        else
            retVal = super.visitUnary(expr);
        return retVal;
    }

    @Override
    protected String symbol(Binary.Op op) {
        String retVal;
        switch (op) {
        case NE :
            retVal = "!=";
            break;
        case AND :
            retVal = "&";
            break;
        case OR :
            retVal = "|";
            break;
        default :
            retVal = op.getSymbol();
        }
        return retVal;
    }

    @Override
    public String visitCall(FunctionCall expr) {
        String name = FUNCTIONS.getOrDefault(expr.getName(), expr.getName());
        return name + "(" + expr.getArgs().stream().map(x -> x.accept(this))
                .collect(Collectors.joining(",")) + ")";
    }

}
