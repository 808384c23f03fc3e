/**
 *
 */
package org.theseed.ode.sbml;

import java.util.Map;

import org.sbml.jsbml.ASTNode;
import org.theseed.ode.expr.Binary;
import org.theseed.ode.expr.Constant;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.ExprVisitor;
import org.theseed.ode.expr.FunctionCall;
import org.theseed.ode.expr.Symbol;
import org.theseed.ode.expr.Unary;

/**
 * This visitor converts a symbolic expression into a JSBML abstract syntax tree.  The time
 * symbol becomes the SBML time csymbol.
 */
public class MathConverter implements ExprVisitor<ASTNode> {

    /** map of elementary function names to SBML node types */
    private static final Map<String, ASTNode.Type> FUNCTIONS = Map.of("exp", ASTNode.Type.FUNCTION_EXP,
            "log", ASTNode.Type.FUNCTION_LN, "log10", ASTNode.Type.FUNCTION_LOG, "abs", ASTNode.Type.FUNCTION_ABS,
            "sin", ASTNode.Type.FUNCTION_SIN, "cos", ASTNode.Type.FUNCTION_COS, "tan", ASTNode.Type.FUNCTION_TAN,
            "floor", ASTNode.Type.FUNCTION_FLOOR, "ceil", ASTNode.Type.FUNCTION_CEILING);

    /**
     * @return the SBML math for an expression
     *
     * @param expr		expression to convert
     */
    public static ASTNode convert(Expr expr) {
        return expr.accept(new MathConverter());
    }

    @Override
    public ASTNode visitConstant(Constant expr) {
        double value = expr.getValue();
        ASTNode retVal;
        if (value == Math.rint(value) && Math.abs(value) < Integer.MAX_VALUE)
            retVal = new ASTNode((int) value);
        else
            retVal = new ASTNode(value);
        return retVal;
    }

    @Override
    public ASTNode visitSymbol(Symbol expr) {
        ASTNode retVal;
        if (expr.isTime()) {
            retVal = new ASTNode(ASTNode.Type.NAME_TIME);
            retVal.setName("time");
        } else
            retVal = new ASTNode(expr.getName());
        return retVal;
    }

    @Override
    public ASTNode visitUnary(Unary expr) {
        ASTNode retVal = new ASTNode(expr.getOp() == Unary.Op.NEG ? ASTNode.Type.MINUS : ASTNode.Type.LOGICAL_NOT);
        retVal.addChild(expr.getOperand().accept(this));
        return retVal;
    }

    @Override
    public ASTNode visitBinary(Binary expr) {
        ASTNode.Type type;
        switch (expr.getOp()) {
        case ADD :
            type = ASTNode.Type.PLUS;
            break;
        case SUB :
            type = ASTNode.Type.MINUS;
            break;
        case MUL :
            type = ASTNode.Type.TIMES;
            break;
        case DIV :
            type = ASTNode.Type.DIVIDE;
            break;
        case POW :
            type = ASTNode.Type.POWER;
            break;
        case EQ :
            type = ASTNode.Type.RELATIONAL_EQ;
            break;
        case NE :
            type = ASTNode.Type.RELATIONAL_NEQ;
            break;
        case LT :
            type = ASTNode.Type.RELATIONAL_LT;
            break;
        case LE :
            type = ASTNode.Type.RELATIONAL_LEQ;
            break;
        case GT :
            type = ASTNode.Type.RELATIONAL_GT;
            break;
        case GE :
            type = ASTNode.Type.RELATIONAL_GEQ;
            break;
        case AND :
            type = ASTNode.Type.LOGICAL_AND;
            break;
        default :
            type = ASTNode.Type.LOGICAL_OR;
        }
        ASTNode retVal = new ASTNode(type);
        retVal.addChild(expr.getLeft().accept(this));
        retVal.addChild(expr.getRight().accept(this));
        return retVal;
    }

    @Override
    public ASTNode visitCall(FunctionCall expr) {
        ASTNode.Type type = FUNCTIONS.get(expr.getName());
        if (type == null)
            throw new IllegalArgumentException("Function \"" + expr.getName() + "\" has no SBML equivalent.");
        ASTNode retVal = new ASTNode(type);
        for (Expr arg : expr.getArgs())
            retVal.addChild(arg.accept(this));
        return retVal;
    }

}
