package org.theseed.ode.expr;

/**
 * Visitor over the symbolic expression kinds.
 *
 * @param <T>	type of result produced by the visitor
 */
public interface ExprVisitor<T> {

    T visitConstant(Constant expr);

    T visitSymbol(Symbol expr);

    T visitUnary(Unary expr);

    T visitBinary(Binary expr);

    T visitCall(FunctionCall expr);

}
