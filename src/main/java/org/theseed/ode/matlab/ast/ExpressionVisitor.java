package org.theseed.ode.matlab.ast;

/**
 * Visitor over the expression node kinds.  Every kind has its own method, so an
 * implementation is forced to handle all of them.
 *
 * @param <T>	type of result produced by the visitor
 * @param <E>	type of exception the visitor may throw
 */
public interface ExpressionVisitor<T, E extends Exception> {

    T visitNumber(NumberNode node) throws E;

    T visitString(StringNode node) throws E;

    T visitIdentifier(IdentifierNode node) throws E;

    T visitCall(CallNode node) throws E;

    T visitUnary(UnaryNode node) throws E;

    T visitBinary(BinaryNode node) throws E;

    T visitMatrix(MatrixNode node) throws E;

    T visitRange(RangeNode node) throws E;

    T visitColon(ColonNode node) throws E;

    T visitFunctionHandle(FunctionHandleNode node) throws E;

    T visitAnonymousFunction(AnonymousFunctionNode node) throws E;

}
