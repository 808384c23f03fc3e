package org.theseed.ode.matlab.ast;

/**
 * Visitor over the statement node kinds.
 *
 * @param <T>	type of result produced by the visitor
 * @param <E>	type of exception the visitor may throw
 */
public interface StatementVisitor<T, E extends Exception> {

    T visitAssignment(AssignmentNode node) throws E;

    T visitExpressionStatement(ExpressionStatementNode node) throws E;

    T visitCommand(CommandNode node) throws E;

    T visitIf(IfNode node) throws E;

    T visitFor(ForNode node) throws E;

    T visitFunctionDefinition(FunctionDefinitionNode node) throws E;

}
