package org.theseed.ode.matlab.ast;

/**
 * Visitor over every kind of parse node, including the script root.
 *
 * @param <T>	type of result produced by the visitor
 * @param <E>	type of exception the visitor may throw
 */
public interface ParseNodeVisitor<T, E extends Exception> extends ExpressionVisitor<T, E>, StatementVisitor<T, E> {

    T visitScript(ScriptNode node) throws E;

}
