package org.monkeylang.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 *
 * <p>The hierarchy is closed: a node is either the {@link Program} root, a {@link Statement}
 * or an {@link Expression}. Consumers dispatch over it with an {@link AstVisitor}, so a new
 * grammar form does not compile until every consumer handles it.
 *
 * <p>{@link #toString()} renders the node back into a canonical, fully parenthesized source form.
 */
public sealed interface Node permits Program, Statement, Expression {

    /**
     * Returns the literal of the token that introduced this node.
     * @return The token literal, used for diagnostics and tests.
     */
    String tokenLiteral();

    /**
     * Dispatches this node to the matching method of the visitor.
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(AstVisitor<R> visitor);
}
