package org.monkeylang.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root node of every AST produced by the parser.
 *
 * @param statements The top-level statements in source order.
 */
public record Program(List<Statement> statements) implements Node {

    public Program {
        statements = List.copyOf(statements);
    }

    /**
     * Returns the literal of the first statement, or an empty string for an empty program.
     */
    @Override
    public String tokenLiteral() {
        return statements.isEmpty() ? "" : statements.get(0).tokenLiteral();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Statement statement : statements) {
            sb.append(statement);
        }
        return sb.toString();
    }
}
