package org.monkeylang.compiler.frontend.parser.ast;

/**
 * Visitor over the closed set of AST node variants.
 *
 * @param <R> The result type.
 */
public interface AstVisitor<R> {

    R visitProgram(Program program);

    R visitLetStatement(LetStatement statement);

    R visitReturnStatement(ReturnStatement statement);

    R visitExpressionStatement(ExpressionStatement statement);

    R visitIdentifier(Identifier identifier);

    R visitIntegerLiteral(IntegerLiteral literal);

    R visitBooleanLiteral(BooleanLiteral literal);

    R visitPrefixExpression(PrefixExpression expression);

    R visitInfixExpression(InfixExpression expression);

    R visitCallExpression(CallExpression expression);
}
