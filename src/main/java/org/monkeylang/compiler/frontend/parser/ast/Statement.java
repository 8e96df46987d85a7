package org.monkeylang.compiler.frontend.parser.ast;

/**
 * A node that appears in statement position.
 */
public sealed interface Statement extends Node permits LetStatement, ReturnStatement, ExpressionStatement {
}
