package org.monkeylang.compiler.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public sealed interface Expression extends Node
        permits Identifier, IntegerLiteral, BooleanLiteral, PrefixExpression, InfixExpression, CallExpression {
}
