package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.frontend.parser.features.call.CallExpressionRule;
import org.monkeylang.compiler.frontend.parser.features.group.GroupedExpressionRule;
import org.monkeylang.compiler.frontend.parser.features.infix.InfixOperatorRule;
import org.monkeylang.compiler.frontend.parser.features.literal.BooleanLiteralRule;
import org.monkeylang.compiler.frontend.parser.features.literal.IdentifierRule;
import org.monkeylang.compiler.frontend.parser.features.literal.IntegerLiteralRule;
import org.monkeylang.compiler.frontend.parser.features.prefix.PrefixOperatorRule;
import org.monkeylang.compiler.model.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping token types to prefix and infix parse rules.
 * A registry is immutable once built; use {@link #initialize()} for the built-in grammar or
 * {@link #builder()} to assemble a custom one.
 */
public final class ParseRuleRegistry {

    private final Map<TokenType, IPrefixParseRule> prefixRules;
    private final Map<TokenType, IInfixParseRule> infixRules;

    private ParseRuleRegistry(Map<TokenType, IPrefixParseRule> prefixRules,
                              Map<TokenType, IInfixParseRule> infixRules) {
        this.prefixRules = Collections.unmodifiableMap(new EnumMap<>(prefixRules));
        this.infixRules = Collections.unmodifiableMap(new EnumMap<>(infixRules));
    }

    /**
     * Looks up the rule for a token that starts an expression.
     * @param type The token type.
     * @return The rule, or empty if the token cannot start an expression.
     */
    public Optional<IPrefixParseRule> resolvePrefix(TokenType type) {
        return Optional.ofNullable(prefixRules.get(type));
    }

    /**
     * Looks up the rule for a token that continues an expression.
     * @param type The token type.
     * @return The rule, or empty if the token is not an infix operator.
     */
    public Optional<IInfixParseRule> resolveInfix(TokenType type) {
        return Optional.ofNullable(infixRules.get(type));
    }

    /**
     * Creates a registry with all built-in parse rules.
     * @return A new registry instance.
     */
    public static ParseRuleRegistry initialize() {
        IPrefixParseRule prefixOperator = new PrefixOperatorRule();
        IPrefixParseRule booleanLiteral = new BooleanLiteralRule();
        IInfixParseRule infixOperator = new InfixOperatorRule();

        return builder()
                .prefix(TokenType.IDENT, new IdentifierRule())
                .prefix(TokenType.INT, new IntegerLiteralRule())
                .prefix(TokenType.BANG, prefixOperator)
                .prefix(TokenType.MINUS, prefixOperator)
                .prefix(TokenType.TRUE, booleanLiteral)
                .prefix(TokenType.FALSE, booleanLiteral)
                .prefix(TokenType.LPAREN, new GroupedExpressionRule())
                .infix(TokenType.PLUS, infixOperator)
                .infix(TokenType.MINUS, infixOperator)
                .infix(TokenType.SLASH, infixOperator)
                .infix(TokenType.ASTERISK, infixOperator)
                .infix(TokenType.EQ, infixOperator)
                .infix(TokenType.NOT_EQ, infixOperator)
                .infix(TokenType.LT, infixOperator)
                .infix(TokenType.GT, infixOperator)
                .infix(TokenType.LPAREN, new CallExpressionRule())
                .build();
    }

    /**
     * @return A builder for an empty registry.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects rule registrations before freezing them into a {@link ParseRuleRegistry}.
     */
    public static final class Builder {
        private final Map<TokenType, IPrefixParseRule> prefixRules = new EnumMap<>(TokenType.class);
        private final Map<TokenType, IInfixParseRule> infixRules = new EnumMap<>(TokenType.class);

        private Builder() {
        }

        public Builder prefix(TokenType type, IPrefixParseRule rule) {
            prefixRules.put(type, rule);
            return this;
        }

        public Builder infix(TokenType type, IInfixParseRule rule) {
            infixRules.put(type, rule);
            return this;
        }

        public ParseRuleRegistry build() {
            return new ParseRuleRegistry(prefixRules, infixRules);
        }
    }
}
