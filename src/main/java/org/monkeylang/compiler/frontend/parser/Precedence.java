package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.model.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Binding power of operators, from weakest to strongest.
 * Declaration order is significant: comparisons use the enum ordinal.
 */
public enum Precedence {
    LOWEST,
    /** {@code ==} and {@code !=} */
    EQUALS,
    /** {@code <} and {@code >} */
    LESSGREATER,
    /** {@code +} and {@code -} */
    SUM,
    /** {@code *} and {@code /} */
    PRODUCT,
    /** unary {@code -x} and {@code !x} */
    PREFIX,
    /** {@code fn(x)} */
    CALL;

    private static final Map<TokenType, Precedence> BY_TOKEN = new EnumMap<>(TokenType.class);

    static {
        BY_TOKEN.put(TokenType.EQ, EQUALS);
        BY_TOKEN.put(TokenType.NOT_EQ, EQUALS);
        BY_TOKEN.put(TokenType.LT, LESSGREATER);
        BY_TOKEN.put(TokenType.GT, LESSGREATER);
        BY_TOKEN.put(TokenType.PLUS, SUM);
        BY_TOKEN.put(TokenType.MINUS, SUM);
        BY_TOKEN.put(TokenType.SLASH, PRODUCT);
        BY_TOKEN.put(TokenType.ASTERISK, PRODUCT);
        BY_TOKEN.put(TokenType.LPAREN, CALL);
    }

    /**
     * Returns the infix binding power of a token type.
     * @param type The token type.
     * @return The precedence, or {@link #LOWEST} for tokens that are not infix operators.
     */
    public static Precedence of(TokenType type) {
        return BY_TOKEN.getOrDefault(type, LOWEST);
    }

    /**
     * @param other The precedence to compare against.
     * @return true if this precedence binds strictly weaker than {@code other}.
     */
    public boolean isLowerThan(Precedence other) {
        return compareTo(other) < 0;
    }
}
