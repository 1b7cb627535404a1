package org.casbench.api;

import org.casbench.lexer.Token;
import org.casbench.lexer.TokenType;

/**
 * Thrown when a consumer of the token stream finds a token of a different type than
 * the one it requires at that position.
 */
public final class UnexpectedTokenException extends CasBenchException {

    private final Token token;
    private final TokenType expected;

    /**
     * @param message The detail message supplied by the consumer.
     * @param token The token that was found.
     * @param expected The token type that was required.
     */
    public UnexpectedTokenException(String message, Token token, TokenType expected) {
        super(String.format("%s: expected %s but found %s '%s' on line %d at column %d",
                message, expected, token.type(), token.lexeme(), token.line(), token.column()));
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public TokenType getExpected() {
        return expected;
    }
}
