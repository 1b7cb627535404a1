package org.casbench.lexer;

import java.util.Objects;

/**
 * Represents a single token extracted from the source by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param lexeme The exact text of the token from the source, or null for {@link TokenType#END_OF_STREAM}.
 * @param line The zero-based line where the token begins.
 * @param column The zero-based column where the token begins, counted in code points.
 * @param literal The parsed value of a numeric token: a {@link java.math.BigInteger} for integers,
 *                a {@link Double} for floats, null for every other type.
 */
public record Token(
        TokenType type,
        String lexeme,
        int line,
        int column,
        Number literal
) {
    public Token {
        Objects.requireNonNull(type, "type");
        if ((lexeme == null) != (type == TokenType.END_OF_STREAM)) {
            throw new IllegalArgumentException("Only END_OF_STREAM tokens have no lexeme, got " + type + " with lexeme " + lexeme);
        }
        if ((literal != null) != type.isLiteral()) {
            throw new IllegalArgumentException("Only literal tokens carry a literal value, got " + type + " with literal " + literal);
        }
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Token position must not be negative: " + line + ":" + column);
        }
    }

    /**
     * Creates a token that carries no literal value.
     */
    public Token(TokenType type, String lexeme, int line, int column) {
        this(type, lexeme, line, column, null);
    }

    /**
     * @return The number of code points this token consumed; 0 for the end-of-stream token.
     */
    public int length() {
        return lexeme == null ? 0 : lexeme.codePointCount(0, lexeme.length());
    }
}
