package org.casbench.lexer;

import org.casbench.api.ExhaustedTokensException;
import org.casbench.api.UnexpectedTokenException;

import java.util.List;

/**
 * Reads a token list produced by the {@link Lexer} front to back. A parser uses it to
 * look at the current token, test its type and consume it.
 * <p>
 * The cursor never moves past the {@link TokenType#END_OF_STREAM} token. It is not thread-safe.
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Creates a cursor positioned at the first token.
     * @param tokens The tokens to read; must end with exactly one END_OF_STREAM token.
     */
    public TokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_STREAM) {
            throw new IllegalArgumentException("Token list must end with END_OF_STREAM");
        }
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).type() == TokenType.END_OF_STREAM) {
                throw new IllegalArgumentException("END_OF_STREAM found before the end of the token list at " + i);
            }
        }
        this.tokens = List.copyOf(tokens);
    }

    /**
     * @return The index of the current token.
     */
    public int position() {
        return current;
    }

    /**
     * @return The current token, without consuming it.
     */
    public Token peek() {
        return tokens.get(current);
    }

    /**
     * @return The token after the current one, or the END_OF_STREAM token if there is none.
     */
    public Token peekNext() {
        if (current + 1 >= tokens.size()) return tokens.get(tokens.size() - 1);
        return tokens.get(current + 1);
    }

    /**
     * @return The most recently consumed token.
     * @throws IllegalStateException if nothing has been consumed yet.
     */
    public Token previous() {
        if (current == 0) {
            throw new IllegalStateException("No token has been consumed yet");
        }
        return tokens.get(current - 1);
    }

    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_STREAM;
    }

    /**
     * Checks the type of the current token without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type.
     */
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    /**
     * Consumes the current token if it has one of the given types. END_OF_STREAM is never consumed.
     * @param types The accepted token types.
     * @return true if a token was consumed.
     */
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (type != TokenType.END_OF_STREAM && check(type)) {
                current++;
                return true;
            }
        }
        return false;
    }

    /**
     * Consumes the current token.
     * @return The consumed token.
     * @throws ExhaustedTokensException if the cursor is already at END_OF_STREAM.
     */
    public Token advance() throws ExhaustedTokensException {
        if (isAtEnd()) {
            throw new ExhaustedTokensException("Cannot advance past the end of the token stream", current);
        }
        return tokens.get(current++);
    }

    /**
     * Consumes the current token if it has the required type.
     * Requiring END_OF_STREAM at the end returns that token without moving.
     *
     * @param type The required token type.
     * @param errorMessage Describes what was expected, used as the exception message prefix.
     * @return The consumed token.
     * @throws ExhaustedTokensException if the stream ended before a token of the required type.
     * @throws UnexpectedTokenException if the current token has another type.
     */
    public Token consume(TokenType type, String errorMessage) throws ExhaustedTokensException, UnexpectedTokenException {
        if (check(type)) {
            return type == TokenType.END_OF_STREAM ? peek() : advance();
        }
        if (isAtEnd()) {
            throw new ExhaustedTokensException(errorMessage, current);
        }
        throw new UnexpectedTokenException(errorMessage, peek(), type);
    }
}
