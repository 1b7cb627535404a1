package org.casbench.api;

/**
 * Root of all failures raised while turning benchmark-definition source text into tokens
 * and consuming those tokens.
 * <p>
 * The hierarchy is closed: callers may catch this type to handle every failure, or one of
 * the permitted subtypes to handle a single kind. It is never thrown directly.
 */
public abstract sealed class CasBenchException extends Exception
        permits InvalidLexemeException, UnexpectedTokenException, ExhaustedTokensException {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    protected CasBenchException(String message) {
        super(message, null);
    }
}
