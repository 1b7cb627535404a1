package org.casbench.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Names and literals.
    /** A name such as a function or variable, e.g. {@code diff} or {@code x}. */
    IDENTIFIER,
    /** A numeric literal without a decimal point, e.g. {@code 10}. */
    INTEGER_LITERAL,
    /** A numeric literal with a decimal point, e.g. {@code 0.5678}. */
    FLOAT_LITERAL,

    // Punctuation.
    /** The '(' character. */
    LEFT_PARENTHESIS,
    /** The ')' character. */
    RIGHT_PARENTHESIS,
    /** The ',' character separating call arguments. */
    COMMA,

    // Operators.
    /** The '==' comparison operator. */
    EQUAL_EQUAL,

    // Miscellaneous.
    /** Marks the end of the source; carries no lexeme. */
    END_OF_STREAM;

    /**
     * @return true if tokens of this type carry a parsed numeric literal.
     */
    public boolean isLiteral() {
        return this == INTEGER_LITERAL || this == FLOAT_LITERAL;
    }
}
