package org.casbench.api;

/**
 * Thrown by the {@link org.casbench.lexer.Lexer} when a character cannot start any token,
 * or when it starts a token that turns out to be malformed (a second decimal point, a letter
 * directly after a number, a lone {@code =}).
 * <p>
 * Carries the position of the failure so it can be reported without rescanning.
 */
public final class InvalidLexemeException extends CasBenchException {

    private final int codePoint;
    private final int line;
    private final int column;
    private final int index;

    /**
     * Creates a new exception for the offending character at the given position.
     * @param codePoint The Unicode code point of the character the failure is reported against.
     * @param line The zero-based line of the character.
     * @param column The zero-based column of the character.
     * @param index The offset of the character in the source string.
     */
    public InvalidLexemeException(int codePoint, int line, int column, int index) {
        super(String.format("Invalid lexeme '%s' encountered on line %d at column %d (index %d) during lexing",
                Character.toString(codePoint), line, column, index));
        this.codePoint = codePoint;
        this.line = line;
        this.column = column;
        this.index = index;
    }

    /**
     * @return The code point of the character the failure is reported against.
     */
    public int getCodePoint() {
        return codePoint;
    }

    /**
     * @return The zero-based line of the offending character.
     */
    public int getLine() {
        return line;
    }

    /**
     * @return The zero-based column of the offending character.
     */
    public int getColumn() {
        return column;
    }

    /**
     * @return The offset of the offending character in the source string, in UTF-16 units.
     */
    public int getIndex() {
        return index;
    }
}
