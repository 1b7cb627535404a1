package org.casbench.lexer;

import org.casbench.api.InvalidLexemeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The Lexer converts a single-line benchmark expression such as
 * {@code evalf(subs(result, x, 1.0)) == 0.5678} into a sequence of tokens.
 * <p>
 * The source is scanned once, left to right, the first time {@link #tokens()} is called;
 * later calls return the same list. Scanning stops at the first character that cannot be
 * classified and no partial result is kept. Only the space character is skipped; tabs and
 * line breaks are invalid.
 * <p>
 * Columns count Unicode code points, so a letter outside the Basic Multilingual Plane
 * advances the column by one. Error indexes are offsets into the source string.
 * <p>
 * Instances may be shared between threads: the scan is guarded so that a successful scan
 * happens at most once.
 */
public final class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final LexerOptions options;
    private final Object scanLock = new Object();
    private volatile List<Token> tokens;

    // Scan state, only touched while holding scanLock.
    private List<Token> scanned;
    private int start;
    private int current;
    private int line;
    private int column;
    private int startColumn;

    /**
     * Creates a new Lexer using the configured {@link LexerOptions#defaults()}.
     * @param source The expression to tokenize.
     */
    public Lexer(String source) {
        this(source, LexerOptions.defaults());
    }

    /**
     * Creates a new Lexer with explicit options.
     * @param source The expression to tokenize.
     * @param options The options controlling diagnostic output.
     */
    public Lexer(String source, LexerOptions options) {
        this.source = Objects.requireNonNull(source, "source");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Tokenizes the given expression with a fresh Lexer.
     * @param source The expression to tokenize.
     * @return The tokens, ending with {@link TokenType#END_OF_STREAM}.
     * @throws InvalidLexemeException if the source contains text that is not a valid token.
     */
    public static List<Token> tokensOf(String source) throws InvalidLexemeException {
        return new Lexer(source).tokens();
    }

    /**
     * @return The source this lexer tokenizes.
     */
    public String source() {
        return source;
    }

    /**
     * @return true once the token list has been computed successfully.
     */
    public boolean isScanned() {
        return tokens != null;
    }

    /**
     * Returns the tokens of the source, scanning it on the first call.
     * @return An unmodifiable list of tokens, always ending with exactly one {@link TokenType#END_OF_STREAM}.
     * @throws InvalidLexemeException if the source contains text that is not a valid token.
     */
    public List<Token> tokens() throws InvalidLexemeException {
        List<Token> result = tokens;
        if (result == null) {
            synchronized (scanLock) {
                result = tokens;
                if (result == null) {
                    result = scanTokens();
                    tokens = result;
                }
            }
        }
        return result;
    }

    private List<Token> scanTokens() throws InvalidLexemeException {
        scanned = new ArrayList<>();
        start = 0;
        current = 0;
        line = 0;
        column = 0;
        try {
            while (!isAtEnd()) {
                start = current;
                startColumn = column;
                scanToken();
            }
        } catch (InvalidLexemeException e) {
            scanned = null;
            LOG.debug("Aborted scan of \"{}\": {}", source, e.getMessage());
            throw e;
        }
        scanned.add(new Token(TokenType.END_OF_STREAM, null, line, column));

        List<Token> result = List.copyOf(scanned);
        scanned = null;
        if (options.traceTokens()) {
            result.forEach(token -> LOG.debug("{}", token));
        }
        LOG.debug("Scanned {} tokens from {} characters", result.size(), column);
        return result;
    }

    private void scanToken() throws InvalidLexemeException {
        int c = advance();
        switch (c) {
            // Ignore spaces
            case ' ': break;
            case '(': addToken(TokenType.LEFT_PARENTHESIS); break;
            case ')': addToken(TokenType.RIGHT_PARENTHESIS); break;
            case ',': addToken(TokenType.COMMA); break;
            case '=':
                // There is no assignment, only '=='.
                if (peek() != '=') {
                    throw invalidLexeme();
                }
                advance();
                addToken(TokenType.EQUAL_EQUAL);
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw invalidLexeme();
                }
                break;
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() throws InvalidLexemeException {
        boolean hasDecimalPoint = false;
        while (true) {
            int next = peek();
            if (next == '.') {
                if (hasDecimalPoint) {
                    throw invalidLexeme();
                }
                hasDecimalPoint = true;
            } else if (isAlpha(next) || next == '_') {
                // Rejects e.g. 100_000 or 0x1 instead of splitting them into two tokens.
                throw invalidLexeme();
            } else if (!isDigit(next)) {
                break;
            }
            advance();
        }

        String digits = toAsciiDigits(source.substring(start, current));
        if (hasDecimalPoint) {
            addToken(TokenType.FLOAT_LITERAL, Double.valueOf(digits));
        } else {
            addToken(TokenType.INTEGER_LITERAL, new BigInteger(digits));
        }
    }

    /**
     * Maps every decimal digit of a numeric lexeme (e.g. Arabic-Indic) to its ASCII form,
     * since {@link Double#valueOf(String)} accepts ASCII digits only.
     */
    private static String toAsciiDigits(String text) {
        StringBuilder ascii = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> ascii.append(cp == '.' ? '.' : (char) ('0' + Character.digit(cp, 10))));
        return ascii.toString();
    }

    /**
     * Builds the failure for the token being scanned. All failures are reported against the
     * first character of that token.
     */
    private InvalidLexemeException invalidLexeme() {
        return new InvalidLexemeException(source.codePointAt(start), line, startColumn, start);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Number literal) {
        String text = source.substring(start, current);
        scanned.add(new Token(type, text, line, startColumn, literal));
    }

    // Columns count code points, current counts UTF-16 chars.
    private int advance() {
        int c = source.codePointAt(current);
        current += Character.charCount(c);
        column++;
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private int peek() {
        if (isAtEnd()) return -1;
        return source.codePointAt(current);
    }

    private boolean isDigit(int c) {
        return c >= 0 && Character.isDigit(c);
    }

    private boolean isAlpha(int c) {
        return c >= 0 && Character.isLetter(c);
    }

    private boolean isIdentifierPart(int c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }
}
