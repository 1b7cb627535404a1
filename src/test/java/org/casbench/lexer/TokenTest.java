package org.casbench.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Token} and {@link TokenType}.
 */
@Tag("unit")
class TokenTest {

    @Test
    void tokenTypeHasExactlyTheExpressionCategories() {
        assertThat(TokenType.values()).containsExactly(
                TokenType.IDENTIFIER,
                TokenType.INTEGER_LITERAL,
                TokenType.FLOAT_LITERAL,
                TokenType.LEFT_PARENTHESIS,
                TokenType.RIGHT_PARENTHESIS,
                TokenType.COMMA,
                TokenType.EQUAL_EQUAL,
                TokenType.END_OF_STREAM);
    }

    @ParameterizedTest
    @EnumSource(value = TokenType.class, names = {"INTEGER_LITERAL", "FLOAT_LITERAL"}, mode = EnumSource.Mode.EXCLUDE)
    void nonNumericTypesAreNotLiterals(TokenType type) {
        assertThat(type.isLiteral()).isFalse();
    }

    @Test
    void numericTypesAreLiterals() {
        assertThat(TokenType.INTEGER_LITERAL.isLiteral()).isTrue();
        assertThat(TokenType.FLOAT_LITERAL.isLiteral()).isTrue();
    }

    @Test
    void createsLiteralTokens() {
        Token integer = new Token(TokenType.INTEGER_LITERAL, "10", 0, 3, BigInteger.TEN);
        Token decimal = new Token(TokenType.FLOAT_LITERAL, "0.0", 0, 0, 0.0);

        assertThat(integer.literal()).isEqualTo(BigInteger.TEN);
        assertThat(integer.length()).isEqualTo(2);
        assertThat(integer.column()).isEqualTo(3);
        assertThat(decimal.literal()).isEqualTo(0.0);
    }

    @Test
    void lengthCountsCodePoints() {
        assertThat(new Token(TokenType.IDENTIFIER, "𝑥𝑦", 0, 0).length()).isEqualTo(2);
    }

    @Test
    void endOfStreamTokenHasNoLexemeAndNoLength() {
        Token end = new Token(TokenType.END_OF_STREAM, null, 0, 7);

        assertThat(end.lexeme()).isNull();
        assertThat(end.literal()).isNull();
        assertThat(end.length()).isZero();
    }

    @Test
    void tokensWithSameFieldsAreEqual() {
        assertThat(new Token(TokenType.IDENTIFIER, "sin", 0, 0))
                .isEqualTo(new Token(TokenType.IDENTIFIER, "sin", 0, 0, null))
                .isNotEqualTo(new Token(TokenType.IDENTIFIER, "sin", 0, 1));
    }

    @Test
    void rejectsLiteralOnNonLiteralToken() {
        assertThatThrownBy(() -> new Token(TokenType.IDENTIFIER, "x", 0, 0, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("literal");
    }

    @Test
    void rejectsLiteralTokenWithoutLiteral() {
        assertThatThrownBy(() -> new Token(TokenType.FLOAT_LITERAL, "1.0", 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMissingLexemeOutsideEndOfStream() {
        assertThatThrownBy(() -> new Token(TokenType.COMMA, null, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lexeme");
        assertThatThrownBy(() -> new Token(TokenType.END_OF_STREAM, "", 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativePositionAndMissingType() {
        assertThatThrownBy(() -> new Token(TokenType.COMMA, ",", 0, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Token(null, ",", 0, 0))
                .isInstanceOf(NullPointerException.class);
    }
}
