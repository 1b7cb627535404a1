package org.casbench.api;

import org.casbench.lexer.Token;
import org.casbench.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the failure types under {@link CasBenchException}.
 */
@Tag("unit")
class InvalidLexemeExceptionTest {

    @Test
    void carriesPositionAndDescribesIt() {
        InvalidLexemeException e = new InvalidLexemeException('_', 0, 3, 3);

        assertThat(e.getCodePoint()).isEqualTo((int) '_');
        assertThat(e.getLine()).isZero();
        assertThat(e.getColumn()).isEqualTo(3);
        assertThat(e.getIndex()).isEqualTo(3);
        assertThat(e).hasMessage("Invalid lexeme '_' encountered on line 0 at column 3 (index 3) during lexing")
                .hasNoCause();
    }

    @Test
    void everyFailureKindSharesTheRoot() {
        CasBenchException lexing = new InvalidLexemeException('=', 0, 0, 0);
        CasBenchException unexpected = new UnexpectedTokenException("Expected ','",
                new Token(TokenType.RIGHT_PARENTHESIS, ")", 0, 4), TokenType.COMMA);
        CasBenchException exhausted = new ExhaustedTokensException("Expected ')'", 5);

        assertThat(describe(lexing)).isEqualTo("lexing at column 0");
        assertThat(describe(unexpected)).isEqualTo("unexpected RIGHT_PARENTHESIS");
        assertThat(describe(exhausted)).isEqualTo("exhausted at 5");
    }

    private static String describe(CasBenchException e) {
        if (e instanceof InvalidLexemeException invalid) {
            return "lexing at column " + invalid.getColumn();
        } else if (e instanceof UnexpectedTokenException unexpected) {
            return "unexpected " + unexpected.getToken().type();
        } else if (e instanceof ExhaustedTokensException exhausted) {
            return "exhausted at " + exhausted.getPosition();
        }
        throw new AssertionError("Unknown failure kind " + e);
    }
}
