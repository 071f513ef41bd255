package org.zlang.compiler.frontend.parser.features.literal;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.frontend.lexer.Lexer;
import org.zlang.compiler.frontend.parser.Parser;
import org.zlang.compiler.frontend.parser.ParserException;
import org.zlang.compiler.frontend.parser.ast.Expression;
import org.zlang.compiler.frontend.parser.ast.ExpressionStatement;

import java.math.BigInteger;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link LiteralParselet}: which literal node a token becomes
 * and how numeric text is converted.
 */
public class LiteralParseletTest {

    private static Expression literal(String source) {
        ExpressionStatement statement = (ExpressionStatement) new Parser(new Lexer(source + ";")).parse().statements().get(0);
        return statement.expression();
    }

    /**
     * Verifies that decimal digit strings of any length become integer literals with the same value,
     * including leading zeros and values beyond the range of {@code long}.
     */
    @Test
    @Tag("unit")
    void testDecimalIntegers() {
        Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            StringBuilder digits = new StringBuilder();
            int length = 1 + random.nextInt(30);
            for (int j = 0; j < length; j++) {
                digits.append((char) ('0' + random.nextInt(10)));
            }
            String text = digits.toString();

            assertThat(literal(text)).as(text).isEqualTo(new IntLiteralExpression(new BigInteger(text, 10)));
        }
    }

    @Test
    @Tag("unit")
    void testHexadecimalIntegers() {
        Random random = new Random(7);
        String hexDigits = "0123456789abcdefABCDEF";
        for (int i = 0; i < 200; i++) {
            StringBuilder digits = new StringBuilder();
            int length = 1 + random.nextInt(20);
            for (int j = 0; j < length; j++) {
                digits.append(hexDigits.charAt(random.nextInt(hexDigits.length())));
            }
            String text = digits.toString();

            assertThat(literal("0x" + text)).as(text).isEqualTo(new IntLiteralExpression(new BigInteger(text, 16)));
        }
        assertThat(literal("0XFF")).isEqualTo(new IntLiteralExpression(BigInteger.valueOf(255)));
        assertThat(literal("0x1e")).isEqualTo(new IntLiteralExpression(BigInteger.valueOf(30)));
    }

    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"3.14", "0.5", "1.", "1e7", "1e+7", "1e-7", "2.3E7", "00.25"})
    void testFloats(String text) {
        assertThat(literal(text)).isEqualTo(new FloatLiteralExpression(Double.parseDouble(text)));
    }

    @Test
    @Tag("unit")
    void testStringsAndBooleans() {
        assertThat(literal("\"a b\"")).isEqualTo(new StringLiteralExpression("a b"));
        assertThat(literal("\"\"")).isEqualTo(new StringLiteralExpression(""));
        assertThat(literal("true")).isEqualTo(new BoolLiteralExpression(true));
        assertThat(literal("false")).isEqualTo(new BoolLiteralExpression(false));
    }

    /**
     * Verifies that numerals the lexer accepts but that cannot be converted are syntax errors.
     */
    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"0x", "0X", "1e", "1e+", "1e999", "1.5e999"})
    void testMalformedNumeralsAreSyntaxErrors(String text) {
        assertThatThrownBy(() -> literal(text))
                .isInstanceOf(ParserException.class)
                .extracting(e -> ((ParserException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.INVALID_NUMBER_LITERAL);
    }

    @Test
    @Tag("unit")
    void testLiteralRendering() {
        assertThat(new IntLiteralExpression(new BigInteger("123456789012345678901234567890")).toString())
                .isEqualTo("123456789012345678901234567890");
        assertThat(new FloatLiteralExpression(0.5).toString()).isEqualTo("0.5");
        assertThat(new BoolLiteralExpression(true).toString()).isEqualTo("true");
        assertThat(new StringLiteralExpression("x").toString()).isEqualTo("\"x\"");
    }
}
