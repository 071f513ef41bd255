package org.zlang.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link TokenType} and {@link Token}.
 */
public class TokenTypeTest {

    /**
     * Verifies that the keyword and symbol tables together cover every fixed-text category
     * exactly once, split by whether the text starts with a letter.
     */
    @Test
    @Tag("unit")
    void testDispatchTablesAreDerivedFromTheEnumeration() {
        long fixedText = Arrays.stream(TokenType.values()).filter(TokenType::isFixedText).count();

        assertThat(TokenType.keywords().size() + TokenType.symbols().size()).isEqualTo((int) fixedText);
        assertThat(TokenType.keywords()).containsOnlyKeys("true", "false", "let", "return", "fn", "if", "else");
        assertThat(TokenType.symbols().keySet()).allSatisfy(text -> assertThat(Character.isLetter(text.charAt(0))).isFalse());
        assertThat(TokenType.symbol("<=")).contains(TokenType.LE);
        assertThat(TokenType.keyword("fn")).contains(TokenType.FUNCTION);
        assertThat(TokenType.keyword("main")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testVariableTextCategoriesAreNotInTheTables() {
        assertThat(TokenType.IDENTIFIER.isFixedText()).isFalse();
        assertThat(TokenType.END_OF_FILE.isFixedText()).isFalse();
        String tableTexts = TokenType.symbols().keySet().stream().collect(Collectors.joining());
        assertThat(tableTexts).doesNotContain("<identifier>", "<number>", "<string>", "<illegal>");
    }

    /**
     * Verifies that every one- and two-character operator the lexer can produce has a category.
     */
    @Test
    @Tag("unit")
    void testEveryOperatorLexemeIsMapped() {
        for (char c : "=!<>+-*/&|".toCharArray()) {
            assertThat(TokenType.symbol(String.valueOf(c))).as("symbol %s", c).isPresent();
            assertThat(TokenType.symbol(c + "=")).as("symbol %s=", c).isPresent();
        }
    }

    @Test
    @Tag("unit")
    void testTokenTextDefaultsToCanonicalText() {
        assertThat(new Token(TokenType.LPAREN).text()).isEqualTo("(");
        assertThat(new Token(TokenType.STRING, "").text()).isEmpty();
        assertThat(new Token(TokenType.IDENTIFIER, "x")).isEqualTo(new Token(TokenType.IDENTIFIER, "x", 0, 0));
        assertThat(new Token(TokenType.TRUE, "true").toString()).isEqualTo("TRUE('true')");
    }
}
