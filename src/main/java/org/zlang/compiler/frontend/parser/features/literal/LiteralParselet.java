package org.zlang.compiler.frontend.parser.features.literal;

import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parselet.IPrefixParselet;
import org.zlang.compiler.frontend.parser.ParserException;
import org.zlang.compiler.frontend.parser.ParsingContext;
import org.zlang.compiler.frontend.parser.ast.Expression;

import java.math.BigInteger;

/**
 * Parselet for number, string and boolean literals.
 * <p>
 * A number is a hexadecimal integer if it starts with {@code 0x} or {@code 0X}, a float if
 * its text contains {@code .}, {@code e} or {@code E}, and a decimal integer otherwise.
 * The hexadecimal check comes first because {@code e} and {@code E} are hex digits.
 */
public class LiteralParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context, Token token) {
        switch (token.type()) {
            case STRING:
                return new StringLiteralExpression(token.text());
            case TRUE:
                return new BoolLiteralExpression(true);
            case FALSE:
                return new BoolLiteralExpression(false);
            case NUMBER:
                return number(token);
            default:
                throw new IllegalArgumentException("Not a literal token: " + token);
        }
    }

    private Expression number(Token token) {
        String text = token.text();
        try {
            // e and E are hex digits, so the prefix is checked before the float test: 0x1e is 30.
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return new IntLiteralExpression(new BigInteger(text.substring(2), 16));
            }
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                double value = Double.parseDouble(text);
                if (!Double.isFinite(value)) {
                    throw new ParserException(CompilerErrorCode.INVALID_NUMBER_LITERAL,
                            "Float literal out of range: " + text, token);
                }
                return new FloatLiteralExpression(value);
            }
            return new IntLiteralExpression(new BigInteger(text, 10));
        } catch (NumberFormatException e) {
            throw new ParserException(CompilerErrorCode.INVALID_NUMBER_LITERAL,
                    "Invalid number literal: " + text, token, e);
        }
    }
}
