package org.zlang.compiler.frontend.parselet;

import org.zlang.compiler.frontend.lexer.TokenType;
import org.zlang.compiler.frontend.parser.features.assign.AssignParselet;
import org.zlang.compiler.frontend.parser.features.binary.BinaryOperatorParselet;
import org.zlang.compiler.frontend.parser.features.group.GroupParselet;
import org.zlang.compiler.frontend.parser.features.identifier.IdentifierParselet;
import org.zlang.compiler.frontend.parser.features.literal.LiteralParselet;
import org.zlang.compiler.frontend.parser.features.unary.UnaryOperatorParselet;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for parselets. This class holds two maps from token types to the
 * parselets that handle them in prefix and in infix position.
 * <p>
 * New syntax is added by registering a parselet for a token type; the parser
 * itself does not change.
 */
public class ParseletRegistry {
    private final Map<TokenType, IPrefixParselet> prefixParselets = new EnumMap<>(TokenType.class);
    private final Map<TokenType, IInfixParselet> infixParselets = new EnumMap<>(TokenType.class);

    /**
     * Registers a parselet for tokens that start an expression, replacing any existing one.
     * @param type The token type.
     * @param parselet The parselet.
     */
    public void registerPrefix(TokenType type, IPrefixParselet parselet) {
        prefixParselets.put(type, parselet);
    }

    /**
     * Registers a parselet for tokens that extend an expression, replacing any existing one.
     * @param type The token type.
     * @param parselet The parselet.
     */
    public void registerInfix(TokenType type, IInfixParselet parselet) {
        infixParselets.put(type, parselet);
    }

    /**
     * Gets the prefix parselet for a token type.
     * @param type The token type.
     * @return An {@link Optional} containing the parselet if it exists, otherwise empty.
     */
    public Optional<IPrefixParselet> getPrefix(TokenType type) {
        return Optional.ofNullable(prefixParselets.get(type));
    }

    /**
     * Gets the infix parselet for a token type.
     * @param type The token type.
     * @return An {@link Optional} containing the parselet if it exists, otherwise empty.
     */
    public Optional<IInfixParselet> getInfix(TokenType type) {
        return Optional.ofNullable(infixParselets.get(type));
    }

    /**
     * Initializes a registry with all the built-in parselets.
     * @return A new instance of {@link ParseletRegistry} with all standard parselets registered.
     */
    public static ParseletRegistry initialize() {
        ParseletRegistry registry = new ParseletRegistry();

        registry.registerPrefix(TokenType.IDENTIFIER, new IdentifierParselet());
        LiteralParselet literal = new LiteralParselet();
        registry.registerPrefix(TokenType.NUMBER, literal);
        registry.registerPrefix(TokenType.STRING, literal);
        registry.registerPrefix(TokenType.TRUE, literal);
        registry.registerPrefix(TokenType.FALSE, literal);
        UnaryOperatorParselet unary = new UnaryOperatorParselet();
        registry.registerPrefix(TokenType.ADD, unary);
        registry.registerPrefix(TokenType.SUB, unary);
        registry.registerPrefix(TokenType.NOT, unary);
        registry.registerPrefix(TokenType.LPAREN, new GroupParselet());

        // Binary operators
        registry.registerInfix(TokenType.ADD, new BinaryOperatorParselet(Precedence.ADDSUB));
        registry.registerInfix(TokenType.SUB, new BinaryOperatorParselet(Precedence.ADDSUB));
        registry.registerInfix(TokenType.MUL, new BinaryOperatorParselet(Precedence.MULDIV));
        registry.registerInfix(TokenType.DIV, new BinaryOperatorParselet(Precedence.MULDIV));
        registry.registerInfix(TokenType.LT, new BinaryOperatorParselet(Precedence.LEGE));
        registry.registerInfix(TokenType.LE, new BinaryOperatorParselet(Precedence.LEGE));
        registry.registerInfix(TokenType.GT, new BinaryOperatorParselet(Precedence.LEGE));
        registry.registerInfix(TokenType.GE, new BinaryOperatorParselet(Precedence.LEGE));
        registry.registerInfix(TokenType.EQ, new BinaryOperatorParselet(Precedence.EQUALS));
        registry.registerInfix(TokenType.NEQ, new BinaryOperatorParselet(Precedence.EQUALS));
        registry.registerInfix(TokenType.AND, new BinaryOperatorParselet(Precedence.LOGICAL));
        registry.registerInfix(TokenType.OR, new BinaryOperatorParselet(Precedence.LOGICAL));

        // Assignment
        AssignParselet assign = new AssignParselet();
        registry.registerInfix(TokenType.ASSIGN, assign);
        registry.registerInfix(TokenType.ADD_ASSIGN, assign);
        registry.registerInfix(TokenType.SUB_ASSIGN, assign);
        registry.registerInfix(TokenType.MUL_ASSIGN, assign);
        registry.registerInfix(TokenType.DIV_ASSIGN, assign);
        registry.registerInfix(TokenType.AND_ASSIGN, assign);
        registry.registerInfix(TokenType.OR_ASSIGN, assign);

        return registry;
    }
}
