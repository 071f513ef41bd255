package org.zlang.compiler.frontend.parser;

import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.frontend.lexer.Lexer;
import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.lexer.TokenType;
import org.zlang.compiler.frontend.parselet.IInfixParselet;
import org.zlang.compiler.frontend.parselet.IPrefixParselet;
import org.zlang.compiler.frontend.parselet.ParseletRegistry;
import org.zlang.compiler.frontend.parselet.Precedence;
import org.zlang.compiler.frontend.parser.ast.Expression;
import org.zlang.compiler.frontend.parser.ast.ExpressionStatement;
import org.zlang.compiler.frontend.parser.ast.Program;
import org.zlang.compiler.frontend.parser.ast.Statement;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * A precedence-climbing (Pratt) parser. It pulls tokens from a {@link Lexer} on demand,
 * keeping one token of lookahead, and delegates every token to the parselets
 * registered for its type.
 * <p>
 * Parsing stops at the first defect with a {@link ParserException}; a lexical error
 * surfaces as the lexer's {@link org.zlang.compiler.frontend.lexer.LexerException}.
 * The parser is not thread-safe.
 */
public class Parser implements ParsingContext {

    private final Lexer lexer;
    private final ParseletRegistry registry;

    private Iterator<Token> tokens;
    private Token current;
    private Token lookahead;

    /**
     * Constructs a new Parser with the standard parselets.
     * @param lexer The lexer that supplies the tokens.
     */
    public Parser(Lexer lexer) {
        this(lexer, ParseletRegistry.initialize());
    }

    /**
     * Constructs a new Parser with a custom parselet registry.
     * @param lexer The lexer that supplies the tokens.
     * @param registry The parselets, owned by this parser from now on.
     */
    public Parser(Lexer lexer, ParseletRegistry registry) {
        this.lexer = lexer;
        this.registry = registry;
    }

    /**
     * Registers an additional prefix parselet.
     * @param type The token type that starts the new expression form.
     * @param parselet The parselet.
     */
    public void registerPrefix(TokenType type, IPrefixParselet parselet) {
        registry.registerPrefix(type, parselet);
    }

    /**
     * Registers an additional infix parselet.
     * @param type The operator token type.
     * @param parselet The parselet.
     */
    public void registerInfix(TokenType type, IInfixParselet parselet) {
        registry.registerInfix(type, parselet);
    }

    /**
     * Parses the entire source. Each call rescans the source from the beginning.
     * @return The parsed {@link Program}.
     * @throws ParserException on the first syntax error.
     */
    public Program parse() {
        tokens = lexer.iterator();
        current = nextToken();
        lookahead = nextToken();

        List<Statement> statements = new ArrayList<>();
        while (current != null && current.type() != TokenType.END_OF_FILE) {
            Statement statement = statement();
            if (statement != null) {
                statements.add(statement);
            }
            advance(); // move to the first token of the next statement
        }
        return new Program(statements);
    }

    /**
     * Parses a single statement starting at the current token.
     * @return The statement, or {@code null} for an empty statement.
     */
    private Statement statement() {
        if (current.type() == TokenType.SEMICOLON) {
            return null;
        }
        return expressionStatement();
    }

    private ExpressionStatement expressionStatement() {
        Expression expression = parseExpression(Precedence.DEFAULT);
        expectNext(TokenType.SEMICOLON, CompilerErrorCode.MISSING_TERMINATOR,
                "Statement must end with `" + TokenType.SEMICOLON.canonicalText() + "`.");
        return new ExpressionStatement(expression);
    }

    @Override
    public Expression parseExpression(Precedence precedence) {
        if (current == null) {
            throw new ParserException(CompilerErrorCode.NO_PARSELET, "Unexpected end of input.", null);
        }
        IPrefixParselet prefix = registry.getPrefix(current.type())
                .orElseThrow(() -> new ParserException(CompilerErrorCode.NO_PARSELET,
                        "Could not parse " + current + ": no parselet for token.", current));
        Expression left = prefix.parse(this, current);

        IInfixParselet infix = infixFor(lookahead);
        while (infix != null && precedence.isLowerThan(infix.getPrecedence())) {
            advance(); // move to the infix operator
            left = infix.parse(this, left, current);
            infix = infixFor(lookahead);
        }
        return left;
    }

    private IInfixParselet infixFor(Token token) {
        if (token == null) return null;
        return registry.getInfix(token.type()).orElse(null);
    }

    @Override
    public Token current() {
        return current;
    }

    @Override
    public Token lookahead() {
        return lookahead;
    }

    @Override
    public Token advance() {
        current = lookahead;
        lookahead = nextToken();
        return current;
    }

    @Override
    public Token expectNext(TokenType type, CompilerErrorCode errorCode, String errorMessage) {
        Token token = advance();
        if (token == null || token.type() != type) {
            throw new ParserException(errorCode, errorMessage, token);
        }
        return token;
    }

    private Token nextToken() {
        return tokens.hasNext() ? tokens.next() : null;
    }
}
