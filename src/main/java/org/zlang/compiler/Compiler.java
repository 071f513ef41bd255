package org.zlang.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zlang.compiler.api.CompilationException;
import org.zlang.compiler.api.CompilerErrorCode;
import org.zlang.compiler.api.ICompiler;
import org.zlang.compiler.api.ParseResult;
import org.zlang.compiler.api.SourceInfo;
import org.zlang.compiler.diagnostics.Diagnostic;
import org.zlang.compiler.diagnostics.DiagnosticsEngine;
import org.zlang.compiler.frontend.FrontendException;
import org.zlang.compiler.frontend.lexer.Lexer;
import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parselet.ParseletRegistry;
import org.zlang.compiler.frontend.parser.Parser;
import org.zlang.compiler.frontend.parser.ast.Program;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * The front-end implementation. It runs the lexer and the parser and translates their
 * internal errors into {@link CompilationException}s and {@link Diagnostic}s.
 * It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final Consumer<ParseletRegistry> grammarExtension;

    /**
     * Creates a compiler for the standard grammar.
     */
    public Compiler() {
        this(registry -> { });
    }

    /**
     * Creates a compiler whose parsers get additional parselets.
     * @param grammarExtension Called with each new parser's registry before parsing begins.
     */
    public Compiler(Consumer<ParseletRegistry> grammarExtension) {
        this.grammarExtension = grammarExtension;
    }

    @Override
    public List<Token> tokenize(String source, String fileName) throws CompilationException {
        diagnostics.clear();
        try {
            List<Token> tokens = new Lexer(source).scanTokens();
            LOG.debug("Lexer: {} produced {} tokens", fileName, tokens.size());
            return tokens;
        } catch (FrontendException e) {
            throw toCompilationException(e, fileName);
        }
    }

    @Override
    public Program parse(String source, String fileName) throws CompilationException {
        diagnostics.clear();
        try {
            Program program = newParser(source).parse();
            LOG.debug("Parser: {} produced {} statements", fileName, program.size());
            return program;
        } catch (FrontendException e) {
            throw toCompilationException(e, fileName);
        }
    }

    @Override
    public Program parse(Path path) throws CompilationException {
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            diagnostics.clear();
            String message = "Cannot read source file: " + e.getMessage();
            diagnostics.reportError(CompilerErrorCode.IO_ERROR_READING_FILE, message, path.toString(), 0, 0);
            LOG.debug("Reading {} failed", path, e);
            throw new CompilationException(CompilerErrorCode.IO_ERROR_READING_FILE, message,
                    new SourceInfo(path.toString(), 0, 0), e);
        }
        return parse(source, path.toString());
    }

    @Override
    public ParseResult tryParse(String source, String fileName) {
        try {
            return ParseResult.success(parse(source, fileName));
        } catch (CompilationException e) {
            return ParseResult.failure(diagnostics.getDiagnostics().get(0));
        }
    }

    /** @return The diagnostics of the last run. */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private Parser newParser(String source) {
        ParseletRegistry registry = ParseletRegistry.initialize();
        grammarExtension.accept(registry);
        return new Parser(new Lexer(source), registry);
    }

    private CompilationException toCompilationException(FrontendException e, String fileName) {
        Diagnostic diagnostic = diagnostics.reportError(e.getErrorCode(), e.getMessage(), fileName, e.getLine(), e.getColumn());
        LOG.debug("Compilation of {} failed: {}", fileName, diagnostic);
        return new CompilationException(e.getErrorCode(), e.getMessage(),
                new SourceInfo(fileName, e.getLine(), e.getColumn()), e);
    }
}
