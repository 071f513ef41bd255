package org.zlang.compiler.api;

import org.zlang.compiler.frontend.lexer.Token;
import org.zlang.compiler.frontend.parser.ast.Program;

import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the zlang front end.
 */
public interface ICompiler {

    /**
     * Scans the source into tokens.
     *
     * @param source The source code.
     * @param fileName A logical name for the source, used in error messages.
     * @return All tokens, ending with the end-of-input token.
     * @throws CompilationException on the first lexical error.
     */
    List<Token> tokenize(String source, String fileName) throws CompilationException;

    /**
     * Parses the source into a program.
     *
     * @param source The source code.
     * @param fileName A logical name for the source, used in error messages.
     * @return The parsed program.
     * @throws CompilationException on the first lexical or syntax error.
     */
    Program parse(String source, String fileName) throws CompilationException;

    /**
     * Parses the source without throwing for defects in it.
     *
     * @param source The source code.
     * @param fileName A logical name for the source, used in error messages.
     * @return The program or the error that stopped the parse.
     */
    ParseResult tryParse(String source, String fileName);

    /**
     * Parses a UTF-8 source file. The path is the logical name of the source.
     * @param path The path of the source file.
     * @return The parsed program.
     * @throws CompilationException on the first lexical or syntax error, or with
     *         {@link CompilerErrorCode#IO_ERROR_READING_FILE} if the file cannot be read.
     */
    Program parse(Path path) throws CompilationException;
}
