package org.zlang.cli.commands;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zlang.cli.CommandLineInterface;
import org.zlang.compiler.Compiler;
import org.zlang.compiler.api.CompilationException;
import org.zlang.compiler.frontend.parser.ast.Program;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses source text and prints each statement in canonical, fully parenthesized form.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private SourceOptions source;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String name = source.name(config.getString("zlang.compiler.file-name"));
        Program program;
        Compiler compiler = new Compiler();
        try {
            program = compiler.parse(source.read(), name);
        } catch (IOException e) {
            err.println("Cannot read source: " + e.getMessage());
            return CommandLineInterface.EXIT_USAGE;
        } catch (CompilationException e) {
            err.println(compiler.getDiagnostics().summary());
            return CommandLineInterface.EXIT_SOURCE_ERROR;
        }

        LOG.debug("Parsed {} statements from {}", program.size(), name);
        program.forEach(out::println);
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
