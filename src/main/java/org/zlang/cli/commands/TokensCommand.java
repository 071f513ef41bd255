package org.zlang.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import org.zlang.cli.CommandLineInterface;
import org.zlang.compiler.Compiler;
import org.zlang.compiler.api.CompilationException;
import org.zlang.compiler.frontend.lexer.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Scans source text and prints the token stream.")
public class TokensCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private SourceOptions source;

    @Option(names = "--json", description = "Print the tokens as JSON (default from zlang.cli.output-format).")
    private Boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        List<Token> tokens;
        Compiler compiler = new Compiler();
        try {
            tokens = compiler.tokenize(source.read(), source.name(config.getString("zlang.compiler.file-name")));
        } catch (IOException e) {
            err.println("Cannot read source: " + e.getMessage());
            return CommandLineInterface.EXIT_USAGE;
        } catch (CompilationException e) {
            err.println(compiler.getDiagnostics().summary());
            return CommandLineInterface.EXIT_SOURCE_ERROR;
        }

        boolean asJson = json != null ? json : "json".equalsIgnoreCase(config.getString("zlang.cli.output-format"));
        if (asJson) {
            GsonBuilder builder = new GsonBuilder();
            if (config.getBoolean("zlang.cli.pretty-json")) {
                builder.setPrettyPrinting();
            }
            Gson gson = builder.create();
            out.println(gson.toJson(tokens));
        } else {
            tokens.forEach(out::println);
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
