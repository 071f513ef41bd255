package org.zlang.cli.commands;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * The source a command works on: inline text or a file, exactly one of them.
 */
public class SourceOptions {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Input input;

    static class Input {
        @Option(names = {"-e", "--expr"}, description = "Source text to process, e.g. 'a = 1 + 2;'.")
        String text;

        @Option(names = {"-f", "--file"}, description = "Path to a source file.")
        File file;
    }

    /**
     * Reads the selected source.
     * @return The source text.
     * @throws IOException if the source file cannot be read.
     */
    public String read() throws IOException {
        if (input.file != null) {
            return Files.readString(input.file.toPath(), StandardCharsets.UTF_8);
        }
        return input.text;
    }

    /**
     * @param inlineName The logical name used for inline source text.
     * @return The name used for the source in error messages.
     */
    public String name(String inlineName) {
        return input.file != null ? input.file.getPath() : inlineName;
    }
}
