package org.zlang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.zlang.cli.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@link CommandLineInterface} in-process and checks output and exit codes.
 */
@Tag("unit")
class CommandLineInterfaceTest {

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        ConfigFactory.invalidateCaches();
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void tokensPrintsOneTokenPerLine() {
        int exitCode = run("tokens", "-e", "a = 1;");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().lines()).containsExactly(
                "IDENTIFIER('a')", "ASSIGN('=')", "NUMBER('1')", "SEMICOLON(';')", "END_OF_FILE('<end_of_file>')");
    }

    @Test
    void tokensAsJson() {
        int exitCode = run("tokens", "--json", "-e", "x += 0x1F");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        JsonArray tokens = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(tokens.size()).isEqualTo(4);
        JsonObject number = tokens.get(2).getAsJsonObject();
        assertThat(number.get("type").getAsString()).isEqualTo("NUMBER");
        assertThat(number.get("text").getAsString()).isEqualTo("0x1F");
        assertThat(number.get("line").getAsInt()).isEqualTo(1);
        assertThat(number.get("column").getAsInt()).isEqualTo(6);
    }

    @Test
    void parsePrintsCanonicalStatements() {
        int exitCode = run("parse", "-e", "a = b = 1 + 2 * 3; ; -x;");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().lines()).containsExactly("(a = (b = (1 + (2 * 3))));", "(-x);");
    }

    @Test
    void parseReadsSourceFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("prog.zl");
        Files.writeString(file, "flag = a < b & c;\n", StandardCharsets.UTF_8);

        int exitCode = run("parse", "-f", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().lines()).containsExactly("(flag = ((a < b) & c));");
    }

    @Test
    void syntaxErrorExitsWithSourceError() {
        int exitCode = run("parse", "-e", "1 + 2");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_SOURCE_ERROR);
        assertThat(err.toString()).contains("[MISSING_TERMINATOR]").contains("Statement must end with `;`.").contains("<memory>:1:6");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void lexicalErrorExitsWithSourceError() {
        int exitCode = run("tokens", "-e", "\"open");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_SOURCE_ERROR);
        assertThat(err.toString()).contains("double quotes");
    }

    @Test
    void missingSourceFileIsAUsageError(@TempDir Path tempDir) {
        int exitCode = run("parse", "-f", tempDir.resolve("absent.zl").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_USAGE);
        assertThat(err.toString()).contains("Cannot read source");
    }

    @Test
    void missingSourceOptionIsAUsageError() {
        assertThat(run("parse")).isEqualTo(CommandLineInterface.EXIT_USAGE);
        assertThat(run("parse", "-e", "a;", "-f", "a.zl")).isEqualTo(CommandLineInterface.EXIT_USAGE);
    }

    @Test
    void missingConfigFileIsAUsageError(@TempDir Path tempDir) {
        int exitCode = run("-c", tempDir.resolve("absent.conf").toString(), "tokens", "-e", "a;");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_USAGE);
        assertThat(err.toString()).contains("was not found");
    }

    /**
     * Verifies that the output format and the inline source name come from the configuration file.
     */
    @Test
    void configFileSelectsDefaults(@TempDir Path tempDir) throws Exception {
        Path conf = tempDir.resolve("custom.conf");
        Files.writeString(conf, "zlang.cli.output-format = json\nzlang.cli.pretty-json = false\nzlang.compiler.file-name = \"inline.zl\"\n",
                StandardCharsets.UTF_8);

        int tokensExit = run("-c", conf.toString(), "tokens", "-e", "a");
        String json = out.toString().trim();
        int parseExit = run("-c", conf.toString(), "parse", "-e", "a");

        assertThat(tokensExit).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(json).doesNotContain("\n");
        assertThat(JsonParser.parseString(json).getAsJsonArray().size()).isEqualTo(2);
        assertThat(parseExit).isEqualTo(CommandLineInterface.EXIT_SOURCE_ERROR);
        assertThat(err.toString()).contains("inline.zl:1:2");
    }

    @Test
    void noSubcommandPrintsUsage() {
        assertThat(run()).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("Usage: zlang").contains("tokens").contains("parse");
    }
}
