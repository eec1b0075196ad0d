package org.configlex.cli.commands;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.configlex.cli.CommandLineInterface;
import org.configlex.junit.extensions.logging.ExpectLog;
import org.configlex.junit.extensions.logging.LogLevel;
import org.configlex.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@code scan} command end to end through picocli.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ScanCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = rootLogger().getLevel();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void printsTextDumpWithDefaultLanguage() throws IOException {
        Path source = write("a.lua", "local x = 1\nreturn x");

        int exitCode = commandLine.execute("scan", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "[#000 line 1] Keyword(local)",
                "[#001 line 1] Identifier(x)",
                "[#002 line 1] Symbol(=)",
                "[#003 line 1] NumberLiteral(1, 1.0)",
                "[#004 line 2] Keyword(return)",
                "[#005 line 2] Identifier(x)");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void printsJsonWithPositions() throws IOException {
        Path source = write("b.lua", "x = 0x10 -- hex");

        int exitCode = commandLine.execute("scan", "--format", "json", source.toString());

        assertThat(exitCode).isZero();
        JsonObject result = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(result.get("file").getAsString()).isEqualTo(source.toString());
        assertThat(result.has("error")).isFalse();
        JsonArray tokens = result.getAsJsonArray("tokens");
        assertThat(tokens).hasSize(4);
        JsonObject number = tokens.get(2).getAsJsonObject();
        assertThat(number.get("kind").getAsString()).isEqualTo("NumberLiteral");
        assertThat(number.get("text").getAsString()).isEqualTo("0x10");
        assertThat(number.get("value").getAsDouble()).isEqualTo(16.0);
        assertThat(number.get("start").getAsInt()).isEqualTo(4);
        assertThat(number.get("length").getAsInt()).isEqualTo(4);
        assertThat(tokens.get(0).getAsJsonObject().has("value")).isFalse();
    }

    @Test
    void reportsScanErrorAfterPartialDump() throws IOException {
        Path source = write("c.lua", "local s=\"à");

        int exitCode = commandLine.execute("scan", source.toString());

        assertThat(exitCode).isEqualTo(ScanCommand.EXIT_SCAN_ERROR);
        assertThat(out.toString().lines()).hasSize(4).last().isEqualTo("[#003 line 1] StringLiteral(à)");
        assertThat(err.toString().trim()).isEqualTo(source + ":1:8 : unexpected end of file");
    }

    @Test
    void includesScanErrorInJson() throws IOException {
        Path source = write("d.lua", "x = $");

        int exitCode = commandLine.execute("scan", "-f", "json", source.toString());

        assertThat(exitCode).isEqualTo(ScanCommand.EXIT_SCAN_ERROR);
        JsonObject error = JsonParser.parseString(out.toString()).getAsJsonObject().getAsJsonObject("error");
        assertThat(error.get("kind").getAsString()).isEqualTo("UNKNOWN_TOKEN");
        assertThat(error.get("line").getAsInt()).isEqualTo(1);
        assertThat(error.get("offset").getAsInt()).isEqualTo(4);
    }

    @Test
    void usesLanguageFile() throws IOException {
        Path language = write("mini.conf", "language { keywords = [\"let\"], symbols = [\"=\", \";\"], comments.single-line = \"#\" }");
        Path source = write("e.mini", "let a = b; # done");

        int exitCode = commandLine.execute("scan", "-L", language.toString(), source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Keyword(let)", "Symbol(;)", "Comment(# done)");
    }

    @Test
    void labelsOutputPerFileWhenScanningSeveralFiles() throws IOException {
        Path first = write("f1.lua", "a");
        Path second = write("f2.lua", "b");

        int exitCode = commandLine.execute("scan", first.toString(), second.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "== " + first + " ==",
                "[#000 line 1] Identifier(a)",
                "== " + second + " ==",
                "[#000 line 1] Identifier(b)");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Cannot read .*")
    void missingFileIsAUsageError() {
        int exitCode = commandLine.execute("scan", tempDir.resolve("missing.lua").toString());

        assertThat(exitCode).isEqualTo(ScanCommand.EXIT_USAGE_ERROR);
        assertThat(err.toString()).contains("Error reading");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Cannot prepare scan: .*cobol.*")
    void unknownLanguageIsAUsageError() throws IOException {
        Path source = write("g.lua", "a");

        int exitCode = commandLine.execute("scan", "--language", "cobol", source.toString());

        assertThat(exitCode).isEqualTo(ScanCommand.EXIT_USAGE_ERROR);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unknownFormatIsAUsageError() throws IOException {
        Path source = write("h.lua", "a");

        int exitCode = commandLine.execute("scan", "--format", "xml", source.toString());

        assertThat(exitCode).isEqualTo(ScanCommand.EXIT_USAGE_ERROR);
        assertThat(err.toString()).contains("Unknown format: xml");
    }

    // Each run applies the logging section of the loaded configuration.
    @AfterEach
    void restoreRootLevel() {
        rootLogger().setLevel(originalRootLevel);
    }

    @Test
    void appliesRootLevelFromConfigurationFile() throws IOException {
        Path config = write("quiet.conf", "logging.default-level = \"ERROR\"");
        Path source = write("i.lua", "a");

        int exitCode = commandLine.execute("--config", config.toString(), "scan", source.toString());

        assertThat(exitCode).isZero();
        assertThat(rootLogger().getLevel()).isEqualTo(Level.ERROR);
    }

    private static Logger rootLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
