package org.configlex.language;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.configlex.junit.extensions.logging.ExpectLog;
import org.configlex.junit.extensions.logging.LogLevel;
import org.configlex.junit.extensions.logging.LogWatchExtension;
import org.configlex.scanner.LanguageConfig;
import org.configlex.scanner.ScanBuffer;
import org.configlex.scanner.ScanException;
import org.configlex.scanner.Scanner;
import org.configlex.scanner.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for loading language definitions from HOCON.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LanguageConfigLoaderTest {

    @Test
    @DisplayName("Bundled Lua definition loads with its comment markers")
    void builtin_shouldLoadLua() {
        LanguageConfig lua = LanguageConfigLoader.builtin("lua");

        assertThat(lua.keywords()).hasSize(21).startsWith("and", "break").contains("function", "local");
        assertThat(lua.symbols()).startsWith("...", "..").endsWith(".");
        assertThat(lua.singleLineComment()).contains("--");
        assertThat(lua.multiLineCommentStart()).contains("--[[");
        assertThat(lua.multiLineCommentEnd()).contains("]]");
    }

    @Test
    @DisplayName("Bundled Lua definition scans a Lua snippet")
    void builtin_shouldDriveScanner() throws ScanException {
        ScanBuffer buffer = new Scanner().scan("local t = {...} -- varargs", LanguageConfigLoader.builtin("lua"));

        assertThat(buffer.tokens()).containsExactly(
                new Token.Keyword("local"),
                new Token.Identifier("t"),
                new Token.Symbol("="),
                new Token.Symbol("{"),
                new Token.Symbol("..."),
                new Token.Symbol("}"),
                new Token.Comment("-- varargs"));
    }

    @Test
    @DisplayName("Unknown built-in language is rejected")
    void builtin_shouldRejectUnknownLanguage() {
        assertThatThrownBy(() -> LanguageConfigLoader.builtin("cobol"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("languages/cobol.conf");
    }

    @Test
    @DisplayName("Shadowed entries are reported as warnings")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Language 'conflicting': symbol '\\.' is listed before '\\.\\.' and shadows it")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Language 'conflicting': keyword 'end' is listed before 'end!' and shadows it")
    void fromResource_shouldWarnAboutShadowedEntries() {
        LanguageConfig config = LanguageConfigLoader.fromResource("languages/conflicting.conf");

        assertThat(config.symbols()).containsExactly(".", "..", "+");
        assertThat(config.singleLineComment()).contains("#");
        assertThat(config.multiLineCommentStart()).isEmpty();
    }

    @Test
    @DisplayName("sort-longest-first reorders entries instead of warning")
    void fromResource_shouldSortWhenRequested() {
        LanguageConfig config = LanguageConfigLoader.fromResource("languages/sorted.conf");

        assertThat(config.symbols()).containsExactly("..", ".", "+");
        assertThat(config.keywords()).containsExactly("end!", "end");
    }

    @Test
    @DisplayName("Missing required keys raise ConfigException")
    void fromResource_shouldRejectMissingSymbols() {
        assertThatThrownBy(() -> LanguageConfigLoader.fromResource("languages/missing-symbols.conf"))
                .isInstanceOf(ConfigException.Missing.class);
    }

    @Test
    @DisplayName("Invalid marker combinations raise IllegalArgumentException")
    void fromConfig_shouldRejectHalfConfiguredMultiLineComment() {
        String hocon = "language { keywords = [], symbols = [], comments { multi-line-start = \"/*\" } }";

        assertThatThrownBy(() -> LanguageConfigLoader.fromConfig(ConfigFactory.parseString(hocon), "inline"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Definitions load from files and support substitutions")
    void fromFile_shouldLoadDefinition(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("mini.conf");
        Files.writeString(file, String.join("\n",
                "base-symbols = [\"(\", \")\"]",
                "language {",
                "  name = \"mini\"",
                "  keywords = [\"let\"]",
                "  symbols = ${base-symbols} [\"=\"]",
                "  comments.single-line = \"//\"",
                "}"), StandardCharsets.UTF_8);

        LanguageConfig config = LanguageConfigLoader.fromFile(file.toFile());

        assertThat(config.keywords()).containsExactly("let");
        assertThat(config.symbols()).containsExactly("(", ")", "=");
        assertThat(config.singleLineComment()).contains("//");
    }

    @Test
    @DisplayName("Missing definition file raises ConfigException")
    void fromFile_shouldRejectMissingFile(@TempDir Path tempDir) {
        File missing = tempDir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> LanguageConfigLoader.fromFile(missing))
                .isInstanceOf(ConfigException.class);
    }
}
