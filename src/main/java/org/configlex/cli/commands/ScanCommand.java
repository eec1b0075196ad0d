package org.configlex.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.configlex.cli.CommandLineInterface;
import org.configlex.language.LanguageConfigLoader;
import org.configlex.scanner.LanguageConfig;
import org.configlex.scanner.ScanBuffer;
import org.configlex.scanner.ScanException;
import org.configlex.scanner.Scanner;
import org.configlex.scanner.Token;
import org.configlex.scanner.TokenDumper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "scan",
    description = "Scan source files and print their tokens"
)
public class ScanCommand implements Callable<Integer> {

    /** Exit code for a file that failed to scan. */
    public static final int EXIT_SCAN_ERROR = 1;
    /** Exit code for unreadable input or an unusable language definition. */
    public static final int EXIT_USAGE_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(ScanCommand.class);

    @Parameters(
        arity = "1..*",
        paramLabel = "FILE",
        description = "Source files to scan"
    )
    private List<File> files;

    @Option(
        names = {"-l", "--language"},
        description = "Built-in language name (default: configlex.default-language)"
    )
    private String language;

    @Option(
        names = {"-L", "--language-file"},
        description = "HOCON language definition file, takes precedence over --language"
    )
    private File languageFile;

    @Option(
        names = "--sort-longest-first",
        description = "Sort keywords and symbols by descending length before scanning"
    )
    private boolean sortLongestFirst;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: text, json (default: text)"
    )
    private String format = "text";

    @Option(
        names = "--charset",
        description = "Charset of the input files (default: configlex.charset)"
    )
    private String charset;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            return scanAll(out, err);
        } finally {
            out.flush();
            err.flush();
        }
    }

    private int scanAll(PrintWriter out, PrintWriter err) {
        if (!"text".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
            err.println("Unknown format: " + format + ". Supported formats: text, json");
            return EXIT_USAGE_ERROR;
        }

        final Config config;
        final LanguageConfig languageConfig;
        final Charset inputCharset;
        try {
            config = parent.getConfig();
            languageConfig = resolveLanguage(config);
            inputCharset = Charset.forName(charset != null ? charset : config.getString("configlex.charset"));
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Cannot prepare scan: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        final Scanner scanner = new Scanner();
        int exitCode = 0;
        for (File file : files) {
            final String source;
            try {
                source = Files.readString(file.toPath(), inputCharset);
            } catch (IOException e) {
                LOG.error("Cannot read {}: {}", file, e.toString());
                err.println("Error reading " + file + ": " + e.getMessage());
                exitCode = Math.max(exitCode, EXIT_USAGE_ERROR);
                continue;
            }

            final ScanBuffer buffer = new ScanBuffer();
            ScanException failure = null;
            try {
                scanner.run(source, languageConfig, buffer);
            } catch (ScanException e) {
                failure = e;
                exitCode = Math.max(exitCode, EXIT_SCAN_ERROR);
            }

            if ("json".equalsIgnoreCase(format)) {
                printJson(out, file, buffer, failure);
            } else {
                printText(out, file, buffer);
            }
            if (failure != null) {
                err.println(file.getPath() + ":" + failure.getMessage());
            }
        }
        return exitCode;
    }

    private LanguageConfig resolveLanguage(Config config) {
        LanguageConfig result;
        if (languageFile != null) {
            result = LanguageConfigLoader.fromFile(languageFile);
        } else {
            result = LanguageConfigLoader.builtin(language != null ? language : config.getString("configlex.default-language"));
        }
        return sortLongestFirst ? result.sortedLongestFirst() : result;
    }

    private void printText(PrintWriter out, File file, ScanBuffer buffer) {
        if (files.size() > 1) {
            out.println("== " + file.getPath() + " ==");
        }
        TokenDumper.dump(buffer, out);
    }

    private void printJson(PrintWriter out, File file, ScanBuffer buffer, ScanException failure) {
        List<TokenEntry> tokens = new ArrayList<>(buffer.size());
        for (int i = 0; i < buffer.size(); i++) {
            Token token = buffer.token(i);
            Double value = token instanceof Token.NumberLiteral number ? number.value() : null;
            tokens.add(new TokenEntry(i, buffer.line(i), buffer.start(i), buffer.length(i),
                    token.getClass().getSimpleName(), token.text(), value));
        }
        ErrorEntry error = failure == null ? null
                : new ErrorEntry(failure.error().name(), failure.line(), failure.offset(), failure.getMessage());
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        out.println(gson.toJson(new FileEntry(file.getPath(), tokens, error)));
    }

    private record FileEntry(String file, List<TokenEntry> tokens, ErrorEntry error) {}

    private record TokenEntry(int index, int line, int start, int length, String kind, String text, Double value) {}

    private record ErrorEntry(String kind, int line, int offset, String message) {}
}
