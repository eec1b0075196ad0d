package org.configlex.language;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.configlex.scanner.LanguageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads {@link LanguageConfig}s from HOCON language definitions.
 *
 * <h3>Definition Structure:</h3>
 * <pre>
 * language {
 *   name = "lua"
 *   keywords = ["and", "break", "do"]
 *   symbols = ["...", "..", "."]
 *   comments {
 *     single-line = "--"          # optional
 *     multi-line-start = "--[["   # optional, requires multi-line-end
 *     multi-line-end = "]]"
 *   }
 *   sort-longest-first = false   # optional, sorts both lists by descending length
 * }
 * </pre>
 * Built-in definitions live on the classpath under {@code languages/<name>.conf}.
 */
public final class LanguageConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(LanguageConfigLoader.class);

    private static final String BUILTIN_RESOURCE_PREFIX = "languages/";
    private static final String LANGUAGE_PATH = "language";
    private static final String NAME_KEY = "name";
    private static final String KEYWORDS_KEY = "keywords";
    private static final String SYMBOLS_KEY = "symbols";
    private static final String SINGLE_LINE_KEY = "comments.single-line";
    private static final String MULTI_LINE_START_KEY = "comments.multi-line-start";
    private static final String MULTI_LINE_END_KEY = "comments.multi-line-end";
    private static final String SORT_KEY = "sort-longest-first";

    private LanguageConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads a definition bundled with the library.
     *
     * @param name The language name, e.g. {@code "lua"}.
     * @return The language configuration.
     * @throws IllegalArgumentException if no such definition exists.
     */
    public static LanguageConfig builtin(String name) {
        return fromResource(BUILTIN_RESOURCE_PREFIX + name + ".conf");
    }

    /**
     * Loads a definition from a classpath resource.
     *
     * @param resource The resource path.
     * @return The language configuration.
     * @throws IllegalArgumentException if the resource does not exist or holds invalid values.
     * @throws com.typesafe.config.ConfigException if the resource cannot be parsed or lacks required keys.
     */
    public static LanguageConfig fromResource(String resource) {
        Config config = ConfigFactory.parseResources(resource);
        if (config.isEmpty()) {
            throw new IllegalArgumentException("Language definition not found on classpath: " + resource);
        }
        return fromConfig(config, resource);
    }

    /**
     * Loads a definition from a file.
     *
     * @param file The HOCON file.
     * @return The language configuration.
     * @throws com.typesafe.config.ConfigException if the file is missing, cannot be parsed or lacks required keys.
     */
    public static LanguageConfig fromFile(File file) {
        Config config = ConfigFactory.parseFile(file, ConfigParseOptions.defaults().setAllowMissing(false));
        return fromConfig(config, file.getPath());
    }

    /**
     * Builds a configuration from a parsed definition containing a {@code language} block.
     *
     * @param config The parsed definition.
     * @param origin A description of where the definition came from, for logging.
     * @return The language configuration.
     * @throws IllegalArgumentException if a keyword, symbol or marker is invalid.
     * @throws com.typesafe.config.ConfigException if the {@code language} block or a required key is missing.
     */
    public static LanguageConfig fromConfig(Config config, String origin) {
        Config language = config.resolve().getConfig(LANGUAGE_PATH);
        String name = language.hasPath(NAME_KEY) ? language.getString(NAME_KEY) : origin;

        LanguageConfig result = LanguageConfig.builder()
                .keywords(language.getStringList(KEYWORDS_KEY))
                .symbols(language.getStringList(SYMBOLS_KEY))
                .singleLineComment(optionalString(language, SINGLE_LINE_KEY))
                .multiLineComment(optionalString(language, MULTI_LINE_START_KEY), optionalString(language, MULTI_LINE_END_KEY))
                .build();

        if (language.hasPath(SORT_KEY) && language.getBoolean(SORT_KEY)) {
            result = result.sortedLongestFirst();
            LOG.debug("Sorted keywords and symbols of language '{}' longest first.", name);
        } else {
            for (String conflict : OrderingCheck.findConflicts(result)) {
                LOG.warn("Language '{}': {}", name, conflict);
            }
        }

        LOG.info("Loaded language '{}' from {} ({} keywords, {} symbols).", name, origin,
                result.keywords().size(), result.symbols().size());
        return result;
    }

    private static String optionalString(Config config, String path) {
        return config.hasPath(path) ? config.getString(path) : null;
    }
}
