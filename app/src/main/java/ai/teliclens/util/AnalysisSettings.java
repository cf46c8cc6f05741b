package ai.teliclens.util;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Analysis configuration. Defaults come from {@code teliclens.properties} on the classpath; a user file may override
 * any subset of the keys.
 *
 * <p>Keys:
 *
 * <ul>
 *   <li>parser.strict: boolean, treat syntax errors as parse failures
 *   <li>extraction.callArgumentEdges: boolean
 *   <li>extraction.parallelism: int, at least 1
 *   <li>filter.enabled: boolean
 *   <li>filter.loopCounters: comma list
 *   <li>trust.enabled: boolean
 *   <li>trust.keywords: comma list
 *   <li>trust.sanitizers: comma list
 * </ul>
 */
public record AnalysisSettings(
        boolean strictParsing,
        boolean callArgumentEdges,
        int parallelism,
        boolean filterEnabled,
        Set<String> loopCounters,
        boolean trustEnabled,
        List<String> trustKeywords,
        List<String> sanitizers) {
    private static final Logger logger = LogManager.getLogger(AnalysisSettings.class);

    public static final String DEFAULTS_RESOURCE = "/teliclens.properties";

    static final String KEY_PARSER_STRICT = "parser.strict";
    static final String KEY_CALL_ARGUMENT_EDGES = "extraction.callArgumentEdges";
    static final String KEY_PARALLELISM = "extraction.parallelism";
    static final String KEY_FILTER_ENABLED = "filter.enabled";
    static final String KEY_LOOP_COUNTERS = "filter.loopCounters";
    static final String KEY_TRUST_ENABLED = "trust.enabled";
    static final String KEY_TRUST_KEYWORDS = "trust.keywords";
    static final String KEY_SANITIZERS = "trust.sanitizers";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public AnalysisSettings {
        if (parallelism < 1) {
            throw new IllegalArgumentException("extraction.parallelism must be >= 1, was " + parallelism);
        }
        loopCounters = Set.copyOf(loopCounters);
        trustKeywords = List.copyOf(trustKeywords);
        sanitizers = List.copyOf(sanitizers);
    }

    /** Classpath defaults only. */
    public static AnalysisSettings defaults() {
        return fromProperties(loadDefaults());
    }

    /** Classpath defaults overlaid with the given file, if any. */
    public static AnalysisSettings load(@Nullable Path overrides) throws IOException {
        var props = loadDefaults();
        if (overrides != null) {
            try (var reader = Files.newBufferedReader(overrides)) {
                props.load(reader);
            }
            logger.debug("Loaded analysis settings overrides from {}", overrides);
        }
        return fromProperties(props);
    }

    public static AnalysisSettings fromProperties(Properties props) {
        return new AnalysisSettings(
                bool(props, KEY_PARSER_STRICT, false),
                bool(props, KEY_CALL_ARGUMENT_EDGES, true),
                integer(props, KEY_PARALLELISM, 1),
                bool(props, KEY_FILTER_ENABLED, true),
                Set.copyOf(list(props, KEY_LOOP_COUNTERS, "i,j,k")),
                bool(props, KEY_TRUST_ENABLED, true),
                list(props, KEY_TRUST_KEYWORDS, "database,findUser,query,fetch,exec,eval,password,secret,credential"),
                list(props, KEY_SANITIZERS, "sanitize,encrypt,validate"));
    }

    public AnalysisSettings withCallArgumentEdges(boolean enabled) {
        return new AnalysisSettings(
                strictParsing,
                enabled,
                parallelism,
                filterEnabled,
                loopCounters,
                trustEnabled,
                trustKeywords,
                sanitizers);
    }

    public AnalysisSettings withParallelism(int threads) {
        return new AnalysisSettings(
                strictParsing,
                callArgumentEdges,
                threads,
                filterEnabled,
                loopCounters,
                trustEnabled,
                trustKeywords,
                sanitizers);
    }

    public AnalysisSettings withFilterEnabled(boolean enabled) {
        return new AnalysisSettings(
                strictParsing,
                callArgumentEdges,
                parallelism,
                enabled,
                loopCounters,
                trustEnabled,
                trustKeywords,
                sanitizers);
    }

    public AnalysisSettings withTrustEnabled(boolean enabled) {
        return new AnalysisSettings(
                strictParsing,
                callArgumentEdges,
                parallelism,
                filterEnabled,
                loopCounters,
                enabled,
                trustKeywords,
                sanitizers);
    }

    private static Properties loadDefaults() {
        var props = new Properties();
        try (InputStream in = AnalysisSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("{} not found on classpath; using built-in defaults", DEFAULTS_RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, e);
        }
        return props;
    }

    private static boolean bool(Properties props, String key, boolean defaultValue) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + key + ": " + raw);
        };
    }

    private static int integer(Properties props, String key, int defaultValue) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static List<String> list(Properties props, String key, String defaultValue) {
        return LIST_SPLITTER.splitToList(props.getProperty(key, defaultValue));
    }
}
