package de.mirkosertic.aznlp.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Configuration of the morphology engine.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.aznlp/config.yaml)
 * 4. Defaults (aznlp.yaml in classpath)
 */
public class MorphologyConfig {

    private static final Logger logger = LoggerFactory.getLogger(MorphologyConfig.class);

    public static final String ENV_DICTIONARY_PATH = "AZNLP_DICTIONARY_PATH";
    public static final String ENV_CACHE_MAX_SIZE = "AZNLP_CACHE_MAX_SIZE";
    public static final String PROP_DICTIONARY_PATH = "aznlp.dictionary.path";
    public static final String PROP_CACHE_MAX_SIZE = "aznlp.cache.max-size";

    private static final String CONFIG_DIR = ".aznlp";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "aznlp.yaml";

    // Dictionary settings
    private String dictionaryResource = "/az-stems.txt";
    private @Nullable String dictionaryPath;

    // Cache settings
    private boolean cacheEnabled = true;
    private long cacheMaxSize = 100_000;

    // Lucene analysis settings
    private boolean foldDiacritics = false;

    private MorphologyConfig() {
    }

    /**
     * Built-in defaults only, ignoring every file, property and environment variable.
     */
    public static MorphologyConfig defaults() {
        return new MorphologyConfig();
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static MorphologyConfig load() {
        return load(getUserConfigPath());
    }

    /**
     * Load configuration, reading the user config from {@code userConfigPath} instead of the
     * home directory.
     */
    public static MorphologyConfig load(final Path userConfigPath) {
        final MorphologyConfig config = new MorphologyConfig();

        // Step 1: Load defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromFile(userConfigPath);

        // Step 3: System properties, then environment variables (highest priority)
        config.applySystemPropertyOverrides();
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: dictionary={}, cacheEnabled={}, cacheMaxSize={}, foldDiacritics={}",
                config.dictionaryPath != null ? config.dictionaryPath : config.dictionaryResource,
                config.cacheEnabled, config.cacheMaxSize, config.foldDiacritics);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is, DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path path) {
        if (Files.exists(path)) {
            try (final InputStream is = Files.newInputStream(path)) {
                applyYaml(is, path.toString());
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", path, e);
            }
        }
    }

    private void applyYaml(final InputStream is, final String source) {
        final Object config;
        try {
            config = new Yaml().load(is);
        } catch (final YAMLException e) {
            logger.warn("Ignoring malformed config {}: {}", source, e.getMessage());
            return;
        }
        if (config instanceof Map<?, ?> root) {
            applyYamlConfig(root);
            logger.debug("Loaded config from: {}", source);
        }
    }

    private void applyYamlConfig(final Map<?, ?> config) {
        final Map<?, ?> aznlpConfig = section(config, "aznlp");
        if (aznlpConfig == null) {
            return;
        }

        final Map<?, ?> morphologyConfig = section(aznlpConfig, "morphology");
        if (morphologyConfig != null) {
            final Map<?, ?> dictionaryConfig = section(morphologyConfig, "dictionary");
            if (dictionaryConfig != null) {
                final Object resource = dictionaryConfig.get("resource");
                if (resource != null) {
                    this.dictionaryResource = resolveVariables(resource.toString());
                }
                final Object path = dictionaryConfig.get("path");
                if (path != null) {
                    final String resolved = resolveVariables(path.toString()).trim();
                    this.dictionaryPath = resolved.isEmpty() ? null : resolved;
                }
            }

            final Map<?, ?> cacheConfig = section(morphologyConfig, "cache");
            if (cacheConfig != null) {
                if (cacheConfig.get("enabled") instanceof Boolean enabled) {
                    this.cacheEnabled = enabled;
                }
                if (cacheConfig.get("max-size") instanceof Number maxSize) {
                    setCacheMaxSize(maxSize.longValue(), "config file");
                }
            }
        }

        final Map<?, ?> analysisConfig = section(aznlpConfig, "analysis");
        if (analysisConfig != null && analysisConfig.get("fold-diacritics") instanceof Boolean fold) {
            this.foldDiacritics = fold;
        }
    }

    private static @Nullable Map<?, ?> section(final Map<?, ?> parent, final String key) {
        if (parent.get(key) instanceof Map<?, ?> child) {
            return child;
        }
        return null;
    }

    private void applySystemPropertyOverrides() {
        applyDictionaryPath(System.getProperty(PROP_DICTIONARY_PATH), PROP_DICTIONARY_PATH);
        applyCacheMaxSize(System.getProperty(PROP_CACHE_MAX_SIZE), PROP_CACHE_MAX_SIZE);
    }

    private void applyEnvironmentOverrides() {
        applyDictionaryPath(System.getenv(ENV_DICTIONARY_PATH), ENV_DICTIONARY_PATH);
        applyCacheMaxSize(System.getenv(ENV_CACHE_MAX_SIZE), ENV_CACHE_MAX_SIZE);
    }

    private void applyDictionaryPath(final @Nullable String value, final String source) {
        if (value != null && !value.trim().isEmpty()) {
            this.dictionaryPath = value.trim();
            logger.info("Dictionary path from {}: {}", source, this.dictionaryPath);
        }
    }

    private void applyCacheMaxSize(final @Nullable String value, final String source) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        try {
            if (setCacheMaxSize(Long.parseLong(value.trim()), source)) {
                logger.info("Cache max size from {}: {}", source, this.cacheMaxSize);
            }
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring invalid cache max size from {}: {}", source, value);
        }
    }

    private boolean setCacheMaxSize(final long maxSize, final String source) {
        if (maxSize < 0) {
            logger.warn("Ignoring negative cache max size from {}: {}", source, maxSize);
            return false;
        }
        this.cacheMaxSize = maxSize;
        return true;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (!value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters
    public String getDictionaryResource() {
        return dictionaryResource;
    }

    public @Nullable String getDictionaryPath() {
        return dictionaryPath;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public boolean isFoldDiacritics() {
        return foldDiacritics;
    }
}
