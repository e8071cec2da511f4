package de.mirkosertic.mcp.docsimilarity.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the document similarity server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpdocsimilarity/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_THREAD_POOL_SIZE = "SIMILARITY_THREAD_POOL_SIZE";
    private static final String ENV_DEFAULT_THRESHOLD = "SIMILARITY_DEFAULT_THRESHOLD";
    private static final String PROP_THREAD_POOL_SIZE = "similarity.thread-pool-size";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".mcpdocsimilarity";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Analysis settings
    private int threadPoolSize = Runtime.getRuntime().availableProcessors();
    private double defaultThreshold = 0.70;

    // Document-level limits
    private int minDocuments = 2;
    private int maxDocuments = 100;
    private int maxDocumentLength = 50_000;

    // File upload limits
    private int minFiles = 2;
    private int maxFiles = 5;
    private long maxFileSize = 10L * 1024 * 1024;
    private long maxTotalSize = 50L * 1024 * 1024;

    // Extraction settings
    private long maxContentLength = -1;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: threadPoolSize={}, defaultThreshold={}, maxDocuments={}, maxFiles={}, deployedMode={}",
                config.threadPoolSize, config.defaultThreshold, config.maxDocuments, config.maxFiles, config.deployedMode);

        return config;
    }

    /**
     * Built-in defaults plus the classpath application.yaml, ignoring user file and environment.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        return config;
    }

    /**
     * Built-in defaults overridden by the given YAML document.
     */
    public static ApplicationConfig fromYaml(final String yamlContent) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yaml = new Yaml().load(yamlContent);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> similarityConfig = (Map<String, Object>) config.get("similarity");
        if (similarityConfig == null) {
            return;
        }

        final Map<String, Object> analysisConfig = (Map<String, Object>) similarityConfig.get("analysis");
        if (analysisConfig != null && analysisConfig.containsKey("thread-pool-size")) {
            final int size = intValue(analysisConfig.get("thread-pool-size"), threadPoolSize);
            // 0 or less keeps the processor-count default
            if (size > 0) {
                this.threadPoolSize = size;
            }
        }

        final Map<String, Object> sentenceConfig = (Map<String, Object>) similarityConfig.get("sentence");
        if (sentenceConfig != null && sentenceConfig.containsKey("default-threshold")) {
            applyDefaultThreshold(doubleValue(sentenceConfig.get("default-threshold"), defaultThreshold),
                    "default-threshold");
        }

        final Map<String, Object> extractionConfig = (Map<String, Object>) similarityConfig.get("extraction");
        if (extractionConfig != null && extractionConfig.containsKey("max-content-length")) {
            this.maxContentLength = longValue(extractionConfig.get("max-content-length"), maxContentLength);
        }

        final Map<String, Object> limitsConfig = (Map<String, Object>) similarityConfig.get("limits");
        if (limitsConfig != null) {
            applyLimitsConfig(limitsConfig);
        }
    }

    private void applyLimitsConfig(final Map<String, Object> limitsConfig) {
        if (limitsConfig.containsKey("min-documents")) {
            this.minDocuments = intValue(limitsConfig.get("min-documents"), minDocuments);
        }
        if (limitsConfig.containsKey("max-documents")) {
            this.maxDocuments = intValue(limitsConfig.get("max-documents"), maxDocuments);
        }
        if (limitsConfig.containsKey("max-document-length")) {
            this.maxDocumentLength = intValue(limitsConfig.get("max-document-length"), maxDocumentLength);
        }
        if (limitsConfig.containsKey("min-files")) {
            this.minFiles = intValue(limitsConfig.get("min-files"), minFiles);
        }
        if (limitsConfig.containsKey("max-files")) {
            this.maxFiles = intValue(limitsConfig.get("max-files"), maxFiles);
        }
        if (limitsConfig.containsKey("max-file-size")) {
            this.maxFileSize = longValue(limitsConfig.get("max-file-size"), maxFileSize);
        }
        if (limitsConfig.containsKey("max-total-size")) {
            this.maxTotalSize = longValue(limitsConfig.get("max-total-size"), maxTotalSize);
        }
    }

    private int intValue(final Object value, final int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(resolveVariables(text).trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid integer config value '{}'", text);
            }
        }
        return fallback;
    }

    private long longValue(final Object value, final long fallback) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(resolveVariables(text).trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid long config value '{}'", text);
            }
        }
        return fallback;
    }

    private double doubleValue(final Object value, final double fallback) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(resolveVariables(text).trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid number config value '{}'", text);
            }
        }
        return fallback;
    }

    private void applyEnvironmentOverrides() {
        final String propThreadPoolSize = System.getProperty(PROP_THREAD_POOL_SIZE);
        if (propThreadPoolSize != null && !propThreadPoolSize.isBlank()) {
            applyThreadPoolSize(propThreadPoolSize, PROP_THREAD_POOL_SIZE);
        }

        final String envThreadPoolSize = System.getenv(ENV_THREAD_POOL_SIZE);
        if (envThreadPoolSize != null && !envThreadPoolSize.isBlank()) {
            applyThreadPoolSize(envThreadPoolSize, ENV_THREAD_POOL_SIZE);
        }

        final String envThreshold = System.getenv(ENV_DEFAULT_THRESHOLD);
        if (envThreshold != null && !envThreshold.isBlank()) {
            try {
                if (applyDefaultThreshold(Double.parseDouble(envThreshold.trim()), ENV_DEFAULT_THRESHOLD)) {
                    logger.info("Default threshold from environment: {}", this.defaultThreshold);
                }
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {}='{}'", ENV_DEFAULT_THRESHOLD, envThreshold);
            }
        }
    }

    private void applyThreadPoolSize(final String value, final String source) {
        try {
            final int size = Integer.parseInt(value.trim());
            if (size > 0) {
                this.threadPoolSize = size;
                logger.info("Thread pool size from {}: {}", source, size);
            }
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring invalid {}='{}'", source, value);
        }
    }

    private boolean applyDefaultThreshold(final double value, final String source) {
        // NaN fails both comparisons
        if (!(value >= 0.0 && value <= 1.0)) {
            logger.warn("Ignoring {}={}: threshold must be between 0.0 and 1.0", source, value);
            return false;
        }
        this.defaultThreshold = value;
        return true;
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(parts[0], defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public int getMinDocuments() {
        return minDocuments;
    }

    public int getMaxDocuments() {
        return maxDocuments;
    }

    public int getMaxDocumentLength() {
        return maxDocumentLength;
    }

    public int getMinFiles() {
        return minFiles;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public long getMaxFileSize() {
        return maxFileSize;
    }

    public long getMaxTotalSize() {
        return maxTotalSize;
    }

    public long getMaxContentLength() {
        return maxContentLength;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
