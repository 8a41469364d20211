package de.mirkosertic.doctree.config;

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
 * Central configuration for doctree.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System property {@code doctree.base.path}
 * 2. Environment variable {@code DOCTREE_BASE_PATH}
 * 3. User config file (~/.doctree/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * The base path overrides apply to the store location only; every other setting comes from
 * the YAML files.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_BASE_PATH = "DOCTREE_BASE_PATH";
    static final String PROP_BASE_PATH = "doctree.base.path";
    static final String PROP_PROFILE = "doctree.profile";
    private static final String CONFIG_DIR = ".doctree";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    /** Where the tablet keeps its documents. */
    static final String DEVICE_BASE_PATH = "/home/root/.local/share/remarkable/xochitl";
    static final String DEVELOPMENT_BASE_PATH = "samples";

    // Store settings
    private String basePath;

    // Index settings
    private int readPoolSize = 4;

    // Watch settings
    private boolean watchEnabled = true;
    private long watchDebounceMs = 2000;
    private long watchPollIntervalMs = 500;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(getUserConfigPath());

        // Step 3: Apply environment variable, then system property (highest priority)
        config.applyEnvironmentOverrides(System.getenv(ENV_BASE_PATH));

        logger.info("Configuration loaded: basePath={}, readPoolSize={}, watchEnabled={}, watchDebounceMs={}",
                config.basePath, config.readPoolSize, config.watchEnabled, config.watchDebounceMs);

        return config;
    }

    /**
     * Load configuration from the given YAML document only, then fill in defaults.
     * The user config file and the {@value #ENV_BASE_PATH} environment override are not consulted.
     */
    static ApplicationConfig fromYaml(final String yamlDocument) {
        return fromYaml(yamlDocument, null);
    }

    /**
     * Like {@link #fromYaml(String)}, with {@code envBasePath} standing in for the
     * {@value #ENV_BASE_PATH} environment variable.
     */
    static ApplicationConfig fromYaml(final String yamlDocument, final String envBasePath) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> values = new Yaml().load(yamlDocument);
        if (values != null) {
            config.applyYamlConfig(values);
        }
        config.applyEnvironmentOverrides(envBasePath);
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
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
        final Map<String, Object> doctreeConfig = (Map<String, Object>) config.get("doctree");
        if (doctreeConfig == null) {
            return;
        }

        final Map<String, Object> storeConfig = (Map<String, Object>) doctreeConfig.get("store");
        if (storeConfig != null) {
            final Object path = storeConfig.get("base-path");
            if (path != null) {
                this.basePath = resolveVariables(path.toString());
            }
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) doctreeConfig.get("index");
        if (indexConfig != null && indexConfig.containsKey("read-pool-size")) {
            this.readPoolSize = ((Number) indexConfig.get("read-pool-size")).intValue();
        }

        final Map<String, Object> watchConfig = (Map<String, Object>) doctreeConfig.get("watch");
        if (watchConfig != null) {
            applyWatchConfig(watchConfig);
        }
    }

    private void applyWatchConfig(final Map<String, Object> watchConfig) {
        if (watchConfig.containsKey("enabled")) {
            this.watchEnabled = (Boolean) watchConfig.get("enabled");
        }
        if (watchConfig.containsKey("debounce-ms")) {
            this.watchDebounceMs = ((Number) watchConfig.get("debounce-ms")).longValue();
        }
        if (watchConfig.containsKey("poll-interval-ms")) {
            this.watchPollIntervalMs = ((Number) watchConfig.get("poll-interval-ms")).longValue();
        }
    }

    private void applyEnvironmentOverrides(final String envBasePath) {
        // Base path from environment
        if (envBasePath != null && !envBasePath.trim().isEmpty()) {
            this.basePath = envBasePath.trim();
            logger.info("Base path from environment: {}", this.basePath);
        }

        // System property for base path, wins over the environment
        final String propBasePath = System.getProperty(PROP_BASE_PATH);
        if (propBasePath != null && !propBasePath.isEmpty()) {
            this.basePath = propBasePath;
        }

        // Default base path if not set: the tablet's own store, else the development samples
        if (this.basePath == null || this.basePath.isEmpty()) {
            this.basePath = Files.isDirectory(Paths.get(DEVICE_BASE_PATH)) ? DEVICE_BASE_PATH : DEVELOPMENT_BASE_PATH;
        }

        if (this.readPoolSize < 1) {
            logger.warn("Invalid read-pool-size {}, using 1", this.readPoolSize);
            this.readPoolSize = 1;
        }
    }

    /**
     * Whether the daemon profile is active. Checked before logging is configured, so it must not log.
     */
    public static boolean isDaemonProfile() {
        return "daemon".equalsIgnoreCase(System.getProperty(PROP_PROFILE, "default"));
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
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

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public Path getBasePath() {
        return Paths.get(basePath);
    }

    public int getReadPoolSize() {
        return readPoolSize;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public long getWatchDebounceMs() {
        return watchDebounceMs;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }
}
