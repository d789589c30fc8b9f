package de.mirkosertic.mangalibrary.config;

import org.jspecify.annotations.Nullable;
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
 * Central configuration of the manga library watcher.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables ({@code MANGA_PATH}, {@code MANGA_LIBRARY_FILE})
 * 2. System properties ({@code manga.path}, {@code manga.library.file})
 * 3. User config file (~/.mangalibrary/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_LIBRARY_PATH = "MANGA_PATH";
    private static final String ENV_STORE_FILE = "MANGA_LIBRARY_FILE";
    private static final String PROP_LIBRARY_PATH = "manga.path";
    private static final String PROP_STORE_FILE = "manga.library.file";
    private static final String CONFIG_DIR = ".mangalibrary";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";
    private static final String DEFAULT_STORE_FILE = "manga_library.json";

    @Nullable
    private String libraryPath;
    @Nullable
    private String storeFile;
    private String chapterExtension = ".cbz";
    private long flushThrottleMs = 500;
    private long changeThrottleMs = 500;
    private long watchPollIntervalMs = 1000;
    private boolean scanOnStart = true;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyOverrides();
        config.applyDefaults();

        logger.info("Configuration loaded: libraryPath={}, storeFile={}, chapterExtension={}",
                config.libraryPath, config.storeFile, config.chapterExtension);

        return config;
    }

    /**
     * Build a configuration from an already parsed YAML document. Environment
     * variables and system properties are not consulted, placeholders are resolved.
     */
    public static ApplicationConfig fromYaml(final Map<String, Object> yaml) {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(yaml);
        config.applyDefaults();
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
            } catch (final RuntimeException e) {
                logger.warn("Failed to parse user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Object section = config.get("library");
        if (!(section instanceof Map)) {
            return;
        }
        final Map<String, Object> libraryConfig = (Map<String, Object>) section;

        if (libraryConfig.get("root") != null) {
            this.libraryPath = emptyToNull(resolveVariables(libraryConfig.get("root").toString()));
        }
        if (libraryConfig.get("store-file") != null) {
            this.storeFile = emptyToNull(resolveVariables(libraryConfig.get("store-file").toString()));
        }
        if (libraryConfig.get("chapter-extension") != null) {
            this.chapterExtension = libraryConfig.get("chapter-extension").toString();
        }
        if (libraryConfig.get("flush-throttle-ms") != null) {
            this.flushThrottleMs = parseLong("flush-throttle-ms", libraryConfig.get("flush-throttle-ms"));
        }
        if (libraryConfig.get("change-throttle-ms") != null) {
            this.changeThrottleMs = parseLong("change-throttle-ms", libraryConfig.get("change-throttle-ms"));
        }
        if (libraryConfig.get("watch-poll-interval-ms") != null) {
            this.watchPollIntervalMs = parseLong("watch-poll-interval-ms", libraryConfig.get("watch-poll-interval-ms"));
        }
        if (libraryConfig.get("scan-on-start") != null) {
            this.scanOnStart = Boolean.parseBoolean(resolveVariables(libraryConfig.get("scan-on-start").toString()).trim());
        }
    }

    /**
     * Scalars may arrive as YAML numbers, quoted strings or placeholders.
     */
    private long parseLong(final String key, final Object value) {
        final String resolved = resolveVariables(value.toString()).trim();
        try {
            return Long.parseLong(resolved);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for library." + key + ": " + resolved, e);
        }
    }

    private void applyOverrides() {
        final String propLibraryPath = System.getProperty(PROP_LIBRARY_PATH);
        if (propLibraryPath != null && !propLibraryPath.isBlank()) {
            this.libraryPath = propLibraryPath.trim();
        }
        final String propStoreFile = System.getProperty(PROP_STORE_FILE);
        if (propStoreFile != null && !propStoreFile.isBlank()) {
            this.storeFile = propStoreFile.trim();
        }

        final String envLibraryPath = System.getenv(ENV_LIBRARY_PATH);
        if (envLibraryPath != null && !envLibraryPath.isBlank()) {
            this.libraryPath = envLibraryPath.trim();
            logger.info("Library path from environment: {}", this.libraryPath);
        }
        final String envStoreFile = System.getenv(ENV_STORE_FILE);
        if (envStoreFile != null && !envStoreFile.isBlank()) {
            this.storeFile = envStoreFile.trim();
            logger.info("Library file from environment: {}", this.storeFile);
        }
    }

    private void applyDefaults() {
        if (this.storeFile == null) {
            this.storeFile = getConfigDirectory().resolve(DEFAULT_STORE_FILE).toString();
        }
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

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    @Nullable
    private static String emptyToNull(final String value) {
        return value.isBlank() ? null : value;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * @return the library root
     * @throws IllegalStateException if no library root is configured
     */
    public Path getLibraryPath() {
        if (libraryPath == null) {
            throw new IllegalStateException("No library root configured, set " + ENV_LIBRARY_PATH + " or library.root");
        }
        return Paths.get(libraryPath);
    }

    public boolean hasLibraryPath() {
        return libraryPath != null;
    }

    public Path getStoreFile() {
        return Paths.get(storeFile != null ? storeFile : DEFAULT_STORE_FILE);
    }

    public String getChapterExtension() {
        return chapterExtension;
    }

    public long getFlushThrottleMs() {
        return flushThrottleMs;
    }

    public long getChangeThrottleMs() {
        return changeThrottleMs;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }

    public boolean isScanOnStart() {
        return scanOnStart;
    }
}
