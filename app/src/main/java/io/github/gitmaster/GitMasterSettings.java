package io.github.gitmaster;

import io.github.gitmaster.util.Environment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Global settings, read from {@code ~/.config/gitmaster/gitmaster.properties}. Any key may be overridden with a JVM
 * system property of the same name.
 */
public final class GitMasterSettings {
    private static final Logger logger = LogManager.getLogger(GitMasterSettings.class);

    public static final Path CONFIG_DIR = Environment.getHomePath().resolve(".config").resolve("gitmaster");
    public static final Path GLOBAL_PROPERTIES_PATH = CONFIG_DIR.resolve("gitmaster.properties");

    public static final String GIT_EXECUTABLE_KEY = "git.executable";
    public static final String GIT_TIMEOUT_KEY = "git.timeout.seconds";
    public static final String MAX_SHELVES_KEY = "shelves.max";
    public static final String MAX_FILES_PER_SHELF_KEY = "shelves.maxFiles";

    public static final String DEFAULT_GIT_EXECUTABLE = "git";
    public static final int DEFAULT_GIT_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_MAX_SHELVES = 50;
    public static final int DEFAULT_MAX_FILES_PER_SHELF = 500;

    @Nullable
    private static GitMasterSettings globalCache = null; // protected by synchronized

    private final String gitExecutable;
    private final Duration gitTimeout;
    private final int maxShelves;
    private final int maxFilesPerShelf;

    public GitMasterSettings(Properties props) {
        this.gitExecutable =
                props.getProperty(GIT_EXECUTABLE_KEY, DEFAULT_GIT_EXECUTABLE).trim();
        int timeoutSeconds = intProperty(props, GIT_TIMEOUT_KEY, DEFAULT_GIT_TIMEOUT_SECONDS);
        this.gitTimeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        this.maxShelves = clampShelves(intProperty(props, MAX_SHELVES_KEY, DEFAULT_MAX_SHELVES));
        this.maxFilesPerShelf =
                clampFilesPerShelf(intProperty(props, MAX_FILES_PER_SHELF_KEY, DEFAULT_MAX_FILES_PER_SHELF));
    }

    public static GitMasterSettings defaults() {
        return new GitMasterSettings(new Properties());
    }

    /** Loads the global properties file (if any) and applies system property overrides. Cached after first load. */
    public static synchronized GitMasterSettings load() {
        if (globalCache != null) {
            return globalCache;
        }

        var props = new Properties();
        if (Files.exists(GLOBAL_PROPERTIES_PATH)) {
            try (var reader = Files.newBufferedReader(GLOBAL_PROPERTIES_PATH)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Unable to read global properties file: {}", e.getMessage());
            }
        }
        for (var key : new String[] {GIT_EXECUTABLE_KEY, GIT_TIMEOUT_KEY, MAX_SHELVES_KEY, MAX_FILES_PER_SHELF_KEY}) {
            var override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        globalCache = new GitMasterSettings(props);
        return globalCache;
    }

    private static int intProperty(Properties props, String key, int defaultValue) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultValue);
            return defaultValue;
        }
    }

    public static int clampShelves(int requested) {
        return clamp(requested, 1, 200);
    }

    public static int clampFilesPerShelf(int requested) {
        return clamp(requested, 1, 5000);
    }

    private static int clamp(int n, int min, int max) {
        return Math.max(min, Math.min(max, n));
    }

    public String getGitExecutable() {
        return gitExecutable;
    }

    public Duration getGitTimeout() {
        return gitTimeout;
    }

    public int getMaxShelves() {
        return maxShelves;
    }

    public int getMaxFilesPerShelf() {
        return maxFilesPerShelf;
    }
}
