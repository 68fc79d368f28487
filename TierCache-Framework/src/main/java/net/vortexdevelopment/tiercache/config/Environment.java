package net.vortexdevelopment.tiercache.config;

import net.vortexdevelopment.tiercache.debug.DebugLogger;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Resolves cache settings with the following priority:
 * - Environment variables (highest priority)
 * - System properties
 * - application.properties file (lowest priority)
 */
public class Environment {
    private static Environment instance;
    private final Properties applicationProperties;

    private Environment() {
        applicationProperties = new Properties();
        loadApplicationProperties();
    }

    /**
     * Create an environment backed by the given properties instead of application.properties.
     * Environment variables and system properties still take precedence.
     *
     * @param properties the fallback properties
     */
    public Environment(Properties properties) {
        applicationProperties = new Properties();
        applicationProperties.putAll(properties);
    }

    /**
     * Get the singleton Environment instance.
     *
     * @return The Environment instance
     */
    public static Environment getInstance() {
        if (instance == null) {
            synchronized (Environment.class) {
                if (instance == null) {
                    instance = new Environment();
                }
            }
        }
        return instance;
    }

    /**
     * Load properties from application.properties.
     *
     * <p>Looks for application.properties in the following order:
     * <ol>
     *   <li>Current working directory (where the application is run from)</li>
     *   <li>Classpath resource</li>
     * </ol>
     */
    private void loadApplicationProperties() {
        boolean loaded = false;

        String workingDir = System.getProperty("user.dir");
        File propertiesFile = new File(workingDir, "application.properties");
        if (propertiesFile.exists() && propertiesFile.isFile()) {
            try (FileInputStream fileInputStream = new FileInputStream(propertiesFile)) {
                applicationProperties.load(fileInputStream);
                loaded = true;
            } catch (Exception e) {
                DebugLogger.warn(Environment.class, "Could not read %s: %s", propertiesFile, e.getMessage());
            }
        }

        if (!loaded) {
            try (InputStream inputStream = Environment.class.getClassLoader()
                    .getResourceAsStream("application.properties")) {
                if (inputStream != null) {
                    applicationProperties.load(inputStream);
                }
            } catch (Exception e) {
                DebugLogger.warn(Environment.class, "Could not read classpath application.properties: %s", e.getMessage());
            }
        }
    }

    /**
     * Get a property value with resolution priority:
     * 1. Environment variables (converted from dot notation to UPPER_SNAKE_CASE)
     * 2. System properties
     * 3. application.properties file
     *
     * @param key The property key (supports dot notation, e.g., "tiercache.cache-dir")
     * @return The property value, or null if not found
     */
    public String getProperty(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }

        String value = System.getenv(convertToEnvKey(key));
        if (value != null) {
            return value;
        }

        value = System.getProperty(key);
        if (value != null) {
            return value;
        }

        return applicationProperties.getProperty(key);
    }

    /**
     * Get a property value with a default value if not found.
     */
    public String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get a property value as an integer.
     *
     * @param key The property key
     * @param defaultValue The default value if property is not found or invalid
     * @return The integer value
     */
    public int getPropertyAsInt(String key, int defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Get a property value as a long.
     *
     * @param key The property key
     * @param defaultValue The default value if property is not found or invalid
     * @return The long value
     */
    public long getPropertyAsLong(String key, long defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Get a property value as a boolean.
     */
    public boolean getPropertyAsBoolean(String key, boolean defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Get a comma separated property as a list of trimmed, non-empty values.
     */
    public List<String> getPropertyAsList(String key) {
        List<String> values = new ArrayList<>();
        String value = getProperty(key);
        if (value == null) {
            return values;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    /**
     * Convert a property key from dot notation to environment variable format.
     * Example: "tiercache.cache-dir" -> "TIERCACHE_CACHE_DIR"
     */
    private String convertToEnvKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }
}
