package io.fullerstack.rmw.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.Set;

/**
 * Middleware configuration backed by a {@link ResourceBundle} (zero dependencies).
 *
 * <p>Lookup order for every key:
 * <ol>
 *   <li>System property with the same name ({@code -Drmw.subscription.queue-depth=50})</li>
 *   <li>{@code rmw.properties} on the classpath</li>
 * </ol>
 *
 * <p><strong>Example:</strong>
 * <pre>
 * # rmw.properties
 * rmw.subscription.queue-depth=10
 * rmw.discovery.automatic-range=LOCALHOST
 * rmw.wait.slow-wait-warn-ms=1000
 * </pre>
 *
 * <pre>
 * RmwConfig config = RmwConfig.global();
 * int depth = config.getInt(RmwConfig.SUBSCRIPTION_QUEUE_DEPTH, 10);
 * </pre>
 */
public class RmwConfig {

    public static final String BUNDLE_NAME = "rmw";

    public static final String SUBSCRIPTION_QUEUE_DEPTH = "rmw.subscription.queue-depth";
    public static final String DISCOVERY_AUTOMATIC_RANGE = "rmw.discovery.automatic-range";
    public static final String SLOW_WAIT_WARN_MS = "rmw.wait.slow-wait-warn-ms";

    private final ResourceBundle bundle;
    private final String context;

    private RmwConfig(ResourceBundle bundle, String context) {
        this.bundle = bundle;
        this.context = context;
    }

    /**
     * Get global configuration ({@code rmw.properties}).
     *
     * @return Global configuration
     */
    public static RmwConfig global() {
        return fromBundle(BUNDLE_NAME);
    }

    /**
     * Get configuration from an arbitrary bundle on the classpath.
     *
     * @param baseName bundle base name (e.g. "rmw")
     * @return configuration backed by that bundle
     * @throws ConfigurationException if the bundle does not exist
     */
    public static RmwConfig fromBundle(String baseName) {
        Objects.requireNonNull(baseName, "baseName cannot be null");
        if (baseName.isBlank()) {
            throw new IllegalArgumentException("baseName cannot be blank");
        }
        try {
            return new RmwConfig(ResourceBundle.getBundle(baseName, Locale.ROOT), "bundle:" + baseName);
        } catch (MissingResourceException e) {
            throw new ConfigurationException("Missing configuration bundle '" + baseName + "'", e);
        }
    }

    // =========================================================================
    // Type-safe getters with system property override support
    // =========================================================================

    /**
     * Get string value.
     *
     * @param key Property key
     * @return Property value
     * @throws ConfigurationException if key not found
     */
    public String getString(String key) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            throw new ConfigurationException(
                "Missing config key '" + key + "' in context: " + context, e
            );
        }
    }

    /**
     * Get string value with default.
     *
     * @param key Property key
     * @param defaultValue Default if not found
     * @return Property value or default
     */
    public String getString(String key, String defaultValue) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return defaultValue;
        }
    }

    /**
     * Get int value.
     *
     * @param key Property key
     * @return Property value as int
     * @throws ConfigurationException if key not found or invalid format
     */
    public int getInt(String key) {
        String value = getString(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "': " + value, e
            );
        }
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
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
     * Get enum constant by (case-insensitive) name.
     *
     * @param key Property key
     * @param type Enum type
     * @param defaultValue Default if the key is not set
     * @return the matching constant or the default
     * @throws ConfigurationException if the key is set to a name that is not a constant of {@code type}
     */
    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Invalid " + type.getSimpleName() + " value for key '" + key + "': " + value, e
            );
        }
    }

    /**
     * Check if key exists in configuration.
     *
     * @param key Property key
     * @return true if key exists
     */
    public boolean contains(String key) {
        if (System.getProperty(key) != null) {
            return true;
        }
        return bundle.containsKey(key);
    }

    public Set<String> keys() {
        return bundle.keySet();
    }

    /**
     * @return Context description (e.g., "bundle:rmw")
     */
    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return "RmwConfig[context=" + context + "]";
    }
}
