package io.fullerstack.switchboard.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.TreeSet;

/**
 * Layered configuration backed by {@link ResourceBundle} (zero dependencies).
 *
 * <p>Lookup order, first match wins:
 * <ol>
 *   <li>system property</li>
 *   <li>switchboard-{hub}.properties (hub-specific, optional)</li>
 *   <li>switchboard.properties (global defaults)</li>
 *   <li>the default passed by the caller</li>
 * </ol>
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # switchboard.properties
 * switchboard.subscription.policy=per-instance
 * switchboard.export.graph-name=Hub
 *
 * # switchboard-ingest.properties
 * switchboard.subscription.policy=per-kind
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <pre>
 * java -Dswitchboard.subscription.policy=per-kind -jar app.jar
 * </pre>
 */
public class SwitchboardConfig {

    private static final Logger logger = LoggerFactory.getLogger(SwitchboardConfig.class);

    public static final String POLICY = "switchboard.subscription.policy";
    public static final String GRAPH_NAME = "switchboard.export.graph-name";
    public static final String RANKDIR = "switchboard.export.rankdir";

    private static final String BASE_NAME = "switchboard";
    private static final ResourceBundle.Control PROPERTIES_ONLY =
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final List<ResourceBundle> bundles;
    private final String context;  // For debugging/logging

    private SwitchboardConfig(List<ResourceBundle> bundles, String context) {
        this.bundles = bundles;
        this.context = context;
    }

    /**
     * Global configuration (switchboard.properties).
     */
    public static SwitchboardConfig global() {
        List<ResourceBundle> bundles = new ArrayList<>(1);
        load(BASE_NAME, bundles);
        return new SwitchboardConfig(bundles, "global");
    }

    /**
     * Hub-specific configuration falling back to the global one.
     *
     * @param hubName hub name (e.g., "ingest", "ui")
     */
    public static SwitchboardConfig forHub(String hubName) {
        Objects.requireNonNull(hubName, "hubName cannot be null");
        if (hubName.isBlank()) {
            throw new IllegalArgumentException("hubName cannot be blank");
        }
        List<ResourceBundle> bundles = new ArrayList<>(2);
        load(BASE_NAME + "-" + hubName, bundles);
        load(BASE_NAME, bundles);
        return new SwitchboardConfig(bundles, "hub:" + hubName);
    }

    private static void load(String baseName, List<ResourceBundle> bundles) {
        try {
            bundles.add(ResourceBundle.getBundle(baseName, Locale.ROOT, PROPERTIES_ONLY));
        } catch (MissingResourceException e) {
            logger.debug("No {}.properties on the classpath, skipping layer", baseName);
        }
    }

    // =========================================================================
    // Type-safe getters with system property override support
    // =========================================================================

    /**
     * @throws ConfigurationException if the key is not found
     */
    public String getString(String key) {
        String value = lookup(key);
        if (value == null) {
            throw new ConfigurationException("Missing config key '" + key + "' in context: " + context);
        }
        return value;
    }

    public String getString(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @throws ConfigurationException if the key is not found or not an int
     */
    public int getInt(String key) {
        return parseInt(key, getString(key));
    }

    /**
     * @throws ConfigurationException if the key is present but not an int
     */
    public int getInt(String key, int defaultValue) {
        String value = lookup(key);
        return value != null ? parseInt(key, value) : defaultValue;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid int value for key '" + key + "': " + value, e);
        }
    }

    public boolean getBoolean(String key) {
        return Boolean.parseBoolean(getString(key).trim());
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = lookup(key);
        return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    /**
     * Enum value matched case-insensitively, with '-' standing for '_' ({@code per-kind}
     * reads as {@code PER_KIND}).
     *
     * @throws ConfigurationException if the key is present but names no constant
     */
    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        String constant = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, constant);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Invalid " + type.getSimpleName() + " value for key '" + key + "': " + value, e);
        }
    }

    public boolean contains(String key) {
        return lookup(key) != null;
    }

    /**
     * All keys defined by the property files of this configuration.
     */
    public Set<String> keys() {
        Set<String> keys = new TreeSet<>();
        for (ResourceBundle bundle : bundles) {
            keys.addAll(bundle.keySet());
        }
        return Collections.unmodifiableSet(keys);
    }

    /**
     * Configuration context (e.g., "global", "hub:ingest").
     */
    public String context() {
        return context;
    }

    private String lookup(String key) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }
        for (ResourceBundle bundle : bundles) {
            if (bundle.containsKey(key)) {
                return bundle.getString(key);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "SwitchboardConfig[context=" + context + "]";
    }
}
