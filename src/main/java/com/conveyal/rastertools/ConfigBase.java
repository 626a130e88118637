package com.conveyal.rastertools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.Reader;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information.
 *
 * Unlike a server configuration, every option has a default, since the processing tools are mostly used as a library
 * with no configuration file at all. Values that are present but cannot be parsed are logged and collected, so that
 * all problems can be reported at once by throwIfErrors().
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "rastertools-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators. System properties can be set on the JVM command line with -D options. The usual config file keys
     * must be prefixed with "rastertools", e.g. RASTERTOOLS_MAX_WORKERS=4 or java -Drastertools.max.workers=4.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     * The environment and system properties are passed in, usually System.getenv() and System.getProperties().
     */
    protected ConfigBase (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        this.properties = new Properties();
        // Config file keys are normalized the same way as the overrides, so they can be matched against each other.
        for (String key : properties.stringPropertyNames()) {
            this.properties.setProperty(normalize(key), properties.getProperty(key));
        }
        setPropertiesFromMap(environment, "environment variable");
        setPropertiesFromMap(systemProperties, "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new RasterConfigurationException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log parse exceptions, allowing
    // config loading to continue and reporting as many problems as possible at once.

    /** @return the value of the given key, or null if it is not set. */
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        return value == null ? null : value.trim();
    }

    protected int intProp (String key, int defaultValue) {
        String val = strProp(key);
        if (val == null || val.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException nfe) {
            LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
            keysWithErrors.add(key);
        }
        return defaultValue;
    }

    protected boolean boolProp (String key, boolean defaultValue) {
        String val = strProp(key);
        if (val == null || val.isEmpty()) {
            return defaultValue;
        }
        // Boolean.parseBoolean will return false for any string other than "true".
        // We want to be more strict.
        if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val) || "1".equals(val)) {
            return true;
        } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val) || "0".equals(val)) {
            return false;
        }
        LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
        keysWithErrors.add(key);
        return defaultValue;
    }

    /** Call this after reading all properties to report every option that could not be used. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new RasterConfigurationException(
                    "Invalid values for configuration properties: " + String.join(", ", keysWithErrors));
        }
    }

    private static String normalize (String key) {
        return key.toLowerCase(Locale.ROOT).replaceAll("[\\._-]", "-");
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String) || !(entry.getValue() instanceof String)) continue;
            // Normalize to String type, all lower case, all dash separators.
            String key = normalize((String) entry.getKey());
            String value = (String) entry.getValue();
            if (key.startsWith(PROPERTY_PREFIX)) {
                // Strip off the prefix to get the key that would be used in a config file.
                key = key.substring(PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
