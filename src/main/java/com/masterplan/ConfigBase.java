package com.masterplan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.Reader;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these options
 * via the Config interfaces of Components.
 *
 * An example config file is shipped with the project, so it's easy to see an exhaustive list of all parameters. All
 * configuration parameters are therefore required, to avoid any confusion due to merging layers of defaults.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "masterplan-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators, and must be prefixed with "masterplan", e.g. MASTERPLAN_HEAVY_THREADS=2 or
     * java -Dmasterplan.heavy.threads=2.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new RuntimeException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. These record missing keys and parse errors,
    // allowing config loading to continue and reporting as many problems as possible at once.

    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected long longProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Long.parseLong(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected double doubleProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Double.parseDouble(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    /**
     * Call this after reading all properties to enforce the presence of all configuration options.
     * @throws IllegalArgumentException naming every missing or unparseable key.
     */
    protected void checkForErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new IllegalArgumentException(
                "You must provide valid values for these configuration properties: " + String.join(", ", keysWithErrors)
            );
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties.
     * Case and separators are normalized to conform to both properties and environment variable conventions.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to all lower case, all dash separators.
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String) entry.getValue());
            if (key.startsWith(PROPERTY_PREFIX)) {
                key = key.substring(PROPERTY_PREFIX.length());
                if (properties.getProperty(key) != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
