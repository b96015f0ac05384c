package ch.ethz.systems.clusterbench.core.config;

import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyMissingException;
import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyNotExistingException;
import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyValueInvalidException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.Properties;

/**
 * Run configuration. A thin layer over {@link Properties} which restricts
 * the accepted keys to the given allowed lists and offers typed getters
 * that fail loudly when a value is missing or malformed.
 *
 * @see BaseAllowedProperties
 */
public class NBProperties extends Properties {

    private static final long serialVersionUID = 1L;

    private final String fileName;
    private final Set<String> allowedProperties;

    /**
     * Load the configuration from a properties file.
     *
     * @param fileName          Path to the properties file
     * @param allowedLists      Lists of keys which are allowed to appear
     */
    public NBProperties(String fileName, String[]... allowedLists) {
        this.fileName = fileName;
        this.allowedProperties = collect(allowedLists);
        try (InputStream input = new FileInputStream(fileName)) {
            load(input);
        } catch (IOException e) {
            throw new RuntimeException("Could not read configuration file " + fileName, e);
        }
        checkAllowed();
    }

    /**
     * Create an empty configuration which is filled programmatically.
     *
     * @param allowedLists      Lists of keys which are allowed to appear
     */
    public NBProperties(String[]... allowedLists) {
        this.fileName = null;
        this.allowedProperties = collect(allowedLists);
    }

    private static Set<String> collect(String[]... allowedLists) {
        Set<String> allowed = new HashSet<>();
        for (String[] list : allowedLists) {
            allowed.addAll(Arrays.asList(list));
        }
        return allowed;
    }

    private void checkAllowed() {
        for (String key : stringPropertyNames()) {
            if (!allowedProperties.contains(key)) {
                throw new PropertyNotExistingException(key);
            }
        }
    }

    /**
     * Override (or add) a property, e.g. from a command line argument.
     *
     * @param key       Property key
     * @param value     New value
     */
    public void overrideProperty(String key, String value) {
        if (!allowedProperties.contains(key)) {
            throw new PropertyNotExistingException(key);
        }
        setProperty(key, value);
    }

    public boolean isPropertyDefined(String property) {
        return getProperty(property) != null;
    }

    public String getFileName() {
        return fileName;
    }

    // =========================================================================
    // STRING
    // =========================================================================

    public String getPropertyOrFail(String property) {
        String value = getProperty(property);
        if (value == null) {
            throw new PropertyMissingException(this, property);
        }
        return value.trim();
    }

    public String getPropertyWithDefault(String property, String defaultValue) {
        String value = getProperty(property);
        return value == null ? defaultValue : value.trim();
    }

    // =========================================================================
    // INTEGER
    // =========================================================================

    public int getIntegerPropertyOrFail(String property) {
        String value = getPropertyOrFail(property);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new PropertyValueInvalidException(this, property, "must be an integer");
        }
    }

    public int getIntegerPropertyWithDefault(String property, int defaultValue) {
        return isPropertyDefined(property) ? getIntegerPropertyOrFail(property) : defaultValue;
    }

    // =========================================================================
    // LONG
    // =========================================================================

    public long getLongPropertyOrFail(String property) {
        String value = getPropertyOrFail(property);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new PropertyValueInvalidException(this, property, "must be a long");
        }
    }

    public long getLongPropertyWithDefault(String property, long defaultValue) {
        return isPropertyDefined(property) ? getLongPropertyOrFail(property) : defaultValue;
    }

    // =========================================================================
    // DOUBLE
    // =========================================================================

    public double getDoublePropertyOrFail(String property) {
        String value = getPropertyOrFail(property);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new PropertyValueInvalidException(this, property, "must be a double");
        }
    }

    public double getDoublePropertyWithDefault(String property, double defaultValue) {
        return isPropertyDefined(property) ? getDoublePropertyOrFail(property) : defaultValue;
    }

    // =========================================================================
    // BOOLEAN
    // =========================================================================

    public boolean getBooleanPropertyOrFail(String property) {
        String value = getPropertyOrFail(property);
        if (value.equalsIgnoreCase("true")) {
            return true;
        } else if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new PropertyValueInvalidException(this, property, "must be true or false");
    }

    public boolean getBooleanPropertyWithDefault(String property, boolean defaultValue) {
        return isPropertyDefined(property) ? getBooleanPropertyOrFail(property) : defaultValue;
    }

    /**
     * Render all properties sorted by key, one per line, for the run folder.
     *
     * @return  Properties as text
     */
    public String getAllPropertiesToString() {
        StringBuilder builder = new StringBuilder();
        builder.append("# Run configuration").append(fileName == null ? "" : " (" + fileName + ")").append("\n");
        for (String key : new TreeSet<>(stringPropertyNames())) {
            builder.append(key).append("=").append(getProperty(key)).append("\n");
        }
        return builder.toString();
    }

}
