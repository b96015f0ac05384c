package ch.ethz.systems.clusterbench.core.config.exceptions;

import ch.ethz.systems.clusterbench.core.config.NBProperties;

/**
 * Thrown when a property is present but its value cannot be parsed
 * or lies outside of the range the consumer accepts.
 */
public class PropertyValueInvalidException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PropertyValueInvalidException(NBProperties properties, String property) {
        super("Property value invalid: " + property + "=" + properties.getProperty(property));
    }

    public PropertyValueInvalidException(NBProperties properties, String property, String requirement) {
        super("Property value invalid: " + property + "=" + properties.getProperty(property)
                + " (" + requirement + ")");
    }

}
