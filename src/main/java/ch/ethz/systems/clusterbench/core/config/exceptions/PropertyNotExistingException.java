package ch.ethz.systems.clusterbench.core.config.exceptions;

/**
 * Thrown when a run configuration contains a key that no component
 * recognizes (most often a typo in the properties file).
 */
public class PropertyNotExistingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PropertyNotExistingException(String property) {
        super("Property does not exist (not in any allowed list): " + property);
    }

}
