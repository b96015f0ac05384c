package ch.ethz.systems.clusterbench.core.config.exceptions;

import ch.ethz.systems.clusterbench.core.config.NBProperties;

public class PropertyMissingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PropertyMissingException(NBProperties properties, String property) {
        super("Property missing: " + property
                + (properties.getFileName() == null ? "" : " (in " + properties.getFileName() + ")"));
    }

}
