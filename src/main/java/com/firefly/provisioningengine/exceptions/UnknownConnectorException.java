package com.firefly.provisioningengine.exceptions;

/**
 * Raised when a connector name has no binding in the registry for its data category.
 */
public class UnknownConnectorException extends ValidationException {
    private final String category;
    private final String connector;

    public UnknownConnectorException(String category, String connector) {
        super("Unknown " + category + " connector: " + connector);
        this.category = category;
        this.connector = connector;
    }

    public String getCategory() {
        return category;
    }

    public String getConnector() {
        return connector;
    }
}
