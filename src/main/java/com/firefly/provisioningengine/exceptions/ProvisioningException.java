package com.firefly.provisioningengine.exceptions;

/**
 * Root of the provisioning engine's unchecked exception hierarchy.
 */
public class ProvisioningException extends RuntimeException {

    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
