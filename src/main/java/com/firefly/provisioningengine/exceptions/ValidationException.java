package com.firefly.provisioningengine.exceptions;

/**
 * Bad input: unknown scenario, malformed scenario id, unknown connector, mismatched resume marker.
 * Never retried; surfaced to the caller immediately.
 */
public class ValidationException extends ProvisioningException {

    public ValidationException(String message) {
        super(message);
    }
}
