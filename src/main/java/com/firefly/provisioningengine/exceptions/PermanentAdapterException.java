package com.firefly.provisioningengine.exceptions;

/**
 * Malformed data, conflicting resource state, missing prerequisites. Needs operator intervention.
 */
public class PermanentAdapterException extends AdapterException {

    public PermanentAdapterException(String message) {
        super(message);
    }

    public PermanentAdapterException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
