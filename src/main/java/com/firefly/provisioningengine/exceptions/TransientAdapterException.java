package com.firefly.provisioningengine.exceptions;

/**
 * Network timeout, throttling, a resource that is still indexing. Safe to retry from the failed step.
 */
public class TransientAdapterException extends AdapterException {

    public TransientAdapterException(String message) {
        super(message);
    }

    public TransientAdapterException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
