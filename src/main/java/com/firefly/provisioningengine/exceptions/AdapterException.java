package com.firefly.provisioningengine.exceptions;

/**
 * Base class for errors raised by resource adapters. Adapters may throw either subclass to state the
 * classification explicitly; anything else is classified by the engine.
 */
public abstract class AdapterException extends ProvisioningException {

    protected AdapterException(String message) {
        super(message);
    }

    protected AdapterException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isTransient();
}
