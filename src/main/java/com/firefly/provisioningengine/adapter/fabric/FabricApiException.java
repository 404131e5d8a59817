package com.firefly.provisioningengine.adapter.fabric;

import com.firefly.provisioningengine.exceptions.AdapterException;

/**
 * Non-success response from a Fabric, OneLake or Kusto endpoint. Throttling (429), request timeouts (408) and
 * server errors are transient; other statuses are permanent.
 */
public class FabricApiException extends AdapterException {
    private final int status;

    public FabricApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public boolean isTransient() {
        return status == 408 || status == 429 || status >= 500;
    }
}
