package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.core.FailureKind;
import com.firefly.provisioningengine.core.FailureReason;
import com.firefly.provisioningengine.exceptions.AdapterException;
import com.firefly.provisioningengine.util.JsonUtils;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps adapter errors to {@link FailureKind#TRANSIENT} or {@link FailureKind#PERMANENT}.
 * <p>
 * Explicit {@link AdapterException}s keep their own classification. Timeouts, connection errors,
 * HTTP 408/429 and 5xx are transient. Everything else, including other 4xx responses, is permanent.
 */
public class ErrorClassifier {

    public FailureKind classify(Throwable error) {
        Throwable e = unwrap(error);
        if (e instanceof AdapterException ae) {
            return ae.isTransient() ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
        }
        if (e instanceof WebClientResponseException wre) {
            return forStatus(wre.getStatusCode().value());
        }
        if (e instanceof WebClientRequestException || e instanceof TimeoutException || e instanceof IOException) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    public boolean isTransient(Throwable error) {
        return classify(error) == FailureKind.TRANSIENT;
    }

    public FailureReason toReason(String stepId, Throwable error) {
        Throwable e = unwrap(error);
        String message = e instanceof TimeoutException
                ? "Step timed out"
                : JsonUtils.errorMessage(e, 500);
        return new FailureReason(stepId, classify(e), message);
    }

    public static FailureKind forStatus(int status) {
        if (status == 408 || status == 429 || status >= 500) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable e = Exceptions.unwrap(error);
        if (Exceptions.isRetryExhausted(e) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
