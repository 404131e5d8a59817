package com.firefly.provisioningengine.web;

import com.firefly.provisioningengine.exceptions.RunInProgressException;
import com.firefly.provisioningengine.exceptions.ValidationException;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

@RestControllerAdvice(assignableTypes = {
        ProvisioningController.class, HealthController.class, ConfigurationController.class, QueryController.class})
public class ProvisioningExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(ValidationException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), null);
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<Map<String, Object>> runInProgress(RunInProgressException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), e.getRunId());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> notFound(NoSuchElementException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), null);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String runId) {
        log.info(JsonUtils.json(
                "provisioning_http", "rejected",
                "status", Integer.toString(status.value()),
                "error_msg", JsonUtils.safeString(message, 300)
        ));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (runId != null) body.put("run_id", runId);
        return ResponseEntity.status(status).body(body);
    }
}
