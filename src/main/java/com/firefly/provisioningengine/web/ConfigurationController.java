package com.firefly.provisioningengine.web;

import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.configstore.ConfigurationSnapshot;
import com.firefly.provisioningengine.exceptions.ValidationException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads and writes the shared configuration. Writes go straight to the store and drop every cached view.
 */
@RestController
@RequestMapping("/api/config")
public class ConfigurationController {
    private static final Pattern KEY = Pattern.compile("[A-Z][A-Z0-9_]*");

    private final ConfigurationAccessor configuration;

    public ConfigurationController(ConfigurationAccessor configuration) {
        this.configuration = configuration;
    }

    @GetMapping
    public Mono<Map<String, String>> read() {
        return configuration.current().map(ConfigurationSnapshot::values);
    }

    @PostMapping
    public Mono<Map<String, String>> write(@RequestBody Map<String, String> updates) {
        return Mono.fromRunnable(() -> validate(updates))
                .then(configuration.write(updates))
                .then(configuration.current())
                .map(ConfigurationSnapshot::values);
    }

    private static void validate(Map<String, String> updates) {
        if (updates == null || updates.isEmpty()) {
            throw new ValidationException("No configuration keys given");
        }
        updates.forEach((key, value) -> {
            if (key == null || !KEY.matcher(key).matches()) {
                throw new ValidationException("Invalid configuration key '" + key + "'");
            }
            if (value == null) {
                throw new ValidationException("Missing value for configuration key '" + key + "'");
            }
        });
    }
}
