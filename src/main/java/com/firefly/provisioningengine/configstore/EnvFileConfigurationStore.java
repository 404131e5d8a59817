package com.firefly.provisioningengine.configstore;

import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persists configuration as {@code KEY=value} lines in a dotenv-style file. Existing keys are replaced in place;
 * new keys are appended; comments and unrelated lines are preserved.
 */
public class EnvFileConfigurationStore implements ConfigurationStore {
    private static final Logger log = LoggerFactory.getLogger(EnvFileConfigurationStore.class);

    private final Path file;
    private final Object lock = new Object();

    public EnvFileConfigurationStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    @Override
    public Mono<Map<String, String>> load() {
        return Mono.fromCallable(this::readValues).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> write(Map<String, String> updates) {
        return Mono.fromRunnable(() -> writeValues(updates)).subscribeOn(Schedulers.boundedElastic()).then();
    }

    private Map<String, String> readValues() {
        Map<String, String> values = new LinkedHashMap<>();
        synchronized (lock) {
            for (String line : readLines()) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                int eq = trimmed.indexOf('=');
                if (eq <= 0) continue;
                String key = trimmed.substring(0, eq).trim();
                if (key.startsWith("export ")) key = key.substring("export ".length()).trim();
                values.put(key, unquote(trimmed.substring(eq + 1).trim()));
            }
        }
        return values;
    }

    private void writeValues(Map<String, String> updates) {
        synchronized (lock) {
            List<String> lines = new ArrayList<>(readLines());
            Set<String> pending = new LinkedHashSet<>(updates.keySet());
            for (int i = 0; i < lines.size(); i++) {
                String trimmed = lines.get(i).trim();
                int eq = trimmed.indexOf('=');
                if (trimmed.startsWith("#") || eq <= 0) continue;
                String key = trimmed.substring(0, eq).trim();
                if (key.startsWith("export ")) key = key.substring("export ".length()).trim();
                if (pending.remove(key)) {
                    lines.set(i, key + "=" + updates.get(key));
                }
            }
            for (String key : pending) {
                lines.add(key + "=" + updates.get(key));
            }
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.write(file, lines, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write configuration file " + file, e);
            }
            log.info(JsonUtils.json(
                    "config_store", "written",
                    "file", file.toString(),
                    "keys", String.join(",", updates.keySet())
            ));
        }
    }

    private List<String> readLines() {
        if (!Files.exists(file)) return List.of();
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration file " + file, e);
        }
    }

    private static String unquote(String v) {
        if (v.length() >= 2 && ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'")))) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }
}
