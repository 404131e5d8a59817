package com.firefly.provisioningengine.configstore;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvFileConfigurationStoreTest {

    @TempDir
    Path dir;

    @Test
    void loadsKeyValueLinesAndSkipsComments() throws Exception {
        Path file = dir.resolve("azure_config.env");
        Files.write(file, List.of(
                "# Fabric settings",
                "FABRIC_WORKSPACE_ID=ws-1",
                "export FABRIC_CAPACITY_ID=\"cap-1\"",
                "",
                "not a pair",
                "FABRIC_GRAPH_MODEL_ID='gm-1'"), StandardCharsets.UTF_8);

        Map<String, String> values = new EnvFileConfigurationStore(file).load().block();

        assertEquals(Map.of(
                "FABRIC_WORKSPACE_ID", "ws-1",
                "FABRIC_CAPACITY_ID", "cap-1",
                "FABRIC_GRAPH_MODEL_ID", "gm-1"), values);
    }

    @Test
    void missingFileLoadsEmpty() {
        Map<String, String> values = new EnvFileConfigurationStore(dir.resolve("absent.env")).load().block();

        assertNotNull(values);
        assertTrue(values.isEmpty());
    }

    @Test
    void writeReplacesInPlaceAppendsNewKeysAndKeepsComments() throws Exception {
        Path file = dir.resolve("nested").resolve("azure_config.env");
        Files.createDirectories(file.getParent());
        Files.write(file, List.of(
                "# keep me",
                "export FABRIC_WORKSPACE_ID=old",
                "OTHER=x"), StandardCharsets.UTF_8);
        Map<String, String> updates = new LinkedHashMap<>();
        updates.put("FABRIC_WORKSPACE_ID", "ws-2");
        updates.put("FABRIC_GRAPH_MODEL_ID", "gm-2");

        new EnvFileConfigurationStore(file).write(updates).block();

        assertEquals(List.of(
                "# keep me",
                "FABRIC_WORKSPACE_ID=ws-2",
                "OTHER=x",
                "FABRIC_GRAPH_MODEL_ID=gm-2"), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    void writeCreatesTheFile() {
        Path file = dir.resolve("new").resolve("config.env");
        EnvFileConfigurationStore store = new EnvFileConfigurationStore(file);

        store.write(Map.of("KEY", "value")).block();

        assertEquals(Map.of("KEY", "value"), store.load().block());
    }
}
