package com.firefly.provisioningengine.adapter.fabric;

import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the uploaded CSV files into managed delta tables, one table per file. Exists when every table is
 * already listed by the lakehouse ({@code {"data":[{"name":...}]}}).
 */
public class LakehouseTableAdapter implements ResourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(LakehouseTableAdapter.class);

    private final FabricRestClient client;

    public LakehouseTableAdapter(FabricRestClient client) {
        this.client = client;
    }

    @Override
    public String key() {
        return AdapterKeys.LAKEHOUSE_TABLES;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        List<String> expected = expectedTables(target);
        return client.get(tablesPath(target))
                .flatMapIterable(listing -> listing.path("data"))
                .map(table -> table.path("name").asText(""))
                .collect(HashSet<String>::new, Set::add)
                .filter(present -> !expected.isEmpty() && present.containsAll(expected))
                .map(present -> loaded(expected));
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        List<String> tables = expectedTables(target);
        return Flux.fromIterable(tables)
                .concatMap(table -> client.postAndWait(tablesPath(target) + "/" + table + "/load",
                                loadBody(table), "load table " + table)
                        .doOnSuccess(r -> log.info(JsonUtils.json(
                                "lakehouse_table", "loaded",
                                "table", table
                        ))))
                .then(Mono.fromCallable(() -> loaded(tables)));
    }

    static Map<String, Object> loadBody(String table) {
        Map<String, Object> format = new LinkedHashMap<>();
        format.put("format", "Csv");
        format.put("header", true);
        format.put("delimiter", ",");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("relativePath", "Files/" + table + ".csv");
        body.put("pathType", "File");
        body.put("mode", "Overwrite");
        body.put("formatOptions", format);
        return body;
    }

    private static String tablesPath(ResourceTarget target) {
        return "/workspaces/" + target.require(ConfigKeys.WORKSPACE_ID)
                + "/lakehouses/" + target.require(ConfigKeys.LAKEHOUSE_ID) + "/tables";
    }

    private static List<String> expectedTables(ResourceTarget target) {
        return Arrays.stream(target.require(ConfigKeys.UPLOADED_FILES).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static DiscoveredResource loaded(List<String> tables) {
        return DiscoveredResource.of(ConfigKeys.LAKEHOUSE_TABLES, String.join(",", tables));
    }
}
