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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-series tables in the eventhouse's KQL database, one per CSV file in the {@code telemetry-dir} data-source
 * parameter.
 * <p>
 * Create runs {@code .create-merge table}; columns are typed from the optional {@code column-types} parameter
 * ({@code Timestamp:datetime,Value:real}) and default to {@code string}. Populate ingests rows inline in batches
 * of {@value #BATCH_SIZE}. Exists when every table is present and holds rows.
 */
public class KustoTableAdapter implements ResourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(KustoTableAdapter.class);

    public static final String TELEMETRY_DIR = "telemetry-dir";
    public static final String COLUMN_TYPES = "column-types";
    public static final int BATCH_SIZE = 500;

    private final KustoRestClient kusto;

    public KustoTableAdapter(KustoRestClient kusto) {
        this.kusto = kusto;
    }

    @Override
    public String key() {
        return AdapterKeys.TIMESERIES_TABLES;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        String uri = target.require(ConfigKeys.EVENTHOUSE_QUERY_URI);
        String db = target.require(ConfigKeys.KQL_DB_NAME);
        return CsvFiles.list(target.requireParam(TELEMETRY_DIR))
                .filter(files -> !files.isEmpty())
                .flatMap(files -> Flux.fromIterable(files)
                        .concatMap(file -> rowCount(uri, db, CsvFiles.tableName(file)))
                        .all(count -> count > 0)
                        .filter(Boolean::booleanValue)
                        .map(ok -> tables(files)));
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        String uri = target.require(ConfigKeys.EVENTHOUSE_QUERY_URI);
        String db = target.require(ConfigKeys.KQL_DB_NAME);
        Map<String, String> types = columnTypes(target.param(COLUMN_TYPES).orElse(""));
        return CsvFiles.list(target.requireParam(TELEMETRY_DIR))
                .flatMap(files -> Flux.fromIterable(files)
                        .concatMap(CsvFiles::readTable)
                        .concatMap(table -> kusto.mgmt(uri, db, createMergeCommand(table.name(), table.columns(), types))
                                .doOnSuccess(r -> log.info(JsonUtils.json("kusto_table", "created", "table", table.name()))))
                        .then(Mono.fromCallable(() -> tables(files))));
    }

    @Override
    public Mono<Void> populate(ResourceTarget target, DiscoveredResource resource) {
        String uri = target.require(ConfigKeys.EVENTHOUSE_QUERY_URI);
        String db = target.require(ConfigKeys.KQL_DB_NAME);
        return CsvFiles.list(target.requireParam(TELEMETRY_DIR))
                .flatMapMany(Flux::fromIterable)
                .concatMap(CsvFiles::readTable)
                .concatMap(table -> Flux.fromIterable(batches(table.rows()))
                        .concatMap(batch -> kusto.mgmt(uri, db, ingestCommand(table.name(), batch)))
                        .then(Mono.fromRunnable(() -> log.info(JsonUtils.json(
                                "kusto_table", "ingested",
                                "table", table.name(),
                                "rows", Integer.toString(table.rows().size())
                        )))))
                .then();
    }

    static String createMergeCommand(String table, List<String> columns, Map<String, String> types) {
        StringBuilder sb = new StringBuilder(".create-merge table ").append(table).append(" (");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sb.append(", ");
            String col = columns.get(i);
            sb.append("['").append(col).append("']: ").append(types.getOrDefault(col, "string"));
        }
        return sb.append(")").toString();
    }

    static String ingestCommand(String table, List<String> rows) {
        return ".ingest inline into table " + table + " <|\n" + String.join("\n", rows);
    }

    static List<List<String>> batches(List<String> rows) {
        List<List<String>> out = new ArrayList<>();
        for (int start = 0; start < rows.size(); start += BATCH_SIZE) {
            out.add(rows.subList(start, Math.min(rows.size(), start + BATCH_SIZE)));
        }
        return out;
    }

    static Map<String, String> columnTypes(String spec) {
        Map<String, String> types = new LinkedHashMap<>();
        for (String pair : spec.split(",")) {
            int colon = pair.indexOf(':');
            if (colon > 0) {
                types.put(pair.substring(0, colon).trim(), pair.substring(colon + 1).trim());
            }
        }
        return types;
    }

    private Mono<Long> rowCount(String uri, String db, String table) {
        return kusto.query(uri, db, "['" + table + "'] | count")
                .map(result -> result.rows().isEmpty() ? 0L : result.rows().get(0).path(0).asLong(0L))
                .onErrorResume(FabricApiException.class,
                        e -> e.getStatus() == 400 ? Mono.just(0L) : Mono.error(e));
    }

    private static DiscoveredResource tables(List<Path> files) {
        return DiscoveredResource.of(ConfigKeys.TELEMETRY_TABLES,
                String.join(",", files.stream().map(CsvFiles::tableName).toList()));
    }
}
