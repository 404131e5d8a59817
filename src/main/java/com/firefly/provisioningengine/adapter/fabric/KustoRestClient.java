package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.util.JsonUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kusto REST v1 client for an eventhouse: management commands ({@code /v1/rest/mgmt}) and queries
 * ({@code /v1/rest/query}). The cluster URI is passed per call because it is discovered at provisioning time.
 */
public class KustoRestClient {
    private final WebClient webClient;
    private final AccessTokenProvider tokens;

    public KustoRestClient(WebClient webClient, AccessTokenProvider tokens) {
        this.webClient = webClient;
        this.tokens = tokens;
    }

    /** Primary result table of a v1 response. */
    public record KustoTable(List<String> columnNames, List<String> columnTypes, List<JsonNode> rows) {

        static KustoTable from(JsonNode response) {
            JsonNode table = response.path("Tables").path(0);
            List<String> names = new ArrayList<>();
            List<String> types = new ArrayList<>();
            for (JsonNode col : table.path("Columns")) {
                names.add(col.path("ColumnName").asText());
                types.add(col.path("ColumnType").asText(col.path("DataType").asText("string")));
            }
            List<JsonNode> rows = new ArrayList<>();
            table.path("Rows").forEach(rows::add);
            return new KustoTable(names, types, rows);
        }

        public int column(String name) {
            return columnNames.indexOf(name);
        }
    }

    public Mono<KustoTable> mgmt(String clusterUri, String database, String command) {
        return call(clusterUri, "/v1/rest/mgmt", database, command);
    }

    public Mono<KustoTable> query(String clusterUri, String database, String query) {
        return call(clusterUri, "/v1/rest/query", database, query);
    }

    private Mono<KustoTable> call(String clusterUri, String path, String database, String csl) {
        String base = clusterUri.endsWith("/") ? clusterUri.substring(0, clusterUri.length() - 1) : clusterUri;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("db", database);
        body.put("csl", csl);
        return tokens.token(base + "/.default").flatMap(token -> webClient.post()
                .uri(base + path)
                .headers(h -> h.setBearerAuth(token))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    if (status >= 200 && status < 300) {
                        return response.bodyToMono(JsonNode.class).map(KustoTable::from);
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(text -> Mono.error(new FabricApiException(status,
                                    "Kusto " + path + " failed (" + status + "): " + JsonUtils.safeString(text, 500))));
                }));
    }
}
