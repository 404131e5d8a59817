package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Uploads the scenario's entity CSV files ({@code entities-dir} data-source parameter) to the lakehouse
 * {@code Files/} area through the OneLake DFS API: create, append, flush per file. Exists when every local file is
 * already present remotely.
 */
public class OneLakeUploadAdapter implements ResourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(OneLakeUploadAdapter.class);

    public static final String SCOPE = "https://storage.azure.com/.default";
    public static final String ENTITIES_DIR = "entities-dir";

    private final WebClient oneLake;
    private final AccessTokenProvider tokens;

    public OneLakeUploadAdapter(WebClient oneLake, AccessTokenProvider tokens) {
        this.oneLake = oneLake;
        this.tokens = tokens;
    }

    @Override
    public String key() {
        return AdapterKeys.LAKEHOUSE_FILES;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        String workspaceId = target.require(ConfigKeys.WORKSPACE_ID);
        String lakehouseId = target.require(ConfigKeys.LAKEHOUSE_ID);
        return CsvFiles.list(target.requireParam(ENTITIES_DIR))
                .zipWith(remoteFiles(workspaceId, lakehouseId))
                .filter(t -> !t.getT1().isEmpty() && t.getT1().stream()
                        .allMatch(p -> t.getT2().contains(p.getFileName().toString())))
                .map(t -> uploaded(t.getT1()));
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        String workspaceId = target.require(ConfigKeys.WORKSPACE_ID);
        String lakehouseId = target.require(ConfigKeys.LAKEHOUSE_ID);
        return CsvFiles.list(target.requireParam(ENTITIES_DIR))
                .flatMap(files -> Flux.fromIterable(files)
                        .concatMap(file -> upload(workspaceId, lakehouseId, file))
                        .then(Mono.fromCallable(() -> uploaded(files))));
    }

    private Mono<Void> upload(String workspaceId, String lakehouseId, Path file) {
        String path = "/" + workspaceId + "/" + lakehouseId + "/Files/" + file.getFileName();
        return CsvFiles.read(file).flatMap(bytes -> tokens.token(SCOPE).flatMap(token -> {
            Mono<Void> created = call(token, HttpMethod.PUT, path + "?resource=file", null);
            Mono<Void> appended = bytes.length == 0
                    ? Mono.empty()
                    : call(token, HttpMethod.PATCH, path + "?action=append&position=0", bytes);
            Mono<Void> flushed = call(token, HttpMethod.PATCH, path + "?action=flush&position=" + bytes.length, null);
            return created.then(appended).then(flushed)
                    .doOnSuccess(v -> log.info(JsonUtils.json(
                            "onelake_upload", "uploaded",
                            "file", file.getFileName().toString(),
                            "bytes", Integer.toString(bytes.length)
                    )));
        }));
    }

    private Mono<Set<String>> remoteFiles(String workspaceId, String lakehouseId) {
        String uri = "/" + workspaceId + "?resource=filesystem&recursive=false&directory=" + lakehouseId + "/Files";
        return tokens.token(SCOPE).flatMap(token -> oneLake.get()
                .uri(uri)
                .headers(h -> h.setBearerAuth(token))
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == 404) {
                        return response.releaseBody().thenReturn(Set.<String>of());
                    }
                    return checked(response, HttpMethod.GET, uri)
                            .then(response.bodyToMono(JsonNode.class))
                            .map(OneLakeUploadAdapter::fileNames);
                }));
    }

    private Mono<Void> call(String token, HttpMethod method, String uri, byte[] body) {
        WebClient.RequestBodySpec spec = oneLake.method(method)
                .uri(uri)
                .headers(h -> h.setBearerAuth(token));
        WebClient.RequestHeadersSpec<?> request = body == null
                ? spec
                : spec.contentType(MediaType.APPLICATION_OCTET_STREAM).bodyValue(body);
        return request.exchangeToMono(response -> checked(response, method, uri).then(response.releaseBody()));
    }

    private static Mono<Void> checked(ClientResponse response, HttpMethod method, String uri) {
        int status = response.statusCode().value();
        if (status >= 200 && status < 300) {
            return Mono.empty();
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(text -> Mono.error(new FabricApiException(status,
                        "OneLake " + method + " " + uri + " failed (" + status + "): " + JsonUtils.safeString(text, 300))));
    }

    private static Set<String> fileNames(JsonNode listing) {
        Set<String> names = new HashSet<>();
        for (JsonNode p : listing.path("paths")) {
            String name = p.path("name").asText("");
            names.add(name.substring(name.lastIndexOf('/') + 1));
        }
        return names;
    }

    private static DiscoveredResource uploaded(List<Path> files) {
        return DiscoveredResource.of(ConfigKeys.UPLOADED_FILES,
                String.join(",", files.stream().map(CsvFiles::tableName).toList()));
    }
}
