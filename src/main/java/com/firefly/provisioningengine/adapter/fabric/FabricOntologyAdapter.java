package com.firefly.provisioningengine.adapter.fabric;

import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.exceptions.PermanentAdapterException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Ontology item plus its definition.
 * <p>
 * The definition parts are the files under the {@code ontology-dir} data-source parameter, uploaded as
 * {@code InlineBase64} parts with their relative paths. {@code ${FABRIC_WORKSPACE_ID}} and
 * {@code ${FABRIC_LAKEHOUSE_ID}} placeholders in the files are replaced with the discovered identifiers so data
 * bindings point at the provisioned lakehouse. The step counts as done only once the item carries a definition.
 */
public class FabricOntologyAdapter extends FabricItemAdapter {
    public static final String ONTOLOGY_DIR = "ontology-dir";

    public FabricOntologyAdapter(FabricRestClient client) {
        super(client, AdapterKeys.ONTOLOGY, "ontologies", "Ontology", ConfigKeys.ONTOLOGY_ID, ConfigKeys.ONTOLOGY_NAME);
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        return super.exists(target)
                .filterWhen(resource -> hasDefinition(target.require(ConfigKeys.WORKSPACE_ID),
                        resource.get(ConfigKeys.ONTOLOGY_ID).orElse("")));
    }

    @Override
    protected Map<String, Object> createBody(ResourceTarget target) {
        Map<String, Object> body = super.createBody(target);
        body.put("description", "Ontology provisioned for scenario " + target.scenarioId());
        return body;
    }

    @Override
    public Mono<Void> populate(ResourceTarget target, DiscoveredResource resource) {
        String workspaceId = target.require(ConfigKeys.WORKSPACE_ID);
        String ontologyId = resource.get(ConfigKeys.ONTOLOGY_ID)
                .orElseThrow(() -> new PermanentAdapterException("Ontology id missing after create"));
        return definitionParts(target)
                .flatMap(parts -> client.postAndWait(
                        "/workspaces/" + workspaceId + "/ontologies/" + ontologyId + "/updateDefinition",
                        Map.of("definition", Map.of("parts", parts)),
                        "update ontology definition"))
                .then();
    }

    Mono<List<Map<String, String>>> definitionParts(ResourceTarget target) {
        String dir = target.requireParam(ONTOLOGY_DIR);
        Map<String, String> placeholders = new LinkedHashMap<>();
        placeholders.put("${" + ConfigKeys.WORKSPACE_ID + "}", target.value(ConfigKeys.WORKSPACE_ID).orElse(""));
        placeholders.put("${" + ConfigKeys.LAKEHOUSE_ID + "}", target.value(ConfigKeys.LAKEHOUSE_ID).orElse(""));
        return Mono.fromCallable(() -> readParts(Path.of(dir), placeholders))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Boolean> hasDefinition(String workspaceId, String ontologyId) {
        return client.postAndWait("/workspaces/" + workspaceId + "/ontologies/" + ontologyId + "/getDefinition",
                        null, "get ontology definition")
                .map(node -> node.path("definition").path("parts").size() > 0)
                .onErrorResume(FabricApiException.class,
                        e -> e.getStatus() == 404 ? Mono.just(false) : Mono.error(e));
    }

    private static List<Map<String, String>> readParts(Path dir, Map<String, String> placeholders) {
        if (!Files.isDirectory(dir)) {
            throw new PermanentAdapterException("Ontology definition directory not found: " + dir);
        }
        List<Map<String, String>> parts = new ArrayList<>();
        try (Stream<Path> files = Files.walk(dir)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                for (Map.Entry<String, String> e : placeholders.entrySet()) {
                    content = content.replace(e.getKey(), e.getValue());
                }
                Map<String, String> part = new LinkedHashMap<>();
                part.put("path", dir.relativize(file).toString().replace('\\', '/'));
                part.put("payload", Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8)));
                part.put("payloadType", "InlineBase64");
                parts.add(part);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (parts.isEmpty()) {
            throw new PermanentAdapterException("Ontology definition directory is empty: " + dir);
        }
        return parts;
    }
}
