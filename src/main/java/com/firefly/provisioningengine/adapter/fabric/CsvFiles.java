package com.firefly.provisioningengine.adapter.fabric;

import com.firefly.provisioningengine.exceptions.PermanentAdapterException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** Local CSV data files of a scenario. File reads run on the bounded elastic scheduler. */
final class CsvFiles {

    private CsvFiles() {
    }

    static Mono<List<Path>> list(String directory) {
        return Mono.fromCallable(() -> {
            Path dir = Path.of(directory);
            if (!Files.isDirectory(dir)) {
                throw new PermanentAdapterException("Data directory not found: " + dir);
            }
            try (Stream<Path> files = Files.list(dir)) {
                return files.filter(p -> p.getFileName().toString().toLowerCase().endsWith(".csv"))
                        .sorted()
                        .toList();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    static Mono<byte[]> read(Path file) {
        return Mono.fromCallable(() -> Files.readAllBytes(file)).subscribeOn(Schedulers.boundedElastic());
    }

    /** Header columns and non-blank data lines. */
    static Mono<Table> readTable(Path file) {
        return Mono.fromCallable(() -> {
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (lines.isEmpty()) {
                return new Table(tableName(file), List.of(), List.of());
            }
            List<String> header = new ArrayList<>();
            for (String col : lines.get(0).split(",")) {
                header.add(col.trim().replace("\"", "").replace("\uFEFF", ""));
            }
            List<String> rows = lines.subList(1, lines.size()).stream()
                    .map(String::strip)
                    .filter(l -> !l.isEmpty())
                    .toList();
            return new Table(tableName(file), header, rows);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    static String tableName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    record Table(String name, List<String> columns, List<String> rows) {
    }
}
