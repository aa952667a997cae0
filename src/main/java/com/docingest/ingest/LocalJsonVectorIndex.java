package com.docingest.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Single-file JSON vector index. Each upsert rewrites the file before returning, so an acknowledged write
 * survives a restart.
 */
public class LocalJsonVectorIndex implements VectorIndex {
    private static final String SERVICE = "vector-index";

    private final Map<String, VectorRecord> records = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private final Path path;

    private LocalJsonVectorIndex(Path path) {
        this.path = path;
    }

    public static LocalJsonVectorIndex load(Path path) throws IOException {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(path);
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return index;
        }
        List<VectorRecord> loaded = index.objectMapper.readValue(path.toFile(), new TypeReference<List<VectorRecord>>() {
        });
        for (VectorRecord record : loaded) {
            index.records.put(record.id(), record);
        }
        return index;
    }

    @Override
    public synchronized void upsert(List<VectorRecord> batch) {
        Map<String, VectorRecord> replaced = new LinkedHashMap<>();
        for (VectorRecord record : batch) {
            replaced.put(record.id(), records.put(record.id(), record));
        }
        try {
            save();
        } catch (IOException e) {
            replaced.forEach((id, previous) -> {
                if (previous == null) {
                    records.remove(id);
                } else {
                    records.put(id, previous);
                }
            });
            throw ExternalCallException.permanent(SERVICE, "unable to write " + path, e);
        }
    }

    @Override
    public synchronized Optional<VectorRecord> fetch(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public synchronized int size() {
        return records.size();
    }

    private void save() throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path staging = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(staging.toFile(), new ArrayList<>(records.values()));
        Files.move(staging, path, StandardCopyOption.REPLACE_EXISTING);
    }
}
