package com.agentsessions.payloads.core.layout;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Part files of one session, grouped by message id.
 *
 * @param schema         layout generation the files were found with
 * @param partsByMessage part files per message id; message ids ascending, files in name order
 */
public record PartFileLayout(StorageSchema schema, Map<String, List<Path>> partsByMessage) {

    public PartFileLayout {
        if (schema == null) {
            throw new IllegalArgumentException("schema is required");
        }
        TreeMap<String, List<Path>> sorted = new TreeMap<>();
        partsByMessage.forEach((id, files) -> sorted.put(id, List.copyOf(files)));
        partsByMessage = Collections.unmodifiableMap(sorted);
    }

    public static PartFileLayout empty(StorageSchema schema) {
        return new PartFileLayout(schema, Map.of());
    }

    public boolean isEmpty() {
        return partsByMessage.values().stream().allMatch(List::isEmpty);
    }

    public int fileCount() {
        return partsByMessage.values().stream().mapToInt(List::size).sum();
    }
}
