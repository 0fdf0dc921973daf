package com.agentsessions.payloads.core.layout;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Default resolver for OpenCode storage directories.
 *
 * <p>Layout: {@code {root}/session/{projectId}/ses_{id}.json} with part files under
 * {@code {root}/part/}. A {@code {root}/migration} file containing {@code 2} marks the
 * {@link StorageSchema#V2} layout, {@code part/{messageId}/*.json}; anything else is
 * treated as {@link StorageSchema#LEGACY} and the part tree is walked, grouping files
 * by their parent directory name.
 */
@ApplicationScoped
public class PartDirectoryLayoutResolver implements StorageLayoutResolver {

    private static final Logger log = Logger.getLogger(PartDirectoryLayoutResolver.class);

    static final String MIGRATION_FILE = "migration";
    static final String PART_DIR = "part";

    @Override
    public PartFileLayout resolve(Path sessionFile, Collection<String> messageIds) throws IOException {
        Path root = storageRoot(sessionFile);
        if (root == null) {
            return PartFileLayout.empty(StorageSchema.LEGACY);
        }
        StorageSchema schema = readSchema(root);
        Path partRoot = root.resolve(PART_DIR);
        if (!Files.isDirectory(partRoot)) {
            log.debugf("No part directory under %s", root);
            return PartFileLayout.empty(schema);
        }
        Map<String, List<Path>> parts = schema == StorageSchema.V2
                ? listV2(partRoot, messageIds)
                : walkLegacy(partRoot, messageIds);
        return new PartFileLayout(schema, parts);
    }

    /**
     * Storage root three levels above the session file, or null for shallow paths.
     */
    static Path storageRoot(Path sessionFile) {
        Path root = sessionFile.toAbsolutePath().getParent();
        for (int i = 0; i < 2 && root != null; i++) {
            root = root.getParent();
        }
        return root;
    }

    static StorageSchema readSchema(Path root) {
        Path migration = root.resolve(MIGRATION_FILE);
        if (!Files.isRegularFile(migration)) {
            return StorageSchema.LEGACY;
        }
        try {
            String version = Files.readString(migration, StandardCharsets.UTF_8).trim();
            return "2".equals(version) ? StorageSchema.V2 : StorageSchema.LEGACY;
        } catch (IOException e) {
            log.debugf("Unreadable migration marker %s: %s", migration, e.getMessage());
            return StorageSchema.LEGACY;
        }
    }

    private Map<String, List<Path>> listV2(Path partRoot, Collection<String> messageIds) throws IOException {
        Map<String, List<Path>> out = new TreeMap<>();
        for (String messageId : messageIds) {
            if (messageId.isEmpty() || isHidden(messageId)) {
                continue;
            }
            Path dir = partRoot.resolve(messageId);
            if (!dir.normalize().startsWith(partRoot.normalize()) || !Files.isDirectory(dir)) {
                continue;
            }
            List<Path> files = new ArrayList<>();
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
                for (Path entry : entries) {
                    if (isPartFile(entry)) {
                        files.add(entry);
                    }
                }
            }
            files.sort(Comparator.comparing(p -> p.getFileName().toString()));
            out.put(messageId, files);
        }
        return out;
    }

    private Map<String, List<Path>> walkLegacy(Path partRoot, Collection<String> messageIds) throws IOException {
        Set<String> requested = new HashSet<>(messageIds);
        Map<String, List<Path>> out = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(partRoot)) {
            walk.filter(p -> !partRoot.equals(p.getParent()))
                    .filter(this::isPartFile)
                    .filter(p -> !hasHiddenSegment(partRoot.relativize(p)))
                    .forEach(p -> {
                        String messageId = p.getParent().getFileName().toString();
                        if (requested.isEmpty() || requested.contains(messageId)) {
                            out.computeIfAbsent(messageId, k -> new ArrayList<>()).add(p);
                        }
                    });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        out.values().forEach(files -> files.sort(Comparator.comparing(p -> p.getFileName().toString())));
        return out;
    }

    private boolean isPartFile(Path path) {
        String name = path.getFileName().toString();
        return !isHidden(name)
                && name.toLowerCase(Locale.ROOT).endsWith(".json")
                && Files.isRegularFile(path);
    }

    private static boolean hasHiddenSegment(Path relative) {
        for (Path segment : relative) {
            if (isHidden(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isHidden(String name) {
        return name.startsWith(".");
    }
}
