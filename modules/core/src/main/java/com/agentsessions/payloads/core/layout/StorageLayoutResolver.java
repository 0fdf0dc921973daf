package com.agentsessions.payloads.core.layout;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Maps a session file of a delegated dialect to the per-message part files holding its
 * content. Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface StorageLayoutResolver {

    /**
     * Resolves the part files of a session.
     *
     * @param sessionFile session file as listed by the caller
     * @param messageIds  messages whose part files are wanted; empty means all
     * @return layout with message ids ascending and part files in name order
     * @throws IOException if the store cannot be listed
     */
    PartFileLayout resolve(Path sessionFile, Collection<String> messageIds) throws IOException;
}
