package com.agentsessions.payloads.core.layout;

/**
 * On-disk layout generation of a part-file store.
 */
public enum StorageSchema {
    /** Part files are found by walking the whole {@code part/} tree. */
    LEGACY,
    /** Part files live in {@code part/<messageId>/}. */
    V2
}
