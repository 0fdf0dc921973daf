/**
 * Shared utilities for all payload-locator modules.
 *
 * <p>Contains {@link com.agentsessions.payloads.util.FileSignature} and the
 * {@link com.agentsessions.payloads.util.stream stream layer} (ByteStreamReader).
 * No framework dependencies.
 */
package com.agentsessions.payloads.util;
