/**
 * Pure Java value types shared across all payload-locator modules.
 *
 * <p>No framework dependencies.
 */
package com.agentsessions.payloads.types;
