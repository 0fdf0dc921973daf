package com.agentsessions.payloads.scanner.registry;

import com.agentsessions.payloads.scanner.api.ExtractorFactory;
import com.agentsessions.payloads.scanner.dialects.ClaudeImageBlockExtractorFactory;
import com.agentsessions.payloads.scanner.dialects.CodexDataUrlExtractorFactory;
import com.agentsessions.payloads.scanner.dialects.GeminiInlineDataExtractorFactory;
import com.agentsessions.payloads.scanner.dialects.OpenClawImageBlockExtractorFactory;
import com.agentsessions.payloads.types.Dialect;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Central registry that maps dialects to their extractor factories.
 * All {@link ExtractorFactory} beans are discovered via CDI.
 */
@ApplicationScoped
public class DialectRegistry {

    private static final Logger log = Logger.getLogger(DialectRegistry.class);

    @Inject
    Instance<ExtractorFactory> factories;

    private final Map<Dialect, ExtractorFactory> byDialect = new EnumMap<>(Dialect.class);

    /**
     * Registry over an explicit list of factories, for use outside a CDI container.
     */
    public static DialectRegistry of(List<? extends ExtractorFactory> factories) {
        DialectRegistry registry = new DialectRegistry();
        factories.forEach(registry::register);
        return registry;
    }

    /**
     * Registry holding the built-in factory of every scanned dialect.
     */
    public static DialectRegistry builtIn() {
        return of(List.of(
                new CodexDataUrlExtractorFactory(),
                new ClaudeImageBlockExtractorFactory(),
                new OpenClawImageBlockExtractorFactory(),
                new GeminiInlineDataExtractorFactory()));
    }

    @PostConstruct
    void init() {
        for (ExtractorFactory factory : factories) {
            register(factory);
            log.debugf("Registered extractor: %s → %s", factory.dialect().label(), factory.getClass().getSimpleName());
        }
        log.infof("DialectRegistry initialized with %d dialects", byDialect.size());
    }

    private void register(ExtractorFactory factory) {
        Dialect dialect = factory.dialect();
        if (dialect.delegated()) {
            throw new IllegalStateException("Dialect '" + dialect.label() + "' is delegated and takes no extractor");
        }
        ExtractorFactory existing = byDialect.put(dialect, factory);
        if (existing != null) {
            throw new IllegalStateException(
                    "Duplicate extractor for dialect '" + dialect.label() + "': " +
                            existing.getClass().getName() + " and " + factory.getClass().getName());
        }
    }

    /**
     * Finds the factory for the given dialect.
     */
    public Optional<ExtractorFactory> find(Dialect dialect) {
        return Optional.ofNullable(byDialect.get(dialect));
    }

    /**
     * Returns the factory for the given dialect.
     *
     * @throws IllegalArgumentException if no factory is registered for it
     */
    public ExtractorFactory require(Dialect dialect) {
        return find(dialect).orElseThrow(() ->
                new IllegalArgumentException("No extractor registered for dialect " + dialect.label()));
    }

    public Set<Dialect> dialects() {
        return Collections.unmodifiableSet(byDialect.keySet());
    }
}
