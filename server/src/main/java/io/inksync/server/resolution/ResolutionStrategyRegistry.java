// file: server/src/main/java/io/inksync/server/resolution/ResolutionStrategyRegistry.java
package io.inksync.server.resolution;

import io.inksync.core.conflict.ResolutionStrategy;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy -> handler lookup. MANUAL never has a handler.
 */
public final class ResolutionStrategyRegistry {

    private final Map<ResolutionStrategy, ResolutionStrategyHandler> handlers =
            new EnumMap<>(ResolutionStrategy.class);

    public static ResolutionStrategyRegistry defaults() {
        return new ResolutionStrategyRegistry()
                .register(new LastWriterWinsStrategy())
                .register(new PriorityUserStrategy())
                .register(new MergeStrategy())
                .register(new SpatialOffsetStrategy())
                .register(new AutomaticStrategy());
    }

    /** Register or replace the handler for its strategy. */
    public ResolutionStrategyRegistry register(ResolutionStrategyHandler handler) {
        if (handler.strategy() == ResolutionStrategy.MANUAL) {
            throw new IllegalArgumentException("MANUAL cannot be handled automatically");
        }
        handlers.put(handler.strategy(), handler);
        return this;
    }

    public Optional<ResolutionStrategyHandler> handlerFor(ResolutionStrategy strategy) {
        return Optional.ofNullable(handlers.get(strategy));
    }

    public Collection<ResolutionStrategyHandler> handlers() {
        return Collections.unmodifiableCollection(handlers.values());
    }
}
