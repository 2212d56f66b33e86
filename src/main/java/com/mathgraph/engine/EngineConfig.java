package com.mathgraph.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tunables for {@link ExpressionEngine}.
 *
 * <p>
 * All three algorithms recurse once per level of the graph. {@code maxDepth}
 * bounds that recursion: deeper graphs are rejected up front with
 * {@link com.mathgraph.error.ExpressionTooDeepException} instead of running
 * into a {@link StackOverflowError} half way through. The default can be
 * overridden with the {@value #MAX_DEPTH_PROPERTY} system property.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class EngineConfig {
    public static final String MAX_DEPTH_PROPERTY = "mathgraph.maxDepth";
    public static final int DEFAULT_MAX_DEPTH = 2048;

    @Builder.Default
    private final int maxDepth = Integer.getInteger(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH);

    public static EngineConfig defaults() {
        return builder().build();
    }
}
