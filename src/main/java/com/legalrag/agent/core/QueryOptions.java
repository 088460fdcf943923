package com.legalrag.agent.core;

import com.legalrag.agent.config.RagProperties;

/**
 * Per-query settings, resolved once from configured defaults plus the
 * caller's overrides. Never shared between queries.
 */
public record QueryOptions(int maxIterations, int topK, boolean enableWebSearch) {

    public QueryOptions {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, was " + maxIterations);
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1, was " + topK);
        }
    }

    public static QueryOptions resolve(RagProperties.Agent defaults,
                                       Integer maxIterations,
                                       Integer topK,
                                       Boolean enableWebSearch) {
        return new QueryOptions(
                maxIterations != null ? maxIterations : defaults.getMaxIterations(),
                topK != null ? topK : defaults.getTopK(),
                enableWebSearch != null ? enableWebSearch : defaults.isEnableWebSearch());
    }

    public QueryOptions withWebSearch(boolean enabled) {
        return new QueryOptions(maxIterations, topK, enabled);
    }
}
