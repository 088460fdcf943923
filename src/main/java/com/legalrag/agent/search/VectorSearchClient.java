package com.legalrag.agent.search;

import java.util.List;

/**
 * Internal similarity-search capability over the indexed legal corpus.
 */
public interface VectorSearchClient {

    /**
     * @param query          free-text query, embedded by the implementation
     * @param topK           maximum number of hits
     * @param scoreThreshold minimum similarity, or null for no threshold
     * @return hits ranked by descending score; never null
     */
    List<ScoredPassage> search(String query, int topK, Double scoreThreshold);

    /** True if the backing collection is reachable and exists */
    boolean isHealthy();
}
